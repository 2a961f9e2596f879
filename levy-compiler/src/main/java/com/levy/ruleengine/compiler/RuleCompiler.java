/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.levy.ruleengine.api.CompilationListener;
import com.levy.ruleengine.api.IRuleCompiler;
import com.levy.ruleengine.api.config.EngineConfig;
import com.levy.ruleengine.api.exceptions.RuleValidationException;
import com.levy.ruleengine.api.model.RuleDocument;
import com.levy.ruleengine.api.model.ValidationIssue;
import com.levy.ruleengine.compiler.validation.RuleDocumentValidator;
import com.levy.ruleengine.runtime.function.BuiltinLibrary;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles rule JSON into a {@link RuleDocument} the evaluator can run.
 *
 * <p>The compilation process has three stages:
 * <ol>
 *   <li>PARSING: read the JSON text into a tree.</li>
 *   <li>VALIDATION: run the {@link RuleDocumentValidator} on the tree and refuse the
 *       document according to the configured validation mode.</li>
 *   <li>BINDING: map the tree onto the rule document model.</li>
 * </ol>
 *
 * <p>Warnings that do not refuse the document are logged.
 */
public class RuleCompiler implements IRuleCompiler {
    private static final Logger logger = Logger.getLogger(RuleCompiler.class.getName());

    static final String STAGE_PARSING = "PARSING";
    static final String STAGE_VALIDATION = "VALIDATION";
    static final String STAGE_BINDING = "BINDING";
    private static final int TOTAL_STAGES = 3;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RuleDocumentValidator validator;
    private Tracer tracer;
    private volatile CompilationListener listener;

    public RuleCompiler() {
        this(OpenTelemetry.noop().getTracer("levy-compiler"), EngineConfig.defaults());
    }

    public RuleCompiler(Tracer tracer) {
        this(tracer, EngineConfig.defaults());
    }

    public RuleCompiler(Tracer tracer, EngineConfig config) {
        this(tracer, config, BuiltinLibrary.standard());
    }

    public RuleCompiler(Tracer tracer, EngineConfig config, BuiltinLibrary library) {
        this.tracer = tracer;
        this.validator = new RuleDocumentValidator(config, library);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public RuleDocument compile(Path rulePath) throws IOException {
        Span span = tracer.spanBuilder("compile-rule-file").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleFilePath", rulePath.toString());
            String json = Files.readString(rulePath);
            return compile(json);
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public RuleDocument compile(String json) {
        Span span = tracer.spanBuilder("compile-rule").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            span.setAttribute("validationMode", validator.mode().name());

            JsonNode tree = runStage(STAGE_PARSING, 1, () -> parse(json), parsed -> Map.of("bytes", json.length()));
            String ruleName = tree.path("name").asText("<unnamed>");
            span.setAttribute("rule.name", ruleName);

            List<ValidationIssue> issues = runStage(STAGE_VALIDATION, 2, () -> validate(ruleName, tree),
                    found -> Map.of("issueCount", found.size(),
                            "errorCount", found.stream().filter(ValidationIssue::isError).count()));
            span.setAttribute("issueCount", issues.size());

            RuleDocument rule = runStage(STAGE_BINDING, 3, () -> bind(ruleName, tree),
                    bound -> Map.of("stepCount", bound.flow().size(), "tableCount", bound.tables().size()));

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));
            logger.fine("Compiled rule '" + ruleName + "' in " + TimeUnit.NANOSECONDS.toMicros(compilationTime)
                    + " µs with " + issues.size() + " issue(s)");
            return rule;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private JsonNode parse(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RuleValidationException("<unparsed>",
                    List.of(ValidationIssue.error("/", "Invalid JSON: " + e.getOriginalMessage())));
        }
    }

    private List<ValidationIssue> validate(String ruleName, JsonNode tree) {
        List<ValidationIssue> issues = validator.validate(tree);
        if (validator.refuses(issues)) {
            throw new RuleValidationException(ruleName, issues);
        }
        for (ValidationIssue issue : issues) {
            logger.warning("Rule '" + ruleName + "': " + issue);
        }
        return issues;
    }

    private RuleDocument bind(String ruleName, JsonNode tree) {
        try {
            return objectMapper.treeToValue(tree, RuleDocument.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RuleValidationException(ruleName,
                    List.of(ValidationIssue.error("/", "Cannot bind rule document: " + e.getMessage())));
        }
    }

    private <T> T runStage(String stage, int number, Supplier<T> work, Function<T, Map<String, Object>> metrics) {
        CompilationListener current = this.listener;
        if (current != null) {
            current.onStageStart(stage, number, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        Span span = tracer.spanBuilder("compile-" + stage.toLowerCase()).startSpan();
        try (Scope scope = span.makeCurrent()) {
            T result = work.get();
            if (current != null) {
                current.onStageComplete(stage, new CompilationListener.StageResult(
                        stage, System.nanoTime() - start, metrics.apply(result)));
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            if (current != null) {
                current.onError(stage, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine;

import com.levy.ruleengine.api.EvaluationListener;
import com.levy.ruleengine.api.IRuleDocumentManager;
import com.levy.ruleengine.api.config.EngineConfig;
import com.levy.ruleengine.api.exceptions.InputValidationException;
import com.levy.ruleengine.api.exceptions.RuleEvaluationException;
import com.levy.ruleengine.api.exceptions.RuleValidationException;
import com.levy.ruleengine.api.exceptions.RuleViolationException;
import com.levy.ruleengine.api.model.EvaluationResult;
import com.levy.ruleengine.api.model.RuleDocument;
import com.levy.ruleengine.api.model.ValidationIssue;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.compiler.RuleCompiler;
import com.levy.ruleengine.filing.FilingScheduleGenerator;
import com.levy.ruleengine.filing.TaxLiability;
import com.levy.ruleengine.period.PeriodCalculator;
import com.levy.ruleengine.period.PeriodInfo;
import com.levy.ruleengine.period.PeriodOptions;
import com.levy.ruleengine.runtime.context.EvaluationContext;
import com.levy.ruleengine.runtime.evaluation.RuleFlowEvaluator;
import com.levy.ruleengine.runtime.function.BuiltinLibrary;
import com.levy.ruleengine.runtime.validation.InputValidationReport;
import com.levy.ruleengine.runtime.validation.InputValidator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for computing a tax liability from a rule document.
 *
 * <pre>{@code
 * TaxRuleEngine engine = TaxRuleEngine.fromPath(Path.of("rules/ph-income-tax.json"));
 * CalculationResult result = engine.calculate(
 *         Map.of("gross_income", 500_000, "filing_status", "SINGLE"),
 *         PeriodOptions.parse("2025-01-01", "2025-12-31"));
 * }</pre>
 *
 * <p>The document is compiled and validated when the engine is created; a refused document
 * never reaches evaluation. Each calculation validates the inputs, runs the flow and splits
 * the resulting liability over the filing schedules.
 *
 * <p>Instances are safe to share between threads: every thread evaluates with its own
 * {@link RuleFlowEvaluator}.
 */
public final class TaxRuleEngine {
    private static final Logger logger = Logger.getLogger(TaxRuleEngine.class.getName());

    private final Supplier<RuleDocument> documents;
    private final Tracer tracer;
    private final PeriodCalculator periods;
    private final ThreadLocal<RuleFlowEvaluator> evaluators;

    private volatile EvaluationListener listener;

    TaxRuleEngine(Supplier<RuleDocument> documents, EngineConfig config, Tracer tracer,
                  BuiltinLibrary library, PeriodCalculator periods) {
        this.documents = documents;
        this.tracer = tracer;
        this.periods = periods;
        this.evaluators = ThreadLocal.withInitial(() -> new RuleFlowEvaluator(config, tracer, library));
    }

    /**
     * @throws RuleValidationException if the document is not JSON or is refused
     */
    public static TaxRuleEngine fromJson(String json) {
        return fromJson(json, EngineConfig.defaults(), noopTracer());
    }

    public static TaxRuleEngine fromJson(String json, EngineConfig config, Tracer tracer) {
        RuleDocument document = new RuleCompiler(tracer, config).compile(json);
        return fixed(document, config, tracer);
    }

    /**
     * @throws IOException             if the file cannot be read
     * @throws RuleValidationException if the document is refused
     */
    public static TaxRuleEngine fromPath(Path rulePath) throws IOException {
        return fromPath(rulePath, EngineConfig.defaults(), noopTracer());
    }

    public static TaxRuleEngine fromPath(Path rulePath, EngineConfig config, Tracer tracer) throws IOException {
        RuleDocument document = new RuleCompiler(tracer, config).compile(rulePath);
        return fixed(document, config, tracer);
    }

    /**
     * Creates an engine that always calculates with the manager's active document, so reloads
     * take effect on the next calculation.
     */
    public static TaxRuleEngine fromManager(IRuleDocumentManager manager, EngineConfig config, Tracer tracer) {
        return new TaxRuleEngine(manager::getRuleDocument, config, tracer,
                BuiltinLibrary.standard(), new PeriodCalculator());
    }

    private static TaxRuleEngine fixed(RuleDocument document, EngineConfig config, Tracer tracer) {
        return new TaxRuleEngine(() -> document, config, tracer, BuiltinLibrary.standard(), new PeriodCalculator());
    }

    private static Tracer noopTracer() {
        return OpenTelemetry.noop().getTracer("levy-core");
    }

    public RuleDocument ruleDocument() {
        return documents.get();
    }

    /**
     * Sets a listener notified of flow progress on every thread (null to disable).
     */
    public void setEvaluationListener(EvaluationListener listener) {
        this.listener = listener;
    }

    /**
     * Calculates over the current calendar year.
     *
     * @see #calculate(Map, PeriodOptions)
     */
    public CalculationResult calculate(Map<String, ?> inputs) {
        return calculate(inputs, PeriodOptions.currentYear());
    }

    /**
     * Calculates the liability for {@code inputs}.
     *
     * @param inputs input values keyed by name without the {@code $} prefix; values may be
     *               {@link Value}s or plain {@code Number}, {@code Boolean} and {@code String}
     *               objects, {@code null} entries count as omitted
     * @param period taxable period; null bounds default to the current calendar year
     * @throws InputValidationException if an input is missing, mistyped or out of range
     * @throws RuleViolationException   if one of the rule's {@code validate} guards holds
     * @throws RuleEvaluationException  if a flow step or a filing schedule fails
     * @throws IllegalArgumentException if the period starts after it ends
     */
    public CalculationResult calculate(Map<String, ?> inputs, PeriodOptions period) {
        RuleDocument rule = documents.get();
        Span span = tracer.spanBuilder("calculate-tax").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rule.name", String.valueOf(rule.name()));
            span.setAttribute("inputCount", inputs.size());

            RuleFlowEvaluator evaluator = evaluators.get();
            evaluator.setEvaluationListener(listener);

            Map<String, Value> validated = validateInputs(rule, evaluator, inputs);
            EvaluationResult evaluation = evaluator.evaluate(rule, validated);
            PeriodInfo periodInfo = periods.calculate(period);

            EvaluationContext base = evaluator.createContext(rule, evaluation.inputs());
            EvaluationContext finalContext = new EvaluationContext(
                    base.inputs(), base.constants(), evaluation.calculated(), base.tables());
            List<TaxLiability> liabilities = new FilingScheduleGenerator(
                    evaluator.expressionEvaluator(), evaluator.conditionalEvaluator())
                    .generate(rule, finalContext, evaluation.liability(), periodInfo);

            span.setAttribute("liability", evaluation.liability());
            span.setAttribute("liabilityCount", liabilities.size());
            return new CalculationResult(evaluation.liability(), liabilities, evaluation.outputs(),
                    evaluation.calculated(), evaluation.inputs(), periodInfo, evaluation.trace());
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Map<String, Value> validateInputs(RuleDocument rule, RuleFlowEvaluator evaluator, Map<String, ?> raw) {
        Map<String, Value> values = new LinkedHashMap<>();
        List<ValidationIssue> conversionErrors = new ArrayList<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            try {
                values.put(entry.getKey(), Value.from(entry.getValue()));
            } catch (IllegalArgumentException e) {
                conversionErrors.add(ValidationIssue.error("/inputs/" + entry.getKey(),
                        "Input '" + entry.getKey() + "' must be a number, boolean or string"));
            }
        }
        if (!conversionErrors.isEmpty()) {
            throw new InputValidationException(conversionErrors);
        }

        InputValidationReport report = new InputValidator(evaluator.conditionalEvaluator()).validate(rule, values);
        if (!report.isValid()) {
            throw new InputValidationException(report.errors());
        }
        for (ValidationIssue issue : report.issues()) {
            logger.log(Level.FINE, "Rule ''{0}'': {1}", new Object[]{rule.name(), issue});
        }
        return report.resolvedInputs();
    }
}

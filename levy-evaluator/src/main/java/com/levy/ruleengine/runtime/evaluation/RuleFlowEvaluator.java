/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.evaluation;

import com.levy.ruleengine.api.EvaluationListener;
import com.levy.ruleengine.api.ITaxRuleEvaluator;
import com.levy.ruleengine.api.config.EngineConfig;
import com.levy.ruleengine.api.exceptions.RuleEvaluationException;
import com.levy.ruleengine.api.exceptions.RuleViolationException;
import com.levy.ruleengine.api.exceptions.TaxRuleException;
import com.levy.ruleengine.api.model.Case;
import com.levy.ruleengine.api.model.EvaluationResult;
import com.levy.ruleengine.api.model.EvaluationTrace;
import com.levy.ruleengine.api.model.FlowStep;
import com.levy.ruleengine.api.model.Operation;
import com.levy.ruleengine.api.model.OperationRecord;
import com.levy.ruleengine.api.model.RuleDocument;
import com.levy.ruleengine.api.model.ValidationRule;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.api.model.ValueType;
import com.levy.ruleengine.api.model.VariableDeclaration;
import com.levy.ruleengine.runtime.context.EvaluationContext;
import com.levy.ruleengine.runtime.function.BuiltinLibrary;
import com.levy.ruleengine.runtime.table.TableResolver;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Runs a rule's flow against a set of inputs.
 *
 * <h2>Evaluation</h2>
 * <ol>
 *   <li>Build the context: inputs, rule constants, tables with resolved bounds, no calculated values.</li>
 *   <li>Check the rule's {@code validate} guards; a guard that holds aborts with the author's message,
 *       a guard that cannot be evaluated (it names an omitted conditional input) is skipped.</li>
 *   <li>Run the steps in order. An operations step applies its operations sequentially, each seeing
 *       the previous one's result. A cases step runs the first case whose guard holds or that has no
 *       guard, then stops; when nothing matches the step does nothing.</li>
 *   <li>Default declared outputs that were never assigned: 0, false or the empty string.</li>
 * </ol>
 *
 * <p>Every failure inside a step is wrapped in a {@link RuleEvaluationException} naming the rule
 * and step; there are no partial results.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The underlying expression evaluator rebuilds its symbol table per call, so evaluations on
 * one instance are serialized with a lock. Callers evaluating in parallel should keep one
 * instance per thread.
 */
public final class RuleFlowEvaluator implements ITaxRuleEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(RuleFlowEvaluator.class);

    private final EngineConfig config;
    private final Tracer tracer;
    private final ExpressionEvaluator expressions;
    private final ConditionalEvaluator conditions;
    private final OperationRegistry operations;
    private final TableResolver tables;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile EvaluationListener listener;

    public RuleFlowEvaluator() {
        this(EngineConfig.defaults(), OpenTelemetry.noop().getTracer("levy-evaluator"));
    }

    public RuleFlowEvaluator(EngineConfig config, Tracer tracer) {
        this(config, tracer, BuiltinLibrary.standard());
    }

    public RuleFlowEvaluator(EngineConfig config, Tracer tracer, BuiltinLibrary library) {
        this.config = config;
        this.tracer = tracer;
        this.expressions = new ExpressionEvaluator(library, config.getMaxExpressionDepth());
        this.conditions = new ConditionalEvaluator(expressions, config.getMaxConditionDepth());
        this.operations = new OperationRegistry(expressions);
        this.tables = new TableResolver(expressions);
    }

    @Override
    public void setEvaluationListener(EvaluationListener listener) {
        this.listener = listener;
    }

    public ExpressionEvaluator expressionEvaluator() {
        return expressions;
    }

    public ConditionalEvaluator conditionalEvaluator() {
        return conditions;
    }

    @Override
    public EvaluationResult evaluate(RuleDocument rule, Map<String, Value> inputs) {
        lock.lock();
        Span span = tracer.spanBuilder("evaluate-rule").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rule.name", String.valueOf(rule.name()));
            span.setAttribute("rule.steps", rule.flow().size());
            long start = System.nanoTime();

            EvaluationContext context = createContext(rule, inputs);
            checkValidationRules(rule, context);

            TraceRecorder recorder = config.isTraceEnabled() ? new TraceRecorder() : null;
            List<EvaluationListener> listeners = activeListeners(recorder);

            List<FlowStep> flow = rule.flow();
            for (int i = 0; i < flow.size(); i++) {
                context = executeStep(rule, flow.get(i), i + 1, flow.size(), context, listeners);
            }

            Map<String, Value> outputs = collectOutputs(rule, context);
            long duration = System.nanoTime() - start;
            EvaluationTrace trace = recorder == null ? null : recorder.build(duration);

            span.setAttribute("calculatedCount", context.calculated().size());
            logger.debug("Evaluated rule '{}' in {} µs: {} calculated variable(s)",
                    rule.name(), duration / 1_000, context.calculated().size());
            return new EvaluationResult(rule.name(), outputs, context.calculated(), context.inputs(), trace);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
            lock.unlock();
        }
    }

    /**
     * Builds the initial context for {@code rule}. Table bounds that reference constants are resolved here.
     */
    public EvaluationContext createContext(RuleDocument rule, Map<String, Value> inputs) {
        EvaluationContext context = EvaluationContext.of(inputs, rule.constants());
        try {
            return context.withTables(tables.resolve(rule.tables(), context));
        } catch (TaxRuleException e) {
            throw new RuleEvaluationException(rule.name(), null, "Cannot resolve tables: " + e.getMessage(), e);
        }
    }

    private void checkValidationRules(RuleDocument rule, EvaluationContext context) {
        for (ValidationRule validation : rule.validate()) {
            boolean violated;
            try {
                violated = conditions.evaluate(validation.when(), context);
            } catch (TaxRuleException e) {
                logger.debug("Skipping validation '{}' of rule '{}': {}",
                        validation.error(), rule.name(), e.getMessage());
                continue;
            }
            if (violated) {
                logger.info("Rule '{}' rejected inputs: {}", rule.name(), validation.error());
                throw new RuleViolationException(validation.error());
            }
        }
    }

    private EvaluationContext executeStep(RuleDocument rule, FlowStep step, int stepNumber, int totalSteps,
                                          EvaluationContext context, List<EvaluationListener> listeners) {
        notify(listeners, l -> l.onStepStart(step.name(), stepNumber, totalSteps));
        long start = System.nanoTime();
        EvaluationContext result;
        try {
            if (step.hasOperations() && step.hasCases()) {
                throw new RuleEvaluationException(rule.name(), step.name(),
                        "A step must have either operations or cases, not both");
            }
            if (step.hasCases()) {
                result = executeCases(step, context, listeners);
            } else {
                result = applyAll(step, step.operations(), context, listeners);
            }
        } catch (RuleEvaluationException e) {
            throw e;
        } catch (TaxRuleException e) {
            throw new RuleEvaluationException(rule.name(), step.name(), e.getMessage(), e);
        }
        long duration = System.nanoTime() - start;
        notify(listeners, l -> l.onStepComplete(step.name(), duration));
        return result;
    }

    private EvaluationContext executeCases(FlowStep step, EvaluationContext context,
                                           List<EvaluationListener> listeners) {
        List<Case> cases = step.cases();
        for (int i = 0; i < cases.size(); i++) {
            Case candidate = cases.get(i);
            if (candidate.isDefault() || conditions.evaluate(candidate.when(), context)) {
                int selected = i;
                notify(listeners, l -> l.onCaseSelected(step.name(), selected));
                logger.trace("Step '{}' selected case #{}", step.name(), selected);
                return applyAll(step, candidate.operations(), context, listeners);
            }
        }
        notify(listeners, l -> l.onCaseSelected(step.name(), -1));
        logger.trace("Step '{}' matched no case", step.name());
        return context;
    }

    private EvaluationContext applyAll(FlowStep step, List<Operation> stepOperations, EvaluationContext context,
                                       List<EvaluationListener> listeners) {
        EvaluationContext current = context;
        for (Operation operation : stepOperations) {
            Value before = current.calculated().get(operation.target());
            current = operations.apply(operation, current);
            OperationRecord record = new OperationRecord(step.name(), operation.type(), operation.target(),
                    before, current.calculated().get(operation.target()));
            notify(listeners, l -> l.onOperationApplied(record));
        }
        return current;
    }

    private Map<String, Value> collectOutputs(RuleDocument rule, EvaluationContext context) {
        Map<String, Value> outputs = new LinkedHashMap<>();
        for (Map.Entry<String, VariableDeclaration> output : rule.outputs().entrySet()) {
            String name = output.getKey();
            ValueType declared = output.getValue().type();
            Value value = context.calculated().get(name);
            if (value == null) {
                outputs.put(name, defaultFor(declared));
                continue;
            }
            if (declared != null && value.type() != declared) {
                throw new RuleEvaluationException(rule.name(), null, "Output '" + name + "' is declared as "
                        + declared.jsonName() + " but the flow assigned a " + value.type().jsonName()
                        + " (" + value + ")");
            }
            outputs.put(name, value);
        }
        return outputs;
    }

    static Value defaultFor(ValueType type) {
        if (type == ValueType.BOOLEAN) {
            return Value.of(false);
        }
        if (type == ValueType.STRING) {
            return Value.of("");
        }
        return Value.of(0);
    }

    private List<EvaluationListener> activeListeners(TraceRecorder recorder) {
        List<EvaluationListener> active = new ArrayList<>(2);
        EvaluationListener external = this.listener;
        if (external != null) {
            active.add(external);
        }
        if (recorder != null) {
            active.add(recorder);
        }
        return active;
    }

    private static void notify(List<EvaluationListener> listeners, Consumer<EvaluationListener> event) {
        for (EvaluationListener l : listeners) {
            event.accept(l);
        }
    }
}

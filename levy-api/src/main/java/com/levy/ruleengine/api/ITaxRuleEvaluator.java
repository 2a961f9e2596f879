/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api;

import com.levy.ruleengine.api.exceptions.RuleEvaluationException;
import com.levy.ruleengine.api.exceptions.RuleViolationException;
import com.levy.ruleengine.api.model.EvaluationResult;
import com.levy.ruleengine.api.model.RuleDocument;
import com.levy.ruleengine.api.model.Value;

import java.util.Map;

/**
 * Contract for running a compiled rule's flow against typed inputs.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ITaxRuleEvaluator evaluator = new RuleFlowEvaluator();
 * EvaluationResult result = evaluator.evaluate(rule, Map.of(
 *     "gross_income", Value.of(500_000),
 *     "exemption", Value.of(250_000)));
 * double liability = result.liability();
 * }</pre>
 *
 * <p>Inputs are expected to have passed input validation already; the evaluator does not
 * re-check declarations. Every failure aborts the evaluation, there are no partial results.
 */
public interface ITaxRuleEvaluator {

    /**
     * Evaluates the rule's validation guards and flow.
     *
     * @param rule   compiled rule document
     * @param inputs validated inputs keyed by name (without the {@code $} prefix)
     * @return outputs, calculated variables and, when enabled, the trace
     * @throws RuleViolationException  if a {@code validate} guard holds
     * @throws RuleEvaluationException if any step fails
     */
    EvaluationResult evaluate(RuleDocument rule, Map<String, Value> inputs);

    /**
     * Sets a listener notified of step progress (null to disable).
     */
    default void setEvaluationListener(EvaluationListener listener) {
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Wraps any failure raised while a rule is being evaluated, adding the rule
 * and the flow step in which it happened.
 */
public class RuleEvaluationException extends TaxRuleException {

    private final String ruleName;
    private final String stepName;

    public RuleEvaluationException(String ruleName, String stepName, String message) {
        this(ruleName, stepName, message, null);
    }

    public RuleEvaluationException(String ruleName, String stepName, String message, Throwable cause) {
        super(describe(ruleName, stepName) + ": " + message, stepName, cause);
        this.ruleName = ruleName;
        this.stepName = stepName;
    }

    private static String describe(String ruleName, String stepName) {
        return stepName == null
                ? "Rule '" + ruleName + "'"
                : "Rule '" + ruleName + "', step '" + stepName + "'";
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getStepName() {
        return stepName;
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api;

import com.levy.ruleengine.api.model.OperationRecord;

/**
 * Callback interface for rule-flow progress.
 * Allows auditing and monitoring systems to follow an evaluation step by step.
 *
 * <h2>Usage</h2>
 * <pre>
 * EvaluationListener listener = new EvaluationListener() {
 *     {@literal @}Override
 *     public void onStepStart(String stepName, int stepNumber, int totalSteps) {
 *         System.out.printf("Step %s (%d/%d)%n", stepName, stepNumber, totalSteps);
 *     }
 *
 *     {@literal @}Override
 *     public void onCaseSelected(String stepName, int caseIndex) {
 *         System.out.printf("  case #%d%n", caseIndex);
 *     }
 *
 *     {@literal @}Override
 *     public void onOperationApplied(OperationRecord record) {
 *         System.out.printf("  %s %s: %s -&gt; %s%n",
 *             record.type(), record.target(), record.before(), record.after());
 *     }
 *
 *     {@literal @}Override
 *     public void onStepComplete(String stepName, long durationNanos) {
 *     }
 * };
 *
 * evaluator.setEvaluationListener(listener);
 * </pre>
 */
public interface EvaluationListener {

    /**
     * Called before a flow step runs.
     *
     * @param stepName   name of the step
     * @param stepNumber current step number (1-based)
     * @param totalSteps number of steps in the flow
     */
    void onStepStart(String stepName, int stepNumber, int totalSteps);

    /**
     * Called when a cases step picks a branch; {@code caseIndex} is -1 when none matched.
     */
    void onCaseSelected(String stepName, int caseIndex);

    /**
     * Called after each operation has been applied.
     */
    void onOperationApplied(OperationRecord record);

    /**
     * Called after a step completes successfully.
     */
    void onStepComplete(String stepName, long durationNanos);
}

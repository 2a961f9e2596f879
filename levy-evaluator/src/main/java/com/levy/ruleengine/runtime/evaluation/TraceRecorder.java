/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.evaluation;

import com.levy.ruleengine.api.EvaluationListener;
import com.levy.ruleengine.api.model.EvaluationTrace;
import com.levy.ruleengine.api.model.OperationRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Listener that assembles an {@link EvaluationTrace} for a single evaluation.
 */
final class TraceRecorder implements EvaluationListener {

    private final List<EvaluationTrace.StepTrace> steps = new ArrayList<>();
    private List<OperationRecord> currentOperations = new ArrayList<>();
    private Integer currentCase;

    @Override
    public void onStepStart(String stepName, int stepNumber, int totalSteps) {
        currentOperations = new ArrayList<>();
        currentCase = null;
    }

    @Override
    public void onCaseSelected(String stepName, int caseIndex) {
        currentCase = caseIndex;
    }

    @Override
    public void onOperationApplied(OperationRecord record) {
        currentOperations.add(record);
    }

    @Override
    public void onStepComplete(String stepName, long durationNanos) {
        steps.add(new EvaluationTrace.StepTrace(stepName, currentCase, currentOperations, durationNanos));
    }

    EvaluationTrace build(long totalDurationNanos) {
        return new EvaluationTrace(steps, totalDurationNanos);
    }
}

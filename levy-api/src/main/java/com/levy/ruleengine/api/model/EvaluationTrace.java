/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import java.util.List;

/**
 * Step-by-step record of a single rule evaluation.
 *
 * <p>Only populated when tracing is enabled in the engine configuration.
 *
 * @param steps            one entry per executed flow step, in order
 * @param totalDurationNanos wall time of the whole evaluation
 */
public record EvaluationTrace(List<StepTrace> steps, long totalDurationNanos) {

    public EvaluationTrace {
        steps = List.copyOf(steps);
    }

    /**
     * Every operation applied during the evaluation, flattened across steps.
     */
    public List<OperationRecord> operations() {
        return steps.stream().flatMap(s -> s.operations().stream()).toList();
    }

    /**
     * @param stepName      name of the flow step
     * @param selectedCase  index of the case that ran, -1 when no case matched,
     *                      null for an operations-only step
     * @param operations    operations applied by the step
     * @param durationNanos time spent in the step
     */
    public record StepTrace(String stepName, Integer selectedCase, List<OperationRecord> operations,
                            long durationNanos) {

        public StepTrace {
            operations = List.copyOf(operations);
        }

        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}

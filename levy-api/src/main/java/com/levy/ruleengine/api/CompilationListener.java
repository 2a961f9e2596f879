/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api;

import java.util.Map;

/**
 * Callback interface for rule compilation stage events.
 *
 * <p>The compilation pipeline consists of 3 stages:
 * <ol>
 *   <li>PARSING - Read the JSON document</li>
 *   <li>VALIDATION - Check structure, naming, tables, flow and conditions</li>
 *   <li>BINDING - Map the validated tree onto the rule document model</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * CompilationListener listener = new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d ms%n", stageName, result.durationMillis());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 *
 * IRuleCompiler compiler = new RuleCompiler();
 * compiler.setCompilationListener(listener);
 * RuleDocument rule = compiler.compile(rulePath);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName   Name of the stage (e.g., "PARSING", "VALIDATION")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage encounters an error.
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName     Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics       Stage-specific metrics (e.g., "errorCount", "stepCount")
     */
    record StageResult(
            String stageName,
            long durationNanos,
            Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine;

import com.levy.ruleengine.api.model.EvaluationTrace;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.filing.TaxLiability;
import com.levy.ruleengine.period.PeriodInfo;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link TaxRuleEngine#calculate}.
 *
 * @param liability   the {@code liability} accumulator, 0 when the rule never set it
 * @param liabilities payments due under the rule's filing schedules
 * @param outputs     declared outputs, defaulted where the flow did not assign them
 * @param calculated  every calculated variable
 * @param inputs      inputs after defaults were applied
 * @param period      the resolved taxable period
 * @param trace       operation trace, or {@code null} when tracing is disabled
 */
public record CalculationResult(
        double liability,
        List<TaxLiability> liabilities,
        Map<String, Value> outputs,
        Map<String, Value> calculated,
        Map<String, Value> inputs,
        PeriodInfo period,
        EvaluationTrace trace
) {

    public CalculationResult {
        liabilities = List.copyOf(liabilities);
        outputs = Map.copyOf(outputs);
        calculated = Map.copyOf(calculated);
        inputs = Map.copyOf(inputs);
    }

    public Value output(String name) {
        return outputs.get(name);
    }

    public double totalScheduled() {
        return liabilities.stream().mapToDouble(TaxLiability::amount).sum();
    }
}

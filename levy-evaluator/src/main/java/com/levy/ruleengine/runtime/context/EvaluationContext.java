/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.context;

import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.runtime.table.BracketTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable state of one rule evaluation, split into the three reference domains plus
 * the resolved bracket tables.
 *
 * <p>Instances are immutable. Operations produce a new context through
 * {@link #withCalculated(String, Value)}, so a failed operation leaves the previous
 * context untouched. {@code calculated} starts empty and only grows during a flow.
 */
public record EvaluationContext(
        Map<String, Value> inputs,
        Map<String, Value> constants,
        Map<String, Value> calculated,
        Map<String, BracketTable> tables
) {

    public EvaluationContext {
        inputs = freeze(inputs);
        constants = freeze(constants);
        calculated = freeze(calculated);
        tables = freeze(tables);
    }

    public static EvaluationContext empty() {
        return new EvaluationContext(Map.of(), Map.of(), Map.of(), Map.of());
    }

    public static EvaluationContext of(Map<String, Value> inputs, Map<String, Value> constants) {
        return new EvaluationContext(inputs, constants, Map.of(), Map.of());
    }

    public static EvaluationContext of(Map<String, Value> inputs, Map<String, Value> constants,
                                       Map<String, Value> calculated) {
        return new EvaluationContext(inputs, constants, calculated, Map.of());
    }

    /**
     * Returns a copy with {@code name} set to {@code value} in the calculated domain.
     */
    public EvaluationContext withCalculated(String name, Value value) {
        Map<String, Value> next = new LinkedHashMap<>(calculated);
        next.put(name, value);
        return new EvaluationContext(inputs, constants, next, tables);
    }

    public EvaluationContext withTables(Map<String, BracketTable> resolvedTables) {
        return new EvaluationContext(inputs, constants, calculated, resolvedTables);
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return map == null || map.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}

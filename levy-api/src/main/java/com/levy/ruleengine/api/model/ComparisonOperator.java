/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import java.util.Optional;

/**
 * Operators accepted inside a comparison condition such as {@code {"$age": {"gte": 18}}}.
 */
public enum ComparisonOperator {
    EQ("eq", false),
    NE("ne", false),
    GT("gt", true),
    LT("lt", true),
    GTE("gte", true),
    LTE("lte", true);

    private final String key;
    private final boolean ordering;

    ComparisonOperator(String key, boolean ordering) {
        this.key = key;
        this.ordering = ordering;
    }

    public String key() {
        return key;
    }

    /**
     * True for operators that order their operands and therefore require numbers on both sides.
     */
    public boolean isOrdering() {
        return ordering;
    }

    public static Optional<ComparisonOperator> fromKey(String key) {
        for (ComparisonOperator operator : values()) {
            if (operator.key.equals(key)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.table;

/**
 * A resolved bracket. {@code min} is inclusive, {@code max} exclusive; a null {@code max} is unbounded.
 */
public record TaxBracket(double min, Double max, double rate, double baseTax) {

    public boolean isUnbounded() {
        return max == null;
    }

    public boolean covers(double value) {
        return min <= value && (max == null || value < max);
    }

    /**
     * {@code base_tax + (min(value, max) - min) * rate}.
     */
    public double taxFor(double value) {
        double upper = max == null ? value : Math.min(value, max);
        return baseTax + (upper - min) * rate;
    }
}

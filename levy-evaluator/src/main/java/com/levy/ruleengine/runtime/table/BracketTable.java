/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.table;

import com.levy.ruleengine.api.exceptions.TableLookupException;

import java.util.List;

/**
 * Progressive bracket table with all bounds resolved to numbers.
 *
 * <p>Lookup picks the first bracket, in declaration order, with {@code min <= value}
 * and {@code value < max} (or an unbounded max). A value below the first bracket or
 * inside a gap between brackets has no bracket and fails; it never yields 0.
 */
public record BracketTable(String name, List<TaxBracket> brackets) {

    public BracketTable {
        brackets = List.copyOf(brackets);
    }

    public double lookup(double value) {
        for (TaxBracket bracket : brackets) {
            if (bracket.covers(value)) {
                return bracket.taxFor(value);
            }
        }
        throw new TableLookupException(
                "No bracket in table '" + name + "' covers value " + value, name);
    }
}

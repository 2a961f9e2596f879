/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.levy.ruleengine.api.model.json.ValueDeserializer;

import java.math.BigDecimal;

/**
 * A scalar value flowing through a rule: a number, a boolean or a string.
 *
 * <p>Numbers are IEEE-754 doubles. Arithmetic and ordering comparisons accept
 * {@link NumberValue} only; equality requires both sides to carry the same {@link ValueType}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Map<String, Value> inputs = Map.of(
 *     "gross_income", Value.of(500_000),
 *     "filing_status", Value.of("MARRIED"),
 *     "has_dependents", Value.of(true));
 * }</pre>
 */
@JsonDeserialize(using = ValueDeserializer.class)
public sealed interface Value permits Value.NumberValue, Value.BooleanValue, Value.StringValue {

    ValueType type();

    /**
     * Returns the boxed Java representation ({@link Double}, {@link Boolean} or {@link String}).
     */
    Object raw();

    static Value of(double number) {
        return new NumberValue(number);
    }

    static Value of(boolean flag) {
        return flag ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static Value of(String text) {
        return new StringValue(text);
    }

    /**
     * Converts a plain Java scalar into a Value.
     *
     * @throws IllegalArgumentException if {@code raw} is null or not a Number, Boolean or String
     */
    static Value from(Object raw) {
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof Number number) {
            return of(number.doubleValue());
        }
        if (raw instanceof Boolean flag) {
            return of(flag.booleanValue());
        }
        if (raw instanceof String text) {
            return of(text);
        }
        throw new IllegalArgumentException("Not a scalar value: " + raw);
    }

    default boolean isNumber() {
        return type() == ValueType.NUMBER;
    }

    record NumberValue(double value) implements Value {

        @Override
        public ValueType type() {
            return ValueType.NUMBER;
        }

        @Override
        @JsonValue
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            if (Double.isFinite(value)) {
                return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
            }
            return Double.toString(value);
        }
    }

    record BooleanValue(boolean value) implements Value {

        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public ValueType type() {
            return ValueType.BOOLEAN;
        }

        @Override
        @JsonValue
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record StringValue(String value) implements Value {

        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("String value must not be null");
            }
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }

        @Override
        @JsonValue
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return "'" + value + "'";
        }
    }
}

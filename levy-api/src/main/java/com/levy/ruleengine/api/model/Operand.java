/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import java.util.Objects;

/**
 * The value side of an operation, a bracket bound, a filing day or a comparison:
 * either a literal scalar or expression text to be evaluated against the context.
 */
public sealed interface Operand permits Operand.Literal, Operand.ExpressionText {

    /** Marks a comparison right-hand side as an expression rather than a string literal. */
    String EXPRESSION_MARKER = "=";

    static Operand literal(Value value) {
        return new Literal(value);
    }

    static Operand expression(String text) {
        return new ExpressionText(text);
    }

    /**
     * Interprets a raw operation value: numbers and booleans are literals, strings are expressions.
     */
    static Operand forOperation(Object raw) {
        if (raw instanceof Operand operand) {
            return operand;
        }
        if (raw instanceof String text) {
            return expression(text);
        }
        return literal(Value.from(raw));
    }

    /**
     * Interprets a raw comparison right-hand side. Numbers, booleans and plain strings are literals.
     * A string is treated as an expression when it starts with {@code $} (an input or constant
     * reference) or with the {@code =} marker, which is stripped.
     *
     * <p>Every string starting with {@code $} is parsed as an expression, so literal text such as
     * {@code "$5 fee"} does not compare as text and fails to parse. Write such a literal as a
     * marked string expression instead: {@code "='$5 fee'"}.
     */
    static Operand forComparison(Object raw) {
        if (raw instanceof Operand operand) {
            return operand;
        }
        if (raw instanceof String text) {
            if (text.startsWith(EXPRESSION_MARKER)) {
                return expression(text.substring(EXPRESSION_MARKER.length()));
            }
            if (text.startsWith("$")) {
                return expression(text);
            }
        }
        return literal(Value.from(raw));
    }

    record Literal(Value value) implements Operand {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record ExpressionText(String text) implements Operand {
        public ExpressionText {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String toString() {
            return text;
        }
    }
}

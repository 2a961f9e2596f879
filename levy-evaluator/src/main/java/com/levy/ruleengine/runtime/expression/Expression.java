/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.expression;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable syntax tree of a single expression.
 *
 * <p>Node kinds:
 * <ul>
 *   <li>{@link NumberLiteral}, {@link BooleanLiteral}, {@link StringLiteral}</li>
 *   <li>{@link InputVariableRef} ({@code $name}), {@link ConstantRef} ({@code $$name}),
 *       {@link CalculatedRef} (bare {@code name})</li>
 *   <li>{@link Call} ({@code name(arg, ...)})</li>
 * </ul>
 * The parser performs no semantic checks; whether names resolve is decided at evaluation time.
 */
public sealed interface Expression permits Expression.NumberLiteral, Expression.BooleanLiteral,
        Expression.StringLiteral, Expression.InputVariableRef, Expression.ConstantRef,
        Expression.CalculatedRef, Expression.Call {

    <T> T accept(ExpressionVisitor<T> visitor);

    record NumberLiteral(double value) implements Expression {
        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record BooleanLiteral(boolean value) implements Expression {
        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    record StringLiteral(String value) implements Expression {
        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitString(this);
        }
    }

    record InputVariableRef(String name) implements Expression {
        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitInput(this);
        }

        @Override
        public String toString() {
            return "$" + name;
        }
    }

    record ConstantRef(String name) implements Expression {
        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public String toString() {
            return "$$" + name;
        }
    }

    record CalculatedRef(String name) implements Expression {
        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitCalculated(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Call(String name, List<Expression> arguments) implements Expression {
        public Call {
            Objects.requireNonNull(name, "name");
            arguments = List.copyOf(arguments);
        }

        @Override
        public <T> T accept(ExpressionVisitor<T> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            return arguments.stream().map(Object::toString).collect(Collectors.joining(", ", name + "(", ")"));
        }
    }
}

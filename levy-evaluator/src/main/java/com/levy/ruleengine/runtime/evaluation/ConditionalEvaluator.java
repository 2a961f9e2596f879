/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.evaluation;

import com.levy.ruleengine.api.exceptions.EvaluationDepthException;
import com.levy.ruleengine.api.exceptions.TypeMismatchException;
import com.levy.ruleengine.api.model.ComparisonOperator;
import com.levy.ruleengine.api.model.Condition;
import com.levy.ruleengine.api.model.Operand;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.runtime.context.EvaluationContext;

import java.util.List;

/**
 * Evaluates guards used by cases, validation rules, conditional inputs and filing schedules.
 *
 * <p>The subject of a comparison is always evaluated as an expression. The right-hand side is a
 * literal unless it was written as an expression ({@code $}-prefixed or {@code =}-marked), see
 * {@link Operand#forComparison(Object)}.
 *
 * <p>{@code eq}/{@code ne} need operands of the same type; {@code gt}, {@code lt}, {@code gte}
 * and {@code lte} need two numbers. {@code and}/{@code or} short-circuit left to right.
 */
public final class ConditionalEvaluator {

    private final ExpressionEvaluator expressions;
    private final int maxDepth;

    public ConditionalEvaluator(ExpressionEvaluator expressions) {
        this(expressions, 64);
    }

    public ConditionalEvaluator(ExpressionEvaluator expressions, int maxDepth) {
        this.expressions = expressions;
        this.maxDepth = maxDepth;
    }

    public boolean evaluate(Condition condition, EvaluationContext context) {
        return evaluate(condition, context, 1);
    }

    /**
     * True when every condition holds; an empty list holds.
     */
    public boolean evaluateAll(List<Condition> conditions, EvaluationContext context) {
        for (Condition condition : conditions) {
            if (!evaluate(condition, context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when at least one condition holds; an empty list does not.
     */
    public boolean evaluateAny(List<Condition> conditions, EvaluationContext context) {
        for (Condition condition : conditions) {
            if (evaluate(condition, context)) {
                return true;
            }
        }
        return false;
    }

    private boolean evaluate(Condition condition, EvaluationContext context, int depth) {
        if (depth > maxDepth) {
            throw new EvaluationDepthException("Condition", maxDepth, null);
        }
        if (condition instanceof Condition.Comparison comparison) {
            return compare(comparison, context);
        }
        if (condition instanceof Condition.All all) {
            for (Condition child : all.conditions()) {
                if (!evaluate(child, context, depth + 1)) {
                    return false;
                }
            }
            return true;
        }
        if (condition instanceof Condition.Any any) {
            for (Condition child : any.conditions()) {
                if (evaluate(child, context, depth + 1)) {
                    return true;
                }
            }
            return false;
        }
        Condition.Not not = (Condition.Not) condition;
        return !evaluate(not.condition(), context, depth + 1);
    }

    private boolean compare(Condition.Comparison comparison, EvaluationContext context) {
        Value left = expressions.evaluate(comparison.subject(), context);
        Value right = resolve(comparison.operand(), context);
        ComparisonOperator operator = comparison.operator();

        if (operator.isOrdering()) {
            if (!left.isNumber() || !right.isNumber()) {
                throw mismatch(comparison, left, right);
            }
            double l = ((Value.NumberValue) left).value();
            double r = ((Value.NumberValue) right).value();
            return switch (operator) {
                case GT -> l > r;
                case LT -> l < r;
                case GTE -> l >= r;
                case LTE -> l <= r;
                default -> throw new IllegalStateException("Not an ordering operator: " + operator);
            };
        }
        if (left.type() != right.type()) {
            throw mismatch(comparison, left, right);
        }
        boolean equal = left.isNumber()
                ? ((Value.NumberValue) left).value() == ((Value.NumberValue) right).value()
                : left.equals(right);
        return operator == ComparisonOperator.EQ ? equal : !equal;
    }

    private Value resolve(Operand operand, EvaluationContext context) {
        if (operand instanceof Operand.Literal literal) {
            return literal.value();
        }
        return expressions.evaluate(((Operand.ExpressionText) operand).text(), context);
    }

    private static TypeMismatchException mismatch(Condition.Comparison comparison, Value left, Value right) {
        return new TypeMismatchException("Cannot compare " + left.type().jsonName() + " with "
                + right.type().jsonName() + " using '" + comparison.operator().key() + "'", comparison.subject());
    }
}

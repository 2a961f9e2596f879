/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.evaluation;

import com.levy.ruleengine.api.exceptions.DivisionByZeroException;
import com.levy.ruleengine.api.exceptions.OperationTypeException;
import com.levy.ruleengine.api.exceptions.TableLookupException;
import com.levy.ruleengine.api.model.Operand;
import com.levy.ruleengine.api.model.Operation;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.runtime.context.EvaluationContext;
import com.levy.ruleengine.runtime.table.BracketTable;

import java.util.function.DoubleBinaryOperator;

/**
 * Applies operations to an evaluation context.
 *
 * <p>Every operation returns a new context; the input context is never modified, so a
 * failing operation (including division by zero) leaves the caller's state unchanged.
 *
 * <table>
 *   <caption>Operations</caption>
 *   <tr><th>type</th><th>effect</th></tr>
 *   <tr><td>set</td><td>target = value (any scalar)</td></tr>
 *   <tr><td>add, subtract/deduct, multiply, divide</td><td>target = target op value (numbers)</td></tr>
 *   <tr><td>min, max</td><td>target = min/max(target, value) (numbers)</td></tr>
 *   <tr><td>lookup</td><td>target = bracket tax of value in table</td></tr>
 * </table>
 *
 * <p>The current value of an arithmetic target is read from the calculated variables, falling
 * back to built-in variables, so {@code liability} accumulates from 0.
 */
public final class OperationRegistry {

    private final ExpressionEvaluator expressions;

    public OperationRegistry(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    public EvaluationContext apply(Operation operation, EvaluationContext context) {
        return switch (operation.type()) {
            case SET -> context.withCalculated(operation.target(), operand(operation, context));
            case ADD -> arithmetic(operation, context, Double::sum);
            case SUBTRACT -> arithmetic(operation, context, (a, b) -> a - b);
            case MULTIPLY -> arithmetic(operation, context, (a, b) -> a * b);
            case DIVIDE -> divide(operation, context);
            case MIN -> arithmetic(operation, context, Math::min);
            case MAX -> arithmetic(operation, context, Math::max);
            case LOOKUP -> lookup(operation, context);
        };
    }

    private EvaluationContext arithmetic(Operation operation, EvaluationContext context, DoubleBinaryOperator op) {
        double current = currentNumber(operation, context);
        double value = numericOperand(operation, context);
        return context.withCalculated(operation.target(), Value.of(op.applyAsDouble(current, value)));
    }

    private EvaluationContext divide(Operation operation, EvaluationContext context) {
        double current = currentNumber(operation, context);
        double divisor = numericOperand(operation, context);
        if (divisor == 0) {
            throw new DivisionByZeroException(operation.target());
        }
        return context.withCalculated(operation.target(), Value.of(current / divisor));
    }

    private EvaluationContext lookup(Operation operation, EvaluationContext context) {
        String tableName = operation.table();
        if (tableName == null) {
            throw new TableLookupException("Lookup into '" + operation.target() + "' names no table", null);
        }
        BracketTable table = context.tables().get(tableName);
        if (table == null) {
            throw new TableLookupException("Table '" + tableName + "' not found", tableName);
        }
        double amount = numericOperand(operation, context);
        return context.withCalculated(operation.target(), Value.of(table.lookup(amount)));
    }

    private double currentNumber(Operation operation, EvaluationContext context) {
        Value current = context.calculated().get(operation.target());
        if (current == null) {
            current = expressions.library().variables().get(operation.target());
        }
        if (current == null) {
            throw new OperationTypeException("Cannot " + operation.type().jsonName() + " '"
                    + operation.target() + "': it has no value yet", operation.target());
        }
        if (!current.isNumber()) {
            throw new OperationTypeException("Cannot " + operation.type().jsonName() + " '"
                    + operation.target() + "': current value is " + current.type().jsonName(), operation.target());
        }
        return ((Value.NumberValue) current).value();
    }

    private double numericOperand(Operation operation, EvaluationContext context) {
        Value value = operand(operation, context);
        if (!value.isNumber()) {
            throw new OperationTypeException(operation.type().jsonName() + " on '" + operation.target()
                    + "' requires a number but value is " + value.type().jsonName(), operation.target());
        }
        return ((Value.NumberValue) value).value();
    }

    private Value operand(Operation operation, EvaluationContext context) {
        Operand operand = operation.value();
        if (operand == null) {
            throw new OperationTypeException(operation.type().jsonName() + " on '" + operation.target()
                    + "' has no value", operation.target());
        }
        if (operand instanceof Operand.Literal literal) {
            return literal.value();
        }
        return expressions.evaluate(((Operand.ExpressionText) operand).text(), context);
    }
}

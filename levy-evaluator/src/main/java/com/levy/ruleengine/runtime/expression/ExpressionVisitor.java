/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.expression;

public interface ExpressionVisitor<T> {

    T visitNumber(Expression.NumberLiteral literal);

    T visitBoolean(Expression.BooleanLiteral literal);

    T visitString(Expression.StringLiteral literal);

    T visitInput(Expression.InputVariableRef ref);

    T visitConstant(Expression.ConstantRef ref);

    T visitCalculated(Expression.CalculatedRef ref);

    T visitCall(Expression.Call call);
}

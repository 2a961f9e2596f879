/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when a function implementation produces no Number, Boolean or String value.
 */
public class NonScalarReturnException extends ExpressionEvaluationException {

    public NonScalarReturnException(String functionName) {
        super("Function '" + functionName + "' must return a number, boolean or string", functionName);
    }
}

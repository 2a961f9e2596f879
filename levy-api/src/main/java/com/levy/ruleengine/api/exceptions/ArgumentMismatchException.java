/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when a function call has the wrong number of arguments or an argument
 * of the wrong type.
 */
public class ArgumentMismatchException extends ExpressionEvaluationException {

    public ArgumentMismatchException(String message, String functionName) {
        super(message, functionName);
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when a function is used as a variable or a variable is called as a function.
 */
public class WrongKindUsageException extends ExpressionEvaluationException {

    public WrongKindUsageException(String message, String name) {
        super(message, name);
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

import java.util.Collection;

/**
 * Raised when an expression calls a function that is not registered.
 */
public class UnknownFunctionException extends ExpressionEvaluationException {

    public UnknownFunctionException(String name, Collection<String> available) {
        super("Unknown function '" + name + "'. Available functions: " + String.join(", ", available), name);
    }
}

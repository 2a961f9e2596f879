/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when expression or condition nesting exceeds the configured depth limit.
 */
public class EvaluationDepthException extends ExpressionEvaluationException {

    public EvaluationDepthException(String what, int limit, String subject) {
        super(what + " nesting exceeds the maximum depth of " + limit, subject);
    }
}

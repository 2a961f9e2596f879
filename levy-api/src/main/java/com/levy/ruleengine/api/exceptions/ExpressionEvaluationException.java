/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Base class for failures raised while resolving or invoking parts of a parsed expression.
 */
public abstract class ExpressionEvaluationException extends TaxRuleException {

    protected ExpressionEvaluationException(String message, String subject) {
        super(message, subject);
    }
}

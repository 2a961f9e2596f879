/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when a comparison receives operands whose types it cannot compare.
 */
public class TypeMismatchException extends TaxRuleException {

    public TypeMismatchException(String message, String subject) {
        super(message, subject);
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when an operation is unknown or receives a non-numeric value where a number is required.
 */
public class OperationTypeException extends TaxRuleException {

    public OperationTypeException(String message, String target) {
        super(message, target);
    }
}

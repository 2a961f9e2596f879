/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when a name is registered with a kind that contradicts an existing symbol,
 * or when a built-in function would be redefined.
 */
public class SymbolConflictException extends TaxRuleException {

    public SymbolConflictException(String message, String name) {
        super(message, name);
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when a bracket table is missing or no bracket covers the looked-up value.
 */
public class TableLookupException extends TaxRuleException {

    public TableLookupException(String message, String tableName) {
        super(message, tableName);
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when one of a rule's {@code validate} guards holds for the supplied inputs.
 * The message is the rule author's error text.
 */
public class RuleViolationException extends TaxRuleException {

    public RuleViolationException(String error) {
        super("Validation failed: " + error);
    }
}

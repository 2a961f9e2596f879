/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

import com.levy.ruleengine.api.model.ValidationIssue;

import java.util.List;

/**
 * Raised when supplied inputs do not satisfy the rule's input declarations.
 */
public class InputValidationException extends TaxRuleException {

    private final List<ValidationIssue> issues;

    public InputValidationException(List<ValidationIssue> issues) {
        super("Input validation failed:\n" + RuleValidationException.format(issues));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

import com.levy.ruleengine.api.model.ValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a rule document is refused because structural validation reported problems.
 */
public class RuleValidationException extends TaxRuleException {

    private final List<ValidationIssue> issues;

    public RuleValidationException(String ruleName, List<ValidationIssue> issues) {
        super("Rule '" + ruleName + "' failed validation:\n" + format(issues), ruleName);
        this.issues = List.copyOf(issues);
    }

    public static String format(List<ValidationIssue> issues) {
        return issues.stream()
                .map(ValidationIssue::toString)
                .collect(Collectors.joining("\n  - ", "  - ", ""));
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}

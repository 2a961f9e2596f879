/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.validation;

import com.levy.ruleengine.api.model.ValidationIssue;
import com.levy.ruleengine.api.model.Value;

import java.util.List;
import java.util.Map;

/**
 * @param issues         problems found, errors and warnings
 * @param resolvedInputs the supplied inputs with declared defaults filled in
 */
public record InputValidationReport(List<ValidationIssue> issues, Map<String, Value> resolvedInputs) {

    public InputValidationReport {
        issues = List.copyOf(issues);
        resolvedInputs = Map.copyOf(resolvedInputs);
    }

    public boolean isValid() {
        return issues.stream().noneMatch(ValidationIssue::isError);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shape of the {@code validate} section. Guards are checked by {@link ConditionValidator}.
 */
final class ValidationRuleValidator implements SectionValidator {

    @Override
    public String section() {
        return "validate";
    }

    @Override
    public void validate(JsonNode rule, IssueCollector issues) {
        JsonNode validate = rule.path("validate");
        for (int i = 0; i < validate.size(); i++) {
            String path = "/validate/" + i;
            JsonNode entry = validate.get(i);
            JsonNode when = entry.get("when");
            if (when == null || when.isNull()) {
                issues.error(path + "/when", "Validation rule must have a when condition");
            }
            if (!IssueCollector.isNonEmptyText(entry.get("error"))) {
                issues.error(path + "/error", "Validation rule must have a non-empty error message");
            }
        }
    }
}

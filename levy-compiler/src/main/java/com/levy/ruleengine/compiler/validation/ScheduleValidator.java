/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.levy.ruleengine.api.model.FilingFrequency;

/**
 * Filing schedules: name, frequency, filing day and forms.
 */
final class ScheduleValidator implements SectionValidator {

    @Override
    public String section() {
        return "schedules";
    }

    @Override
    public void validate(JsonNode rule, IssueCollector issues) {
        JsonNode schedules = rule.path("filing_schedules");
        for (int i = 0; i < schedules.size(); i++) {
            String path = "/filing_schedules/" + i;
            JsonNode schedule = schedules.get(i);

            if (!IssueCollector.isNonEmptyText(schedule.get("name"))) {
                issues.error(path + "/name", "Filing schedule must have a non-empty name");
            }
            String frequency = schedule.path("frequency").asText(null);
            if (FilingFrequency.fromName(frequency).isEmpty()) {
                issues.error(path + "/frequency", "Invalid frequency: " + frequency,
                        "Must be one of: quarterly, monthly, annually");
            }
            checkFilingDay(rule, schedule.get("filing_day"), path + "/filing_day", issues);
            checkForms(schedule.get("forms"), path + "/forms", issues);
        }
    }

    private static void checkFilingDay(JsonNode rule, JsonNode day, String path, IssueCollector issues) {
        if (day == null || day.isNull()) {
            issues.error(path, "Filing day must be a number or constant reference");
        } else if (day.isNumber()) {
            if (!day.canConvertToInt() || day.asDouble() != Math.floor(day.asDouble())
                    || day.asInt() < 1 || day.asInt() > 31) {
                issues.error(path, "Invalid filing day: " + day.asText(), "Filing day must be between 1 and 31");
            }
        } else if (day.isTextual()) {
            String text = day.asText();
            if (!text.startsWith("$$")) {
                issues.error(path, "Invalid filing day reference: " + text,
                        "String values must be constant references (e.g., $$quarterly_filing_day)");
            } else if (!rule.path("constants").has(text.substring(2))) {
                issues.error(path, "Undefined constant: " + text,
                        "Define " + text.substring(2) + " in the constants section");
            }
        } else {
            issues.error(path, "Filing day must be a number or constant reference");
        }
    }

    private static void checkForms(JsonNode forms, String path, IssueCollector issues) {
        if (forms == null || !forms.isObject()) {
            issues.error(path, "Filing schedule must declare its forms");
            return;
        }
        if (!IssueCollector.isNonEmptyText(forms.get("primary"))) {
            issues.error(path + "/primary", "Primary form must be a non-empty string");
        }
        JsonNode attachments = forms.get("attachments");
        if (attachments == null || attachments.isNull()) {
            return;
        }
        if (!attachments.isArray()) {
            issues.error(path + "/attachments", "Attachments must be an array of strings");
            return;
        }
        for (int i = 0; i < attachments.size(); i++) {
            if (!attachments.get(i).isTextual()) {
                issues.error(path + "/attachments/" + i, "Attachment at index " + i + " must be a string");
            }
        }
    }
}

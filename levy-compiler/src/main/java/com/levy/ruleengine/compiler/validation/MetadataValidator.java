/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Version, name, jurisdiction, taxpayer type, effective dates and descriptive fields.
 */
final class MetadataValidator implements SectionValidator {

    static final List<String> TAXPAYER_TYPES =
            List.of("INDIVIDUAL", "CORPORATION", "PARTNERSHIP", "SOLE_PROPRIETORSHIP");

    private static final Pattern VERSION = Pattern.compile("\\d+\\.\\d+\\.\\d+");
    private static final Pattern COUNTRY_CODE = Pattern.compile("[A-Z]{2}");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private final boolean allowUnknownTaxpayerTypes;

    MetadataValidator(boolean allowUnknownTaxpayerTypes) {
        this.allowUnknownTaxpayerTypes = allowUnknownTaxpayerTypes;
    }

    @Override
    public String section() {
        return "metadata";
    }

    @Override
    public void validate(JsonNode rule, IssueCollector issues) {
        JsonNode version = rule.path("$version");
        if (!version.isTextual() || !VERSION.matcher(version.asText()).matches()) {
            issues.error("/$version", "Invalid version format: " + version,
                    "Use semantic versioning format (e.g., \"1.0.0\")");
        }

        if (!IssueCollector.isNonEmptyText(rule.get("name"))) {
            issues.error("/name", "Name must be a non-empty string");
        }

        JsonNode jurisdiction = rule.path("jurisdiction");
        if (!jurisdiction.isTextual() || !COUNTRY_CODE.matcher(jurisdiction.asText()).matches()) {
            issues.error("/jurisdiction", "Invalid jurisdiction code: " + jurisdiction,
                    "Use ISO 3166 two-letter country codes (e.g., \"PH\", \"US\")");
        }

        JsonNode taxpayerType = rule.path("taxpayer_type");
        if (!taxpayerType.isTextual()) {
            issues.error("/taxpayer_type", "Taxpayer type must be a string");
        } else if (!TAXPAYER_TYPES.contains(taxpayerType.asText()) && !allowUnknownTaxpayerTypes) {
            issues.warning("/taxpayer_type", "Unknown taxpayer type: " + taxpayerType.asText(),
                    "Consider using one of: " + String.join(", ", TAXPAYER_TYPES));
        }

        LocalDate from = date(rule, "effective_from", issues);
        LocalDate to = date(rule, "effective_to", issues);
        if (from != null && to != null && !from.isBefore(to)) {
            issues.error("/effective_from", "effective_from must be before effective_to");
        }

        JsonNode references = rule.get("references");
        if (IssueCollector.isPresent(references) && !references.isNull()) {
            if (!references.isArray()) {
                issues.error("/references", "References must be an array of strings");
            } else {
                for (int i = 0; i < references.size(); i++) {
                    if (!references.get(i).isTextual()) {
                        issues.error("/references/" + i, "Reference at index " + i + " must be a string");
                    }
                }
            }
        }
        for (String field : List.of("author", "category")) {
            JsonNode value = rule.get(field);
            if (value != null && !value.isNull() && !value.isTextual()) {
                issues.error("/" + field, Character.toUpperCase(field.charAt(0)) + field.substring(1)
                        + " must be a string");
            }
        }
    }

    private static LocalDate date(JsonNode rule, String field, IssueCollector issues) {
        JsonNode value = rule.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() && ISO_DATE.matcher(value.asText()).matches()) {
            try {
                return LocalDate.parse(value.asText());
            } catch (DateTimeParseException e) {
                issues.error("/" + field, "Invalid " + field + " date: " + value.asText() + " (" + e.getMessage() + ")");
                return null;
            }
        }
        issues.error("/" + field, "Invalid " + field + " date format: " + value, "Use ISO date format (YYYY-MM-DD)");
        return null;
    }
}

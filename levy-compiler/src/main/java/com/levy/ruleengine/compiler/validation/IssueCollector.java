/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.levy.ruleengine.api.model.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Accumulates issues for one validation run, plus the JSON helpers shared by the section validators.
 */
final class IssueCollector {

    private static final Pattern RULE_IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]*");

    static final String IDENTIFIER_HINT = "Identifiers must match pattern: [a-z][a-z0-9_]*";

    private final List<ValidationIssue> issues = new ArrayList<>();

    void error(String path, String message) {
        issues.add(ValidationIssue.error(path, message));
    }

    void error(String path, String message, String suggestion) {
        issues.add(ValidationIssue.error(path, message, suggestion));
    }

    void warning(String path, String message) {
        issues.add(ValidationIssue.warning(path, message));
    }

    void warning(String path, String message, String suggestion) {
        issues.add(ValidationIssue.warning(path, message, suggestion));
    }

    boolean hasErrors() {
        return issues.stream().anyMatch(ValidationIssue::isError);
    }

    List<ValidationIssue> issues() {
        return List.copyOf(issues);
    }

    static boolean isRuleIdentifier(String name) {
        return name != null && RULE_IDENTIFIER.matcher(name).matches();
    }

    static boolean isNonEmptyText(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank();
    }

    static boolean isPresent(JsonNode node) {
        return node != null && !node.isMissingNode();
    }

    /**
     * Escapes a key for use as a JSON-pointer segment.
     */
    static String segment(String key) {
        return key.replace("~", "~0").replace("/", "~1");
    }
}

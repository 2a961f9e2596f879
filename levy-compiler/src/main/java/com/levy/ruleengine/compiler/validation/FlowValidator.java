/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.levy.ruleengine.api.model.OperationType;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flow steps, cases and operations. Case guards are left to {@link ConditionValidator}.
 */
final class FlowValidator implements SectionValidator {

    private static final String OPERATION_TYPES = Arrays.stream(OperationType.values())
            .map(OperationType::jsonName)
            .collect(Collectors.joining(", "));

    private final ExpressionChecker expressions;

    FlowValidator(ExpressionChecker expressions) {
        this.expressions = expressions;
    }

    @Override
    public String section() {
        return "flow";
    }

    @Override
    public void validate(JsonNode rule, IssueCollector issues) {
        JsonNode flow = rule.path("flow");
        if (flow.isEmpty()) {
            issues.error("/flow", "Rule must have at least one flow step");
            return;
        }
        Set<String> tables = new HashSet<>();
        rule.path("tables").forEach(table -> tables.add(table.path("name").asText()));

        for (int s = 0; s < flow.size(); s++) {
            validateStep(rule, flow.get(s), "/flow/" + s, tables, issues);
        }
    }

    private void validateStep(JsonNode rule, JsonNode step, String path, Set<String> tables, IssueCollector issues) {
        if (!step.isObject()) {
            issues.error(path, "Flow step must be an object");
            return;
        }
        if (!IssueCollector.isNonEmptyText(step.get("name"))) {
            issues.error(path + "/name", "Flow step must have a non-empty name");
        }

        JsonNode operations = step.path("operations");
        JsonNode cases = step.path("cases");
        boolean hasOperations = operations.isArray() && !operations.isEmpty();
        boolean hasCases = cases.isArray() && !cases.isEmpty();
        if (!hasOperations && !hasCases) {
            issues.error(path, "Flow step must have either operations or cases");
        }
        if (hasOperations && hasCases) {
            issues.error(path, "Flow step cannot have both operations and cases",
                    "Use either operations for direct calculations or cases for conditional logic");
        }

        if (hasOperations) {
            validateOperations(rule, operations, path + "/operations", tables, issues);
        }
        if (!hasCases) {
            return;
        }
        int defaults = 0;
        for (int c = 0; c < cases.size(); c++) {
            JsonNode item = cases.get(c);
            String casePath = path + "/cases/" + c;
            JsonNode when = item.get("when");
            if (when == null || when.isNull()) {
                defaults++;
                if (defaults > 1) {
                    issues.error(path + "/cases", "Only one default case (without when) allowed per step");
                } else if (c != cases.size() - 1) {
                    issues.error(casePath, "Default case must be the last case in the array");
                }
            }
            JsonNode caseOperations = item.path("operations");
            if (!caseOperations.isArray() || caseOperations.isEmpty()) {
                issues.error(casePath + "/operations", "Case must have at least one operation");
            } else {
                validateOperations(rule, caseOperations, casePath + "/operations", tables, issues);
            }
        }
    }

    private void validateOperations(JsonNode rule, JsonNode operations, String path, Set<String> tables,
                                    IssueCollector issues) {
        for (int o = 0; o < operations.size(); o++) {
            validateOperation(rule, operations.get(o), path + "/" + o, tables, issues);
        }
    }

    private void validateOperation(JsonNode rule, JsonNode operation, String path, Set<String> tables,
                                   IssueCollector issues) {
        String typeName = operation.path("type").asText(null);
        OperationType type = OperationType.fromName(typeName).orElse(null);
        if (type == null) {
            issues.error(path + "/type", "Invalid operation type: " + typeName, "Must be one of: " + OPERATION_TYPES);
        }

        String target = operation.path("target").asText(null);
        if (!IssueCollector.isRuleIdentifier(target)) {
            issues.error(path + "/target", "Invalid operation target: " + target,
                    "Operation targets must be valid identifiers: [a-z][a-z0-9_]*");
        }

        if (type == OperationType.LOOKUP) {
            String table = operation.path("table").asText(null);
            if (table == null || table.isEmpty()) {
                issues.error(path + "/table", "Lookup operation requires a table");
            } else if (!tables.contains(table)) {
                issues.error(path + "/table", "Undefined table: " + table, "Define the table in the tables section");
            }
        }

        JsonNode value = operation.get("value");
        if (value == null) {
            issues.error(path + "/value", "Operation " + typeName + " requires a value");
        } else if (value.isNull()) {
            issues.error(path + "/value", "Operation value cannot be null",
                    "Use explicit values instead of null in calculations");
        } else if (value.isTextual()) {
            expressions.check(value.asText(), path + "/value", rule, issues);
        } else if (!value.isNumber() && !value.isBoolean()) {
            issues.error(path + "/value", "Value must be a string, number, or boolean, got " + value.getNodeType());
        }
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.levy.ruleengine.api.model.ComparisonOperator;
import com.levy.ruleengine.api.model.Condition;
import com.levy.ruleengine.api.model.Operand;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Guards of flow cases, validation rules and filing schedules. Input guards are checked
 * together with their declaration by {@link VariableValidator}.
 */
final class ConditionValidator implements SectionValidator {

    private static final String OPERATORS = Arrays.stream(ComparisonOperator.values())
            .map(ComparisonOperator::key)
            .collect(Collectors.joining(", "));

    private final ExpressionChecker expressions;
    private final int maxDepth;

    ConditionValidator(ExpressionChecker expressions, int maxDepth) {
        this.expressions = expressions;
        this.maxDepth = maxDepth;
    }

    @Override
    public String section() {
        return "conditions";
    }

    @Override
    public void validate(JsonNode rule, IssueCollector issues) {
        JsonNode flow = rule.path("flow");
        for (int s = 0; s < flow.size(); s++) {
            JsonNode cases = flow.get(s).path("cases");
            for (int c = 0; c < cases.size(); c++) {
                JsonNode when = cases.get(c).get("when");
                if (when != null && !when.isNull()) {
                    check(when, "/flow/" + s + "/cases/" + c + "/when", rule, issues, 1);
                }
            }
        }
        JsonNode validate = rule.path("validate");
        for (int i = 0; i < validate.size(); i++) {
            JsonNode when = validate.get(i).get("when");
            if (when != null && !when.isNull()) {
                check(when, "/validate/" + i + "/when", rule, issues, 1);
            }
        }
        JsonNode schedules = rule.path("filing_schedules");
        for (int i = 0; i < schedules.size(); i++) {
            JsonNode when = schedules.get(i).get("when");
            if (when != null && !when.isNull()) {
                check(when, "/filing_schedules/" + i + "/when", rule, issues, 1);
            }
        }
    }

    /**
     * Checks a condition outside the sections this validator walks itself.
     */
    void validateCondition(JsonNode condition, String path, JsonNode rule, IssueCollector issues) {
        check(condition, path, rule, issues, 1);
    }

    private void check(JsonNode node, String path, JsonNode rule, IssueCollector issues, int depth) {
        if (depth > maxDepth) {
            issues.error(path, "Condition nesting exceeds the maximum depth of " + maxDepth);
            return;
        }
        if (!node.isObject()) {
            issues.error(path, "Conditional expression must be an object");
            return;
        }
        if (node.size() != 1) {
            issues.error(path, "Conditional expression must have exactly one key, found " + node.size(),
                    "Combine several comparisons with 'and' or 'or'");
            return;
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        String key = entry.getKey();
        JsonNode body = entry.getValue();
        String childPath = path + "/" + IssueCollector.segment(key);

        switch (key) {
            case Condition.AND, Condition.OR -> {
                if (!body.isArray() || body.isEmpty()) {
                    issues.error(childPath, key.toUpperCase() + " operator requires an array of conditions");
                    return;
                }
                for (int i = 0; i < body.size(); i++) {
                    check(body.get(i), childPath + "/" + i, rule, issues, depth + 1);
                }
            }
            case Condition.NOT -> {
                if (body.isNull()) {
                    issues.error(childPath, "NOT operator requires a condition");
                    return;
                }
                check(body, childPath, rule, issues, depth + 1);
            }
            default -> checkComparison(key, body, childPath, rule, issues);
        }
    }

    private void checkComparison(String subject, JsonNode body, String path, JsonNode rule, IssueCollector issues) {
        if (!body.isObject()) {
            issues.error(path, "Invalid operator for variable " + subject);
            return;
        }
        if (body.size() != 1) {
            issues.error(path, "Comparison operator must have exactly one operator key", "Use one of: " + OPERATORS);
            return;
        }
        Map.Entry<String, JsonNode> comparison = body.fields().next();
        String operatorPath = path + "/" + IssueCollector.segment(comparison.getKey());
        ComparisonOperator operator = ComparisonOperator.fromKey(comparison.getKey()).orElse(null);
        if (operator == null) {
            issues.error(operatorPath, "Invalid comparison operator: " + comparison.getKey(),
                    "Must be one of: " + OPERATORS);
            return;
        }
        JsonNode value = comparison.getValue();
        if (value.isNull()) {
            issues.error(operatorPath, "Comparison value cannot be null",
                    "Use explicit values instead of null in conditions");
            return;
        }
        if (!value.isValueNode()) {
            issues.error(operatorPath, "Comparison value must be a number, boolean or string");
            return;
        }
        Operand operand = value.isTextual() ? Operand.forComparison(value.asText()) : null;
        if (operator.isOrdering() && !value.isNumber() && !(operand instanceof Operand.ExpressionText)) {
            issues.error(operatorPath, "Numeric comparison operator " + operator.key()
                    + " requires a number or variable reference");
        }

        expressions.check(subject, path, rule, issues);
        if (operand instanceof Operand.ExpressionText text) {
            expressions.check(text.text(), operatorPath, rule, issues);
        }
    }
}

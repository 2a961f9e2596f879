/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Constants, inputs and outputs: naming, uniqueness across the three sections and schemas.
 */
final class VariableValidator implements SectionValidator {

    static final List<String> SCHEMA_TYPES = List.of("number", "boolean", "string");

    private final ConditionValidator conditions;

    VariableValidator(ConditionValidator conditions) {
        this.conditions = conditions;
    }

    @Override
    public String section() {
        return "variables";
    }

    @Override
    public void validate(JsonNode rule, IssueCollector issues) {
        Set<String> names = new HashSet<>();

        forEachField(rule.path("constants"), (name, value) -> {
            String path = "/constants/" + IssueCollector.segment(name);
            checkName("constant", "Constant", name, path, names, issues);
            if (value.isNull()) {
                issues.error(path, "Constant " + name + " cannot be null",
                        "Use explicit values instead of null in calculations");
            } else if (!value.isNumber() && !value.isBoolean()) {
                issues.error(path, "Constant " + name + " must be a number or boolean");
            }
        });
        forEachField(rule.path("inputs"), (name, schema) -> {
            String path = "/inputs/" + IssueCollector.segment(name);
            checkName("input", "Input", name, path, names, issues);
            checkSchema(schema, path, issues);
            JsonNode when = schema.get("when");
            if (when != null && !when.isNull()) {
                conditions.validateCondition(when, path + "/when", rule, issues);
            }
        });
        forEachField(rule.path("outputs"), (name, schema) -> {
            String path = "/outputs/" + IssueCollector.segment(name);
            checkName("output", "Output", name, path, names, issues);
            checkSchema(schema, path, issues);
        });
    }

    private static void checkName(String kind, String label, String name, String path, Set<String> names,
                                  IssueCollector issues) {
        if (!IssueCollector.isRuleIdentifier(name)) {
            issues.error(path, "Invalid " + kind + " identifier: " + name, IssueCollector.IDENTIFIER_HINT);
        }
        if (!names.add(name)) {
            issues.error(path, label + " '" + name + "' is already defined",
                    "Each variable, constant, and output must have a unique name");
        }
    }

    private static void checkSchema(JsonNode schema, String path, IssueCollector issues) {
        if (!schema.isObject()) {
            issues.error(path, "Variable schema must be an object");
            return;
        }
        JsonNode type = schema.path("type");
        if (!type.isTextual() || !SCHEMA_TYPES.contains(type.asText())) {
            issues.error(path + "/type", "Invalid type: " + type, "Must be one of: " + String.join(", ", SCHEMA_TYPES));
        }

        JsonNode minimum = schema.get("minimum");
        JsonNode maximum = schema.get("maximum");
        if (minimum != null && !minimum.isNumber()) {
            issues.error(path + "/minimum", "Minimum must be a number");
        }
        if (maximum != null && !maximum.isNumber()) {
            issues.error(path + "/maximum", "Maximum must be a number");
        }
        if (minimum != null && maximum != null && minimum.isNumber() && maximum.isNumber()
                && minimum.asDouble() >= maximum.asDouble()) {
            issues.error(path + "/minimum", "Minimum must be less than maximum");
        }

        JsonNode pattern = schema.get("pattern");
        if (pattern != null) {
            if (!pattern.isTextual()) {
                issues.error(path + "/pattern", "Pattern must be a string");
            } else {
                try {
                    Pattern.compile(pattern.asText());
                } catch (PatternSyntaxException e) {
                    issues.error(path + "/pattern", "Invalid regular expression pattern: " + pattern.asText());
                }
            }
        }

        JsonNode enumValues = schema.get("enum");
        if (enumValues != null && (!enumValues.isArray() || enumValues.isEmpty())) {
            issues.error(path + "/enum", "Enum must be a non-empty array of values");
        }
        JsonNode defaultValue = schema.get("default");
        if (defaultValue != null && !defaultValue.isValueNode()) {
            issues.error(path + "/default", "Default must be a number, boolean or string");
        }
    }

    static void forEachField(JsonNode node, FieldVisitor visitor) {
        if (!node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            visitor.visit(field.getKey(), field.getValue());
        }
    }

    @FunctionalInterface
    interface FieldVisitor {
        void visit(String name, JsonNode value);
    }
}

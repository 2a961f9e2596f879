/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.runtime.function.BuiltinLibrary;

import java.util.HashSet;
import java.util.Set;

/**
 * Bracket tables: names, bracket shape, bound references and contiguity.
 */
final class TableValidator implements SectionValidator {

    private final BuiltinLibrary library;

    TableValidator(BuiltinLibrary library) {
        this.library = library;
    }

    @Override
    public String section() {
        return "tables";
    }

    @Override
    public void validate(JsonNode rule, IssueCollector issues) {
        JsonNode tables = rule.path("tables");
        Set<String> names = new HashSet<>();
        for (int t = 0; t < tables.size(); t++) {
            JsonNode table = tables.get(t);
            String path = "/tables/" + t;
            String name = table.path("name").asText(null);
            if (!IssueCollector.isRuleIdentifier(name)) {
                issues.error(path + "/name", "Invalid table identifier: " + name, IssueCollector.IDENTIFIER_HINT);
            } else if (!names.add(name)) {
                issues.error(path + "/name", "Duplicate table name: " + name);
            }

            JsonNode brackets = table.path("brackets");
            if (!brackets.isArray() || brackets.isEmpty()) {
                issues.error(path + "/brackets", "Table " + name + " must have at least one bracket");
                continue;
            }
            double previousMax = Double.NaN;
            for (int b = 0; b < brackets.size(); b++) {
                String bracketPath = path + "/brackets/" + b;
                JsonNode bracket = brackets.get(b);
                if (!bracket.isObject()) {
                    issues.error(bracketPath, "Bracket must be an object");
                    previousMax = Double.NaN;
                    continue;
                }
                double min = bound(rule, bracket.get("min"), bracketPath + "/min", false, issues);
                double max = bound(rule, bracket.get("max"), bracketPath + "/max", true, issues);
                checkRates(bracket, bracketPath, issues);

                if (!Double.isNaN(min) && !Double.isNaN(max) && min >= max) {
                    issues.error(bracketPath + "/min",
                            "Bracket min (" + Value.of(min) + ") must be less than max (" + Value.of(max) + ")");
                }
                if (b == 0 && !Double.isNaN(min) && min != 0) {
                    issues.warning(bracketPath + "/min", "First bracket should start at 0, found: " + Value.of(min),
                            "Tax brackets typically start from zero income");
                }
                if (b > 0 && !Double.isNaN(previousMax) && !Double.isNaN(min) && previousMax != min) {
                    issues.warning(path + "/brackets", "Gap or overlap between brackets: "
                                    + Value.of(previousMax) + " to " + Value.of(min),
                            "Tax brackets should be contiguous (no gaps or overlaps)");
                }
                previousMax = max;
            }
        }
    }

    /**
     * Resolves a bound to a number where possible. NaN means the bound is invalid or cannot be
     * known before evaluation; an absent or null max is unbounded.
     */
    private double bound(JsonNode rule, JsonNode value, String path, boolean isMax, IssueCollector issues) {
        if (value == null || value.isNull()) {
            if (isMax) {
                return Double.POSITIVE_INFINITY;
            }
            issues.error(path, "Bracket min cannot be null", "Use 0 for the lowest bracket");
            return Double.NaN;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual() && value.asText().startsWith("$$")) {
            String name = value.asText().substring(2);
            JsonNode constant = rule.path("constants").get(name);
            if (constant != null) {
                if (constant.isNumber()) {
                    return constant.asDouble();
                }
                issues.error(path, "Bracket bound " + value.asText() + " must reference a numeric constant");
                return Double.NaN;
            }
            Value builtin = library.constants().get(name);
            if (builtin instanceof Value.NumberValue number) {
                return number.value();
            }
            issues.error(path, "Undefined constant: " + value.asText(), "Define " + name + " in the constants section");
            return Double.NaN;
        }
        issues.error(path, "Invalid bracket " + (isMax ? "max" : "min") + " value: " + value,
                "Must be a number or a constant reference such as $$" + BuiltinLibrary.MAX_TAXABLE_INCOME);
        return Double.NaN;
    }

    private static void checkRates(JsonNode bracket, String path, IssueCollector issues) {
        JsonNode rate = bracket.get("rate");
        if (rate == null || !rate.isNumber()) {
            issues.error(path + "/rate", "Invalid bracket rate: " + rate, "Rate must be a number");
        } else if (rate.asDouble() < 0) {
            issues.warning(path + "/rate", "Negative tax rate: " + rate.asText(),
                    "Tax rates are typically non-negative");
        } else if (rate.asDouble() > 1) {
            issues.warning(path + "/rate", "Tax rate greater than 100%: " + rate.asText(),
                    "Consider if this rate should be expressed as a decimal (e.g., 0.25 for 25%)");
        }

        JsonNode baseTax = bracket.get("base_tax");
        if (baseTax == null) {
            return;
        }
        if (!baseTax.isNumber()) {
            issues.error(path + "/base_tax", "Invalid bracket base_tax: " + baseTax, "Base tax must be a number");
        } else if (baseTax.asDouble() < 0) {
            issues.warning(path + "/base_tax", "Negative base tax: " + baseTax.asText(),
                    "Base tax is typically non-negative");
        }
    }
}

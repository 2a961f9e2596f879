/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.levy.ruleengine.api.config.EngineConfig;
import com.levy.ruleengine.api.config.ValidationMode;
import com.levy.ruleengine.api.model.ValidationIssue;
import com.levy.ruleengine.runtime.expression.ExpressionParser;
import com.levy.ruleengine.runtime.function.BuiltinLibrary;

import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Structural validation of a rule document, run on the JSON tree before it is bound.
 *
 * <p>The structure check (required fields, section types) always runs. Unless the mode is
 * {@link ValidationMode#QUICK} and the structure is sound, the metadata, variables, tables,
 * flow, conditions, validation rules and filing schedules are checked in that order. Every
 * issue carries a JSON-pointer path into the document.
 *
 * <p>Whether a list of issues refuses the document depends on the mode: any error refuses;
 * in {@link ValidationMode#STRICT} warnings refuse too.
 */
public final class RuleDocumentValidator {
    private static final Logger logger = Logger.getLogger(RuleDocumentValidator.class.getName());

    private static final List<String> REQUIRED_FIELDS =
            List.of("$version", "name", "jurisdiction", "taxpayer_type", "flow");

    private final ValidationMode mode;
    private final List<SectionValidator> sections;

    public RuleDocumentValidator(EngineConfig config) {
        this(config, BuiltinLibrary.standard());
    }

    public RuleDocumentValidator(EngineConfig config, BuiltinLibrary library) {
        this.mode = config.getValidationMode();
        ExpressionChecker expressions = new ExpressionChecker(
                new ExpressionParser(config.getMaxExpressionDepth()), library);
        ConditionValidator conditions = new ConditionValidator(expressions, config.getMaxConditionDepth());
        this.sections = List.of(
                new MetadataValidator(config.isAllowUnknownTaxpayerTypes()),
                new VariableValidator(conditions),
                new TableValidator(library),
                new FlowValidator(expressions),
                conditions,
                new ValidationRuleValidator(),
                new ScheduleValidator());
    }

    public ValidationMode mode() {
        return mode;
    }

    public List<ValidationIssue> validate(JsonNode rule) {
        IssueCollector issues = new IssueCollector();
        if (rule == null || !rule.isObject()) {
            issues.error("/", "Rule must be a valid JSON object");
            return issues.issues();
        }

        validateStructure(rule, issues);
        if (mode == ValidationMode.QUICK || issues.hasErrors()) {
            return issues.issues();
        }

        for (SectionValidator section : sections) {
            try {
                section.validate(rule, issues);
            } catch (RuntimeException e) {
                logger.warning("Validation of section '" + section.section() + "' failed: " + e);
                issues.error("/" + section.section(), "Validation failed in " + section.section() + ": "
                        + e.getMessage());
            }
        }
        return issues.issues();
    }

    /**
     * True when {@code issues} must stop the document from being used.
     */
    public boolean refuses(List<ValidationIssue> issues) {
        if (mode == ValidationMode.STRICT) {
            return !issues.isEmpty();
        }
        return issues.stream().anyMatch(ValidationIssue::isError);
    }

    private static void validateStructure(JsonNode rule, IssueCollector issues) {
        for (String field : REQUIRED_FIELDS) {
            if (!rule.has(field)) {
                issues.error("/" + field, "Missing required field: " + field);
            }
        }
        checkType(rule, "flow", JsonNode::isArray, "Flow must be an array", issues);
        checkType(rule, "constants", JsonNode::isObject, "Constants must be an object", issues);
        checkType(rule, "inputs", JsonNode::isObject, "Inputs must be an object", issues);
        checkType(rule, "outputs", JsonNode::isObject, "Outputs must be an object", issues);
        checkType(rule, "tables", JsonNode::isArray, "Tables must be an array", issues);
        checkType(rule, "validate", JsonNode::isArray, "Validate section must be an array", issues);
        checkType(rule, "filing_schedules", JsonNode::isArray, "Filing schedules must be an array", issues);
    }

    private static void checkType(JsonNode rule, String field, Predicate<JsonNode> check,
                                  String message, IssueCollector issues) {
        JsonNode value = rule.get(field);
        if (value != null && !check.test(value)) {
            issues.error("/" + field, message);
        }
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.validation;

import com.levy.ruleengine.api.exceptions.TaxRuleException;
import com.levy.ruleengine.api.model.RuleDocument;
import com.levy.ruleengine.api.model.ValidationIssue;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.api.model.VariableDeclaration;
import com.levy.ruleengine.runtime.context.EvaluationContext;
import com.levy.ruleengine.runtime.evaluation.ConditionalEvaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks supplied inputs against a rule's input declarations.
 *
 * <p>An input with a {@code when} guard is only required when the guard holds. The guard is
 * evaluated against a partial context holding the supplied inputs, the defaults of inputs
 * declared before it and the rule's constants; if it cannot be evaluated (for instance because it refers to another omitted input) the
 * input is treated as required.
 *
 * <p>A missing input with a declared default receives the default. Present inputs must match
 * their declared type, numeric bounds, enumeration and pattern. Inputs the rule does not
 * declare are reported as warnings.
 */
public final class InputValidator {

    private static final Logger logger = Logger.getLogger(InputValidator.class.getName());

    private final ConditionalEvaluator conditions;

    public InputValidator(ConditionalEvaluator conditions) {
        this.conditions = conditions;
    }

    public InputValidationReport validate(RuleDocument rule, Map<String, Value> inputs) {
        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, Value> resolved = new LinkedHashMap<>(inputs);
        EvaluationContext partial = EvaluationContext.of(resolved, rule.constants());

        for (Map.Entry<String, VariableDeclaration> entry : rule.inputs().entrySet()) {
            String name = entry.getKey();
            VariableDeclaration declaration = entry.getValue();
            String path = "/inputs/" + name;
            Value value = inputs.get(name);

            if (value == null) {
                if (declaration.hasDefault()) {
                    resolved.put(name, declaration.defaultValue());
                    partial = EvaluationContext.of(resolved, rule.constants());
                } else if (isRequired(name, declaration, partial)) {
                    issues.add(ValidationIssue.error(path, "Required input '" + name + "' not provided"));
                }
                continue;
            }
            checkValue(name, path, declaration, value, issues);
        }

        for (String name : inputs.keySet()) {
            if (!rule.inputs().containsKey(name)) {
                issues.add(ValidationIssue.warning("/inputs/" + name,
                        "Input '" + name + "' is not declared by rule '" + rule.name() + "'"));
            }
        }
        return new InputValidationReport(issues, resolved);
    }

    private boolean isRequired(String name, VariableDeclaration declaration, EvaluationContext partial) {
        if (declaration.when() == null) {
            return true;
        }
        try {
            return conditions.evaluate(declaration.when(), partial);
        } catch (TaxRuleException e) {
            logger.fine("Requirement guard of input '" + name + "' could not be evaluated, treating as required: "
                    + e.getMessage());
            return true;
        }
    }

    private void checkValue(String name, String path, VariableDeclaration declaration, Value value,
                            List<ValidationIssue> issues) {
        if (declaration.type() != null && value.type() != declaration.type()) {
            issues.add(ValidationIssue.error(path, "Input '" + name + "' must be a "
                    + declaration.type().jsonName() + " but got " + value.type().jsonName()));
            return;
        }
        if (value instanceof Value.NumberValue number) {
            if (declaration.minimum() != null && number.value() < declaration.minimum()) {
                issues.add(ValidationIssue.error(path, "Input '" + name + "' must be at least "
                        + Value.of(declaration.minimum()) + " but got " + number));
            }
            if (declaration.maximum() != null && number.value() > declaration.maximum()) {
                issues.add(ValidationIssue.error(path, "Input '" + name + "' must be at most "
                        + Value.of(declaration.maximum()) + " but got " + number));
            }
        }
        if (!declaration.enumValues().isEmpty() && !declaration.enumValues().contains(value)) {
            issues.add(ValidationIssue.error(path, "Input '" + name + "' must be one of "
                    + declaration.enumValues() + " but got " + value));
        }
        if (declaration.pattern() != null && value instanceof Value.StringValue text) {
            try {
                if (!Pattern.compile(declaration.pattern()).matcher(text.value()).matches()) {
                    issues.add(ValidationIssue.error(path, "Input '" + name + "' does not match pattern '"
                            + declaration.pattern() + "'"));
                }
            } catch (PatternSyntaxException e) {
                issues.add(ValidationIssue.error(path, "Input '" + name + "' declares an invalid pattern: "
                        + e.getDescription()));
            }
        }
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.levy.ruleengine.api.exceptions.ExpressionParseException;
import com.levy.ruleengine.runtime.expression.Expression;
import com.levy.ruleengine.runtime.expression.ExpressionParser;
import com.levy.ruleengine.runtime.expression.ExpressionVisitor;
import com.levy.ruleengine.runtime.function.BuiltinLibrary;

import java.util.Set;
import java.util.TreeSet;

/**
 * Parses value expressions ahead of evaluation and checks the names they reference.
 *
 * <p>Rule-defined names must follow {@code [a-z][a-z0-9_]*}; built-in constants and variables are
 * accepted as declared by the library. Calls to functions the library does not provide are
 * reported as warnings, references to constants the document does not define as errors.
 */
final class ExpressionChecker {

    private final ExpressionParser parser;
    private final BuiltinLibrary library;

    ExpressionChecker(ExpressionParser parser, BuiltinLibrary library) {
        this.parser = parser;
        this.library = library;
    }

    void check(String text, String path, JsonNode rule, IssueCollector issues) {
        Expression expression;
        try {
            expression = parser.parse(text);
        } catch (ExpressionParseException e) {
            issues.error(path, "Invalid expression: " + e.getMessage());
            return;
        }
        expression.accept(new ReferenceCheck(path, rule.path("constants"), issues));
    }

    private final class ReferenceCheck implements ExpressionVisitor<Void> {
        private final String path;
        private final JsonNode constants;
        private final IssueCollector issues;

        ReferenceCheck(String path, JsonNode constants, IssueCollector issues) {
            this.path = path;
            this.constants = constants;
            this.issues = issues;
        }

        @Override
        public Void visitNumber(Expression.NumberLiteral literal) {
            return null;
        }

        @Override
        public Void visitBoolean(Expression.BooleanLiteral literal) {
            return null;
        }

        @Override
        public Void visitString(Expression.StringLiteral literal) {
            return null;
        }

        @Override
        public Void visitInput(Expression.InputVariableRef ref) {
            if (!IssueCollector.isRuleIdentifier(ref.name())) {
                issues.error(path, "Invalid input variable reference: $" + ref.name(),
                        "Input variable references must be $[a-z][a-z0-9_]*");
            }
            return null;
        }

        @Override
        public Void visitConstant(Expression.ConstantRef ref) {
            String name = ref.name();
            if (library.constants().containsKey(name) || constants.has(name)) {
                return null;
            }
            if (!IssueCollector.isRuleIdentifier(name)) {
                issues.error(path, "Invalid constant reference: $$" + name,
                        "Constant references must be $$[a-z][a-z0-9_]*");
            } else {
                issues.error(path, "Undefined constant: $$" + name,
                        "Define " + name + " in the constants section");
            }
            return null;
        }

        @Override
        public Void visitCalculated(Expression.CalculatedRef ref) {
            if (!library.variables().containsKey(ref.name()) && !IssueCollector.isRuleIdentifier(ref.name())) {
                issues.error(path, "Invalid calculated variable reference: " + ref.name(),
                        "Calculated variable references must be [a-z][a-z0-9_]*");
            }
            return null;
        }

        @Override
        public Void visitCall(Expression.Call call) {
            if (library.function(call.name()).isEmpty()) {
                Set<String> available = new TreeSet<>(library.functionNames());
                issues.warning(path, "Unknown function '" + call.name() + "'",
                        "Available functions: " + String.join(", ", available));
            }
            for (Expression argument : call.arguments()) {
                argument.accept(this);
            }
            return null;
        }
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.expression;

import com.levy.ruleengine.api.exceptions.ExpressionParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the rule expression language.
 *
 * <h2>Grammar</h2>
 * <pre>
 * expr    := varref | call | literal
 * varref  := "$$" ident | "$" ident | ident          (ident not followed by "(")
 * call    := ident "(" [expr ("," expr)*] ")"
 * literal := number | "true" | "false" | 'single-quoted string'
 * number  := "-"? [0-9]+ ("." [0-9]+)?
 * ident   := [A-Za-z][A-Za-z0-9_]*
 * </pre>
 *
 * <p>Whitespace is allowed around tokens. The whole input must be consumed; anything
 * left over is an error. Only lower-case {@code true}/{@code false} are booleans, so
 * {@code True} parses as a calculated variable reference.
 *
 * <p>Instances are stateless and thread-safe.
 */
public final class ExpressionParser {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final int maxDepth;

    public ExpressionParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ExpressionParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Parses {@code text} into an expression tree.
     *
     * @throws ExpressionParseException if the text does not match the grammar
     */
    public Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionParseException("Empty expression is not allowed", text == null ? "" : text, 0);
        }
        Cursor cursor = new Cursor(text);
        Expression expression = cursor.expression(0);
        cursor.skipWhitespace();
        if (!cursor.atEnd()) {
            throw cursor.error("Unexpected content '" + cursor.rest() + "' at end of expression");
        }
        return expression;
    }

    public static boolean isIdentifierStart(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
    }

    public static boolean isIdentifierPart(char ch) {
        return isIdentifierStart(ch) || isDigit(ch) || ch == '_';
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        Expression expression(int depth) {
            if (depth > maxDepth) {
                throw error("Expression nesting exceeds the maximum depth of " + maxDepth);
            }
            skipWhitespace();
            if (atEnd()) {
                throw error("Unexpected end of expression");
            }
            char ch = peek();
            if (ch == '$') {
                return reference();
            }
            if (ch == '\'') {
                return string();
            }
            if (ch == '-' || isDigit(ch)) {
                return number();
            }
            if (isIdentifierStart(ch)) {
                return identifierOrCall(depth);
            }
            if (ch == '_') {
                throw error("Invalid identifier: identifiers must start with a letter");
            }
            throw error("Unexpected character '" + ch + "'");
        }

        private Expression reference() {
            pos++;
            boolean constant = !atEnd() && peek() == '$';
            if (constant) {
                pos++;
            }
            if (atEnd() || !isIdentifierStart(peek())) {
                throw error("Invalid identifier after '" + (constant ? "$$" : "$")
                        + "': identifiers must start with a letter");
            }
            String name = identifier();
            return constant ? new Expression.ConstantRef(name) : new Expression.InputVariableRef(name);
        }

        private Expression identifierOrCall(int depth) {
            String name = identifier();
            int afterName = pos;
            skipWhitespace();
            if (!atEnd() && peek() == '(') {
                pos++;
                return new Expression.Call(name, arguments(name, depth));
            }
            pos = afterName;
            if ("true".equals(name)) {
                return new Expression.BooleanLiteral(true);
            }
            if ("false".equals(name)) {
                return new Expression.BooleanLiteral(false);
            }
            return new Expression.CalculatedRef(name);
        }

        private List<Expression> arguments(String function, int depth) {
            List<Expression> arguments = new ArrayList<>();
            skipWhitespace();
            if (!atEnd() && peek() == ')') {
                pos++;
                return arguments;
            }
            while (true) {
                arguments.add(expression(depth + 1));
                skipWhitespace();
                if (atEnd()) {
                    throw error("Missing ')' to close call to '" + function + "'");
                }
                char ch = peek();
                if (ch == ')') {
                    pos++;
                    return arguments;
                }
                if (ch != ',') {
                    throw error("Expected ',' or ')' in arguments of '" + function + "' but found '" + ch + "'");
                }
                pos++;
                skipWhitespace();
                if (!atEnd() && peek() == ')') {
                    throw error("Missing argument after ',' in call to '" + function + "'");
                }
            }
        }

        private String identifier() {
            int start = pos;
            pos++;
            while (!atEnd() && isIdentifierPart(peek())) {
                pos++;
            }
            return text.substring(start, pos);
        }

        private Expression number() {
            int start = pos;
            if (peek() == '-') {
                pos++;
                if (atEnd() || !isDigit(peek())) {
                    throw error("'-' must be followed by digits");
                }
            }
            digits();
            if (!atEnd() && peek() == '.') {
                pos++;
                if (atEnd() || !isDigit(peek())) {
                    throw malformedNumber(start);
                }
                digits();
            }
            if (!atEnd() && (isIdentifierPart(peek()) || peek() == '.')) {
                throw malformedNumber(start);
            }
            return new Expression.NumberLiteral(Double.parseDouble(text.substring(start, pos)));
        }

        private void digits() {
            while (!atEnd() && isDigit(peek())) {
                pos++;
            }
        }

        private ExpressionParseException malformedNumber(int start) {
            int end = pos;
            while (end < text.length() && (isIdentifierPart(text.charAt(end)) || text.charAt(end) == '.')) {
                end++;
            }
            return new ExpressionParseException(
                    "Malformed number '" + text.substring(start, end) + "'", text, start);
        }

        private Expression string() {
            int start = pos;
            pos++;
            StringBuilder value = new StringBuilder();
            while (true) {
                if (atEnd()) {
                    throw new ExpressionParseException("Unterminated string literal", text, start);
                }
                char ch = text.charAt(pos++);
                if (ch == '\'') {
                    return new Expression.StringLiteral(value.toString());
                }
                if (ch != '\\') {
                    value.append(ch);
                    continue;
                }
                if (atEnd()) {
                    throw new ExpressionParseException("Unterminated string literal", text, start);
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case '\\' -> value.append('\\');
                    case '\'' -> value.append('\'');
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> throw new ExpressionParseException(
                            "Invalid escape sequence '\\" + escaped + "'", text, pos - 2);
                }
            }
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        String rest() {
            return text.substring(pos);
        }

        ExpressionParseException error(String message) {
            return new ExpressionParseException(message, text, pos);
        }
    }
}

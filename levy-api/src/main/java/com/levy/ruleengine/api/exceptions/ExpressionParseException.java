/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when expression text does not conform to the reference grammar.
 *
 * <p>Retains the full source text and the zero-based offset where parsing stopped.
 */
public class ExpressionParseException extends TaxRuleException {

    private final String source;
    private final int position;

    public ExpressionParseException(String message, String source, int position) {
        super(message + " (at position " + position + " in '" + source + "')", source);
        this.source = source;
        this.position = position;
    }

    public String getSource() {
        return source;
    }

    public int getPosition() {
        return position;
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Root of every failure raised while compiling or evaluating a tax rule.
 *
 * <p>This is a RuntimeException so callers are not forced into checked exception
 * handling on every evaluation path. Each failure carries a human-readable message
 * and, where one exists, the offending subject (expression text, operation target,
 * variable or table name).
 */
public class TaxRuleException extends RuntimeException {

    private final String subject;

    public TaxRuleException(String message) {
        this(message, null, null);
    }

    public TaxRuleException(String message, String subject) {
        this(message, subject, null);
    }

    public TaxRuleException(String message, String subject, Throwable cause) {
        super(message, cause);
        this.subject = subject;
    }

    /**
     * Returns the expression, variable, operation target or table the failure is about,
     * or {@code null} when the failure is not tied to a single subject.
     */
    public String getSubject() {
        return subject;
    }
}

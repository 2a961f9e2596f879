/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * Raised when a variable reference has no value in the domain its prefix selects.
 */
public class UnresolvedReferenceException extends ExpressionEvaluationException {

    private final ReferenceDomain domain;

    public UnresolvedReferenceException(String name, ReferenceDomain domain) {
        super(domain.label() + " '" + name + "' not found", name);
        this.domain = domain;
    }

    public ReferenceDomain getDomain() {
        return domain;
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

/**
 * The namespace a variable reference was resolved against.
 */
public enum ReferenceDomain {
    /** {@code $name} */
    INPUT("Input variable"),
    /** {@code $$name} */
    CONSTANT("Constant"),
    /** bare {@code name} */
    CALCULATED("Calculated variable");

    private final String label;

    ReferenceDomain(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.levy.ruleengine.api.exceptions.OperationTypeException;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of mutations a flow step can apply to a calculated variable.
 */
public enum OperationType {
    SET,
    ADD,
    /** Also accepted as {@code "deduct"} in rule documents. */
    SUBTRACT,
    MULTIPLY,
    DIVIDE,
    MIN,
    MAX,
    LOOKUP;

    private static final String DEDUCT_ALIAS = "deduct";

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a document operation name, including the {@code deduct} alias.
     */
    public static Optional<OperationType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        if (DEDUCT_ALIAS.equals(name)) {
            return Optional.of(SUBTRACT);
        }
        for (OperationType type : values()) {
            if (type.jsonName().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static OperationType fromJson(String name) {
        return fromName(name).orElseThrow(
                () -> new OperationTypeException("Unknown operation type: " + name, name));
    }
}

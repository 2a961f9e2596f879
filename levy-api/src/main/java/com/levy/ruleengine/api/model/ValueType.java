/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The three scalar types a rule can produce or consume.
 */
public enum ValueType {
    NUMBER("number"),
    BOOLEAN("boolean"),
    STRING("string");

    private final String jsonName;

    ValueType(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }

    @JsonCreator
    public static ValueType fromJson(String name) {
        if (name == null) {
            return null;
        }
        for (ValueType type : values()) {
            if (type.jsonName.equals(name.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown value type '" + name + "'. Expected number, boolean or string");
    }

    /**
     * Returns the type of the given Java value, or {@code null} when it has no scalar counterpart.
     */
    public static ValueType of(Object raw) {
        if (raw instanceof Number) {
            return NUMBER;
        }
        if (raw instanceof Boolean) {
            return BOOLEAN;
        }
        if (raw instanceof String) {
            return STRING;
        }
        return null;
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum FilingFrequency {
    QUARTERLY("quarterly"),
    MONTHLY("monthly"),
    ANNUALLY("annually");

    private final String jsonName;

    FilingFrequency(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }

    public static Optional<FilingFrequency> fromName(String name) {
        if ("annual".equals(name)) {
            return Optional.of(ANNUALLY);
        }
        for (FilingFrequency frequency : values()) {
            if (frequency.jsonName.equals(name)) {
                return Optional.of(frequency);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static FilingFrequency fromJson(String name) {
        return fromName(name).orElseThrow(
                () -> new IllegalArgumentException("Unknown filing frequency '" + name + "'"));
    }
}

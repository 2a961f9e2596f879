/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declaration of an input or output variable.
 *
 * @param type         scalar type of the variable
 * @param description  free text
 * @param minimum      inclusive lower bound for numbers
 * @param maximum      inclusive upper bound for numbers
 * @param enumValues   permitted values
 * @param pattern      regular expression strings must match
 * @param when         the input is only required when this guard holds
 * @param defaultValue value applied when the input is omitted
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VariableDeclaration(
        @JsonProperty("type") ValueType type,
        @JsonProperty("description") String description,
        @JsonProperty("minimum") Double minimum,
        @JsonProperty("maximum") Double maximum,
        @JsonProperty("enum") List<Value> enumValues,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("when") Condition when,
        @JsonProperty("default") Value defaultValue
) {

    public VariableDeclaration {
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    }

    public static VariableDeclaration of(ValueType type) {
        return new VariableDeclaration(type, null, null, null, null, null, null, null);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}

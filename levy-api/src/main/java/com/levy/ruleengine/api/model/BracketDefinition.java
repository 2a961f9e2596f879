/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.levy.ruleengine.api.model.json.OperandDeserializer;

/**
 * A bracket as written in a rule document. Bounds are numbers or constant references
 * such as {@code $$MAX_TAXABLE_INCOME}; a missing or null {@code max} means unbounded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BracketDefinition(
        @JsonProperty("min") @JsonDeserialize(using = OperandDeserializer.class) Operand min,
        @JsonProperty("max") @JsonDeserialize(using = OperandDeserializer.class) Operand max,
        @JsonProperty("rate") double rate,
        @JsonProperty("base_tax") double baseTax
) {

    public static BracketDefinition of(double min, Double max, double rate, double baseTax) {
        return new BracketDefinition(
                Operand.literal(Value.of(min)),
                max == null ? null : Operand.literal(Value.of(max)),
                rate,
                baseTax);
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.levy.ruleengine.api.model.json.OperandDeserializer;

import java.util.Objects;

/**
 * A single mutation of a calculated variable.
 *
 * @param type   the operation kind
 * @param target calculated variable that receives the result
 * @param value  literal or expression text; for {@link OperationType#LOOKUP} the amount looked up
 * @param table  bracket table name, only used by {@link OperationType#LOOKUP}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Operation(
        @JsonProperty("type") OperationType type,
        @JsonProperty("target") String target,
        @JsonProperty("value") @JsonDeserialize(using = OperandDeserializer.class) Operand value,
        @JsonProperty("table") String table
) {

    public Operation {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(target, "target");
    }

    public static Operation of(OperationType type, String target, Object value) {
        return new Operation(type, target, Operand.forOperation(value), null);
    }

    public static Operation lookup(String target, String table, Object value) {
        return new Operation(OperationType.LOOKUP, target, Operand.forOperation(value), table);
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.levy.ruleengine.api.model.Operand;

import java.io.IOException;

/**
 * Reads operation values and bracket bounds: JSON strings become expressions,
 * numbers and booleans become literals. JSON {@code null} stays {@code null}.
 */
public class OperandDeserializer extends JsonDeserializer<Operand> {

    @Override
    public Operand deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = parser.readValueAsTree();
        if (node.isTextual()) {
            return Operand.expression(node.textValue());
        }
        return Operand.literal(ValueDeserializer.toValue(node, parser, ctxt));
    }
}

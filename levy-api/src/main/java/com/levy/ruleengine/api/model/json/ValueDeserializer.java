/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.levy.ruleengine.api.model.Value;

import java.io.IOException;

/**
 * Reads a JSON scalar (number, boolean or string) as a {@link Value}.
 */
public class ValueDeserializer extends JsonDeserializer<Value> {

    @Override
    public Value deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = parser.readValueAsTree();
        return toValue(node, parser, ctxt);
    }

    static Value toValue(JsonNode node, JsonParser parser, DeserializationContext ctxt) throws IOException {
        if (node.isNumber()) {
            return Value.of(node.doubleValue());
        }
        if (node.isBoolean()) {
            return Value.of(node.booleanValue());
        }
        if (node.isTextual()) {
            return Value.of(node.textValue());
        }
        return (Value) ctxt.handleUnexpectedToken(Value.class, node.asToken(), parser,
                "Expected a number, boolean or string but found %s", node.getNodeType());
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.levy.ruleengine.api.model.ComparisonOperator;
import com.levy.ruleengine.api.model.Condition;
import com.levy.ruleengine.api.model.Operand;
import com.levy.ruleengine.api.model.Value;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the dynamic-key condition objects used in cases, validation rules,
 * conditional inputs and filing schedules.
 */
public class ConditionDeserializer extends JsonDeserializer<Condition> {

    @Override
    public Condition deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = parser.readValueAsTree();
        return read(node, parser, ctxt);
    }

    private Condition read(JsonNode node, JsonParser parser, DeserializationContext ctxt) throws IOException {
        if (!node.isObject() || node.size() != 1) {
            throw JsonMappingException.from(parser,
                    "A condition must be an object with exactly one key, found: " + node);
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        String key = entry.getKey();
        JsonNode body = entry.getValue();

        switch (key) {
            case Condition.AND:
                return new Condition.All(readList(key, body, parser, ctxt));
            case Condition.OR:
                return new Condition.Any(readList(key, body, parser, ctxt));
            case Condition.NOT:
                return new Condition.Not(read(body, parser, ctxt));
            default:
                return readComparison(key, body, parser, ctxt);
        }
    }

    private List<Condition> readList(String key, JsonNode body, JsonParser parser, DeserializationContext ctxt)
            throws IOException {
        if (!body.isArray()) {
            throw JsonMappingException.from(parser, "'" + key + "' expects an array of conditions");
        }
        List<Condition> conditions = new ArrayList<>(body.size());
        for (JsonNode element : body) {
            conditions.add(read(element, parser, ctxt));
        }
        return conditions;
    }

    private Condition readComparison(String subject, JsonNode body, JsonParser parser, DeserializationContext ctxt)
            throws IOException {
        if (!body.isObject() || body.size() != 1) {
            throw JsonMappingException.from(parser,
                    "Comparison on '" + subject + "' must have exactly one operator");
        }
        Map.Entry<String, JsonNode> comparison = body.fields().next();
        ComparisonOperator operator = ComparisonOperator.fromKey(comparison.getKey())
                .orElseThrow(() -> JsonMappingException.from(parser,
                        "Unknown comparison operator '" + comparison.getKey() + "' on '" + subject + "'"));
        Value literal = ValueDeserializer.toValue(comparison.getValue(), parser, ctxt);
        return new Condition.Comparison(subject, operator, Operand.forComparison(literal.raw()));
    }
}

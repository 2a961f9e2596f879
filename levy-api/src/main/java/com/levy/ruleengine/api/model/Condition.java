/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.levy.ruleengine.api.model.json.ConditionDeserializer;

import java.util.List;
import java.util.Objects;

/**
 * A boolean guard: a single comparison or a logical combination of guards.
 *
 * <p>JSON forms:
 * <pre>
 * {"$filing_status": {"eq": "MARRIED"}}
 * {"and": [ ... ]}   {"or": [ ... ]}   {"not": { ... }}
 * </pre>
 */
@JsonDeserialize(using = ConditionDeserializer.class)
public sealed interface Condition permits Condition.Comparison, Condition.All, Condition.Any, Condition.Not {

    String AND = "and";
    String OR = "or";
    String NOT = "not";

    static Comparison compare(String subject, ComparisonOperator operator, Object rightHandSide) {
        return new Comparison(subject, operator, Operand.forComparison(rightHandSide));
    }

    static All all(Condition... conditions) {
        return new All(List.of(conditions));
    }

    static Any any(Condition... conditions) {
        return new Any(List.of(conditions));
    }

    static Not not(Condition condition) {
        return new Not(condition);
    }

    /**
     * Compares the value of the {@code subject} expression with the right-hand operand.
     */
    record Comparison(String subject, ComparisonOperator operator, Operand operand) implements Condition {
        public Comparison {
            Objects.requireNonNull(subject, "subject");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(operand, "operand");
        }
    }

    record All(List<Condition> conditions) implements Condition {
        public All {
            conditions = List.copyOf(conditions);
        }
    }

    record Any(List<Condition> conditions) implements Condition {
        public Any {
            conditions = List.copyOf(conditions);
        }
    }

    record Not(Condition condition) implements Condition {
        public Not {
            Objects.requireNonNull(condition, "condition");
        }
    }
}

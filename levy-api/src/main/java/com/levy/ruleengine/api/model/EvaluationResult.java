/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.levy.ruleengine.api.exceptions.OperationTypeException;

import java.util.Map;

/**
 * Outcome of evaluating one rule against one set of inputs.
 *
 * @param ruleName   name of the evaluated rule
 * @param outputs    declared outputs; unassigned ones carry their type's default
 * @param calculated every calculated variable assigned during the flow
 * @param inputs     the inputs the rule was evaluated with
 * @param trace      per-step audit trail, or null when tracing is disabled
 */
public record EvaluationResult(
        String ruleName,
        Map<String, Value> outputs,
        Map<String, Value> calculated,
        Map<String, Value> inputs,
        EvaluationTrace trace
) {

    public static final String LIABILITY = "liability";

    public EvaluationResult {
        outputs = Map.copyOf(outputs);
        calculated = Map.copyOf(calculated);
        inputs = Map.copyOf(inputs);
    }

    /**
     * The {@code liability} accumulator: from the outputs, then the calculated variables, else 0.
     *
     * @throws OperationTypeException if {@code liability} holds a value that is not a number
     */
    public double liability() {
        Value value = outputs.containsKey(LIABILITY) ? outputs.get(LIABILITY) : calculated.get(LIABILITY);
        if (value == null) {
            return 0.0;
        }
        if (value instanceof Value.NumberValue number) {
            return number.value();
        }
        throw new OperationTypeException("Rule '" + ruleName + "' set '" + LIABILITY
                + "' to a " + value.type().jsonName() + " (" + value + "), a number is required", LIABILITY);
    }

    public Value output(String name) {
        return outputs.get(name);
    }
}

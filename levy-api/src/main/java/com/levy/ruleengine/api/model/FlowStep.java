/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A named unit of the rule flow carrying either a list of operations or a list of cases.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowStep(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("operations") List<Operation> operations,
        @JsonProperty("cases") List<Case> cases
) {

    public FlowStep {
        operations = operations == null ? List.of() : List.copyOf(operations);
        cases = cases == null ? List.of() : List.copyOf(cases);
    }

    public static FlowStep ofOperations(String name, Operation... operations) {
        return new FlowStep(name, null, List.of(operations), null);
    }

    public static FlowStep ofCases(String name, Case... cases) {
        return new FlowStep(name, null, null, List.of(cases));
    }

    public boolean hasOperations() {
        return !operations.isEmpty();
    }

    public boolean hasCases() {
        return !cases.isEmpty();
    }
}

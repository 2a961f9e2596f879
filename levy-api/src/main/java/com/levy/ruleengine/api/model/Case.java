/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A guarded branch of a flow step. A case without a guard is the step's default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Case(
        @JsonProperty("when") Condition when,
        @JsonProperty("operations") List<Operation> operations
) {

    public Case {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public boolean isDefault() {
        return when == null;
    }
}

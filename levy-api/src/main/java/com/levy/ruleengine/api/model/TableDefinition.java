/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TableDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("brackets") List<BracketDefinition> brackets
) {

    public TableDefinition {
        brackets = brackets == null ? List.of() : List.copyOf(brackets);
    }
}

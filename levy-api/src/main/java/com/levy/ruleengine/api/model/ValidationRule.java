/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An author-defined guard that rejects the inputs with {@code error} when {@code when} holds.
 */
public record ValidationRule(
        @JsonProperty("when") Condition when,
        @JsonProperty("error") String error
) {
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FilingForms(
        @JsonProperty("primary") String primary,
        @JsonProperty("attachments") List<String> attachments
) {

    public FilingForms {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}

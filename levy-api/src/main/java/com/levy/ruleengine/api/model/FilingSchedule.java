/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.levy.ruleengine.api.model.json.OperandDeserializer;

/**
 * When and how the computed liability is filed.
 *
 * @param filingDay day of month, as a number or a constant reference
 * @param when      the schedule only applies when this guard holds; null means always
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FilingSchedule(
        @JsonProperty("name") String name,
        @JsonProperty("frequency") FilingFrequency frequency,
        @JsonProperty("filing_day") @JsonDeserialize(using = OperandDeserializer.class) Operand filingDay,
        @JsonProperty("when") Condition when,
        @JsonProperty("forms") FilingForms forms
) {
}

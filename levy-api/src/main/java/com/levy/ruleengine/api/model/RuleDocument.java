/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A complete tax rule as carried in JSON.
 *
 * <p>Collections are never null: absent sections become empty. Map sections keep the
 * declaration order of the source document.
 *
 * <h2>Example</h2>
 * <pre>
 * {
 *   "$version": "1.0.0",
 *   "name": "Flat income tax",
 *   "jurisdiction": "US",
 *   "taxpayer_type": "INDIVIDUAL",
 *   "inputs": { "gross_income": { "type": "number" } },
 *   "outputs": { "liability": { "type": "number" } },
 *   "flow": [
 *     { "name": "apply_rate",
 *       "operations": [ { "type": "set", "target": "liability", "value": "$gross_income" } ] }
 *   ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDocument(
        @JsonProperty("$version") String version,
        @JsonProperty("name") String name,
        @JsonProperty("jurisdiction") String jurisdiction,
        @JsonProperty("taxpayer_type") String taxpayerType,
        @JsonProperty("effective_from") String effectiveFrom,
        @JsonProperty("effective_to") String effectiveTo,
        @JsonProperty("references") List<String> references,
        @JsonProperty("category") String category,
        @JsonProperty("author") String author,
        @JsonProperty("constants") Map<String, Value> constants,
        @JsonProperty("tables") List<TableDefinition> tables,
        @JsonProperty("inputs") Map<String, VariableDeclaration> inputs,
        @JsonProperty("outputs") Map<String, VariableDeclaration> outputs,
        @JsonProperty("validate") List<ValidationRule> validate,
        @JsonProperty("filing_schedules") List<FilingSchedule> filingSchedules,
        @JsonProperty("flow") List<FlowStep> flow
) {

    public RuleDocument {
        references = listOrEmpty(references);
        constants = mapOrEmpty(constants);
        tables = listOrEmpty(tables);
        inputs = mapOrEmpty(inputs);
        outputs = mapOrEmpty(outputs);
        validate = listOrEmpty(validate);
        filingSchedules = listOrEmpty(filingSchedules);
        flow = listOrEmpty(flow);
    }

    public Optional<TableDefinition> table(String tableName) {
        return tables.stream().filter(t -> t.name().equals(tableName)).findFirst();
    }

    private static <T> List<T> listOrEmpty(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    private static <V> Map<String, V> mapOrEmpty(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.compiler.validation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checks one section of a rule document. Runs after the structure check passed.
 */
interface SectionValidator {

    String section();

    void validate(JsonNode rule, IssueCollector issues);
}

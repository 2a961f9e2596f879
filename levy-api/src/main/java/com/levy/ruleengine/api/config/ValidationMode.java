/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.config;

/**
 * How strictly rule documents are validated before they are accepted.
 */
public enum ValidationMode {
    /** Warnings are refused as well as errors. */
    STRICT,
    /** Only errors are refused; warnings are logged. */
    WARNING,
    /** Structure only: required sections and their JSON types. */
    QUICK
}

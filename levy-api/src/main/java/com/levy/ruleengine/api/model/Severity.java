/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

public enum Severity {
    /** The document or input is refused. */
    ERROR,
    /** Reported but not blocking, unless validation runs in strict mode. */
    WARNING
}

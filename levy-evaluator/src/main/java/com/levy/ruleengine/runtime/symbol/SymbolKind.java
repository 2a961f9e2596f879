/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.symbol;

public enum SymbolKind {
    FUNCTION,
    INPUT_VARIABLE,
    CONSTANT_VARIABLE,
    CALCULATED_VARIABLE;

    public boolean isFunction() {
        return this == FUNCTION;
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.symbol;

public enum SymbolOrigin {
    /** Defined by the built-in library; survives {@link SymbolRegistry#clearDynamicSymbols()}. */
    BUILTIN,
    /** Registered from the evaluation context for a single evaluation. */
    CONTEXT
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.symbol;

import com.levy.ruleengine.api.model.ValueType;

/**
 * @param typeHint value type when known, otherwise null
 */
public record Symbol(String name, SymbolKind kind, SymbolOrigin origin, ValueType typeHint) {

    public boolean isFunction() {
        return kind.isFunction();
    }

    public boolean isBuiltin() {
        return origin == SymbolOrigin.BUILTIN;
    }
}

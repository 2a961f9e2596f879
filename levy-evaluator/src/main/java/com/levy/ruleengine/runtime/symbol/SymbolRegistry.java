/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.symbol;

import com.levy.ruleengine.api.exceptions.SymbolConflictException;
import com.levy.ruleengine.api.exceptions.WrongKindUsageException;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.api.model.ValueType;
import com.levy.ruleengine.runtime.function.BuiltinLibrary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name table for one expression evaluator.
 *
 * <p>Once a name is known as a function it can never be used as a variable, and vice versa.
 * Built-in functions cannot be redefined. Built-in constants and variables may be shadowed by
 * context entries; built-ins and context entries are held apart so that
 * {@link #clearDynamicSymbols()} always restores what a context entry shadowed.
 *
 * <p>Not thread-safe: callers rebuild dynamic symbols per evaluation and must not share an
 * instance across concurrent evaluations.
 */
public final class SymbolRegistry {

    private final Map<String, Symbol> builtins = new LinkedHashMap<>();
    private final Map<String, Symbol> dynamic = new LinkedHashMap<>();

    public SymbolRegistry() {
        this(BuiltinLibrary.standard());
    }

    public SymbolRegistry(BuiltinLibrary library) {
        for (String function : library.functionNames()) {
            addSymbol(function, SymbolKind.FUNCTION, SymbolOrigin.BUILTIN, null);
        }
        for (Map.Entry<String, Value> constant : library.constants().entrySet()) {
            addSymbol(constant.getKey(), SymbolKind.CONSTANT_VARIABLE, SymbolOrigin.BUILTIN,
                    constant.getValue().type());
        }
        for (Map.Entry<String, Value> variable : library.variables().entrySet()) {
            addSymbol(variable.getKey(), SymbolKind.CALCULATED_VARIABLE, SymbolOrigin.BUILTIN,
                    variable.getValue().type());
        }
    }

    /**
     * Registers a name.
     *
     * @throws SymbolConflictException if the name is already known with the other kind
     *                                 (function vs. variable) or names a built-in function
     */
    public void addSymbol(String name, SymbolKind kind, SymbolOrigin origin, ValueType typeHint) {
        Optional<Symbol> existing = getSymbol(name);
        if (existing.isPresent()) {
            Symbol current = existing.get();
            if (current.isFunction() != kind.isFunction()) {
                throw new SymbolConflictException("Symbol '" + name + "' is already defined as "
                        + describe(current.kind()) + " and cannot be redefined as " + describe(kind), name);
            }
            if (current.isFunction() && current.isBuiltin()) {
                throw new SymbolConflictException("Cannot redefine built-in function '" + name + "'", name);
            }
        }
        Symbol symbol = new Symbol(name, kind, origin, typeHint);
        if (origin == SymbolOrigin.BUILTIN) {
            builtins.put(name, symbol);
        } else {
            dynamic.put(name, symbol);
        }
    }

    /**
     * Looks a name up, preferring a context entry over a built-in.
     */
    public Optional<Symbol> getSymbol(String name) {
        Symbol symbol = dynamic.get(name);
        return Optional.ofNullable(symbol != null ? symbol : builtins.get(name));
    }

    /**
     * Forgets every context entry; built-ins remain.
     */
    public void clearDynamicSymbols() {
        dynamic.clear();
    }

    /**
     * Checks that a known name is used as the kind it was registered with.
     * Unknown names pass; resolution reports them.
     *
     * @param expected {@link SymbolKind#FUNCTION} for a call, any variable kind for a reference
     * @throws WrongKindUsageException if a function is referenced as a variable or a variable is called
     */
    public void validateUsage(String name, SymbolKind expected) {
        Optional<Symbol> symbol = getSymbol(name);
        if (symbol.isEmpty()) {
            return;
        }
        if (symbol.get().isFunction() && !expected.isFunction()) {
            throw new WrongKindUsageException("'" + name + "' is a function and cannot be used as a variable", name);
        }
        if (!symbol.get().isFunction() && expected.isFunction()) {
            throw new WrongKindUsageException("'" + name + "' is a variable and cannot be called as a function", name);
        }
    }

    /**
     * Every visible symbol; context entries replace the built-ins they shadow.
     */
    public Collection<Symbol> allSymbols() {
        Map<String, Symbol> visible = new LinkedHashMap<>(builtins);
        visible.putAll(dynamic);
        return List.copyOf(visible.values());
    }

    public List<String> dynamicSymbolNames() {
        return new ArrayList<>(dynamic.keySet());
    }

    private static String describe(SymbolKind kind) {
        return kind.isFunction() ? "a function" : "a variable";
    }
}

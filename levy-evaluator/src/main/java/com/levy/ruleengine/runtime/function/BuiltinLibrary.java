/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.function;

import com.levy.ruleengine.api.exceptions.SymbolConflictException;
import com.levy.ruleengine.api.model.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of built-in functions, constants and calculated variables.
 *
 * <p>The standard library provides:
 * <ul>
 *   <li>functions {@code diff}, {@code sum}, {@code max}, {@code min}, {@code round}, {@code lookup}</li>
 *   <li>constant {@code MAX_TAXABLE_INCOME} = 2<sup>53</sup> - 1</li>
 *   <li>calculated variable {@code liability} = 0</li>
 * </ul>
 *
 * <p>Jurisdictions can add functions through {@link #builder()}; standard functions cannot be replaced.
 */
public final class BuiltinLibrary {

    public static final String MAX_TAXABLE_INCOME = "MAX_TAXABLE_INCOME";
    public static final double MAX_TAXABLE_INCOME_VALUE = 9_007_199_254_740_991d;
    public static final String LIABILITY = "liability";

    private static final BuiltinLibrary STANDARD = new Builder().build();

    private final Map<String, BuiltinFunction> functions;
    private final Map<String, Value> constants;
    private final Map<String, Value> variables;

    private BuiltinLibrary(Builder builder) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.functions));
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(builder.constants));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
    }

    public static BuiltinLibrary standard() {
        return STANDARD;
    }

    /**
     * Returns a builder pre-populated with the standard library.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Optional<BuiltinFunction> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }

    public Map<String, BuiltinFunction> functions() {
        return functions;
    }

    public Map<String, Value> constants() {
        return constants;
    }

    public Map<String, Value> variables() {
        return variables;
    }

    public static class Builder {
        private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
        private final Map<String, Value> constants = new LinkedHashMap<>();
        private final Map<String, Value> variables = new LinkedHashMap<>();

        private Builder() {
            for (BuiltinFunction function : StandardFunctions.all()) {
                functions.put(function.name(), function);
            }
            constants.put(MAX_TAXABLE_INCOME, Value.of(MAX_TAXABLE_INCOME_VALUE));
            variables.put(LIABILITY, Value.of(0));
        }

        /**
         * @throws SymbolConflictException if the name is already taken by a function or variable
         */
        public Builder function(BuiltinFunction function) {
            String name = function.name();
            if (functions.containsKey(name)) {
                throw new SymbolConflictException("Cannot redefine built-in function '" + name + "'", name);
            }
            if (constants.containsKey(name) || variables.containsKey(name)) {
                throw new SymbolConflictException("'" + name + "' is already a built-in variable", name);
            }
            functions.put(name, function);
            return this;
        }

        public Builder constant(String name, Value value) {
            requireNotFunction(name);
            constants.put(name, value);
            return this;
        }

        public Builder variable(String name, Value value) {
            requireNotFunction(name);
            variables.put(name, value);
            return this;
        }

        private void requireNotFunction(String name) {
            if (functions.containsKey(name)) {
                throw new SymbolConflictException("'" + name + "' is already a built-in function", name);
            }
        }

        public BuiltinLibrary build() {
            return new BuiltinLibrary(this);
        }
    }
}

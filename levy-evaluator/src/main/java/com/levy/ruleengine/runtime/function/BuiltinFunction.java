/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.function;

import com.levy.ruleengine.api.model.Value;

import java.util.List;

/**
 * A callable available to expressions.
 *
 * <p>Arguments are evaluated and checked against {@link #signature()} before
 * {@link #invoke} is called, so implementations may assume the declared types.
 */
public interface BuiltinFunction {

    String name();

    FunctionSignature signature();

    /**
     * @return a scalar result; returning null is reported as a non-scalar return
     */
    Value invoke(List<Value> arguments, FunctionContext context);

    static BuiltinFunction of(String name, FunctionSignature signature, Implementation implementation) {
        return new SimpleFunction(name, signature, implementation);
    }

    @FunctionalInterface
    interface Implementation {
        Value apply(List<Value> arguments, FunctionContext context);
    }

    record SimpleFunction(String name, FunctionSignature signature, Implementation implementation)
            implements BuiltinFunction {

        @Override
        public Value invoke(List<Value> arguments, FunctionContext context) {
            return implementation.apply(arguments, context);
        }
    }
}

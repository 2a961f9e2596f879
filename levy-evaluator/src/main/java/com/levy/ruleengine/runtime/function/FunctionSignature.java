/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.function;

import com.levy.ruleengine.api.exceptions.ArgumentMismatchException;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.api.model.ValueType;

import java.util.List;

/**
 * Parameter shape of a built-in function: either positional parameters (trailing ones may be
 * optional) or a single variadic parameter whose elements all share one type.
 */
public final class FunctionSignature {

    /**
     * @param name     used in error messages
     * @param type     required value type
     * @param required whether the argument may be omitted
     */
    public record Parameter(String name, ValueType type, boolean required) {
    }

    private final List<Parameter> parameters;
    private final ValueType variadicType;

    private FunctionSignature(List<Parameter> parameters, ValueType variadicType) {
        this.parameters = List.copyOf(parameters);
        this.variadicType = variadicType;
    }

    public static FunctionSignature fixed(Parameter... parameters) {
        boolean optionalSeen = false;
        for (Parameter parameter : parameters) {
            if (!parameter.required()) {
                optionalSeen = true;
            } else if (optionalSeen) {
                throw new IllegalArgumentException("Required parameter '" + parameter.name()
                        + "' cannot follow an optional one");
            }
        }
        return new FunctionSignature(List.of(parameters), null);
    }

    public static FunctionSignature variadic(ValueType elementType) {
        return new FunctionSignature(List.of(), elementType);
    }

    public static Parameter required(String name, ValueType type) {
        return new Parameter(name, type, true);
    }

    public static Parameter optional(String name, ValueType type) {
        return new Parameter(name, type, false);
    }

    public boolean isVariadic() {
        return variadicType != null;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    /**
     * Checks already-evaluated arguments against this signature.
     *
     * @throws ArgumentMismatchException on a wrong argument count or type
     */
    public void check(String function, List<Value> arguments) {
        if (isVariadic()) {
            for (int i = 0; i < arguments.size(); i++) {
                if (arguments.get(i).type() != variadicType) {
                    throw new ArgumentMismatchException(function + "() expects only " + variadicType.jsonName()
                            + " arguments but argument " + (i + 1) + " is " + arguments.get(i).type().jsonName(),
                            function);
                }
            }
            return;
        }
        long requiredCount = parameters.stream().filter(Parameter::required).count();
        if (arguments.size() < requiredCount || arguments.size() > parameters.size()) {
            String expected = requiredCount == parameters.size()
                    ? String.valueOf(requiredCount)
                    : requiredCount + " to " + parameters.size();
            throw new ArgumentMismatchException(function + "() expects " + expected
                    + " argument(s) but got " + arguments.size(), function);
        }
        for (int i = 0; i < arguments.size(); i++) {
            Parameter parameter = parameters.get(i);
            if (arguments.get(i).type() != parameter.type()) {
                throw new ArgumentMismatchException(function + "() parameter '" + parameter.name() + "' expects "
                        + parameter.type().jsonName() + " but got " + arguments.get(i).type().jsonName(), function);
            }
        }
    }

    @Override
    public String toString() {
        if (isVariadic()) {
            return "(..." + variadicType.jsonName() + ")";
        }
        StringBuilder text = new StringBuilder("(");
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            if (i > 0) {
                text.append(", ");
            }
            text.append(parameter.name()).append(parameter.required() ? "" : "?")
                    .append(": ").append(parameter.type().jsonName());
        }
        return text.append(')').toString();
    }
}

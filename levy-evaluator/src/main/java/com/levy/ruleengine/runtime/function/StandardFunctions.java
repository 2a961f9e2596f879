/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.function;

import com.levy.ruleengine.api.exceptions.ArgumentMismatchException;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.api.model.ValueType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static com.levy.ruleengine.runtime.function.FunctionSignature.fixed;
import static com.levy.ruleengine.runtime.function.FunctionSignature.optional;
import static com.levy.ruleengine.runtime.function.FunctionSignature.required;
import static com.levy.ruleengine.runtime.function.FunctionSignature.variadic;

/**
 * The standard function set: {@code diff}, {@code sum}, {@code max}, {@code min},
 * {@code round} and {@code lookup}.
 */
final class StandardFunctions {

    private StandardFunctions() {
    }

    static List<BuiltinFunction> all() {
        return List.of(
                BuiltinFunction.of("diff",
                        fixed(required("a", ValueType.NUMBER), required("b", ValueType.NUMBER)),
                        (args, ctx) -> Value.of(Math.abs(number(args, 0) - number(args, 1)))),
                BuiltinFunction.of("sum", variadic(ValueType.NUMBER), StandardFunctions::sum),
                BuiltinFunction.of("max", variadic(ValueType.NUMBER), StandardFunctions::max),
                BuiltinFunction.of("min", variadic(ValueType.NUMBER), StandardFunctions::min),
                BuiltinFunction.of("round",
                        fixed(required("value", ValueType.NUMBER), optional("decimals", ValueType.NUMBER)),
                        StandardFunctions::round),
                BuiltinFunction.of("lookup",
                        fixed(required("table", ValueType.STRING), required("value", ValueType.NUMBER)),
                        (args, ctx) -> {
                            String table = ((Value.StringValue) args.get(0)).value();
                            return Value.of(ctx.table(table).lookup(number(args, 1)));
                        }));
    }

    private static Value sum(List<Value> args, FunctionContext ctx) {
        double total = 0;
        for (int i = 0; i < args.size(); i++) {
            total += number(args, i);
        }
        return Value.of(total);
    }

    private static Value max(List<Value> args, FunctionContext ctx) {
        if (args.isEmpty()) {
            return Value.of(0);
        }
        double result = number(args, 0);
        for (int i = 1; i < args.size(); i++) {
            result = Math.max(result, number(args, i));
        }
        return Value.of(result);
    }

    private static Value min(List<Value> args, FunctionContext ctx) {
        if (args.isEmpty()) {
            return Value.of(0);
        }
        double result = number(args, 0);
        for (int i = 1; i < args.size(); i++) {
            result = Math.min(result, number(args, i));
        }
        return Value.of(result);
    }

    /**
     * Rounds to {@code decimals} places; negative places round to tens, hundreds and so on.
     * Ties go toward positive infinity.
     */
    private static Value round(List<Value> args, FunctionContext ctx) {
        double value = number(args, 0);
        double decimals = args.size() > 1 ? number(args, 1) : 0;
        if (decimals != Math.rint(decimals) || Math.abs(decimals) > 15) {
            throw new ArgumentMismatchException(
                    "round() decimals must be a whole number between -15 and 15 but got " + decimals, "round");
        }
        if (!Double.isFinite(value)) {
            return Value.of(value);
        }
        BigDecimal exact = BigDecimal.valueOf(value);
        RoundingMode mode = exact.signum() >= 0 ? RoundingMode.HALF_UP : RoundingMode.HALF_DOWN;
        return Value.of(exact.setScale((int) decimals, mode).doubleValue());
    }

    private static double number(List<Value> args, int index) {
        return ((Value.NumberValue) args.get(index)).value();
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.evaluation;

import com.levy.ruleengine.api.exceptions.EvaluationDepthException;
import com.levy.ruleengine.api.exceptions.NonScalarReturnException;
import com.levy.ruleengine.api.exceptions.ReferenceDomain;
import com.levy.ruleengine.api.exceptions.UnknownFunctionException;
import com.levy.ruleengine.api.exceptions.UnresolvedReferenceException;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.runtime.context.EvaluationContext;
import com.levy.ruleengine.runtime.expression.Expression;
import com.levy.ruleengine.runtime.expression.ExpressionParser;
import com.levy.ruleengine.runtime.expression.ExpressionVisitor;
import com.levy.ruleengine.runtime.function.BuiltinFunction;
import com.levy.ruleengine.runtime.function.BuiltinLibrary;
import com.levy.ruleengine.runtime.function.FunctionContext;
import com.levy.ruleengine.runtime.symbol.SymbolKind;
import com.levy.ruleengine.runtime.symbol.SymbolOrigin;
import com.levy.ruleengine.runtime.symbol.SymbolRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates expressions against an {@link EvaluationContext}.
 *
 * <h2>Resolution</h2>
 * <ul>
 *   <li>{@code $name}: inputs only</li>
 *   <li>{@code $$name}: rule constants, then built-in constants</li>
 *   <li>bare {@code name}: calculated variables, then built-in variables</li>
 *   <li>{@code name(args)}: built-in functions; arguments are evaluated left to right
 *       before the signature is checked</li>
 * </ul>
 *
 * <p>Each call clears the registry's dynamic symbols and registers the context's names again,
 * so symbols never leak between evaluations.
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. The symbol registry is rebuilt on every call; use one instance per
 * thread or guard clear-rebuild-evaluate with a lock.
 */
public final class ExpressionEvaluator {

    private static final Logger logger = Logger.getLogger(ExpressionEvaluator.class.getName());

    private final BuiltinLibrary library;
    private final SymbolRegistry registry;
    private final ExpressionParser parser;
    private final int maxDepth;

    public ExpressionEvaluator() {
        this(BuiltinLibrary.standard(), ExpressionParser.DEFAULT_MAX_DEPTH);
    }

    public ExpressionEvaluator(BuiltinLibrary library, int maxDepth) {
        this.library = library;
        this.registry = new SymbolRegistry(library);
        this.parser = new ExpressionParser(maxDepth);
        this.maxDepth = maxDepth;
    }

    /**
     * Parses and evaluates expression text.
     */
    public Value evaluate(String text, EvaluationContext context) {
        return evaluate(parser.parse(text), context);
    }

    public Value evaluate(Expression expression, EvaluationContext context) {
        registerContextSymbols(context);
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("Evaluating " + expression);
        }
        return expression.accept(new Resolver(context));
    }

    public SymbolRegistry symbolRegistry() {
        return registry;
    }

    public BuiltinLibrary library() {
        return library;
    }

    public ExpressionParser parser() {
        return parser;
    }

    private void registerContextSymbols(EvaluationContext context) {
        registry.clearDynamicSymbols();
        for (Map.Entry<String, Value> input : context.inputs().entrySet()) {
            registry.addSymbol(input.getKey(), SymbolKind.INPUT_VARIABLE, SymbolOrigin.CONTEXT,
                    input.getValue().type());
        }
        for (Map.Entry<String, Value> constant : context.constants().entrySet()) {
            registry.addSymbol(constant.getKey(), SymbolKind.CONSTANT_VARIABLE, SymbolOrigin.CONTEXT,
                    constant.getValue().type());
        }
        for (Map.Entry<String, Value> calculated : context.calculated().entrySet()) {
            registry.addSymbol(calculated.getKey(), SymbolKind.CALCULATED_VARIABLE, SymbolOrigin.CONTEXT,
                    calculated.getValue().type());
        }
    }

    private final class Resolver implements ExpressionVisitor<Value> {
        private final EvaluationContext context;
        private int depth;

        Resolver(EvaluationContext context) {
            this.context = context;
        }

        @Override
        public Value visitNumber(Expression.NumberLiteral literal) {
            return Value.of(literal.value());
        }

        @Override
        public Value visitBoolean(Expression.BooleanLiteral literal) {
            return Value.of(literal.value());
        }

        @Override
        public Value visitString(Expression.StringLiteral literal) {
            return Value.of(literal.value());
        }

        @Override
        public Value visitInput(Expression.InputVariableRef ref) {
            registry.validateUsage(ref.name(), SymbolKind.INPUT_VARIABLE);
            Value value = context.inputs().get(ref.name());
            if (value == null) {
                throw new UnresolvedReferenceException(ref.name(), ReferenceDomain.INPUT);
            }
            return value;
        }

        @Override
        public Value visitConstant(Expression.ConstantRef ref) {
            registry.validateUsage(ref.name(), SymbolKind.CONSTANT_VARIABLE);
            Value value = context.constants().get(ref.name());
            if (value == null) {
                value = library.constants().get(ref.name());
            }
            if (value == null) {
                throw new UnresolvedReferenceException(ref.name(), ReferenceDomain.CONSTANT);
            }
            return value;
        }

        @Override
        public Value visitCalculated(Expression.CalculatedRef ref) {
            registry.validateUsage(ref.name(), SymbolKind.CALCULATED_VARIABLE);
            Value value = context.calculated().get(ref.name());
            if (value == null) {
                value = library.variables().get(ref.name());
            }
            if (value == null) {
                throw new UnresolvedReferenceException(ref.name(), ReferenceDomain.CALCULATED);
            }
            return value;
        }

        @Override
        public Value visitCall(Expression.Call call) {
            registry.validateUsage(call.name(), SymbolKind.FUNCTION);
            BuiltinFunction function = library.function(call.name())
                    .orElseThrow(() -> new UnknownFunctionException(call.name(), library.functionNames()));
            if (++depth > maxDepth) {
                throw new EvaluationDepthException("Function call", maxDepth, call.name());
            }
            try {
                List<Value> arguments = new ArrayList<>(call.arguments().size());
                for (Expression argument : call.arguments()) {
                    arguments.add(argument.accept(this));
                }
                function.signature().check(call.name(), arguments);
                Value result = function.invoke(arguments, new FunctionContext(context.tables()));
                if (result == null) {
                    throw new NonScalarReturnException(call.name());
                }
                return result;
            } finally {
                depth--;
            }
        }
    }
}

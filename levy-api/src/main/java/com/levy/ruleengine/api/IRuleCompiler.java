/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api;

import com.levy.ruleengine.api.exceptions.RuleValidationException;
import com.levy.ruleengine.api.model.RuleDocument;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for turning rule JSON into a validated {@link RuleDocument}.
 *
 * <p>A document that produces any error-severity issue is refused with
 * {@link RuleValidationException}; the evaluator only ever sees compiled documents.
 */
public interface IRuleCompiler {

    /**
     * Compiles a rule from a JSON file.
     *
     * @throws IOException             if the file cannot be read or is not JSON
     * @throws RuleValidationException if the document is refused
     */
    RuleDocument compile(Path rulePath) throws IOException;

    /**
     * Compiles a rule from JSON text.
     *
     * @throws RuleValidationException if the text is not JSON or the document is refused
     */
    RuleDocument compile(String json);

    /**
     * Sets the tracer for observability.
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}

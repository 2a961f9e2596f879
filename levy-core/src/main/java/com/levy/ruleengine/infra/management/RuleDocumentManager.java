/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.infra.management;

import com.levy.ruleengine.api.CompilationListener;
import com.levy.ruleengine.api.IRuleCompiler;
import com.levy.ruleengine.api.IRuleDocumentManager;
import com.levy.ruleengine.api.exceptions.RuleValidationException;
import com.levy.ruleengine.api.model.RuleDocument;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public class RuleDocumentManager implements IRuleDocumentManager {
    private static final Logger logger = Logger.getLogger(RuleDocumentManager.class.getName());

    private static final long DEFAULT_RELOAD_INTERVAL_SECONDS = 10;

    private final Path rulePath;
    private final IRuleCompiler compiler;
    private final Tracer tracer;
    private final long reloadIntervalSeconds;

    /**
     * The active document. Calculations read it without locking; a reload replaces it in one step.
     */
    private final AtomicReference<RuleDocument> activeDocument = new AtomicReference<>();
    private final ScheduledExecutorService monitoringExecutor;

    private volatile long lastModifiedTime = -1;
    private volatile Consumer<RuleDocument> reloadCallback;

    public RuleDocumentManager(Path rulePath, Tracer tracer, IRuleCompiler compiler) throws IOException {
        this(rulePath, tracer, compiler, DEFAULT_RELOAD_INTERVAL_SECONDS);
    }

    /**
     * Compiles the rule file immediately.
     *
     * @throws IOException             if the file cannot be read
     * @throws RuleValidationException if the initial document is refused
     */
    public RuleDocumentManager(Path rulePath, Tracer tracer, IRuleCompiler compiler, long reloadIntervalSeconds)
            throws IOException {
        if (reloadIntervalSeconds < 1) {
            throw new IllegalArgumentException("reloadIntervalSeconds must be positive: " + reloadIntervalSeconds);
        }
        this.rulePath = rulePath;
        this.tracer = tracer;
        this.compiler = compiler;
        this.reloadIntervalSeconds = reloadIntervalSeconds;
        this.compiler.setTracer(tracer);
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Rule-File-Monitor");
            t.setDaemon(true);
            return t;
        });

        reloadInternal(null);
    }

    @Override
    public RuleDocument getRuleDocument() {
        return activeDocument.get();
    }

    /**
     * Sets a callback invoked with each newly activated document. Callback failures are
     * logged and do not undo the swap.
     */
    public void setReloadCallback(Consumer<RuleDocument> callback) {
        this.reloadCallback = callback;
    }

    @Override
    public void start() {
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates,
                reloadIntervalSeconds, reloadIntervalSeconds, TimeUnit.SECONDS);
    }

    @Override
    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    /**
     * Recompiles the rule file now, reporting stage progress to {@code listener}.
     *
     * @throws IOException             if the file cannot be read
     * @throws RuleValidationException if the document is refused; the previous one stays active
     */
    public void recompile(CompilationListener listener) throws IOException {
        Span span = tracer.spanBuilder("manual-recompile").startSpan();
        try (Scope scope = span.makeCurrent()) {
            reloadInternal(listener);
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-rule-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleFile", rulePath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(rulePath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in rule file " + rulePath + ". Attempting to reload...");
                reload();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not check rule file for modifications.", e);
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "An unexpected error occurred during rule reload check.", e);
        } finally {
            span.end();
        }
    }

    private void reload() {
        try {
            reloadInternal(null);
        } catch (RuleValidationException e) {
            logger.log(Level.SEVERE, "Rule file " + rulePath + " was refused. Previous document remains active.\n"
                    + RuleValidationException.format(e.getIssues()));
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to compile rule file " + rulePath
                    + ". Previous document remains active.", e);
        }
    }

    private void reloadInternal(CompilationListener listener) throws IOException {
        Span span = tracer.spanBuilder("load-rule-document").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(rulePath).toMillis();
            RuleDocument document;
            if (listener == null) {
                document = compiler.compile(rulePath);
            } else {
                compiler.setCompilationListener(listener);
                try {
                    document = compiler.compile(rulePath);
                } finally {
                    compiler.setCompilationListener(null);
                }
            }
            activeDocument.set(document);
            this.lastModifiedTime = modifiedTime;
            span.setAttribute("rule.name", String.valueOf(document.name()));
            span.setAttribute("rule.steps", document.flow().size());
            logger.info("Activated rule document '" + document.name() + "' from " + rulePath);

            Consumer<RuleDocument> callback = reloadCallback;
            if (callback != null) {
                runCallback(callback, document);
            }
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void runCallback(Consumer<RuleDocument> callback, RuleDocument document) {
        Span callbackSpan = tracer.spanBuilder("reload-callback").startSpan();
        try (Scope scope = callbackSpan.makeCurrent()) {
            long start = System.nanoTime();
            callback.accept(document);
            callbackSpan.setAttribute("callbackDurationMs", (System.nanoTime() - start) / 1_000_000.0);
        } catch (RuntimeException e) {
            callbackSpan.recordException(e);
            logger.log(Level.WARNING, "Reload callback failed for rule '" + document.name() + "'", e);
        } finally {
            callbackSpan.end();
        }
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api;

import com.levy.ruleengine.api.model.RuleDocument;

/**
 * Owns the active compiled rule document and keeps it in sync with its source.
 */
public interface IRuleDocumentManager {

    /**
     * Returns the currently active document. Never {@code null} once the manager is constructed.
     */
    RuleDocument getRuleDocument();

    void start();

    void shutdown();
}

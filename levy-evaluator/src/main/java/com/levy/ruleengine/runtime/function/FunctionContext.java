/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.function;

import com.levy.ruleengine.api.exceptions.TableLookupException;
import com.levy.ruleengine.runtime.table.BracketTable;

import java.util.Map;

/**
 * Read-only view of the evaluation state a function implementation may consult.
 */
public record FunctionContext(Map<String, BracketTable> tables) {

    public BracketTable table(String name) {
        BracketTable table = tables.get(name);
        if (table == null) {
            throw new TableLookupException("Table '" + name + "' not found", name);
        }
        return table;
    }
}

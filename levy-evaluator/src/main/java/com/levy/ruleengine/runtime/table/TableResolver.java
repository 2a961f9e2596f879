/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.runtime.table;

import com.levy.ruleengine.api.exceptions.TableLookupException;
import com.levy.ruleengine.api.model.BracketDefinition;
import com.levy.ruleengine.api.model.Operand;
import com.levy.ruleengine.api.model.TableDefinition;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.runtime.context.EvaluationContext;
import com.levy.ruleengine.runtime.evaluation.ExpressionEvaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns document tables into {@link BracketTable}s by resolving bound references
 * (e.g. {@code $$MAX_TAXABLE_INCOME}) once, against the evaluation's inputs and constants.
 */
public final class TableResolver {

    private final ExpressionEvaluator expressions;

    public TableResolver(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    public Map<String, BracketTable> resolve(List<TableDefinition> tables, EvaluationContext context) {
        Map<String, BracketTable> resolved = new LinkedHashMap<>();
        for (TableDefinition table : tables) {
            resolved.put(table.name(), resolve(table, context));
        }
        return resolved;
    }

    public BracketTable resolve(TableDefinition table, EvaluationContext context) {
        List<TaxBracket> brackets = new ArrayList<>(table.brackets().size());
        for (int i = 0; i < table.brackets().size(); i++) {
            BracketDefinition bracket = table.brackets().get(i);
            if (bracket.min() == null) {
                throw new TableLookupException("Bracket " + i + " of table '" + table.name() + "' has no min",
                        table.name());
            }
            double min = bound(table, i, "min", bracket.min(), context);
            Double max = bracket.max() == null ? null : bound(table, i, "max", bracket.max(), context);
            brackets.add(new TaxBracket(min, max, bracket.rate(), bracket.baseTax()));
        }
        return new BracketTable(table.name(), brackets);
    }

    private double bound(TableDefinition table, int index, String which, Operand operand, EvaluationContext context) {
        Value value = operand instanceof Operand.Literal literal
                ? literal.value()
                : expressions.evaluate(((Operand.ExpressionText) operand).text(), context);
        if (!value.isNumber()) {
            throw new TableLookupException("Bracket " + index + " " + which + " of table '" + table.name()
                    + "' must be a number but is " + value.type().jsonName(), table.name());
        }
        return ((Value.NumberValue) value).value();
    }
}

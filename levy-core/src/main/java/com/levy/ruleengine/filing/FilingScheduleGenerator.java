/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.filing;

import com.levy.ruleengine.api.exceptions.RuleEvaluationException;
import com.levy.ruleengine.api.exceptions.TaxRuleException;
import com.levy.ruleengine.api.exceptions.TypeMismatchException;
import com.levy.ruleengine.api.model.FilingSchedule;
import com.levy.ruleengine.api.model.Operand;
import com.levy.ruleengine.api.model.RuleDocument;
import com.levy.ruleengine.api.model.Value;
import com.levy.ruleengine.period.PeriodInfo;
import com.levy.ruleengine.runtime.context.EvaluationContext;
import com.levy.ruleengine.runtime.evaluation.ConditionalEvaluator;
import com.levy.ruleengine.runtime.evaluation.ExpressionEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Splits a computed liability over the rule's filing schedules.
 *
 * <p>A schedule whose {@code when} guard is false against the final evaluation context
 * produces nothing. Quarterly schedules emit {@code liability / 4} scaled by each affected
 * quarter's proration factor, monthly schedules {@code liability / 12} per affected month,
 * annual schedules the full liability.
 */
public final class FilingScheduleGenerator {
    private static final Logger logger = Logger.getLogger(FilingScheduleGenerator.class.getName());

    private final ExpressionEvaluator expressions;
    private final ConditionalEvaluator conditions;

    public FilingScheduleGenerator(ExpressionEvaluator expressions, ConditionalEvaluator conditions) {
        this.expressions = expressions;
        this.conditions = conditions;
    }

    public List<TaxLiability> generate(RuleDocument rule, EvaluationContext context,
                                       double liability, PeriodInfo period) {
        List<TaxLiability> liabilities = new ArrayList<>();
        for (FilingSchedule schedule : rule.filingSchedules()) {
            try {
                if (schedule.when() != null && !conditions.evaluate(schedule.when(), context)) {
                    logger.fine(() -> "Filing schedule '" + schedule.name() + "' does not apply");
                    continue;
                }
                addLiabilities(schedule, filingDay(schedule, context), liability, period, liabilities);
            } catch (TaxRuleException e) {
                throw new RuleEvaluationException(rule.name(), schedule.name(),
                        "Cannot generate filing schedule: " + e.getMessage(), e);
            }
        }
        return liabilities;
    }

    private static void addLiabilities(FilingSchedule schedule, int filingDay, double liability,
                                       PeriodInfo period, List<TaxLiability> out) {
        String form = schedule.forms() == null ? null : schedule.forms().primary();
        switch (schedule.frequency()) {
            case QUARTERLY -> {
                for (int quarter : period.affectedQuarters()) {
                    out.add(new TaxLiability(schedule.name(), schedule.frequency(), quarter,
                            liability / 4 * period.quarterFactor(quarter),
                            period.quarterFilingDate(quarter, filingDay), form));
                }
            }
            case MONTHLY -> {
                for (int month : period.affectedMonths()) {
                    out.add(new TaxLiability(schedule.name(), schedule.frequency(), month,
                            liability / 12 * period.monthFactor(month),
                            period.monthFilingDate(month, filingDay), form));
                }
            }
            case ANNUALLY -> out.add(new TaxLiability(schedule.name(), schedule.frequency(), 1,
                    liability, period.annualFilingDate(filingDay), form));
        }
    }

    private int filingDay(FilingSchedule schedule, EvaluationContext context) {
        Operand operand = schedule.filingDay();
        if (operand == null) {
            return PeriodInfo.DEFAULT_FILING_DAY;
        }
        Value value = operand instanceof Operand.Literal literal
                ? literal.value()
                : expressions.evaluate(((Operand.ExpressionText) operand).text(), context);
        if (!(value instanceof Value.NumberValue number)) {
            throw new TypeMismatchException("Filing day must be a number, got " + value, operand.toString());
        }
        double day = number.value();
        if (day != Math.floor(day) || day < 1 || day > 31) {
            throw new TaxRuleException("Filing day must be a whole number between 1 and 31, got " + number,
                    operand.toString());
        }
        return (int) day;
    }
}

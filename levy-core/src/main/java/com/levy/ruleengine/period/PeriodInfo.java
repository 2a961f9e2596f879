/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.period;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * A resolved taxable period, broken down over the quarters and months of its start year.
 *
 * <p>Proration factors are the share of a quarter (or month) covered by the period, counting
 * both end days: a period of April 1 to June 30 gives {@code Q2 = 1.0}. Quarters and months
 * the period does not touch are absent from {@code affectedQuarters}, {@code affectedMonths}
 * and the factor maps.
 */
public record PeriodInfo(
        LocalDate startDate,
        LocalDate endDate,
        List<Integer> affectedQuarters,
        Map<Integer, Double> quarterFactors,
        List<Integer> affectedMonths,
        Map<Integer, Double> monthFactors,
        boolean fullYear,
        long totalDays
) {

    public static final int DEFAULT_FILING_DAY = 15;

    public PeriodInfo {
        affectedQuarters = List.copyOf(affectedQuarters);
        quarterFactors = Map.copyOf(quarterFactors);
        affectedMonths = List.copyOf(affectedMonths);
        monthFactors = Map.copyOf(monthFactors);
    }

    public int year() {
        return startDate.getYear();
    }

    public double quarterFactor(int quarter) {
        return quarterFactors.getOrDefault(quarter, 0.0);
    }

    public double monthFactor(int month) {
        return monthFactors.getOrDefault(month, 0.0);
    }

    /**
     * Filing date of a quarter: {@code filingDay} of the month following the quarter,
     * so Q4 files in January of the next year.
     */
    public LocalDate quarterFilingDate(int quarter, int filingDay) {
        return dayOf(YearMonth.of(year(), quarter * 3).plusMonths(1), filingDay);
    }

    public LocalDate monthFilingDate(int month, int filingDay) {
        return dayOf(YearMonth.of(year(), month).plusMonths(1), filingDay);
    }

    /**
     * Annual returns are due in April of the year after the period.
     */
    public LocalDate annualFilingDate(int filingDay) {
        return dayOf(YearMonth.of(year() + 1, 4), filingDay);
    }

    // Days past the end of a short month fall on its last day.
    private static LocalDate dayOf(YearMonth month, int filingDay) {
        return month.atDay(Math.max(1, Math.min(filingDay, month.lengthOfMonth())));
    }
}

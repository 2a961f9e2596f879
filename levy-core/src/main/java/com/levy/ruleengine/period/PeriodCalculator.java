/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.period;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves {@link PeriodOptions} into a {@link PeriodInfo}.
 *
 * <p>Only the quarters and months of the start year are considered. A period running into
 * the next year is prorated against the start year alone.
 */
public final class PeriodCalculator {

    private final Clock clock;

    public PeriodCalculator() {
        this(Clock.systemDefaultZone());
    }

    public PeriodCalculator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if the start date is after the end date
     */
    public PeriodInfo calculate(PeriodOptions options) {
        int currentYear = LocalDate.now(clock).getYear();
        LocalDate start = options != null && options.startDate() != null
                ? options.startDate() : LocalDate.of(currentYear, 1, 1);
        LocalDate end = options != null && options.endDate() != null
                ? options.endDate() : LocalDate.of(currentYear, 12, 31);

        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start date cannot be after end date");
        }

        int year = start.getYear();
        List<Integer> quarters = new ArrayList<>();
        Map<Integer, Double> quarterFactors = new LinkedHashMap<>();
        for (int quarter = 1; quarter <= 4; quarter++) {
            LocalDate quarterStart = LocalDate.of(year, quarter * 3 - 2, 1);
            LocalDate quarterEnd = YearMonth.of(year, quarter * 3).atEndOfMonth();
            double factor = overlap(quarterStart, quarterEnd, start, end);
            if (factor > 0) {
                quarters.add(quarter);
                quarterFactors.put(quarter, factor);
            }
        }

        List<Integer> months = new ArrayList<>();
        Map<Integer, Double> monthFactors = new LinkedHashMap<>();
        for (int month = 1; month <= 12; month++) {
            YearMonth yearMonth = YearMonth.of(year, month);
            double factor = overlap(yearMonth.atDay(1), yearMonth.atEndOfMonth(), start, end);
            if (factor > 0) {
                months.add(month);
                monthFactors.put(month, factor);
            }
        }

        boolean fullYear = start.equals(LocalDate.of(year, 1, 1)) && end.equals(LocalDate.of(year, 12, 31));
        return new PeriodInfo(start, end, quarters, quarterFactors, months, monthFactors,
                fullYear, daysInclusive(start, end));
    }

    private static double overlap(LocalDate from, LocalDate to, LocalDate periodStart, LocalDate periodEnd) {
        LocalDate overlapStart = from.isAfter(periodStart) ? from : periodStart;
        LocalDate overlapEnd = to.isBefore(periodEnd) ? to : periodEnd;
        if (overlapStart.isAfter(overlapEnd)) {
            return 0.0;
        }
        return (double) daysInclusive(overlapStart, overlapEnd) / daysInclusive(from, to);
    }

    private static long daysInclusive(LocalDate start, LocalDate end) {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.period;

import java.time.LocalDate;

/**
 * Bounds of a taxable period. Either bound may be {@code null}; a missing start defaults
 * to January 1 and a missing end to December 31 of the current year.
 */
public record PeriodOptions(LocalDate startDate, LocalDate endDate) {

    public static PeriodOptions currentYear() {
        return new PeriodOptions(null, null);
    }

    public static PeriodOptions of(LocalDate startDate, LocalDate endDate) {
        return new PeriodOptions(startDate, endDate);
    }

    /**
     * Parses ISO-8601 dates ({@code 2025-04-01}); blank or null strings mean "use the default".
     */
    public static PeriodOptions parse(String startDate, String endDate) {
        return new PeriodOptions(parseDate(startDate), parseDate(endDate));
    }

    private static LocalDate parseDate(String text) {
        return text == null || text.isBlank() ? null : LocalDate.parse(text.trim());
    }
}

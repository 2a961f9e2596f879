/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.filing;

import com.levy.ruleengine.api.model.FilingFrequency;

import java.time.LocalDate;

/**
 * One payment due under a filing schedule.
 *
 * @param name        schedule name
 * @param frequency   schedule frequency
 * @param iteration   quarter (1-4), month (1-12), or 1 for annual filings
 * @param amount      share of the liability due
 * @param filingDate  target filing date
 * @param form        primary form to file, may be {@code null}
 */
public record TaxLiability(
        String name,
        FilingFrequency frequency,
        int iteration,
        double amount,
        LocalDate filingDate,
        String form
) {
}

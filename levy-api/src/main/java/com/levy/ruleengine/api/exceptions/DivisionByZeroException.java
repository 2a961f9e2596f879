/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.exceptions;

public class DivisionByZeroException extends TaxRuleException {

    public DivisionByZeroException(String target) {
        super("Division by zero while dividing '" + target + "'", target);
    }
}

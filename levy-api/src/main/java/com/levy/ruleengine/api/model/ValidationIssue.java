/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

/**
 * A problem found in a rule document or in supplied inputs.
 *
 * @param severity   whether the issue blocks
 * @param message    what is wrong
 * @param path       JSON pointer to the offending node (e.g. {@code /flow/2/cases/0/when})
 * @param suggestion optional hint for fixing it
 */
public record ValidationIssue(Severity severity, String message, String path, String suggestion) {

    public static ValidationIssue error(String path, String message) {
        return new ValidationIssue(Severity.ERROR, message, path, null);
    }

    public static ValidationIssue error(String path, String message, String suggestion) {
        return new ValidationIssue(Severity.ERROR, message, path, suggestion);
    }

    public static ValidationIssue warning(String path, String message) {
        return new ValidationIssue(Severity.WARNING, message, path, null);
    }

    public static ValidationIssue warning(String path, String message, String suggestion) {
        return new ValidationIssue(Severity.WARNING, message, path, suggestion);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String text = "[" + severity + "] " + path + ": " + message;
        return suggestion == null ? text : text + " (" + suggestion + ")";
    }
}

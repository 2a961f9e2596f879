/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.model;

/**
 * Audit entry for one applied operation.
 *
 * @param step   flow step the operation belongs to
 * @param type   operation kind
 * @param target calculated variable written
 * @param before value before the operation, or null if the variable was unset
 * @param after  value after the operation
 */
public record OperationRecord(String step, OperationType type, String target, Value before, Value after) {
}

/*
 * Copyright (c) 2025 Levy Tax Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.levy.ruleengine.api.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Engine-wide configuration shared by the compiler, the evaluator and the façade.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables using the pattern
 * {@code LEVY_<PROPERTY_NAME>}:
 * <pre>
 * LEVY_MAX_EXPRESSION_DEPTH=32
 * LEVY_MAX_CONDITION_DEPTH=32
 * LEVY_TRACE_ENABLED=true
 * LEVY_VALIDATION_MODE=STRICT
 * LEVY_ALLOW_UNKNOWN_TAXPAYER_TYPES=true
 * LEVY_RELOAD_INTERVAL_SECONDS=30
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Strict validation and full tracing
 * EngineConfig config = EngineConfig.forDevelopment();
 *
 * // Custom config with env override
 * EngineConfig config = EngineConfig.builder()
 *     .maxExpressionDepth(32)
 *     .traceEnabled(true)
 *     .build();
 * }</pre>
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_MAX_EXPRESSION_DEPTH = "LEVY_MAX_EXPRESSION_DEPTH";
    static final String ENV_MAX_CONDITION_DEPTH = "LEVY_MAX_CONDITION_DEPTH";
    static final String ENV_TRACE_ENABLED = "LEVY_TRACE_ENABLED";
    static final String ENV_VALIDATION_MODE = "LEVY_VALIDATION_MODE";
    static final String ENV_ALLOW_UNKNOWN_TAXPAYER_TYPES = "LEVY_ALLOW_UNKNOWN_TAXPAYER_TYPES";
    static final String ENV_RELOAD_INTERVAL_SECONDS = "LEVY_RELOAD_INTERVAL_SECONDS";

    public static final String DEFAULT_PROPERTIES = "levy-engine.properties";

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final int maxExpressionDepth;
    private final int maxConditionDepth;
    private final boolean traceEnabled;
    private final ValidationMode validationMode;
    private final boolean allowUnknownTaxpayerTypes;
    private final long reloadIntervalSeconds;

    private EngineConfig(Builder builder) {
        this.maxExpressionDepth = builder.maxExpressionDepth;
        this.maxConditionDepth = builder.maxConditionDepth;
        this.traceEnabled = builder.traceEnabled;
        this.validationMode = builder.validationMode;
        this.allowUnknownTaxpayerTypes = builder.allowUnknownTaxpayerTypes;
        this.reloadIntervalSeconds = builder.reloadIntervalSeconds;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults with environment overrides.
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Strict validation and tracing, for rule authoring.
     */
    public static EngineConfig forDevelopment() {
        return builder()
                .validationMode(ValidationMode.STRICT)
                .traceEnabled(true)
                .reloadIntervalSeconds(2)
                .build();
    }

    /**
     * Errors-only validation, no tracing.
     */
    public static EngineConfig forProduction() {
        return builder()
                .validationMode(ValidationMode.WARNING)
                .traceEnabled(false)
                .build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES} from the classpath when present.
     * Environment variables override properties file values.
     *
     * <p><b>Example levy-engine.properties:</b>
     * <pre>
     * levy.max.expression.depth=64
     * levy.max.condition.depth=64
     * levy.trace.enabled=false
     * levy.validation.mode=WARNING
     * levy.allow.unknown.taxpayer.types=false
     * levy.reload.interval.seconds=10
     * </pre>
     */
    public static EngineConfig loadDefault() {
        Properties props = new Properties();
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_PROPERTIES)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + DEFAULT_PROPERTIES);
            }
        } catch (IOException e) {
            logger.warning("Could not read " + DEFAULT_PROPERTIES + ": " + e.getMessage() + ". Using defaults.");
        }
        return fromSources(props::getProperty, System::getenv);
    }

    /**
     * Builds a configuration from a property lookup, then applies the environment lookup on top.
     */
    static EngineConfig fromSources(Function<String, String> properties, Function<String, String> environment) {
        Builder builder = new Builder();
        builder.apply(properties, "levy.max.expression.depth", "levy.max.condition.depth", "levy.trace.enabled",
                "levy.validation.mode", "levy.allow.unknown.taxpayer.types", "levy.reload.interval.seconds");
        builder.apply(environment, ENV_MAX_EXPRESSION_DEPTH, ENV_MAX_CONDITION_DEPTH, ENV_TRACE_ENABLED,
                ENV_VALIDATION_MODE, ENV_ALLOW_UNKNOWN_TAXPAYER_TYPES, ENV_RELOAD_INTERVAL_SECONDS);
        return builder.build();
    }

    private void validate() {
        if (maxExpressionDepth < 1) {
            throw new IllegalArgumentException("maxExpressionDepth must be positive: " + maxExpressionDepth);
        }
        if (maxConditionDepth < 1) {
            throw new IllegalArgumentException("maxConditionDepth must be positive: " + maxConditionDepth);
        }
        if (validationMode == null) {
            throw new IllegalArgumentException("validationMode must not be null");
        }
        if (reloadIntervalSeconds < 1) {
            throw new IllegalArgumentException("reloadIntervalSeconds must be positive: " + reloadIntervalSeconds);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public int getMaxExpressionDepth() {
        return maxExpressionDepth;
    }

    public int getMaxConditionDepth() {
        return maxConditionDepth;
    }

    public boolean isTraceEnabled() {
        return traceEnabled;
    }

    public ValidationMode getValidationMode() {
        return validationMode;
    }

    public boolean isAllowUnknownTaxpayerTypes() {
        return allowUnknownTaxpayerTypes;
    }

    public long getReloadIntervalSeconds() {
        return reloadIntervalSeconds;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.maxExpressionDepth = this.maxExpressionDepth;
        builder.maxConditionDepth = this.maxConditionDepth;
        builder.traceEnabled = this.traceEnabled;
        builder.validationMode = this.validationMode;
        builder.allowUnknownTaxpayerTypes = this.allowUnknownTaxpayerTypes;
        builder.reloadIntervalSeconds = this.reloadIntervalSeconds;
        return builder;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "maxExpressionDepth=" + maxExpressionDepth +
                ", maxConditionDepth=" + maxConditionDepth +
                ", traceEnabled=" + traceEnabled +
                ", validationMode=" + validationMode +
                ", allowUnknownTaxpayerTypes=" + allowUnknownTaxpayerTypes +
                ", reloadIntervalSeconds=" + reloadIntervalSeconds +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * Returns a builder with defaults overridden by {@code LEVY_*} environment variables.
     */
    public static Builder builder() {
        Builder builder = new Builder();
        builder.apply(System::getenv, ENV_MAX_EXPRESSION_DEPTH, ENV_MAX_CONDITION_DEPTH, ENV_TRACE_ENABLED,
                ENV_VALIDATION_MODE, ENV_ALLOW_UNKNOWN_TAXPAYER_TYPES, ENV_RELOAD_INTERVAL_SECONDS);
        return builder;
    }

    public static class Builder {

        private int maxExpressionDepth = 64;
        private int maxConditionDepth = 64;
        private boolean traceEnabled = false;
        private ValidationMode validationMode = ValidationMode.WARNING;
        private boolean allowUnknownTaxpayerTypes = false;
        private long reloadIntervalSeconds = 10;

        private Builder() {
        }

        /**
         * Applies overrides from a key lookup. Keys are given in field order.
         */
        private void apply(Function<String, String> source, String depthKey, String conditionDepthKey,
                           String traceKey, String modeKey, String taxpayerKey, String reloadKey) {
            lookup(source, depthKey).flatMap(val -> parseInt(depthKey, val))
                    .ifPresent(val -> this.maxExpressionDepth = val);
            lookup(source, conditionDepthKey).flatMap(val -> parseInt(conditionDepthKey, val))
                    .ifPresent(val -> this.maxConditionDepth = val);
            lookup(source, traceKey).ifPresent(val -> this.traceEnabled = Boolean.parseBoolean(val));
            lookup(source, modeKey).ifPresent(val -> {
                try {
                    this.validationMode = ValidationMode.valueOf(val.toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid " + modeKey + ": " + val + ", using default: " + this.validationMode);
                }
            });
            lookup(source, taxpayerKey).ifPresent(val -> this.allowUnknownTaxpayerTypes = Boolean.parseBoolean(val));
            lookup(source, reloadKey).flatMap(val -> parseInt(reloadKey, val))
                    .ifPresent(val -> this.reloadIntervalSeconds = val);
        }

        public Builder maxExpressionDepth(int depth) {
            this.maxExpressionDepth = depth;
            return this;
        }

        public Builder maxConditionDepth(int depth) {
            this.maxConditionDepth = depth;
            return this;
        }

        public Builder traceEnabled(boolean enable) {
            this.traceEnabled = enable;
            return this;
        }

        public Builder validationMode(ValidationMode mode) {
            this.validationMode = mode;
            return this;
        }

        public Builder allowUnknownTaxpayerTypes(boolean allow) {
            this.allowUnknownTaxpayerTypes = allow;
            return this;
        }

        public Builder reloadIntervalSeconds(long seconds) {
            this.reloadIntervalSeconds = seconds;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        // ====================================================================
        // LOOKUP HELPERS
        // ====================================================================

        private static Optional<String> lookup(Function<String, String> source, String key) {
            String value = source.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded config: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> parseInt(String key, String value) {
            try {
                return Optional.of(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for " + key + ": " + value);
                return Optional.empty();
            }
        }
    }
}

/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricwatch.common.config;

/**
 * Thrown if the user supplies an invalid configuration, either in the engine properties or in a metric definition.
 */
public class ConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigException(String name, Object value, String message) {
        super("Invalid value " + value + " for configuration " + name + (message == null ? "" : ": " + message));
    }

    /**
     * @param metricId Id of the metric definition that failed validation.
     * @param field The offending field.
     * @param message Description of the problem.
     * @return A config exception that names both the metric and the field.
     */
    public static ConfigException forMetric(String metricId, String field, String message) {
        return new ConfigException(String.format("Metric '%s', field '%s': %s", metricId, field, message));
    }
}

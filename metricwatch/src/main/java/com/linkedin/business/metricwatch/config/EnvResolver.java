/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * Resolves environment variables, optionally on top of a pre-configured set of variables. Process environment wins
 * over pre-configured values.
 */
public class EnvResolver {
  private static final Pattern ENV_PLACEHOLDER = Pattern.compile("\\$\\{env:([A-Za-z_][A-Za-z0-9_]*)\\}");
  private final Map<String, String> _preConfiguredEnvironmentVariables;

  public EnvResolver() {
    this(Collections.emptyMap());
  }

  public EnvResolver(Map<String, String> preConfiguredEnvironmentVariables) {
    _preConfiguredEnvironmentVariables = new HashMap<>(preConfiguredEnvironmentVariables);
  }

  /**
   * @param name Variable name.
   * @return The value of the variable, or {@code null} if it is not set.
   */
  public String get(String name) {
    String value = System.getenv(name);
    return value != null ? value : _preConfiguredEnvironmentVariables.get(name);
  }

  /**
   * Replace every <code>${env:NAME}</code> placeholder of the given template with the value of NAME.
   *
   * @param template Template to resolve.
   * @return The resolved string.
   * @throws IllegalArgumentException if a referenced variable is not set.
   */
  public String resolve(String template) {
    Matcher matcher = ENV_PLACEHOLDER.matcher(template);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String name = matcher.group(1);
      String value = get(name);
      if (value == null) {
        throw new IllegalArgumentException("Environment variable " + name + " is not set.");
      }
      matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }
}

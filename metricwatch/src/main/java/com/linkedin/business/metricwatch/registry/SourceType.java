/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;


/**
 * The closed set of data source kinds a metric can be read from.
 */
public enum SourceType {
  RELATIONAL, FILE, HTTP, INTERNAL;

  /**
   * @param name Case insensitive source type name.
   * @return The matching source type, or empty if there is none.
   */
  public static Optional<SourceType> forName(String name) {
    return Arrays.stream(values()).filter(t -> t.name().equalsIgnoreCase(name)).findFirst();
  }

  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

/**
 * Where and how the values of a metric are read. Implementations are immutable value objects, one per
 * {@link SourceType}.
 */
public interface DataSourceSpec {

  /**
   * @return The kind of the source.
   */
  SourceType type();
}

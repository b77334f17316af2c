/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import java.util.Collections;
import java.util.List;
import java.util.Map;


public class NoopModelStore implements ModelStore {
  @Override
  public void configure(Map<String, ?> configs) {

  }

  @Override
  public void storeModel(ScorerModel model) {

  }

  @Override
  public List<ScorerModel> loadModels() {
    return Collections.emptyList();
  }

  @Override
  public void deleteModel(String metricId) {

  }

  @Override
  public int evictModelsBefore(long timestampMs) {
    return 0;
  }
}

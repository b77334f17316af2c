/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;


/**
 * An immutable, fully validated set of metric definitions keyed by id.
 */
public final class RegistrySnapshot {
  private static final RegistrySnapshot EMPTY = new RegistrySnapshot(Collections.emptyMap(), 0L);
  private final Map<String, MetricDefinition> _definitions;
  private final long _loadedAtMs;

  private RegistrySnapshot(Map<String, MetricDefinition> definitions, long loadedAtMs) {
    _definitions = Collections.unmodifiableMap(definitions);
    _loadedAtMs = loadedAtMs;
  }

  public static RegistrySnapshot empty() {
    return EMPTY;
  }

  /**
   * @param definitions Definitions with unique ids.
   * @param loadedAtMs Time the definitions were loaded.
   * @return A snapshot of the given definitions.
   */
  public static RegistrySnapshot of(Collection<MetricDefinition> definitions, long loadedAtMs) {
    Map<String, MetricDefinition> byId = new LinkedHashMap<>();
    for (MetricDefinition definition : definitions) {
      if (byId.put(definition.id(), definition) != null) {
        throw new IllegalArgumentException("Duplicate metric id " + definition.id());
      }
    }
    return new RegistrySnapshot(byId, loadedAtMs);
  }

  public Optional<MetricDefinition> get(String metricId) {
    return Optional.ofNullable(_definitions.get(metricId));
  }

  public List<MetricDefinition> all() {
    return new ArrayList<>(_definitions.values());
  }

  public List<MetricDefinition> listEnabled() {
    return _definitions.values().stream().filter(MetricDefinition::enabled).collect(Collectors.toList());
  }

  public int size() {
    return _definitions.size();
  }

  public long loadedAtMs() {
    return _loadedAtMs;
  }

  /**
   * @param definition Definition to add or replace.
   * @param nowMs Current time.
   * @return A new snapshot holding the given definition in place of any definition with the same id.
   */
  RegistrySnapshot with(MetricDefinition definition, long nowMs) {
    Map<String, MetricDefinition> copy = new LinkedHashMap<>(_definitions);
    copy.put(definition.id(), definition);
    return new RegistrySnapshot(copy, nowMs);
  }

  /**
   * @param metricId Id of the definition to drop.
   * @param nowMs Current time.
   * @return A new snapshot without the given definition.
   */
  RegistrySnapshot without(String metricId, long nowMs) {
    Map<String, MetricDefinition> copy = new LinkedHashMap<>(_definitions);
    copy.remove(metricId);
    return new RegistrySnapshot(copy, nowMs);
  }
}

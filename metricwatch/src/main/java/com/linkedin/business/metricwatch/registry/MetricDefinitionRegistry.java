/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import com.linkedin.metricwatch.common.config.ConfigException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Holds the current {@link RegistrySnapshot}. Every change builds a complete new snapshot and publishes it with a
 * single reference swap, so readers always observe either the old or the new set of definitions.
 */
public class MetricDefinitionRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(MetricDefinitionRegistry.class);
  private final AtomicReference<RegistrySnapshot> _snapshot;
  private final Time _time;

  public MetricDefinitionRegistry(Time time) {
    _time = time;
    _snapshot = new AtomicReference<>(RegistrySnapshot.empty());
  }

  /**
   * Parse the given metric definitions into a new snapshot and make it current. The current snapshot is kept if the
   * definitions are invalid.
   *
   * @param reader Reader over a JSON array of metric definitions.
   * @return The new current snapshot.
   * @throws ConfigException if the definitions are invalid.
   */
  public RegistrySnapshot load(Reader reader) {
    List<MetricDefinition> definitions = MetricDefinitionParser.parseAll(reader);
    RegistrySnapshot snapshot = RegistrySnapshot.of(definitions, _time.milliseconds());
    _snapshot.set(snapshot);
    LOG.info("Loaded {} metric definitions, {} enabled.", snapshot.size(), snapshot.listEnabled().size());
    return snapshot;
  }

  /**
   * @param file JSON file holding an array of metric definitions.
   * @return The new current snapshot.
   * @throws ConfigException if the file is missing or the definitions are invalid.
   */
  public RegistrySnapshot load(Path file) throws IOException {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return load(reader);
    } catch (NoSuchFileException e) {
      throw new ConfigException("Metric definitions file " + file + " does not exist.", e);
    }
  }

  public RegistrySnapshot snapshot() {
    return _snapshot.get();
  }

  public Optional<MetricDefinition> get(String metricId) {
    return _snapshot.get().get(metricId);
  }

  public List<MetricDefinition> listEnabled() {
    return _snapshot.get().listEnabled();
  }

  /**
   * Add or replace a single definition.
   *
   * @param definition Definition to add or replace.
   * @return The new current snapshot.
   */
  public RegistrySnapshot put(MetricDefinition definition) {
    RegistrySnapshot updated = _snapshot.updateAndGet(s -> s.with(definition, _time.milliseconds()));
    LOG.info("Metric {} was registered.", definition.id());
    return updated;
  }

  /**
   * Remove a single definition.
   *
   * @param metricId Id of the definition to remove.
   * @return True if a definition was removed.
   */
  public boolean remove(String metricId) {
    RegistrySnapshot before = _snapshot.getAndUpdate(s -> s.get(metricId).isPresent() ? s.without(metricId, _time.milliseconds()) : s);
    boolean removed = before.get(metricId).isPresent();
    if (removed) {
      LOG.info("Metric {} was removed.", metricId);
    }
    return removed;
  }
}

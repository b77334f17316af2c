/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.source;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.registry.DataSourceSpec;
import com.linkedin.business.metricwatch.registry.FileSourceSpec;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;


/**
 * Reads timestamped rows from a CSV file with a header row or from a JSON array of objects. The file is read in full
 * on every call.
 */
public class FileSourceConnector implements DataSourceConnector {
  private static final CSVFormat CSV_WITH_HEADER = CSVFormat.RFC4180.builder()
                                                                    .setHeader()
                                                                    .setSkipHeaderRecord(true)
                                                                    .setIgnoreSurroundingSpaces(true)
                                                                    .setIgnoreEmptyLines(true)
                                                                    .build();
  private final ZoneId _zone;

  public FileSourceConnector(ZoneId zone) {
    _zone = zone;
  }

  @Override
  public double fetchCurrent(DataSourceSpec spec) throws SourceException {
    FileSourceSpec file = (FileSourceSpec) spec;
    List<Sample> samples = readSamples(file);
    if (samples.isEmpty()) {
      throw new SourceException(SourceException.Kind.NOT_FOUND, "File " + file.path() + " has no rows.");
    }
    Sample latest = samples.get(0);
    for (Sample sample : samples) {
      if (sample.timestampMs() >= latest.timestampMs()) {
        latest = sample;
      }
    }
    return latest.value();
  }

  @Override
  public List<Sample> fetchHistorical(DataSourceSpec spec) throws SourceException {
    return SourceUtils.ascending(readSamples((FileSourceSpec) spec));
  }

  private List<Sample> readSamples(FileSourceSpec file) throws SourceException {
    Path path = Paths.get(file.path());
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return file.format() == FileSourceSpec.Format.CSV ? readCsv(reader, file) : readJson(reader, file);
    } catch (NoSuchFileException e) {
      throw new SourceException(SourceException.Kind.NOT_FOUND, "File " + file.path() + " does not exist.", e);
    } catch (IOException e) {
      throw new SourceException(SourceException.Kind.CONNECTION, "Failed to read " + file.path() + ": " + e.getMessage(), e);
    }
  }

  private List<Sample> readCsv(Reader reader, FileSourceSpec file) throws IOException, SourceException {
    List<Sample> samples = new ArrayList<>();
    try (CSVParser parser = CSV_WITH_HEADER.parse(reader)) {
      List<String> header = parser.getHeaderNames();
      for (String column : new String[]{file.valueColumn(), file.timestampColumn()}) {
        if (!header.contains(column)) {
          throw new SourceException(SourceException.Kind.PARSE, "File " + file.path() + " has no column " + column);
        }
      }
      for (CSVRecord record : parser) {
        String value = record.get(file.valueColumn());
        if (value == null || value.isEmpty()) {
          continue;
        }
        samples.add(new Sample(SourceUtils.toEpochMs(record.get(file.timestampColumn()), _zone), SourceUtils.toValue(value)));
      }
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new SourceException(SourceException.Kind.PARSE, "Malformed CSV in " + file.path() + ": " + e.getMessage(), e);
    }
    return samples;
  }

  private List<Sample> readJson(Reader reader, FileSourceSpec file) throws SourceException {
    JsonElement root;
    try {
      root = JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new SourceException(SourceException.Kind.PARSE, "Malformed JSON in " + file.path() + ": " + e.getMessage(), e);
    }
    if (!root.isJsonArray()) {
      throw new SourceException(SourceException.Kind.PARSE, "File " + file.path() + " must hold a JSON array of objects.");
    }
    List<Sample> samples = new ArrayList<>();
    for (JsonElement element : root.getAsJsonArray()) {
      if (!element.isJsonObject()) {
        throw new SourceException(SourceException.Kind.PARSE, "File " + file.path() + " must hold a JSON array of objects.");
      }
      JsonObject row = element.getAsJsonObject();
      JsonElement value = row.get(file.valueColumn());
      JsonElement timestamp = row.get(file.timestampColumn());
      if (value == null || value.isJsonNull()) {
        continue;
      }
      if (timestamp == null || !timestamp.isJsonPrimitive() || !value.isJsonPrimitive()) {
        throw new SourceException(SourceException.Kind.PARSE, "Row " + row + " of " + file.path() + " has no usable timestamp or value.");
      }
      samples.add(new Sample(SourceUtils.toEpochMs(unwrap(timestamp.getAsJsonPrimitive()), _zone),
                             SourceUtils.toValue(unwrap(value.getAsJsonPrimitive()))));
    }
    return samples;
  }

  private static Object unwrap(JsonPrimitive primitive) {
    return primitive.isNumber() ? primitive.getAsNumber() : primitive.getAsString();
  }
}

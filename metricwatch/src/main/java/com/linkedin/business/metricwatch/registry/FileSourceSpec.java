/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Locale;
import java.util.Objects;


/**
 * A flat file of timestamped rows. The current value is the value of the row with the latest timestamp.
 */
public final class FileSourceSpec implements DataSourceSpec {
  /**
   * Supported file layouts.
   */
  public enum Format {
    CSV, JSON;

    public String jsonName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final String _path;
  private final String _valueColumn;
  private final String _timestampColumn;
  private final Format _format;

  public FileSourceSpec(String path, String valueColumn, String timestampColumn, Format format) {
    _path = path;
    _valueColumn = valueColumn;
    _timestampColumn = timestampColumn;
    _format = format;
  }

  @Override
  public SourceType type() {
    return SourceType.FILE;
  }

  public String path() {
    return _path;
  }

  public String valueColumn() {
    return _valueColumn;
  }

  public String timestampColumn() {
    return _timestampColumn;
  }

  public Format format() {
    return _format;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FileSourceSpec that = (FileSourceSpec) o;
    return _path.equals(that._path) && _valueColumn.equals(that._valueColumn) && _timestampColumn.equals(that._timestampColumn)
           && _format == that._format;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_path, _valueColumn, _timestampColumn, _format);
  }

  @Override
  public String toString() {
    return String.format("FileSourceSpec{path=%s, format=%s}", _path, _format);
  }
}

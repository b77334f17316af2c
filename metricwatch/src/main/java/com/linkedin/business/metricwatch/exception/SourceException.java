/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.exception;

import com.linkedin.metricwatch.exception.MetricWatchException;


/**
 * Thrown when a data source cannot provide a value. Transient kinds may succeed on retry, permanent kinds will not.
 */
public class SourceException extends MetricWatchException {
  /**
   * Failure categories of a data source call.
   */
  public enum Kind {
    TIMEOUT(true), CONNECTION(true), AUTH(false), PARSE(false), NOT_FOUND(false);

    private final boolean _transient;

    Kind(boolean isTransient) {
      _transient = isTransient;
    }

    public boolean isTransient() {
      return _transient;
    }
  }

  private final Kind _kind;

  public SourceException(Kind kind, String message) {
    super(message);
    _kind = kind;
  }

  public SourceException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    _kind = kind;
  }

  public Kind kind() {
    return _kind;
  }

  public boolean isTransient() {
    return _kind.isTransient();
  }

  @Override
  public String getMessage() {
    return _kind + ": " + super.getMessage();
  }
}

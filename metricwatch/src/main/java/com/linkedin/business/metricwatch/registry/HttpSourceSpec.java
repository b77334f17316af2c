/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;


/**
 * An HTTP endpoint returning JSON. The current value is extracted with a JsonPath expression. Header values may
 * contain <code>${env:NAME}</code> placeholders, resolved at request time.
 */
public final class HttpSourceSpec implements DataSourceSpec {
  /**
   * Supported request methods.
   */
  public enum Method {
    GET, POST
  }

  private final String _url;
  private final Method _method;
  private final Map<String, String> _headers;
  private final String _responseFieldPath;
  private final String _body;
  private final String _connectionId;
  private final String _historicalUrl;
  private final String _historicalPath;

  public HttpSourceSpec(String url,
                        Method method,
                        Map<String, String> headers,
                        String responseFieldPath,
                        String body,
                        String connectionId,
                        String historicalUrl,
                        String historicalPath) {
    _url = url;
    _method = method;
    _headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    _responseFieldPath = responseFieldPath;
    _body = body;
    _connectionId = connectionId;
    _historicalUrl = historicalUrl;
    _historicalPath = historicalPath;
  }

  @Override
  public SourceType type() {
    return SourceType.HTTP;
  }

  public String url() {
    return _url;
  }

  public Method method() {
    return _method;
  }

  public Map<String, String> headers() {
    return _headers;
  }

  public String responseFieldPath() {
    return _responseFieldPath;
  }

  public String body() {
    return _body;
  }

  public String connectionId() {
    return _connectionId;
  }

  public String historicalUrl() {
    return _historicalUrl;
  }

  public String historicalPath() {
    return _historicalPath;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    HttpSourceSpec that = (HttpSourceSpec) o;
    return _url.equals(that._url) && _method == that._method && _headers.equals(that._headers)
           && _responseFieldPath.equals(that._responseFieldPath) && Objects.equals(_body, that._body)
           && Objects.equals(_connectionId, that._connectionId) && Objects.equals(_historicalUrl, that._historicalUrl)
           && Objects.equals(_historicalPath, that._historicalPath);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_url, _method, _headers, _responseFieldPath, _body, _connectionId, _historicalUrl, _historicalPath);
  }

  @Override
  public String toString() {
    return String.format("HttpSourceSpec{%s %s, path=%s}", _method, _url, _responseFieldPath);
  }
}

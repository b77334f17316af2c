/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.source;

import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import com.linkedin.business.metricwatch.config.ConnectionRegistry;
import com.linkedin.business.metricwatch.config.EnvResolver;
import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.registry.DataSourceSpec;
import com.linkedin.business.metricwatch.registry.HttpSourceSpec;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.io.Closeable;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.conn.ConnectTimeoutException;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Reads metric values from HTTP endpoints returning JSON, extracting them with JsonPath expressions.
 */
public class HttpSourceConnector implements DataSourceConnector, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(HttpSourceConnector.class);
  static final String TIMESTAMP_FIELD = "timestamp";
  static final String VALUE_FIELD = "value";
  private final ConnectionRegistry _connections;
  private final EnvResolver _env;
  private final long _defaultTimeoutMs;
  private final ZoneId _zone;
  private final CloseableHttpClient _client;

  public HttpSourceConnector(ConnectionRegistry connections, EnvResolver env, long defaultTimeoutMs, ZoneId zone) {
    _connections = connections;
    _env = env;
    _defaultTimeoutMs = defaultTimeoutMs;
    _zone = zone;
    _client = HttpClients.createDefault();
  }

  @Override
  public double fetchCurrent(DataSourceSpec spec) throws SourceException {
    HttpSourceSpec http = (HttpSourceSpec) spec;
    String body = execute(buildRequest(http, http.url(), http.method()));
    return SourceUtils.toValue(single(read(body, http.responseFieldPath()), http.responseFieldPath()));
  }

  @Override
  public List<Sample> fetchHistorical(DataSourceSpec spec) throws SourceException {
    HttpSourceSpec http = (HttpSourceSpec) spec;
    if (http.historicalUrl() == null) {
      return Collections.emptyList();
    }
    String body = execute(buildRequest(http, http.historicalUrl(), HttpSourceSpec.Method.GET));
    Object points = read(body, http.historicalPath());
    if (!(points instanceof List)) {
      throw new SourceException(SourceException.Kind.PARSE, "Historical path " + http.historicalPath() + " is not an array.");
    }
    List<Sample> samples = new ArrayList<>();
    for (Object point : (List<?>) points) {
      if (!(point instanceof Map)) {
        throw new SourceException(SourceException.Kind.PARSE, "Historical point " + point + " is not an object.");
      }
      Map<?, ?> fields = (Map<?, ?>) point;
      Object value = fields.get(VALUE_FIELD);
      if (value == null) {
        continue;
      }
      samples.add(new Sample(SourceUtils.toEpochMs(fields.get(TIMESTAMP_FIELD), _zone), SourceUtils.toValue(value)));
    }
    return SourceUtils.ascending(samples);
  }

  HttpRequestBase buildRequest(HttpSourceSpec http, String url, HttpSourceSpec.Method method) throws SourceException {
    ConnectionRegistry.ConnectionInfo info = null;
    if (http.connectionId() != null) {
      info = _connections.get(http.connectionId()).orElseThrow(
          () -> new SourceException(SourceException.Kind.NOT_FOUND, "Unknown connection id " + http.connectionId()));
    }
    HttpRequestBase request;
    if (method == HttpSourceSpec.Method.POST) {
      HttpPost post = new HttpPost(url);
      if (http.body() != null) {
        post.setEntity(new StringEntity(http.body(), ContentType.APPLICATION_JSON));
      }
      request = post;
    } else {
      request = new HttpGet(url);
    }
    request.setHeader("Accept", "application/json");
    try {
      for (Map.Entry<String, String> header : http.headers().entrySet()) {
        request.setHeader(header.getKey(), _env.resolve(header.getValue()));
      }
      String token = info == null ? null : info.password(_env);
      if (token != null) {
        request.setHeader("Authorization", "Bearer " + token);
      }
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new SourceException(SourceException.Kind.AUTH, "Cannot build credentials for " + url + ": " + e.getMessage(), e);
    }
    int timeoutMs = (int) Math.min(Integer.MAX_VALUE, info != null && info.timeoutMs() != null ? info.timeoutMs() : _defaultTimeoutMs);
    request.setConfig(RequestConfig.custom()
                                   .setConnectTimeout(timeoutMs)
                                   .setConnectionRequestTimeout(timeoutMs)
                                   .setSocketTimeout(timeoutMs)
                                   .build());
    return request;
  }

  /**
   * Execute the given request.
   *
   * @param request Request to execute.
   * @return The response body of a successful response.
   * @throws SourceException if the request fails or the response status is not successful.
   */
  protected String execute(HttpRequestBase request) throws SourceException {
    LOG.debug("Requesting {}", request.getRequestLine());
    try (CloseableHttpResponse response = _client.execute(request)) {
      int status = response.getStatusLine().getStatusCode();
      String body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
      if (status >= HttpStatus.SC_OK && status < HttpStatus.SC_MULTIPLE_CHOICES) {
        return body;
      }
      throw new SourceException(kindForStatus(status), String.format("%s returned HTTP %d.", request.getURI(), status));
    } catch (SocketTimeoutException | ConnectTimeoutException e) {
      throw new SourceException(SourceException.Kind.TIMEOUT, request.getURI() + " timed out.", e);
    } catch (IOException e) {
      throw new SourceException(SourceException.Kind.CONNECTION, "Request to " + request.getURI() + " failed: " + e.getMessage(), e);
    }
  }

  static SourceException.Kind kindForStatus(int status) {
    switch (status) {
      case HttpStatus.SC_UNAUTHORIZED:
      case HttpStatus.SC_FORBIDDEN:
        return SourceException.Kind.AUTH;
      case HttpStatus.SC_NOT_FOUND:
        return SourceException.Kind.NOT_FOUND;
      case HttpStatus.SC_REQUEST_TIMEOUT:
      case HttpStatus.SC_GATEWAY_TIMEOUT:
        return SourceException.Kind.TIMEOUT;
      default:
        return status == 429 || status >= HttpStatus.SC_INTERNAL_SERVER_ERROR ? SourceException.Kind.CONNECTION
                                                                             : SourceException.Kind.PARSE;
    }
  }

  static Object read(String body, String path) throws SourceException {
    try {
      return JsonPath.read(body, path);
    } catch (PathNotFoundException e) {
      throw new SourceException(SourceException.Kind.NOT_FOUND, "Path " + path + " not found in the response.", e);
    } catch (InvalidJsonException | InvalidPathException | IllegalArgumentException e) {
      throw new SourceException(SourceException.Kind.PARSE, "Cannot read " + path + " from the response: " + e.getMessage(), e);
    }
  }

  private static Object single(Object result, String path) throws SourceException {
    if (result instanceof List) {
      List<?> values = (List<?>) result;
      if (values.size() != 1) {
        throw new SourceException(values.isEmpty() ? SourceException.Kind.NOT_FOUND : SourceException.Kind.PARSE,
                                  "Path " + path + " matched " + values.size() + " values, expected one.");
      }
      return values.get(0);
    }
    return result;
  }

  @Override
  public void close() throws IOException {
    _client.close();
  }
}

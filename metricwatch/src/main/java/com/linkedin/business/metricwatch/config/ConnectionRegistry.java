/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.config;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.linkedin.metricwatch.common.config.ConfigException;
import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Connection parameters of data sources, keyed by connection id. The format of the file is a JSON object:
 *
 * <pre>
 *   {
 *     "sales_db": {
 *       "url": "jdbc:postgresql://db.local:5432/sales",
 *       "username": "reporter",
 *       "password_env": "SALES_DB_PASSWORD",
 *       "timeout_ms": 10000
 *     }
 *   }
 * </pre>
 */
public final class ConnectionRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectionRegistry.class);
  private static final Gson GSON = new GsonBuilder().setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES).create();
  private static final Type CONNECTIONS_TYPE = new TypeToken<Map<String, ConnectionInfo>>() { }.getType();
  private final Map<String, ConnectionInfo> _connections;

  public ConnectionRegistry(Map<String, ConnectionInfo> connections) {
    _connections = Collections.unmodifiableMap(new HashMap<>(connections));
  }

  /**
   * @return A registry without any connection.
   */
  public static ConnectionRegistry empty() {
    return new ConnectionRegistry(Collections.emptyMap());
  }

  /**
   * Load the connection registry from the given file. A missing file yields an empty registry.
   *
   * @param file The JSON file to read.
   * @return The loaded registry.
   */
  public static ConnectionRegistry load(Path file) throws IOException {
    if (!Files.exists(file)) {
      LOG.warn("Connection registry file {} does not exist, no connection is available.", file);
      return empty();
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return fromJson(reader);
    }
  }

  /**
   * @param reader Reader over a JSON object keyed by connection id.
   * @return The loaded registry.
   */
  public static ConnectionRegistry fromJson(Reader reader) {
    Map<String, ConnectionInfo> connections;
    try {
      connections = GSON.fromJson(new JsonReader(reader), CONNECTIONS_TYPE);
    } catch (JsonParseException e) {
      throw new ConfigException("Malformed connection registry.", e);
    }
    if (connections == null) {
      return empty();
    }
    for (Map.Entry<String, ConnectionInfo> entry : connections.entrySet()) {
      ConnectionInfo info = entry.getValue();
      if (info == null || info.url() == null || info.url().isEmpty()) {
        throw new ConfigException("Connection '" + entry.getKey() + "' has no url.");
      }
      if (info.timeoutMs() != null && info.timeoutMs() <= 0) {
        throw new ConfigException("Connection '" + entry.getKey() + "' has a non-positive timeout_ms.");
      }
    }
    LOG.info("Loaded {} connections: {}.", connections.size(), connections.keySet());
    return new ConnectionRegistry(connections);
  }

  public Optional<ConnectionInfo> get(String connectionId) {
    return Optional.ofNullable(_connections.get(connectionId));
  }

  public int size() {
    return _connections.size();
  }

  /**
   * Connection parameters. Fields are populated by Gson.
   */
  public static final class ConnectionInfo {
    private String url;
    private String username;
    private String passwordEnv;
    private Long timeoutMs;

    public ConnectionInfo() {
    }

    public ConnectionInfo(String url, String username, String passwordEnv, Long timeoutMs) {
      this.url = url;
      this.username = username;
      this.passwordEnv = passwordEnv;
      this.timeoutMs = timeoutMs;
    }

    public String url() {
      return url;
    }

    public String username() {
      return username;
    }

    /**
     * @return Name of the environment variable holding the password or token, or {@code null} if none.
     */
    public String passwordEnv() {
      return passwordEnv;
    }

    public Long timeoutMs() {
      return timeoutMs;
    }

    /**
     * @param env Environment to resolve the password from.
     * @return The password, or {@code null} if the connection does not reference one.
     * @throws IllegalStateException if the referenced environment variable is not set.
     */
    public String password(EnvResolver env) {
      if (passwordEnv == null || passwordEnv.isEmpty()) {
        return null;
      }
      String password = env.get(passwordEnv);
      if (password == null) {
        throw new IllegalStateException("Environment variable " + passwordEnv + " is not set.");
      }
      return password;
    }

    @Override
    public String toString() {
      // Never print the password itself.
      return String.format("{url=%s, username=%s, passwordEnv=%s, timeoutMs=%s}", url, username, passwordEnv, timeoutMs);
    }
  }
}

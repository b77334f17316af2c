/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.config.constants;

import com.linkedin.metricwatch.common.config.ConfigDef;

import static com.linkedin.metricwatch.common.config.ConfigDef.Range.between;


/**
 * A class to keep MetricWatch Web Server Configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class WebServerConfig {

  /**
   * <code>webserver.http.enable</code>
   */
  public static final String WEBSERVER_HTTP_ENABLE_CONFIG = "webserver.http.enable";
  public static final boolean DEFAULT_WEBSERVER_HTTP_ENABLE = true;
  public static final String WEBSERVER_HTTP_ENABLE_DOC = "Whether the management API is served over HTTP.";

  /**
   * <code>webserver.http.port</code>
   */
  public static final String WEBSERVER_HTTP_PORT_CONFIG = "webserver.http.port";
  public static final int DEFAULT_WEBSERVER_HTTP_PORT = 9190;
  public static final String WEBSERVER_HTTP_PORT_DOC = "MetricWatch Webserver bind port. Use 0 to bind an ephemeral port.";

  /**
   * <code>webserver.http.address</code>
   */
  public static final String WEBSERVER_HTTP_ADDRESS_CONFIG = "webserver.http.address";
  public static final String DEFAULT_WEBSERVER_HTTP_ADDRESS = "127.0.0.1";
  public static final String WEBSERVER_HTTP_ADDRESS_DOC = "MetricWatch Webserver bind ip address.";

  /**
   * <code>webserver.api.urlprefix</code>
   */
  public static final String WEBSERVER_API_URLPREFIX_CONFIG = "webserver.api.urlprefix";
  public static final String DEFAULT_WEBSERVER_API_URLPREFIX = "/metricwatch/*";
  public static final String WEBSERVER_API_URLPREFIX_DOC = "REST API default url prefix. It must end with /*";

  private WebServerConfig() {
  }

  /**
   * Define configs for Web Server.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Web Server.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(WEBSERVER_HTTP_ENABLE_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_WEBSERVER_HTTP_ENABLE,
                            ConfigDef.Importance.MEDIUM,
                            WEBSERVER_HTTP_ENABLE_DOC)
                    .define(WEBSERVER_HTTP_PORT_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_WEBSERVER_HTTP_PORT,
                            between(0, 65535),
                            ConfigDef.Importance.HIGH,
                            WEBSERVER_HTTP_PORT_DOC)
                    .define(WEBSERVER_HTTP_ADDRESS_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_WEBSERVER_HTTP_ADDRESS,
                            ConfigDef.Importance.HIGH,
                            WEBSERVER_HTTP_ADDRESS_DOC)
                    .define(WEBSERVER_API_URLPREFIX_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_WEBSERVER_API_URLPREFIX,
                            ConfigDef.Importance.HIGH,
                            WEBSERVER_API_URLPREFIX_DOC);
  }
}

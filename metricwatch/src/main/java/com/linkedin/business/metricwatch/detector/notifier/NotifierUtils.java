/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import java.io.IOException;
import java.util.Map;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NotifierUtils {

  private static final Logger LOG = LoggerFactory.getLogger(NotifierUtils.class);
  public static final int DEFAULT_TIMEOUT_MS = 10000;

  private NotifierUtils() { }

  /**
   * Send POST message to a specific URL (application/json)
   *
   * @param message The message that will be posted
   * @param postUrl The post URL
   * @param headers Additional request headers, may be empty.
   * @param timeoutMs Connect and socket timeout.
   * @throws IOException In case of issue with the API, including a non-2xx response status.
   */
  public static void sendMessage(String message, String postUrl, Map<String, String> headers, int timeoutMs)
      throws IOException {
    RequestConfig requestConfig = RequestConfig.custom()
                                               .setConnectTimeout(timeoutMs)
                                               .setConnectionRequestTimeout(timeoutMs)
                                               .setSocketTimeout(timeoutMs)
                                               .build();
    try (CloseableHttpClient client = HttpClients.custom().setDefaultRequestConfig(requestConfig).build()) {
      HttpPost httpPost = new HttpPost(postUrl);
      httpPost.setEntity(new StringEntity(message, ContentType.APPLICATION_JSON));
      httpPost.setHeader("Accept", "application/json");
      headers.forEach(httpPost::setHeader);
      LOG.debug("Sending alert to: {}\nBody:\n{}", httpPost, message);
      try (CloseableHttpResponse httpResponse = client.execute(httpPost)) {
        int status = httpResponse.getStatusLine().getStatusCode();
        if (LOG.isDebugEnabled()) {
          LOG.debug("Response status: {}", status);
        }
        if (status < 200 || status >= 300) {
          String body = httpResponse.getEntity() == null ? "" : EntityUtils.toString(httpResponse.getEntity());
          throw new IOException(String.format("POST to %s failed with status %d: %s", postUrl, status, body));
        }
      }
    }
  }
}

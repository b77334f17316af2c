/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.vertx;

import com.linkedin.business.metricwatch.MetricWatch;
import com.linkedin.business.metricwatch.config.constants.WebServerConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.ErrorHandler;

import static com.linkedin.business.metricwatch.vertx.MetricWatchRequestHandler.METRIC_ID_PARAM;

public class MainVerticle extends AbstractVerticle {

  public static final String APPLICATION_JSON = "application/json";
  private final int _port;
  private final String _host;
  private final MetricWatch _metricWatch;
  private HttpServer _server;
  private MetricWatchRequestHandler _endPoints;

  public MainVerticle(MetricWatch metricWatch, int port, String host) {
    _port = port;
    _host = host;
    _metricWatch = metricWatch;
  }

  public HttpServer getServer() {
    return _server;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    _endPoints = new MetricWatchRequestHandler(_metricWatch);
    _server = vertx.createHttpServer(createOptions());
    _server.requestHandler(buildRouter());
    _server.listen(result -> {
      if (result.succeeded()) {
        startPromise.complete();
      } else {
        startPromise.fail(result.cause());
      }
    });
  }

  @Override
  public void stop(Promise<Void> promise) {
    if (_server == null) {
      promise.complete();
      return;
    }
    _server.close(v -> promise.complete());
  }

  private Router buildRouter() {
    String idPath = "/metrics/:" + METRIC_ID_PARAM;
    Router router = Router.router(vertx);
    router.get("/metrics").blockingHandler(_endPoints::listMetrics);
    router.post("/metrics").blockingHandler(_endPoints::createMetric);
    router.delete(idPath).blockingHandler(_endPoints::deleteMetric);
    router.post(idPath + "/train").blockingHandler(_endPoints::trainModel);
    router.get(idPath + "/health").blockingHandler(_endPoints::metricHealth);
    router.get("/anomalies").blockingHandler(_endPoints::listAnomalies);
    router.post("/reports").blockingHandler(_endPoints::generateReport);
    router.get("/health").blockingHandler(_endPoints::health);
    router.get("/models").blockingHandler(_endPoints::modelStatus);
    router.post("/models/retrain").blockingHandler(_endPoints::retrainAll);
    router.post("/reload").blockingHandler(_endPoints::reload);

    Router root = Router.router(vertx);
    root.route().handler(BodyHandler.create());
    root.route().failureHandler(ErrorHandler.create(vertx, false));

    String rootPath = _metricWatch
            .config()
            .getString(WebServerConfig.WEBSERVER_API_URLPREFIX_CONFIG)
            .trim()
            .replace("/*", "");
    root.route(rootPath + "/*").subRouter(router);
    return root;
  }

  private HttpServerOptions createOptions() {
    HttpServerOptions options = new HttpServerOptions();
    options.setHost(_host);
    options.setPort(_port);
    return options;
  }

  public MetricWatchRequestHandler getEndPoints() {
    return _endPoints;
  }
}

/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.vertx;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.linkedin.business.metricwatch.MetricWatch;
import com.linkedin.business.metricwatch.detector.AnomalyEvent;
import com.linkedin.business.metricwatch.detector.ModelStatus;
import com.linkedin.business.metricwatch.detector.ScorerModel;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.business.metricwatch.registry.MetricDefinitionParser;
import com.linkedin.business.metricwatch.registry.RegistrySnapshot;
import com.linkedin.metricwatch.common.config.ConfigException;
import com.linkedin.metricwatch.exception.NotEnoughSamplesException;
import io.vertx.ext.web.RoutingContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.business.metricwatch.vertx.MainVerticle.APPLICATION_JSON;


/**
 * Serves the management endpoints on top of the {@link MetricWatch} facade. Every response body is a JSON document;
 * errors are reported as <code>{"error": message}</code>.
 */
public class MetricWatchRequestHandler {
  private static final Logger LOG = LoggerFactory.getLogger(MetricWatchRequestHandler.class);
  private static final Gson GSON = new Gson();
  static final String METRIC_ID_PARAM = "id";
  static final String SINCE_PARAM = "since";
  private final MetricWatch _metricWatch;

  public MetricWatchRequestHandler(MetricWatch metricWatch) {
    _metricWatch = metricWatch;
  }

  @FunctionalInterface
  private interface Endpoint {
    Object handle(RoutingContext context) throws Exception;
  }

  private static final class NotFound extends RuntimeException {
    NotFound(String message) {
      super(message);
    }
  }

  private void serve(RoutingContext context, int successStatus, Endpoint endpoint) {
    int status;
    Object body;
    try {
      body = endpoint.handle(context);
      status = successStatus;
    } catch (NotFound e) {
      status = 404;
      body = error(e.getMessage());
    } catch (ConfigException | IllegalArgumentException | JsonParseException e) {
      status = 400;
      body = error(e.getMessage());
    } catch (NotEnoughSamplesException | IllegalStateException e) {
      status = 409;
      body = error(e.getMessage());
    } catch (Exception e) {
      LOG.error("Failed to serve {} {}.", context.request().method(), context.request().path(), e);
      status = 500;
      body = error(String.valueOf(e.getMessage()));
    }
    context.response().setStatusCode(status).putHeader("Content-Type", APPLICATION_JSON).end(GSON.toJson(body));
  }

  private static Map<String, Object> error(String message) {
    return Collections.singletonMap("error", message);
  }

  private static String metricId(RoutingContext context) {
    return context.pathParam(METRIC_ID_PARAM);
  }

  private static long since(RoutingContext context) {
    String since = context.request().getParam(SINCE_PARAM);
    if (since == null || since.isEmpty()) {
      return 0L;
    }
    try {
      return Long.parseLong(since);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Parameter " + SINCE_PARAM + " must be epoch milliseconds, got " + since);
    }
  }

  private MetricDefinition existingMetric(String metricId) {
    Optional<MetricDefinition> definition = _metricWatch.metric(metricId);
    if (definition.isEmpty()) {
      throw new NotFound("Unknown metric " + metricId);
    }
    return definition.get();
  }

  /** GET /metrics */
  public void listMetrics(RoutingContext context) {
    serve(context, 200, c -> {
      List<JsonElement> metrics = new ArrayList<>();
      for (MetricDefinition definition : _metricWatch.listMetrics()) {
        metrics.add(MetricDefinitionParser.toJson(definition));
      }
      return Collections.singletonMap("metrics", metrics);
    });
  }

  /** POST /metrics */
  public void createMetric(RoutingContext context) {
    serve(context, 201, c -> {
      String body = c.body() == null ? null : c.body().asString();
      if (body == null || body.isBlank()) {
        throw new IllegalArgumentException("A metric definition is required in the request body.");
      }
      JsonElement json = JsonParser.parseString(body);
      if (!json.isJsonObject()) {
        throw new IllegalArgumentException("The metric definition must be a JSON object.");
      }
      return MetricDefinitionParser.toJson(_metricWatch.createMetric(json.getAsJsonObject()));
    });
  }

  /** DELETE /metrics/:id */
  public void deleteMetric(RoutingContext context) {
    serve(context, 200, c -> {
      String metricId = metricId(c);
      if (!_metricWatch.deleteMetric(metricId)) {
        throw new NotFound("Unknown metric " + metricId);
      }
      return Collections.singletonMap("deleted", metricId);
    });
  }

  /** POST /metrics/:id/train */
  public void trainModel(RoutingContext context) {
    serve(context, 200, c -> {
      String metricId = existingMetric(metricId(c)).id();
      ScorerModel model = _metricWatch.trainModel(metricId);
      Map<String, Object> json = new LinkedHashMap<>();
      json.put("metric_id", metricId);
      json.put("trained_at", model.trainedAtMs());
      json.put("sample_count", model.sampleCount());
      json.put("training_anomaly_rate", model.trainingAnomalyRate());
      return json;
    });
  }

  /** GET /metrics/:id/health */
  public void metricHealth(RoutingContext context) {
    serve(context, 200, c -> {
      String metricId = existingMetric(metricId(c)).id();
      return _metricWatch.metricHealth(metricId)
                         .orElseThrow(() -> new NotFound("Metric " + metricId + " is not monitored."));
    });
  }

  /** GET /anomalies?since=ms */
  public void listAnomalies(RoutingContext context) {
    serve(context, 200, c -> {
      List<Map<String, Object>> anomalies = new ArrayList<>();
      for (AnomalyEvent event : _metricWatch.listAnomalies(since(c))) {
        anomalies.add(event.getJsonStructure());
      }
      return Collections.singletonMap("anomalies", anomalies);
    });
  }

  /** POST /reports?since=ms */
  public void generateReport(RoutingContext context) {
    serve(context, 201, c -> Collections.singletonMap("report", _metricWatch.generateReport(since(c))));
  }

  /** GET /health */
  public void health(RoutingContext context) {
    serve(context, 200, c -> _metricWatch.health());
  }

  /** GET /models */
  public void modelStatus(RoutingContext context) {
    serve(context, 200, c -> {
      List<Map<String, Object>> models = new ArrayList<>();
      for (ModelStatus status : _metricWatch.modelStatus().values()) {
        models.add(status.getJsonStructure());
      }
      return Collections.singletonMap("models", models);
    });
  }

  /** POST /models/retrain */
  public void retrainAll(RoutingContext context) {
    serve(context, 200, c -> Collections.singletonMap("retrained", _metricWatch.retrainAll()));
  }

  /** POST /reload */
  public void reload(RoutingContext context) {
    serve(context, 200, c -> {
      RegistrySnapshot snapshot = _metricWatch.reload();
      Map<String, Object> json = new LinkedHashMap<>();
      json.put("num_metrics", snapshot.size());
      json.put("num_enabled_metrics", snapshot.listEnabled().size());
      json.put("loaded_at", snapshot.loadedAtMs());
      return json;
    });
  }
}

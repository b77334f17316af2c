/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.linkedin.metricwatch.common.config.ConfigException;
import java.io.Reader;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;


/**
 * Converts metric definitions from and to their JSON form. Field names are snake_case and unknown fields are ignored.
 * Every validation error names the metric id and the offending field.
 *
 * <pre>
 * {
 *   "id": "daily_sales",
 *   "name": "Daily sales",
 *   "source": {"type": "relational", "connection_id": "sales_db", "query": "SELECT ...", "value_column": "total"},
 *   "historical": {"min_samples": 30, "max_samples": 90},
 *   "scoring": {"contamination": 0.1, "threshold": 0.0, "features": ["value", "day_of_week"]},
 *   "alert": {"severity": "high", "threshold_type": "percentage", "threshold_value": 15, "direction": "below",
 *             "cooldown_minutes": 60, "channels": ["email"], "recipients": ["ops@example.com"]},
 *   "monitoring": {"poll_interval_seconds": 3600, "active_hours": "08:00-20:00", "active_weekdays": ["MON", "FRI"]}
 * }
 * </pre>
 */
public final class MetricDefinitionParser {
  static final String UNKNOWN_ID = "<unknown>";

  private MetricDefinitionParser() {

  }

  /**
   * @param reader Reader over a JSON array of metric definitions.
   * @return The parsed definitions, in file order.
   * @throws ConfigException if the JSON is malformed, a definition is invalid or an id is duplicated.
   */
  public static List<MetricDefinition> parseAll(Reader reader) {
    JsonElement root;
    try {
      root = JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new ConfigException("Malformed metric definitions: " + e.getMessage(), e);
    }
    if (!root.isJsonArray()) {
      throw new ConfigException("Metric definitions must be a JSON array.");
    }
    List<MetricDefinition> definitions = new ArrayList<>();
    Set<String> ids = new HashSet<>();
    for (JsonElement element : root.getAsJsonArray()) {
      if (!element.isJsonObject()) {
        throw new ConfigException("Every metric definition must be a JSON object, found " + element);
      }
      MetricDefinition definition = parse(element.getAsJsonObject());
      if (!ids.add(definition.id())) {
        throw ConfigException.forMetric(definition.id(), "id", "duplicate metric id");
      }
      definitions.add(definition);
    }
    return definitions;
  }

  /**
   * @param json A single metric definition.
   * @return The parsed definition.
   * @throws ConfigException if the definition is invalid.
   */
  public static MetricDefinition parse(JsonObject json) {
    String id = json.has("id") && json.get("id").isJsonPrimitive() ? json.get("id").getAsString() : null;
    if (id == null) {
      throw ConfigException.forMetric(UNKNOWN_ID, "id", "missing required field");
    }
    if (!MetricDefinition.VALID_ID.matcher(id).matches()) {
      throw ConfigException.forMetric(id, "id", "must match " + MetricDefinition.VALID_ID.pattern());
    }
    Fields fields = new Fields(id, json, "");
    String name = fields.requiredString("name");
    String description = fields.optionalString("description", "");
    boolean enabled = fields.optionalBoolean("enabled", true);
    DataSourceSpec source = parseSource(fields.requiredObject("source"));
    HistoricalSpec historical = parseHistorical(fields.optionalObject("historical"));
    ScoringConfig scoring = parseScoring(fields.optionalObject("scoring"));
    AlertConfig alert = parseAlert(fields.requiredObject("alert"));
    MonitoringConfig monitoring = parseMonitoring(fields.requiredObject("monitoring"));
    return new MetricDefinition(id, name, description, enabled, source, historical, scoring, alert, monitoring);
  }

  private static DataSourceSpec parseSource(Fields source) {
    String typeName = source.requiredString("type");
    SourceType type = SourceType.forName(typeName)
                                .orElseThrow(() -> source.error("type", "unknown source type '" + typeName + "'"));
    switch (type) {
      case RELATIONAL:
        return new RelationalQuerySpec(source.requiredString("connection_id"),
                                       source.requiredString("query"),
                                       source.requiredString("value_column"),
                                       source.optionalString("timestamp_column", null),
                                       source.optionalString("historical_query", null));
      case FILE:
        return new FileSourceSpec(source.requiredString("path"),
                                  source.requiredString("value_column"),
                                  source.requiredString("timestamp_column"),
                                  source.requiredEnum("format", FileSourceSpec.Format.class));
      case HTTP:
        HttpSourceSpec.Method method = source.has("method") ? source.requiredEnum("method", HttpSourceSpec.Method.class)
                                                            : HttpSourceSpec.Method.GET;
        String historicalUrl = source.optionalString("historical_url", null);
        String historicalPath = source.optionalString("historical_path", null);
        if ((historicalUrl == null) != (historicalPath == null)) {
          throw source.error("historical_path", "historical_url and historical_path must be set together");
        }
        return new HttpSourceSpec(source.requiredString("url"),
                                  method,
                                  source.optionalStringMap("headers"),
                                  source.requiredString("response_field_path"),
                                  source.optionalString("body", null),
                                  source.optionalString("connection_id", null),
                                  historicalUrl,
                                  historicalPath);
      case INTERNAL:
        String aggregation = source.requiredString("aggregation");
        return new InternalSourceSpec(source.requiredString("counter_key"),
                                      InternalSourceSpec.Aggregation.forName(aggregation).orElseThrow(
                                          () -> source.error("aggregation", "unknown aggregation '" + aggregation + "'")));
      default:
        throw new IllegalStateException("Unhandled source type " + type);
    }
  }

  private static HistoricalSpec parseHistorical(Fields historical) {
    int minSamples = historical.optionalInt("min_samples", HistoricalSpec.DEFAULT_MIN_SAMPLES);
    int maxSamples = historical.optionalInt("max_samples", Math.max(HistoricalSpec.DEFAULT_MAX_SAMPLES, minSamples));
    if (minSamples < 2) {
      throw historical.error("min_samples", "must be at least 2");
    }
    if (maxSamples < minSamples) {
      throw historical.error("max_samples", "must not be below min_samples (" + minSamples + ")");
    }
    return new HistoricalSpec(minSamples, maxSamples, historical.optionalBoolean("seed_on_start", true));
  }

  private static ScoringConfig parseScoring(Fields scoring) {
    double contamination = scoring.optionalDouble("contamination", ScoringConfig.DEFAULT_CONTAMINATION);
    if (!(contamination > 0.0 && contamination <= 0.5)) {
      throw scoring.error("contamination", "must be in (0, 0.5]");
    }
    double threshold = scoring.optionalDouble("threshold", ScoringConfig.DEFAULT_THRESHOLD);
    if (threshold < -1.0 || threshold > 1.0) {
      throw scoring.error("threshold", "must be in [-1, 1]");
    }
    List<ScoringConfig.Feature> features = new ArrayList<>();
    for (String feature : scoring.optionalStringList("features")) {
      features.add(ScoringConfig.Feature.forName(feature).orElseThrow(
          () -> scoring.error("features", "unknown feature '" + feature + "'")));
    }
    return new ScoringConfig(contamination, threshold, features);
  }

  private static AlertConfig parseAlert(Fields alert) {
    double thresholdValue = alert.requiredDouble("threshold_value");
    if (thresholdValue < 0) {
      throw alert.error("threshold_value", "must not be negative");
    }
    int cooldownMinutes = alert.optionalInt("cooldown_minutes", AlertConfig.DEFAULT_COOLDOWN_MINUTES);
    if (cooldownMinutes < 0) {
      throw alert.error("cooldown_minutes", "must not be negative");
    }
    Direction direction = alert.has("direction") ? alert.requiredEnum("direction", Direction.class) : Direction.EITHER;
    return new AlertConfig(alert.requiredEnum("severity", Severity.class),
                           alert.requiredEnum("threshold_type", ThresholdType.class),
                           thresholdValue,
                           direction,
                           cooldownMinutes,
                           alert.optionalStringList("channels"),
                           alert.optionalStringList("recipients"));
  }

  private static MonitoringConfig parseMonitoring(Fields monitoring) {
    long pollIntervalSeconds = monitoring.requiredLong("poll_interval_seconds");
    if (pollIntervalSeconds <= 0) {
      throw monitoring.error("poll_interval_seconds", "must be positive");
    }
    ActiveHours activeHours = null;
    String window = monitoring.optionalString("active_hours", null);
    if (window != null) {
      try {
        activeHours = ActiveHours.parse(window);
      } catch (IllegalArgumentException e) {
        throw monitoring.error("active_hours", e.getMessage());
      }
    }
    Set<DayOfWeek> weekdays = EnumSet.noneOf(DayOfWeek.class);
    for (String day : monitoring.optionalStringList("active_weekdays")) {
      weekdays.add(parseDay(day).orElseThrow(() -> monitoring.error("active_weekdays", "unknown weekday '" + day + "'")));
    }
    return new MonitoringConfig(pollIntervalSeconds, activeHours, weekdays);
  }

  private static Optional<DayOfWeek> parseDay(String day) {
    String normalized = day.trim().toUpperCase(Locale.ROOT);
    if (normalized.length() < 3) {
      return Optional.empty();
    }
    for (DayOfWeek dayOfWeek : DayOfWeek.values()) {
      if (dayOfWeek.name().startsWith(normalized)) {
        return Optional.of(dayOfWeek);
      }
    }
    return Optional.empty();
  }

  /**
   * @param definition Definition to convert.
   * @return The JSON form of the definition, accepted by {@link #parse(JsonObject)}.
   */
  public static JsonObject toJson(MetricDefinition definition) {
    JsonObject json = new JsonObject();
    json.addProperty("id", definition.id());
    json.addProperty("name", definition.name());
    json.addProperty("description", definition.description());
    json.addProperty("enabled", definition.enabled());
    json.add("source", sourceToJson(definition.source()));

    JsonObject historical = new JsonObject();
    historical.addProperty("min_samples", definition.historical().minSamples());
    historical.addProperty("max_samples", definition.historical().maxSamples());
    historical.addProperty("seed_on_start", definition.historical().seedOnStart());
    json.add("historical", historical);

    JsonObject scoring = new JsonObject();
    scoring.addProperty("contamination", definition.scoring().contamination());
    scoring.addProperty("threshold", definition.scoring().threshold());
    scoring.add("features", toJsonArray(definition.scoring().features(), ScoringConfig.Feature::jsonName));
    json.add("scoring", scoring);

    AlertConfig alertConfig = definition.alert();
    JsonObject alert = new JsonObject();
    alert.addProperty("severity", alertConfig.severity().jsonName());
    alert.addProperty("threshold_type", alertConfig.thresholdType().jsonName());
    alert.addProperty("threshold_value", alertConfig.thresholdValue());
    alert.addProperty("direction", alertConfig.direction().jsonName());
    alert.addProperty("cooldown_minutes", alertConfig.cooldownMinutes());
    alert.add("channels", toJsonArray(alertConfig.channels(), Function.identity()));
    alert.add("recipients", toJsonArray(alertConfig.recipients(), Function.identity()));
    json.add("alert", alert);

    MonitoringConfig monitoringConfig = definition.monitoring();
    JsonObject monitoring = new JsonObject();
    monitoring.addProperty("poll_interval_seconds", monitoringConfig.pollIntervalSeconds());
    if (monitoringConfig.activeHours() != null) {
      monitoring.addProperty("active_hours", monitoringConfig.activeHours().toString());
    }
    monitoring.add("active_weekdays", toJsonArray(monitoringConfig.activeWeekdays(), d -> d.name().substring(0, 3)));
    json.add("monitoring", monitoring);
    return json;
  }

  private static JsonObject sourceToJson(DataSourceSpec spec) {
    JsonObject source = new JsonObject();
    source.addProperty("type", spec.type().jsonName());
    switch (spec.type()) {
      case RELATIONAL:
        RelationalQuerySpec relational = (RelationalQuerySpec) spec;
        source.addProperty("connection_id", relational.connectionId());
        source.addProperty("query", relational.query());
        source.addProperty("value_column", relational.valueColumn());
        addIfPresent(source, "timestamp_column", relational.timestampColumn());
        addIfPresent(source, "historical_query", relational.historicalQuery());
        break;
      case FILE:
        FileSourceSpec file = (FileSourceSpec) spec;
        source.addProperty("path", file.path());
        source.addProperty("value_column", file.valueColumn());
        source.addProperty("timestamp_column", file.timestampColumn());
        source.addProperty("format", file.format().jsonName());
        break;
      case HTTP:
        HttpSourceSpec http = (HttpSourceSpec) spec;
        source.addProperty("url", http.url());
        source.addProperty("method", http.method().name());
        JsonObject headers = new JsonObject();
        // Templates are returned as written, resolved secrets never leave the process.
        http.headers().forEach(headers::addProperty);
        source.add("headers", headers);
        source.addProperty("response_field_path", http.responseFieldPath());
        addIfPresent(source, "body", http.body());
        addIfPresent(source, "connection_id", http.connectionId());
        addIfPresent(source, "historical_url", http.historicalUrl());
        addIfPresent(source, "historical_path", http.historicalPath());
        break;
      case INTERNAL:
        InternalSourceSpec internal = (InternalSourceSpec) spec;
        source.addProperty("counter_key", internal.counterKey());
        source.addProperty("aggregation", internal.aggregation().jsonName());
        break;
      default:
        throw new IllegalStateException("Unhandled source type " + spec.type());
    }
    return source;
  }

  private static void addIfPresent(JsonObject json, String field, String value) {
    if (value != null) {
      json.addProperty(field, value);
    }
  }

  private static <T> JsonArray toJsonArray(Iterable<T> items, Function<T, String> toString) {
    JsonArray array = new JsonArray();
    for (T item : items) {
      array.add(toString.apply(item));
    }
    return array;
  }

  /**
   * Typed access to the fields of one JSON object of a metric definition.
   */
  private static final class Fields {
    private final String _metricId;
    private final JsonObject _json;
    private final String _prefix;

    Fields(String metricId, JsonObject json, String prefix) {
      _metricId = metricId;
      _json = json;
      _prefix = prefix;
    }

    ConfigException error(String field, String message) {
      return ConfigException.forMetric(_metricId, _prefix + field, message);
    }

    boolean has(String field) {
      return _json.has(field) && !_json.get(field).isJsonNull();
    }

    private JsonPrimitive primitive(String field) {
      JsonElement element = _json.get(field);
      if (!element.isJsonPrimitive()) {
        throw error(field, "expected a scalar value, found " + element);
      }
      return element.getAsJsonPrimitive();
    }

    String requiredString(String field) {
      if (!has(field)) {
        throw error(field, "missing required field");
      }
      String value = primitive(field).getAsString().trim();
      if (value.isEmpty()) {
        throw error(field, "must not be empty");
      }
      return value;
    }

    String optionalString(String field, String defaultValue) {
      return has(field) ? primitive(field).getAsString() : defaultValue;
    }

    boolean optionalBoolean(String field, boolean defaultValue) {
      if (!has(field)) {
        return defaultValue;
      }
      JsonPrimitive value = primitive(field);
      if (!value.isBoolean()) {
        throw error(field, "expected true or false, found " + value);
      }
      return value.getAsBoolean();
    }

    private Number number(String field) {
      JsonPrimitive value = primitive(field);
      try {
        return value.isNumber() ? value.getAsNumber() : Double.valueOf(value.getAsString().trim());
      } catch (NumberFormatException e) {
        throw error(field, "expected a number, found " + value);
      }
    }

    double requiredDouble(String field) {
      if (!has(field)) {
        throw error(field, "missing required field");
      }
      return number(field).doubleValue();
    }

    double optionalDouble(String field, double defaultValue) {
      return has(field) ? number(field).doubleValue() : defaultValue;
    }

    long requiredLong(String field) {
      if (!has(field)) {
        throw error(field, "missing required field");
      }
      double value = number(field).doubleValue();
      if (value != Math.rint(value)) {
        throw error(field, "expected an integer, found " + value);
      }
      return (long) value;
    }

    int optionalInt(String field, int defaultValue) {
      if (!has(field)) {
        return defaultValue;
      }
      long value = requiredLong(field);
      if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
        throw error(field, "out of range");
      }
      return (int) value;
    }

    <E extends Enum<E>> E requiredEnum(String field, Class<E> enumClass) {
      String value = requiredString(field);
      for (E constant : enumClass.getEnumConstants()) {
        if (constant.name().equalsIgnoreCase(value)) {
          return constant;
        }
      }
      throw error(field, "invalid value '" + value + "'");
    }

    List<String> optionalStringList(String field) {
      List<String> values = new ArrayList<>();
      if (!has(field)) {
        return values;
      }
      JsonElement element = _json.get(field);
      if (!element.isJsonArray()) {
        throw error(field, "expected an array");
      }
      for (JsonElement item : element.getAsJsonArray()) {
        if (!item.isJsonPrimitive()) {
          throw error(field, "expected an array of strings");
        }
        values.add(item.getAsString());
      }
      return values;
    }

    Map<String, String> optionalStringMap(String field) {
      Map<String, String> values = new LinkedHashMap<>();
      if (!has(field)) {
        return values;
      }
      Fields nested = optionalObject(field);
      for (Map.Entry<String, JsonElement> entry : nested._json.entrySet()) {
        if (!entry.getValue().isJsonPrimitive()) {
          throw error(field + "." + entry.getKey(), "expected a string");
        }
        values.put(entry.getKey(), entry.getValue().getAsString());
      }
      return values;
    }

    Fields requiredObject(String field) {
      if (!has(field)) {
        throw error(field, "missing required field");
      }
      return optionalObject(field);
    }

    Fields optionalObject(String field) {
      if (!has(field)) {
        return new Fields(_metricId, new JsonObject(), _prefix + field + ".");
      }
      JsonElement element = _json.get(field);
      if (!element.isJsonObject()) {
        throw error(field, "expected an object");
      }
      return new Fields(_metricId, element.getAsJsonObject(), _prefix + field + ".");
    }
  }
}

/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricwatch.common.config;

import com.linkedin.metricwatch.common.utils.Utils;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * This class is used for specifying the set of expected configurations. For each configuration, you can specify
 * the name, the type, the default value, a validator, the importance and the documentation.
 *
 * To use the class:
 * <pre>
 * ConfigDef defs = new ConfigDef();
 *
 * defs.define(&quot;config_with_default&quot;, Type.STRING, &quot;default string value&quot;, Importance.LOW,
 *             &quot;Configuration with default value.&quot;);
 * defs.define(&quot;config_with_validator&quot;, Type.INT, 42, Range.atLeast(0), Importance.MEDIUM,
 *             &quot;Configuration with user provided validator.&quot;);
 *
 * Map&lt;String, Object&gt; configs = defs.parse(props);
 * </pre>
 * This class can be used standalone or in combination with {@link AbstractConfig} which provides some additional
 * functionality for accessing configs.
 */
public class ConfigDef {
  /**
   * A unique Java object which represents the lack of a default value.
   */
  public static final Object NO_DEFAULT_VALUE = new Object();

  private final Map<String, ConfigKey> _configKeys;

  public ConfigDef() {
    _configKeys = new LinkedHashMap<>();
  }

  public ConfigDef(ConfigDef base) {
    _configKeys = new LinkedHashMap<>(base._configKeys);
  }

  /**
   * @return New unmodifiable {@link Set} instance containing the keys
   */
  public Set<String> names() {
    return Collections.unmodifiableSet(_configKeys.keySet());
  }

  /**
   * Define the given config key and return this config definition.
   *
   * @param key Config key
   * @return This config definition.
   */
  public ConfigDef define(ConfigKey key) {
    if (_configKeys.containsKey(key._name)) {
      throw new ConfigException("Configuration " + key._name + " is defined twice.");
    }
    _configKeys.put(key._name, key);
    return this;
  }

  /**
   * Define a new configuration
   * @param name          the name of the config parameter
   * @param type          the type of the config
   * @param defaultValue  the default value to use if this config isn't present
   * @param validator     the validator to use in checking the correctness of the config
   * @param importance    the importance of this config
   * @param documentation the documentation string for the config
   * @return This ConfigDef so you can chain calls
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                          String documentation) {
    return define(new ConfigKey(name, type, defaultValue, validator, importance, documentation));
  }

  /**
   * Define a new configuration with no special validation logic
   * @param name          The name of the config parameter
   * @param type          The type of the config
   * @param defaultValue  The default value to use if this config isn't present
   * @param importance    The importance of this config: is this something you will likely need to change.
   * @param documentation The documentation string for the config
   * @return This ConfigDef so you can chain calls
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Importance importance, String documentation) {
    return define(name, type, defaultValue, null, importance, documentation);
  }

  /**
   * Define a new configuration with no default value and no special validation logic
   * @param name          The name of the config parameter
   * @param type          The type of the config
   * @param importance    The importance of this config: is this something you will likely need to change.
   * @param documentation The documentation string for the config
   * @return This ConfigDef so you can chain calls
   */
  public ConfigDef define(String name, Type type, Importance importance, String documentation) {
    return define(name, type, NO_DEFAULT_VALUE, null, importance, documentation);
  }

  /**
   * Get the configuration keys
   * @return A map containing all configuration keys
   */
  public Map<String, ConfigKey> configKeys() {
    return Collections.unmodifiableMap(_configKeys);
  }

  /**
   * Parse and validate configs against this configuration definition. The input is a map of configs. It is expected
   * that the keys of the map are strings, but the values can either be strings or they may already be of the
   * appropriate type (int, string, etc). This will work equally well with either java.util.Properties instances or a
   * programmatically constructed map.
   *
   * @param props The configs to parse and validate.
   * @return Parsed and validated configs. The key will be the config name and the value will be the value parsed into
   * the appropriate type (int, string, etc).
   */
  public Map<String, Object> parse(Map<?, ?> props) {
    Map<String, Object> values = new HashMap<>();
    for (ConfigKey key : _configKeys.values()) {
      values.put(key._name, parseValue(key, props.get(key._name), props.containsKey(key._name)));
    }
    return values;
  }

  Object parseValue(ConfigKey key, Object value, boolean isSet) {
    Object parsedValue;
    if (isSet) {
      parsedValue = parseType(key._name, value, key._type);
    } else if (NO_DEFAULT_VALUE.equals(key._defaultValue)) {
      // props map doesn't contain setting, the key is required because no default value specified - its an error
      throw new ConfigException("Missing required configuration \"" + key._name + "\" which has no default value.");
    } else {
      parsedValue = key._defaultValue;
    }
    if (key._validator != null) {
      key._validator.ensureValid(key._name, parsedValue);
    }
    return parsedValue;
  }

  /**
   * Parse a value according to its expected type.
   * @param name  The config name
   * @param value The config value
   * @param type  The expected type
   * @return The parsed object
   */
  public static Object parseType(String name, Object value, Type type) {
    try {
      if (value == null) {
        return null;
      }

      String trimmed = null;
      if (value instanceof String) {
        trimmed = ((String) value).trim();
      }

      switch (type) {
        case BOOLEAN:
          if (value instanceof String) {
            if ("true".equalsIgnoreCase(trimmed)) {
              return true;
            } else if ("false".equalsIgnoreCase(trimmed)) {
              return false;
            }
          } else if (value instanceof Boolean) {
            return value;
          }
          throw new ConfigException(name, value, "Expected value to be either true or false");
        case STRING:
          if (value instanceof String) {
            return trimmed;
          }
          throw new ConfigException(name, value, "Expected value to be a string, but it was a " + value.getClass().getName());
        case INT:
          if (value instanceof Integer) {
            return value;
          } else if (value instanceof String) {
            return Integer.parseInt(trimmed);
          }
          throw new ConfigException(name, value, "Expected value to be a 32-bit integer, but it was a " + value.getClass().getName());
        case LONG:
          if (value instanceof Integer) {
            return ((Integer) value).longValue();
          } else if (value instanceof Long) {
            return value;
          } else if (value instanceof String) {
            return Long.parseLong(trimmed);
          }
          throw new ConfigException(name, value, "Expected value to be a 64-bit integer (long), but it was a " + value.getClass().getName());
        case LIST:
          if (value instanceof List) {
            return value;
          } else if (value instanceof String) {
            return trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(trimmed.split("\\s*,\\s*", -1));
          }
          throw new ConfigException(name, value, "Expected a comma separated list.");
        case CLASS:
          if (value instanceof Class) {
            return value;
          } else if (value instanceof String) {
            return Class.forName(trimmed, true, Utils.getContextOrMetricWatchClassLoader());
          }
          throw new ConfigException(name, value, "Expected a Class instance or class name.");
        default:
          throw new IllegalStateException("Unknown type.");
      }
    } catch (NumberFormatException e) {
      throw new ConfigException(name, value, "Not a number of type " + type);
    } catch (ClassNotFoundException e) {
      throw new ConfigException(name, value, "Class " + value + " could not be found.");
    }
  }

  /**
   * The config types
   */
  public enum Type {
    BOOLEAN, STRING, INT, LONG, LIST, CLASS
  }

  /**
   * The importance level for a configuration
   */
  public enum Importance {
    HIGH, MEDIUM, LOW
  }

  /**
   * Validation logic the user may provide to perform single configuration validation.
   */
  public interface Validator {
    /**
     * Perform single configuration validation.
     * @param name The name of the configuration
     * @param value The value of the configuration
     * @throws ConfigException if the value is invalid.
     */
    void ensureValid(String name, Object value);
  }

  /**
   * Validation logic for numeric ranges
   */
  public static final class Range implements Validator {
    private final Number _min;
    private final Number _max;

    private Range(Number min, Number max) {
      _min = min;
      _max = max;
    }

    /**
     * A numeric range that checks only the lower bound
     *
     * @param min The minimum acceptable value
     * @return A numeric range that checks only the lower bound.
     */
    public static Range atLeast(Number min) {
      return new Range(min, null);
    }

    /**
     * @param min Minimum bound.
     * @param max Maximum bound.
     * @return A numeric range that checks both the upper and lower bound
     */
    public static Range between(Number min, Number max) {
      return new Range(min, max);
    }

    @Override
    public void ensureValid(String name, Object o) {
      if (o == null) {
        throw new ConfigException(name, null, "Value must be non-null");
      }
      Number n = (Number) o;
      if (_min != null && n.doubleValue() < _min.doubleValue()) {
        throw new ConfigException(name, o, "Value must be at least " + _min);
      }
      if (_max != null && n.doubleValue() > _max.doubleValue()) {
        throw new ConfigException(name, o, "Value must be no more than " + _max);
      }
    }

    @Override
    public String toString() {
      if (_min == null) {
        return "[...," + _max + "]";
      } else if (_max == null) {
        return "[" + _min + ",...]";
      } else {
        return "[" + _min + ",...," + _max + "]";
      }
    }
  }

  public static final class ValidString implements Validator {
    private final List<String> _validStrings;

    private ValidString(List<String> validStrings) {
      _validStrings = validStrings;
    }

    public static ValidString in(String... validStrings) {
      return new ValidString(Arrays.asList(validStrings));
    }

    @Override
    public void ensureValid(String name, Object o) {
      String s = (String) o;
      if (!_validStrings.contains(s)) {
        throw new ConfigException(name, o, "String must be one of: " + Utils.join(_validStrings, ", "));
      }
    }

    @Override
    public String toString() {
      return "[" + Utils.join(_validStrings, ", ") + "]";
    }
  }

  public static class NonEmptyString implements Validator {

    @Override
    public void ensureValid(String name, Object o) {
      String s = (String) o;
      if (s != null && s.isEmpty()) {
        throw new ConfigException(name, o, "String must be non-empty");
      }
    }

    @Override
    public String toString() {
      return "non-empty string";
    }
  }

  public static class ConfigKey {
    protected final String _name;
    protected final Type _type;
    protected final String _documentation;
    protected final Object _defaultValue;
    protected final Validator _validator;
    protected final Importance _importance;

    public ConfigKey(String name, Type type, Object defaultValue, Validator validator, Importance importance, String documentation) {
      _name = name;
      _type = type;
      _defaultValue = NO_DEFAULT_VALUE.equals(defaultValue) ? NO_DEFAULT_VALUE : parseType(name, defaultValue, type);
      _validator = validator;
      _importance = importance;
      if (_validator != null && hasDefault()) {
        _validator.ensureValid(name, _defaultValue);
      }
      _documentation = documentation;
    }

    public boolean hasDefault() {
      return !NO_DEFAULT_VALUE.equals(_defaultValue);
    }

    public String name() {
      return _name;
    }

    public Type type() {
      return _type;
    }

    public String documentation() {
      return _documentation;
    }

    public Object defaultValue() {
      return _defaultValue;
    }

    public Validator validator() {
      return _validator;
    }

    public Importance importance() {
      return _importance;
    }
  }
}

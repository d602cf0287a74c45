/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricinsight.common.config;

import com.linkedin.metricinsight.common.utils.Utils;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * The typed keys a configuration accepts. Each key has a type, a default value, an optional validator, an importance
 * and a documentation string:
 * <pre>
 * ConfigDef def = new ConfigDef().define(&quot;threshold&quot;, Type.DOUBLE, 0.5, Range.between(0.0, 1.0),
 *                                        Importance.HIGH, &quot;The threshold.&quot;);
 * Map&lt;String, Object&gt; values = def.parse(Collections.singletonMap(&quot;threshold&quot;, &quot;0.75&quot;));
 * </pre>
 * Values may be given either as strings or already in their target type. See {@link AbstractConfig} for typed
 * access to the parsed values.
 */
public class ConfigDef {
  private final Map<String, ConfigKey> _configKeys = new LinkedHashMap<>();

  /**
   * Define a key validated by the given validator.
   *
   * @param name Name of the key.
   * @param type Type of the value.
   * @param defaultValue Value used when the key is absent, either a string or an instance of the type.
   * @param validator Validator of parsed values, {@code null} to accept any value of the type.
   * @param importance How likely the key is to need tuning.
   * @param documentation What the key controls.
   * @return This config definition, for chaining.
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                          String documentation) {
    if (_configKeys.containsKey(name)) {
      throw new ConfigException("Configuration " + name + " is defined twice.");
    }
    _configKeys.put(name, new ConfigKey(name, type, defaultValue, validator, importance, documentation));
    return this;
  }

  public Map<String, ConfigKey> configKeys() {
    return Collections.unmodifiableMap(_configKeys);
  }

  /**
   * Parse and validate every defined key. Keys absent from the given properties take their default value; entries
   * that are not defined are ignored.
   *
   * @param props Raw configuration values.
   * @return Parsed values by key name.
   */
  public Map<String, Object> parse(Map<?, ?> props) {
    Map<String, Object> values = new HashMap<>();
    for (ConfigKey key : _configKeys.values()) {
      Object value = props.containsKey(key._name) ? parseType(key._name, props.get(key._name), key._type)
                                                  : key._defaultValue;
      if (key._validator != null) {
        key._validator.ensureValid(key._name, value);
      }
      values.put(key._name, value);
    }
    return values;
  }

  /**
   * Convert a raw value to the given type.
   *
   * @param name Name of the key, for error messages.
   * @param value Raw value, a string or an instance of the type.
   * @param type Target type.
   * @return The parsed value.
   */
  static Object parseType(String name, Object value, Type type) {
    if (value == null) {
      throw new ConfigException(name, null, "Value must be non-null");
    }
    String trimmed = value instanceof String ? ((String) value).trim() : null;
    try {
      switch (type) {
        case INT:
          if (value instanceof Integer) {
            return value;
          } else if (trimmed != null) {
            return Integer.parseInt(trimmed);
          }
          throw new ConfigException(name, value, "Expected a 32-bit integer, but it was a " + value.getClass().getName());
        case DOUBLE:
          if (value instanceof Number) {
            return ((Number) value).doubleValue();
          } else if (trimmed != null) {
            return Double.parseDouble(trimmed);
          }
          throw new ConfigException(name, value, "Expected a double, but it was a " + value.getClass().getName());
        case LIST:
          if (value instanceof List) {
            return value;
          } else if (trimmed != null) {
            return trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(trimmed.split("\\s*,\\s*", -1));
          }
          throw new ConfigException(name, value, "Expected a comma separated list.");
        default:
          throw new IllegalStateException("Unknown type " + type);
      }
    } catch (NumberFormatException e) {
      throw new ConfigException(name, value, "Not a number of type " + type);
    }
  }

  public enum Type {
    INT, DOUBLE, LIST
  }

  public enum Importance {
    HIGH, MEDIUM, LOW
  }

  public interface Validator {
    /**
     * @param name Name of the key.
     * @param value Parsed value.
     * @throws ConfigException if the value is invalid.
     */
    void ensureValid(String name, Object value);
  }

  /**
   * Numeric range with an inclusive lower bound and an optional inclusive upper bound.
   */
  public static final class Range implements Validator {
    private final Number _min;
    private final Number _max;

    private Range(Number min, Number max) {
      _min = min;
      _max = max;
    }

    public static Range atLeast(Number min) {
      return new Range(min, null);
    }

    public static Range between(Number min, Number max) {
      return new Range(min, max);
    }

    @Override
    public void ensureValid(String name, Object value) {
      double number = ((Number) value).doubleValue();
      if (number < _min.doubleValue()) {
        throw new ConfigException(name, value, "Value must be at least " + _min);
      }
      if (_max != null && number > _max.doubleValue()) {
        throw new ConfigException(name, value, "Value must be no more than " + _max);
      }
    }

    @Override
    public String toString() {
      return _max == null ? "[" + _min + ",...]" : "[" + _min + ",...," + _max + "]";
    }
  }

  /**
   * List whose entries must all come from a fixed set of strings.
   */
  public static final class ValidList implements Validator {
    private final List<String> _validStrings;

    private ValidList(List<String> validStrings) {
      _validStrings = validStrings;
    }

    public static ValidList in(String... validStrings) {
      return new ValidList(Arrays.asList(validStrings));
    }

    @Override
    @SuppressWarnings("unchecked")
    public void ensureValid(String name, Object value) {
      for (String entry : (List<String>) value) {
        if (!_validStrings.contains(entry)) {
          throw new ConfigException(name, value, "Entries must be one of: " + Utils.join(_validStrings, ", "));
        }
      }
    }

    @Override
    public String toString() {
      return "[" + Utils.join(_validStrings, ", ") + "]";
    }
  }

  public static final class ConfigKey {
    private final String _name;
    private final Type _type;
    private final Object _defaultValue;
    private final Validator _validator;
    private final Importance _importance;
    private final String _documentation;

    private ConfigKey(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                      String documentation) {
      _name = name;
      _type = type;
      _defaultValue = parseType(name, defaultValue, type);
      _validator = validator;
      _importance = importance;
      _documentation = documentation;
      if (_validator != null) {
        _validator.ensureValid(name, _defaultValue);
      }
    }

    public Type type() {
      return _type;
    }

    public Object defaultValue() {
      return _defaultValue;
    }

    public Importance importance() {
      return _importance;
    }

    public String documentation() {
      return _documentation;
    }
  }
}

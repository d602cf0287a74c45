/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricinsight.common.config;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Base class of configurations: parses the given properties against a {@link ConfigDef} and tracks which keys were
 * read.
 */
public class AbstractConfig {
  private final Logger _log = LoggerFactory.getLogger(getClass());
  private final Map<String, ?> _originals;
  private final Map<String, Object> _values;
  private final Set<String> _used = Collections.synchronizedSet(new HashSet<>());

  @SuppressWarnings("unchecked")
  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    for (Object key : originals.keySet()) {
      if (!(key instanceof String)) {
        throw new ConfigException(String.valueOf(key), originals.get(key), "Key must be a string.");
      }
    }
    _originals = (Map<String, ?>) originals;
    _values = definition.parse(_originals);
    if (doLog) {
      logValues();
    }
  }

  protected Object get(String key) {
    if (!_values.containsKey(key)) {
      throw new ConfigException(String.format("Unknown configuration '%s'", key));
    }
    _used.add(key);
    return _values.get(key);
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Double getDouble(String key) {
    return (Double) get(key);
  }

  @SuppressWarnings("unchecked")
  public List<String> getList(String key) {
    return (List<String>) get(key);
  }

  /**
   * @return Supplied keys that have not been read, including keys that are not defined.
   */
  public Set<String> unused() {
    Set<String> keys = new HashSet<>(_originals.keySet());
    keys.removeAll(_used);
    return keys;
  }

  private void logValues() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append(" values:");
    for (Map.Entry<String, Object> entry : new TreeMap<>(_values).entrySet()) {
      sb.append(System.lineSeparator()).append('\t').append(entry.getKey()).append(" = ").append(entry.getValue());
    }
    _log.info(sb.toString());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return _originals.equals(((AbstractConfig) o)._originals);
  }

  @Override
  public int hashCode() {
    return _originals.hashCode();
  }
}

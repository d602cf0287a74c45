/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.common.utils;

import java.util.Collection;
import java.util.Iterator;


public final class Utils {

  private Utils() {

  }

  /**
   * Create a string representation of a collection joined by the given separator
   * @param list The collection of items
   * @param separator The separator
   * @param <T> The type of the items in the given collection.
   * @return The string representation.
   */
  public static <T> String join(Collection<T> list, String separator) {
    StringBuilder sb = new StringBuilder();
    Iterator<T> iter = list.iterator();
    while (iter.hasNext()) {
      sb.append(iter.next());
      if (iter.hasNext()) {
        sb.append(separator);
      }
    }
    return sb.toString();
  }

  /**
   * Checks that the specified object reference is not null and throws a customized IllegalArgumentException if it is.
   *
   * @param obj the object reference to check for nullity
   * @param errorMsg message to be used in the event that a IllegalArgumentException is thrown
   * @param <T> the type of the reference
   * @return obj if not null
   * @throws IllegalArgumentException if obj is null
   */
  public static <T> T validateNotNull(T obj, String errorMsg) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsg);
    }
    return obj;
  }

  /**
   * @param value A possibly {@code null} value.
   * @return {@code true} if the value is present and neither NaN nor infinite.
   */
  public static boolean isFinite(Double value) {
    return value != null && Double.isFinite(value);
  }
}

/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.common.utils;

import com.linkedin.metricwatch.exception.MetricWatchException;
import java.util.Collection;
import java.util.Iterator;


public final class Utils {

  private Utils() {

  }

  /**
   * @param c Class for which a new instance will be instantiated.
   * @param <T> The type of the instance to be returned.
   * @return Instantiated class.
   */
  public static <T> T newInstance(Class<T> c) throws MetricWatchException {
    if (c == null) {
      throw new MetricWatchException("class cannot be null");
    }
    try {
      return c.getDeclaredConstructor().newInstance();
    } catch (NoSuchMethodException e) {
      throw new MetricWatchException("Could not find a public no-argument constructor for " + c.getName(), e);
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new MetricWatchException("Could not instantiate class " + c.getName(), e);
    }
  }

  /**
   * Look up the class by name and instantiate it.
   * @param klass class name
   * @param base super class of the class to be instantiated
   * @param <T> The instance type.
   * @return The new instance
   */
  public static <T> T newInstance(String klass, Class<T> base) throws ClassNotFoundException, MetricWatchException {
    return Utils.newInstance(Class.forName(klass, true, Utils.getContextOrMetricWatchClassLoader()).asSubclass(base));
  }

  /**
   * Get the Context ClassLoader on this thread or, if not present, the ClassLoader that loaded MetricWatch.
   *
   * This should be used whenever passing a ClassLoader to Class.forName
   * @return the Context ClassLoader on this thread or, if not present, the ClassLoader that loaded MetricWatch.
   */
  public static ClassLoader getContextOrMetricWatchClassLoader() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    return cl == null ? Utils.class.getClassLoader() : cl;
  }

  /**
   * Create a string representation of a list joined by the given separator
   * @param list The list of items
   * @param separator The separator
   * @param <T> The type of the items in the given list.
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
   */
  public static <T> T validateNotNull(T obj, String errorMsg) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsg);
    }
    return obj;
  }

  /**
   * @param value Value to clamp.
   * @param min Lower bound.
   * @param max Upper bound.
   * @return The value bounded to [min, max].
   */
  public static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}

/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable set of values describing the logical flow of control (a request id, a tenant, a
 * security principal) that should follow a caller across asynchronous boundaries.
 * <p>
 * Each thread has a current context. Continuations attached with
 * {@link ContinuationFlags#FLOW_EXECUTION_CONTEXT} {@link #capture() capture} the attaching
 * thread's context and {@link #restore() restore} it for the duration of their execution, even when
 * they run on a different thread.
 */
public final class ExecutionContext {
  private static final ExecutionContext EMPTY = new ExecutionContext(Collections.emptyMap());
  private static final ThreadLocal<ExecutionContext> CURRENT =
      ThreadLocal.withInitial(() -> EMPTY);

  private final Map<Object, Object> values;

  private ExecutionContext(final Map<Object, Object> values) {
    this.values = values;
  }

  /**
   * @return the current context of the calling thread
   */
  public static ExecutionContext capture() {
    return CURRENT.get();
  }

  /**
   * @param key the key of the value
   * @return the value bound to the key in the calling thread's current context, or null
   */
  public static Object get(final Object key) {
    return CURRENT.get().values.get(key);
  }

  /**
   * Makes the current context of the calling thread a copy of the existing one with the given
   * binding added, until the returned scope is closed
   *
   * @param key the key to bind
   * @param value the value to bind
   * @return a scope restoring the previous context
   */
  public static Scope with(final Object key, final Object value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    final Map<Object, Object> copy = new HashMap<>(CURRENT.get().values);
    copy.put(key, value);
    return new ExecutionContext(Collections.unmodifiableMap(copy)).restore();
  }

  /**
   * @return true if this context has no bindings
   */
  public boolean isEmpty() {
    return this.values.isEmpty();
  }

  /**
   * Makes this context the current context of the calling thread until the returned scope is
   * closed
   *
   * @return a scope restoring the previous context
   */
  public Scope restore() {
    final ExecutionContext previous = CURRENT.get();
    CURRENT.set(this);
    return () -> CURRENT.set(previous);
  }

  @Override
  public String toString() {
    return "ExecutionContext " + this.values;
  }
}

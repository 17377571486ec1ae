/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * An execution substrate that a thread prefers its continuations to run on, for example a single
 * event-loop thread. A host installs a context on the threads it owns; continuations attached with
 * {@link ContinuationFlags#USE_SCHEDULING_CONTEXT} on such a thread are later
 * {@link #post(Runnable) posted} back to it instead of running wherever the wait completed.
 * <p>
 * Threads without an installed context have a {@link #current() current} context of {@code null},
 * and their continuations run on whichever thread completes the wait.
 */
public abstract class SchedulingContext {
  private static final ThreadLocal<SchedulingContext> CURRENT = new ThreadLocal<>();

  /**
   * @return the context installed on the calling thread, or {@code null} if there is none
   */
  public static SchedulingContext current() {
    return CURRENT.get();
  }

  /**
   * Installs this context on the calling thread until the returned scope is closed
   *
   * @return a scope which restores the previously installed context
   */
  public final Scope install() {
    final SchedulingContext previous = CURRENT.get();
    CURRENT.set(this);
    return () -> {
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    };
  }

  /**
   * Schedules the given action to run on this context. Must not run the action synchronously on
   * the calling thread.
   *
   * @param action the action to run
   */
  public abstract void post(Runnable action);

  /**
   * Creates a context posting to the given executor. Posted actions run with the returned context
   * installed, so continuations attached from within them return to the same executor.
   *
   * @param executor the executor backing the context
   * @return a new scheduling context
   */
  public static SchedulingContext of(final Executor executor) {
    Objects.requireNonNull(executor);
    return new SchedulingContext() {
      @Override
      public void post(final Runnable action) {
        executor.execute(() -> {
          try (Scope ignored = install()) {
            action.run();
          }
        });
      }

      @Override
      public String toString() {
        return "SchedulingContext [" + executor + "]";
      }
    };
  }
}

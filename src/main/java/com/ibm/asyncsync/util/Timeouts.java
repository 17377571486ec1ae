/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Timeout conventions shared by the waiting operations of this library, and the single timer used
 * to enforce them.
 * <p>
 * A timeout is a non-negative {@link Duration}, or the special value {@link #INFINITE} meaning the
 * wait never times out. A zero timeout means "do not wait at all".
 */
public final class Timeouts {
  private Timeouts() {}

  /**
   * A timeout which never elapses. Represented as minus one millisecond so that it is the only
   * accepted negative duration.
   */
  public static final Duration INFINITE = Duration.ofMillis(-1L);

  private static final ScheduledThreadPoolExecutor TIMER;

  static {
    final ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, r -> {
      final Thread t = new Thread(r, "async-sync-timer");
      t.setDaemon(true);
      return t;
    });
    // canceled timeouts are the common case, don't let them pile up in the work queue
    timer.setRemoveOnCancelPolicy(true);
    TIMER = timer;
  }

  /**
   * @return true iff the given timeout is {@link #INFINITE}
   */
  public static boolean isInfinite(final Duration timeout) {
    return INFINITE.equals(timeout);
  }

  /**
   * Checks that the given timeout is either non-negative or {@link #INFINITE}
   *
   * @param timeout the timeout to check
   * @return the given timeout
   * @throws IllegalArgumentException if the timeout is negative and not {@link #INFINITE}
   * @throws NullPointerException if the timeout is null
   */
  public static Duration validate(final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() && !isInfinite(timeout)) {
      throw new IllegalArgumentException(
          String.format("timeout must be non-negative or INFINITE, given %s", timeout));
    }
    return timeout;
  }

  /**
   * Runs the given action once the given (finite, positive) delay has elapsed. The action runs on
   * the shared timer thread and should be brief.
   *
   * @param action the action to run
   * @param delay the delay before running
   * @return a future which may be used to cancel the pending action
   */
  public static ScheduledFuture<?> schedule(final Runnable action, final Duration delay) {
    return TIMER.schedule(action, toNanosSaturated(delay), TimeUnit.NANOSECONDS);
  }

  private static long toNanosSaturated(final Duration duration) {
    try {
      return duration.toNanos();
    } catch (final ArithmeticException overflow) {
      return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }
}

/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

import com.ibm.asyncsync.util.Timeouts;

/**
 * The producing side of a cooperative cancellation request. Observers receive the
 * {@link #getSignal() signal}; whoever owns the source decides when to {@link #cancel()}.
 */
public final class CancellationSource {

  static final CancellationSignal NONE = new CancellationSignal() {
    @Override
    public boolean isCancellationRequested() {
      return false;
    }

    @Override
    public boolean canBeCanceled() {
      return false;
    }

    @Override
    public Registration register(final Runnable callback) {
      Objects.requireNonNull(callback);
      return NO_REGISTRATION;
    }

    @Override
    public String toString() {
      return "CancellationSignal.none()";
    }
  };

  private static final CancellationSignal.Registration NO_REGISTRATION = () -> false;

  private final Signal signal = new Signal();

  // guarded by this
  private LinkedHashSet<CallbackRegistration> callbacks = new LinkedHashSet<>();
  private ScheduledFuture<?> scheduledCancel;
  private volatile boolean canceled;

  /**
   * @return the signal observing this source
   */
  public CancellationSignal getSignal() {
    return this.signal;
  }

  /**
   * @return true if {@link #cancel()} has been called
   */
  public boolean isCancellationRequested() {
    return this.canceled;
  }

  /**
   * Requests cancellation, running every registered callback exactly once on the calling thread.
   * Subsequent calls have no effect.
   * <p>
   * Every callback runs even if an earlier one throws; the first exception is rethrown afterwards
   * with any others added as suppressed exceptions.
   */
  public void cancel() {
    final LinkedHashSet<CallbackRegistration> toRun;
    final ScheduledFuture<?> timer;
    synchronized (this) {
      if (this.canceled) {
        return;
      }
      this.canceled = true;
      toRun = this.callbacks;
      this.callbacks = null;
      timer = this.scheduledCancel;
      this.scheduledCancel = null;
    }

    if (timer != null) {
      timer.cancel(false);
    }

    RuntimeException failure = null;
    for (final CallbackRegistration registration : toRun) {
      try {
        registration.callback.run();
      } catch (final RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Schedules a call to {@link #cancel()} after the given delay. A later call replaces the pending
   * schedule.
   *
   * @param delay the delay before cancellation; zero cancels immediately
   */
  public void cancelAfter(final Duration delay) {
    Timeouts.validate(delay);
    if (Timeouts.isInfinite(delay)) {
      return;
    }
    if (delay.isZero()) {
      cancel();
      return;
    }

    final ScheduledFuture<?> previous;
    synchronized (this) {
      if (this.canceled) {
        return;
      }
      previous = this.scheduledCancel;
      this.scheduledCancel = Timeouts.schedule(this::cancel, delay);
    }
    if (previous != null) {
      previous.cancel(false);
    }
  }

  private CancellationSignal.Registration register(final Runnable callback) {
    Objects.requireNonNull(callback);
    synchronized (this) {
      if (!this.canceled) {
        final CallbackRegistration registration = new CallbackRegistration(callback);
        this.callbacks.add(registration);
        return registration;
      }
    }
    // already canceled, run in place
    callback.run();
    return NO_REGISTRATION;
  }

  private synchronized boolean unregister(final CallbackRegistration registration) {
    return this.callbacks != null && this.callbacks.remove(registration);
  }

  @Override
  public String toString() {
    return "CancellationSource [canceled=" + this.canceled + "]";
  }

  private final class CallbackRegistration implements CancellationSignal.Registration {
    final Runnable callback;

    CallbackRegistration(final Runnable callback) {
      this.callback = callback;
    }

    @Override
    public boolean unregister() {
      return CancellationSource.this.unregister(this);
    }
  }

  private final class Signal implements CancellationSignal {
    @Override
    public boolean isCancellationRequested() {
      return CancellationSource.this.canceled;
    }

    @Override
    public boolean canBeCanceled() {
      return true;
    }

    @Override
    public Registration register(final Runnable callback) {
      return CancellationSource.this.register(callback);
    }

    @Override
    public String toString() {
      return "CancellationSignal [canceled=" + CancellationSource.this.canceled + "]";
    }
  }
}

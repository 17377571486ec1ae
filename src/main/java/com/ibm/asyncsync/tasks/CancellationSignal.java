/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks;

/**
 * The observing side of a cooperative cancellation request. Waiting operations accept a signal and
 * abandon the wait, completing with a {@link java.util.concurrent.CancellationException}, once
 * cancellation is requested.
 * <p>
 * Signals are produced by a {@link CancellationSource}; {@link #none()} provides a signal which is
 * never canceled.
 */
public interface CancellationSignal {

  /**
   * @return true if cancellation has been requested for this signal
   */
  boolean isCancellationRequested();

  /**
   * @return false if this signal can never be canceled, in which case registering callbacks is
   *         unnecessary
   */
  boolean canBeCanceled();

  /**
   * Registers a callback to run when cancellation is requested. If cancellation has already been
   * requested the callback runs immediately on the calling thread.
   * <p>
   * Callbacks run on the thread which requests cancellation and should be brief.
   *
   * @param callback the action to run on cancellation
   * @return a registration which may be used to remove the callback
   */
  Registration register(Runnable callback);

  /**
   * A handle to a registered cancellation callback.
   */
  @FunctionalInterface
  interface Registration {
    /**
     * Removes the callback if it has not run yet. This method never blocks and may be called any
     * number of times.
     *
     * @return true iff this call removed the callback before it ran
     */
    boolean unregister();
  }

  /**
   * @return a signal which is never canceled
   */
  static CancellationSignal none() {
    return CancellationSource.NONE;
  }
}

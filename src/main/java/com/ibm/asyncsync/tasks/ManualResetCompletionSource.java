/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.function.Consumer;

import com.ibm.asyncsync.util.Timeouts;

/**
 * A reusable producer of a single pending asynchronous outcome. One instance serves many waits in
 * sequence: each wait is armed with {@link #prepareWait(Duration, CancellationSignal)}, completes
 * exactly once (with a result, a failure, cancellation or timeout), is consumed by its observer,
 * and the source is then {@link #reset() reset} for the next wait.
 * <p>
 * Every wait is identified by a 16-bit <i>token</i> (the epoch of the source) which increments on
 * each reset. Operations carrying a token from an earlier wait are rejected, so a late observer or
 * a late cancellation callback can never interfere with a later reuse of the same object.
 *
 * @see ValueCompletionSource
 */
public abstract class ManualResetCompletionSource {
  /*
   * The token and the status live together in one volatile int: the token in the high 16 bits and
   * the status ordinal in the low 16 bits. Consumption is a single CAS from (token,
   * WAIT_FOR_CONSUMPTION) to (token, CONSUMED); whoever wins that CAS owns the outcome, and a
   * consumer holding a stale token simply fails the CAS. All other transitions happen while holding
   * syncRoot, which also guards the continuation, the racer and the outcome fields.
   *
   * Cancellation and timeout race against normal completion. Both are subscribed when the source is
   * activated and both funnel into cancellationRequested with the token captured at activation.
   * That method re-checks the token and the ACTIVATED status under syncRoot, so a callback that
   * arrives after completion, or after a reset and reuse, does nothing.
   *
   * Continuations are never invoked while syncRoot is held.
   */

  /**
   * The token of a newly constructed source
   */
  protected static final short INITIAL_COMPLETION_TOKEN = Short.MIN_VALUE;

  static final String INVALID_SOURCE_STATE = "the completion source is not in the expected state";
  static final String INVALID_SOURCE_TOKEN =
      "the token does not belong to the current wait of the completion source";

  private static final ManualResetCompletionSourceStatus[] STATUSES =
      ManualResetCompletionSourceStatus.values();
  private static final int STATUS_MASK = 0xFFFF;

  private static final AtomicIntegerFieldUpdater<ManualResetCompletionSource> STATE_UPDATER =
      AtomicIntegerFieldUpdater.newUpdater(ManualResetCompletionSource.class, "versionAndStatus");

  final Object syncRoot = new Object();
  private final boolean runContinuationsAsynchronously;
  private final Executor executor;

  private volatile int versionAndStatus =
      combine(INITIAL_COMPLETION_TOKEN, ManualResetCompletionSourceStatus.WAIT_FOR_ACTIVATION);

  // guarded by syncRoot
  private Continuation continuation;
  private Racer racer;
  private Object completionData;
  Object outcome;

  /**
   * Creates a source whose continuations run on the completing thread
   */
  protected ManualResetCompletionSource() {
    this(ForkJoinPool.commonPool(), false);
  }

  /**
   * @param executor the executor used to run continuations asynchronously
   * @param runContinuationsAsynchronously if true, continuations without a captured
   *        {@link SchedulingContext} are submitted to {@code executor} instead of running on the
   *        completing thread
   */
  protected ManualResetCompletionSource(final Executor executor,
      final boolean runContinuationsAsynchronously) {
    this.executor = Objects.requireNonNull(executor);
    this.runContinuationsAsynchronously = runContinuationsAsynchronously;
  }

  static int combine(final short version, final ManualResetCompletionSourceStatus status) {
    return (version << 16) | status.ordinal();
  }

  static short version(final int versionAndStatus) {
    return (short) (versionAndStatus >>> 16);
  }

  static ManualResetCompletionSourceStatus status(final int versionAndStatus) {
    return STATUSES[versionAndStatus & STATUS_MASK];
  }

  /**
   * @return the current status of this source
   */
  public final ManualResetCompletionSourceStatus getStatus() {
    return status(this.versionAndStatus);
  }

  /**
   * @return true if the current wait has completed, whether or not its outcome has been consumed
   */
  public final boolean isCompleted() {
    return getStatus().compareTo(ManualResetCompletionSourceStatus.WAIT_FOR_CONSUMPTION) >= 0;
  }

  /**
   * The data passed along with the outcome by whichever path completed the current wait. Typically
   * inspected from {@link #afterConsumed()}.
   *
   * @return the completion data, or null
   */
  protected final Object getCompletionData() {
    synchronized (this.syncRoot) {
      return this.completionData;
    }
  }

  /**
   * Arms this source for a new wait.
   * <p>
   * If the source is idle it is activated: a zero {@code timeout} completes the wait immediately as
   * timed out, an already canceled {@code signal} completes it immediately as canceled, and
   * otherwise both the signal and a timer for {@code timeout} are subscribed to race against the
   * normal completion. If the source has already completed but has not been consumed, its token is
   * returned so that a late observer can still attach.
   *
   * @param timeout how long the wait may last; {@link Timeouts#INFINITE} for no limit
   * @param signal the signal which cancels the wait
   * @return the token of the wait, or empty if the source is active or consumed
   * @throws IllegalArgumentException if {@code timeout} is negative and not infinite
   */
  public final OptionalInt prepareWait(final Duration timeout, final CancellationSignal signal) {
    Timeouts.validate(timeout);
    Objects.requireNonNull(signal, "signal");

    synchronized (this.syncRoot) {
      final int current = this.versionAndStatus;
      switch (status(current)) {
        case WAIT_FOR_ACTIVATION:
          activate(version(current), timeout, signal);
          return OptionalInt.of(version(current));
        case WAIT_FOR_CONSUMPTION:
          return OptionalInt.of(version(current));
        default:
          return OptionalInt.empty();
      }
    }
  }

  private void activate(final short version, final Duration timeout,
      final CancellationSignal signal) {
    if (timeout.isZero()) {
      completeAsTimedOut();
      assert getStatus() == ManualResetCompletionSourceStatus.WAIT_FOR_CONSUMPTION;
    } else if (signal.isCancellationRequested()) {
      completeAsCanceled(signal);
      assert getStatus() == ManualResetCompletionSourceStatus.WAIT_FOR_CONSUMPTION;
    } else {
      setStatus(ManualResetCompletionSourceStatus.ACTIVATED);

      final ScheduledFuture<?> timer = Timeouts.isInfinite(timeout)
          ? null
          : Timeouts.schedule(() -> cancellationRequested(version, null), timeout);
      // the signal may be canceled concurrently, in which case the callback runs right here
      final CancellationSignal.Registration registration = signal.canBeCanceled()
          ? signal.register(() -> cancellationRequested(version, signal))
          : null;

      final Racer r = new Racer(registration, timer);
      if (getStatus() == ManualResetCompletionSourceStatus.ACTIVATED) {
        this.racer = r;
      } else {
        r.cleanup();
      }
    }
  }

  /**
   * Shared by the timer and the cancellation signal; {@code signal} is null for the timer
   */
  private void cancellationRequested(final short expectedVersion,
      final CancellationSignal signal) {
    synchronized (this.syncRoot) {
      final int current = this.versionAndStatus;
      // called after reset, or called twice
      if (status(current) != ManualResetCompletionSourceStatus.ACTIVATED
          || version(current) != expectedVersion) {
        return;
      }

      if (signal == null) {
        completeAsTimedOut();
      } else {
        completeAsCanceled(signal);
      }
      assert getStatus() == ManualResetCompletionSourceStatus.WAIT_FOR_CONSUMPTION;
    }

    resume(expectedVersion);
  }

  /**
   * Completes the current wait as timed out. Called while holding syncRoot, from
   * {@link ManualResetCompletionSourceStatus#WAIT_FOR_ACTIVATION} or
   * {@link ManualResetCompletionSourceStatus#ACTIVATED}
   */
  abstract void completeAsTimedOut();

  /**
   * Completes the current wait as canceled by the given signal. Called while holding syncRoot, from
   * {@link ManualResetCompletionSourceStatus#WAIT_FOR_ACTIVATION} or
   * {@link ManualResetCompletionSourceStatus#ACTIVATED}
   */
  abstract void completeAsCanceled(CancellationSignal signal);

  /**
   * Records the outcome and moves to WAIT_FOR_CONSUMPTION. Must hold syncRoot
   */
  final void setCompleted(final Object completionData, final Object outcome) {
    assert Thread.holdsLock(this.syncRoot);
    this.completionData = completionData;
    this.outcome = outcome;
    setStatus(ManualResetCompletionSourceStatus.WAIT_FOR_CONSUMPTION);
  }

  /**
   * Completes an active wait without running its continuation
   *
   * @return the token of the completed wait, or empty if the wait was not active
   */
  final OptionalInt tryComplete(final Object completionData, final Object outcome) {
    synchronized (this.syncRoot) {
      final int current = this.versionAndStatus;
      if (status(current) != ManualResetCompletionSourceStatus.ACTIVATED) {
        return OptionalInt.empty();
      }
      setCompleted(completionData, outcome);
      return OptionalInt.of(version(current));
    }
  }

  private void setStatus(final ManualResetCompletionSourceStatus status) {
    // only called under syncRoot from statuses that a concurrent consume CAS cannot observe
    this.versionAndStatus = combine(version(this.versionAndStatus), status);
  }

  /**
   * Attempts to complete the current wait with a failure
   *
   * @param e the exception to deliver to the observer
   * @return true iff the wait was active and is now completed by this call
   */
  public final boolean trySetException(final Throwable e) {
    return trySetException(null, e);
  }

  /**
   * Attempts to complete the current wait with a failure
   *
   * @param completionData data made available to {@link #afterConsumed()} through
   *        {@link #getCompletionData()}
   * @param e the exception to deliver to the observer
   * @return true iff the wait was active and is now completed by this call
   */
  public abstract boolean trySetException(Object completionData, Throwable e);

  /**
   * Attempts to complete the current wait as canceled
   *
   * @param signal the signal on whose behalf the wait is canceled
   * @return true iff the wait was active and is now completed by this call
   */
  public final boolean trySetCanceled(final CancellationSignal signal) {
    return trySetCanceled(null, signal);
  }

  /**
   * Attempts to complete the current wait as canceled
   *
   * @param completionData data made available to {@link #afterConsumed()} through
   *        {@link #getCompletionData()}
   * @param signal the signal on whose behalf the wait is canceled
   * @return true iff the wait was active and is now completed by this call
   */
  public abstract boolean trySetCanceled(Object completionData, CancellationSignal signal);

  /**
   * Attaches the continuation of the wait identified by {@code token}. If the wait has already
   * completed the continuation is invoked right away from the calling thread; otherwise it is
   * invoked once the wait completes, from the completing thread, subject to {@code flags} and the
   * asynchronous dispatch setting of this source.
   *
   * @param action the continuation
   * @param state the argument passed to {@code action}
   * @param token the token returned by {@link #prepareWait(Duration, CancellationSignal)}
   * @param flags what to capture from the calling thread
   * @throws IllegalStateException if the token is stale or the wait is neither active nor
   *         completed
   */
  public final void onCompleted(final Consumer<Object> action, final Object state,
      final short token, final Set<ContinuationFlags> flags) {
    Objects.requireNonNull(action, "action");
    final Continuation c = new Continuation(action, state, flags);

    final String errorMessage;
    synchronized (this.syncRoot) {
      final int current = this.versionAndStatus;
      if (version(current) != token) {
        errorMessage = INVALID_SOURCE_TOKEN;
      } else {
        switch (status(current)) {
          case ACTIVATED:
            this.continuation = c;
            return;
          case WAIT_FOR_CONSUMPTION:
            errorMessage = null;
            break;
          default:
            errorMessage = INVALID_SOURCE_STATE;
            break;
        }
      }
    }

    if (errorMessage != null) {
      throw new IllegalStateException(errorMessage);
    }

    // already completed, no need to wait
    c.invokeOnCurrentContext(this.runContinuationsAsynchronously, this.executor);
  }

  /**
   * Tears down the cancellation and timeout subscriptions of the wait identified by {@code token}
   * and invokes its continuation, if one is attached. Does nothing if the source has been reset
   * since that wait.
   * <p>
   * Completion methods which do not resume by themselves require the caller to invoke this method
   * once it is safe to run arbitrary code.
   *
   * @param token the token of the completed wait
   */
  protected final void resume(final short token) {
    final Racer r;
    final Continuation c;
    synchronized (this.syncRoot) {
      if (version(this.versionAndStatus) != token) {
        return;
      }
      r = this.racer;
      this.racer = null;
      c = this.continuation;
      this.continuation = null;
    }

    if (r != null) {
      r.cleanup();
    }
    if (c != null) {
      c.invoke(this.runContinuationsAsynchronously, this.executor);
    }
  }

  /**
   * Marks the outcome of the wait identified by {@code token} consumed. Exactly one caller can
   * succeed for a given wait.
   *
   * @throws IllegalStateException if the token is stale or the wait is not awaiting consumption
   */
  final void consume(final short token) {
    if (STATE_UPDATER.compareAndSet(this,
        combine(token, ManualResetCompletionSourceStatus.WAIT_FOR_CONSUMPTION),
        combine(token, ManualResetCompletionSourceStatus.CONSUMED))) {
      return;
    }

    throw new IllegalStateException(version(this.versionAndStatus) != token
        ? INVALID_SOURCE_TOKEN
        : INVALID_SOURCE_STATE);
  }

  /**
   * Invoked after the outcome of a wait has been consumed, on the consuming thread. Pooled sources
   * override this to reset themselves and return to their pool.
   */
  protected void afterConsumed() {}

  /**
   * Invoked after {@link #reset()}, outside of any internal lock
   */
  protected void cleanup() {}

  /**
   * Resets this source for another wait. Tokens of earlier waits are invalidated, and their pending
   * cancellation and timeout callbacks can no longer complete the source.
   *
   * @return the token of the next wait
   * @throws IllegalStateException if the current wait has not completed yet
   */
  public final short reset() {
    final OptionalInt token = tryReset();
    if (!token.isPresent()) {
      throw new IllegalStateException(INVALID_SOURCE_STATE);
    }
    return (short) token.getAsInt();
  }

  /**
   * Resets this source if the current wait has completed
   *
   * @return the token of the next wait, or empty if the current wait has not completed
   * @see #reset()
   */
  public final OptionalInt tryReset() {
    final Racer r;
    short next;
    synchronized (this.syncRoot) {
      int current;
      do {
        current = this.versionAndStatus;
        if (status(current).compareTo(ManualResetCompletionSourceStatus.WAIT_FOR_CONSUMPTION) < 0) {
          return OptionalInt.empty();
        }
        next = (short) (version(current) + 1);
      } while (!STATE_UPDATER.compareAndSet(this, current,
          combine(next, ManualResetCompletionSourceStatus.WAIT_FOR_ACTIVATION)));

      this.completionData = null;
      this.outcome = null;
      this.continuation = null;
      r = this.racer;
      this.racer = null;
    }

    if (r != null) {
      r.cleanup();
    }
    cleanup();
    return OptionalInt.of(next);
  }

  @Override
  public String toString() {
    final int current = this.versionAndStatus;
    return getClass().getSimpleName() + " [token=" + version(current)
        + ", status=" + status(current) + "]";
  }

  /**
   * The subscriptions racing against normal completion
   */
  private static final class Racer {
    private final CancellationSignal.Registration registration;
    private final ScheduledFuture<?> timer;

    Racer(final CancellationSignal.Registration registration, final ScheduledFuture<?> timer) {
      this.registration = registration;
      this.timer = timer;
    }

    void cleanup() {
      if (this.registration != null) {
        this.registration.unregister();
      }
      if (this.timer != null) {
        this.timer.cancel(false);
      }
    }
  }

  /**
   * An outcome representing a failed wait
   */
  static final class Failure {
    final Throwable error;

    Failure(final Throwable error) {
      this.error = Objects.requireNonNull(error);
    }
  }
}

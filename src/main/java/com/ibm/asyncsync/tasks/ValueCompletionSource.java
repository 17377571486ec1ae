/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

import com.ibm.asyncsync.util.Timeouts;

/**
 * A {@link ManualResetCompletionSource} whose waits produce a value of type {@code T}.
 * <p>
 * A typical single use looks like
 *
 * <pre>
 * {@code
 * ValueCompletionSource<String> source = new ValueCompletionSource<>();
 * CompletionStage<String> stage = source.createStage(Duration.ofSeconds(1), signal);
 * // some other thread
 * source.trySetResult("done");
 * }
 * </pre>
 *
 * after which {@link #reset()} makes the source available for the next wait. A timed out wait
 * fails with a {@link TimeoutException} and a canceled wait fails with a
 * {@link CancellationException}, unless a subclass overrides {@link #timedOutResult()}.
 *
 * @param <T> the type of the result
 */
public class ValueCompletionSource<T> extends ManualResetCompletionSource {

  /**
   * The flags used when a wait is exposed as a {@link CompletionStage}
   */
  public static final Set<ContinuationFlags> DEFAULT_FLAGS =
      Collections.unmodifiableSet(EnumSet.allOf(ContinuationFlags.class));

  public ValueCompletionSource() {}

  /**
   * @see ManualResetCompletionSource#ManualResetCompletionSource(Executor, boolean)
   */
  public ValueCompletionSource(final Executor executor,
      final boolean runContinuationsAsynchronously) {
    super(executor, runContinuationsAsynchronously);
  }

  /**
   * The outcome of a wait which timed out. By default a timed out wait fails with
   * {@link TimeoutException}.
   *
   * @return the result delivered to the observer of a timed out wait
   * @throws TimeoutException to fail the wait instead of producing a result
   */
  protected T timedOutResult() throws TimeoutException {
    throw new TimeoutException();
  }

  @Override
  final void completeAsTimedOut() {
    Object result;
    try {
      result = timedOutResult();
    } catch (final TimeoutException | RuntimeException e) {
      result = new Failure(e);
    }
    setCompleted(null, result);
  }

  @Override
  final void completeAsCanceled(final CancellationSignal signal) {
    setCompleted(null, new Failure(new CancellationException("the wait was canceled")));
  }

  /**
   * Attempts to complete the current wait with a result
   *
   * @param value the result
   * @return true iff the wait was active and is now completed by this call
   */
  public final boolean trySetResult(final T value) {
    return trySetResult(null, value);
  }

  /**
   * Attempts to complete the current wait with a result
   *
   * @param completionData data made available to {@link #afterConsumed()} through
   *        {@link #getCompletionData()}
   * @param value the result
   * @return true iff the wait was active and is now completed by this call
   */
  public final boolean trySetResult(final Object completionData, final T value) {
    return resumeIfCompleted(trySetResultNoResume(completionData, value));
  }

  @Override
  public final boolean trySetException(final Object completionData, final Throwable e) {
    return resumeIfCompleted(trySetExceptionNoResume(completionData, e));
  }

  @Override
  public final boolean trySetCanceled(final Object completionData,
      final CancellationSignal signal) {
    return resumeIfCompleted(tryComplete(completionData,
        new Failure(new CancellationException("the wait was canceled"))));
  }

  /**
   * Completes the current wait with a result without invoking its continuation. The caller must
   * later pass the returned token to {@link #resume(short)}.
   *
   * @return the token of the completed wait, or empty if the wait was not active
   */
  protected final OptionalInt trySetResultNoResume(final Object completionData, final T value) {
    return tryComplete(completionData, value);
  }

  /**
   * Completes the current wait with a failure without invoking its continuation. The caller must
   * later pass the returned token to {@link #resume(short)}.
   *
   * @return the token of the completed wait, or empty if the wait was not active
   */
  protected final OptionalInt trySetExceptionNoResume(final Object completionData,
      final Throwable e) {
    return tryComplete(completionData, new Failure(e));
  }

  private boolean resumeIfCompleted(final OptionalInt token) {
    if (token.isPresent()) {
      resume((short) token.getAsInt());
      return true;
    }
    return false;
  }

  /**
   * Consumes the outcome of the wait identified by {@code token}. Exactly one call per wait can
   * succeed; {@link #afterConsumed()} runs before this method returns.
   *
   * @param token the token of the wait
   * @return the result of the wait
   * @throws IllegalStateException if the token is stale or the wait has not completed or was
   *         already consumed
   * @throws CancellationException if the wait was canceled
   * @throws CompletionException wrapping a checked failure, including the {@link TimeoutException}
   *         of a timed out wait
   */
  public final T getResult(final short token) {
    consume(token);
    final Object result = this.outcome;
    try {
      return unwrap(result);
    } finally {
      afterConsumed();
    }
  }

  @SuppressWarnings("unchecked")
  private T unwrap(final Object result) {
    if (result instanceof Failure) {
      final Throwable e = ((Failure) result).error;
      if (e instanceof RuntimeException) {
        throw (RuntimeException) e;
      }
      if (e instanceof Error) {
        throw (Error) e;
      }
      throw new CompletionException(e);
    }
    return (T) result;
  }

  /**
   * Starts a wait with no time limit which cannot be canceled
   *
   * @see #createStage(Duration, CancellationSignal)
   */
  public final CompletionStage<T> createStage() {
    return createStage(Timeouts.INFINITE, CancellationSignal.none());
  }

  /**
   * Starts a wait and exposes it as a stage. The stage completes with the result, with a
   * {@link TimeoutException} if {@code timeout} elapses first, or with a
   * {@link CancellationException} if {@code signal} is canceled first.
   *
   * @param timeout how long the wait may last; {@link Timeouts#INFINITE} for no limit
   * @param signal the signal which cancels the wait
   * @return a stage completed with the outcome of the wait
   * @throws IllegalStateException if a wait is already active or awaiting consumption by a
   *         different observer
   */
  public final CompletionStage<T> createStage(final Duration timeout,
      final CancellationSignal signal) {
    final OptionalInt token = prepareWait(timeout, signal);
    if (!token.isPresent()) {
      throw new IllegalStateException(INVALID_SOURCE_STATE);
    }
    return toStage((short) token.getAsInt());
  }

  /**
   * Exposes a prepared wait as a stage. The outcome is consumed when it is transferred to the
   * stage.
   *
   * @param token the token returned by {@link #prepareWait(Duration, CancellationSignal)}
   * @return a stage completed with the outcome of the wait
   */
  public final CompletionStage<T> toStage(final short token) {
    final CompletableFuture<T> future = new CompletableFuture<>();
    onCompleted(ignored -> transferTo(future, token), null, token, DEFAULT_FLAGS);
    return future;
  }

  private void transferTo(final CompletableFuture<T> future, final short token) {
    final T result;
    try {
      result = getResult(token);
    } catch (final CompletionException e) {
      future.completeExceptionally(e.getCause());
      return;
    } catch (final Throwable e) {
      future.completeExceptionally(e);
      return;
    }
    future.complete(result);
  }
}

/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.locks;

import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Consumer;

import com.ibm.asyncsync.tasks.CancellationSignal;
import com.ibm.asyncsync.tasks.pooling.ConstrainedValueTaskPool;
import com.ibm.asyncsync.tasks.pooling.UnconstrainedValueTaskPool;
import com.ibm.asyncsync.tasks.pooling.ValueTaskPool;
import com.ibm.asyncsync.util.Timeouts;

/**
 * An asynchronous mutual exclusion lock. Waiters are granted in FIFO order; an acquisition which
 * finds the lock free takes it without looking at the queue.
 * <p>
 * This lock is not reentrant, and it is not bound to threads: any caller may release a lock
 * acquired by another.
 */
public class AsyncExclusiveLock extends QueuedSynchronizer {
  private final ValueTaskPool<ExclusiveNode> pool;

  // guarded by this
  private boolean acquired;

  /**
   * Creates a lock which allocates wait nodes on demand
   */
  public AsyncExclusiveLock() {
    super();
    this.pool = new UnconstrainedValueTaskPool<>(this::newNode);
  }

  /**
   * @param executor the executor on which waiters are resumed
   */
  public AsyncExclusiveLock(final Executor executor) {
    super(executor, true);
    this.pool = new UnconstrainedValueTaskPool<>(this::newNode);
  }

  /**
   * Creates a lock with a fixed number of preallocated wait nodes. Attempting to queue more than
   * {@code concurrencyLevel} waiters at once fails with
   * {@link com.ibm.asyncsync.tasks.pooling.PoolExhaustedException}.
   *
   * @param concurrencyLevel the maximum number of simultaneously queued waiters
   * @throws IllegalArgumentException if {@code concurrencyLevel} is not positive
   */
  public AsyncExclusiveLock(final int concurrencyLevel) {
    this(concurrencyLevel, ForkJoinPool.commonPool(), false);
  }

  /**
   * @param concurrencyLevel the maximum number of simultaneously queued waiters
   * @param executor the executor on which waiters are resumed
   * @throws IllegalArgumentException if {@code concurrencyLevel} is not positive
   * @see #AsyncExclusiveLock(int)
   */
  public AsyncExclusiveLock(final int concurrencyLevel, final Executor executor) {
    this(concurrencyLevel, executor, true);
  }

  private AsyncExclusiveLock(final int concurrencyLevel, final Executor executor,
      final boolean runContinuationsAsynchronously) {
    super(executor, runContinuationsAsynchronously);
    if (concurrencyLevel <= 0) {
      throw new IllegalArgumentException(
          String.format("concurrencyLevel must be positive, given %d", concurrencyLevel));
    }
    this.pool = new ConstrainedValueTaskPool<>(concurrencyLevel, this::newNode);
  }

  private ExclusiveNode newNode(final Consumer<ExclusiveNode> backToPool) {
    return new ExclusiveNode(this, backToPool);
  }

  private boolean tryAcquireCore() {
    if (this.acquired) {
      return false;
    }
    this.acquired = true;
    return true;
  }

  /**
   * @return true if the lock is currently held
   */
  public synchronized boolean isLockAcquired() {
    return this.acquired;
  }

  /**
   * Acquires the lock if it is free, without waiting
   *
   * @return true if the lock was acquired
   * @throws ObjectDisposedException if this lock has been disposed or its disposal was requested
   */
  public synchronized boolean tryAcquire() {
    throwIfDisposedOrDisposing();
    return tryAcquireCore();
  }

  /**
   * Acquires the lock, waiting at most {@code timeout}
   *
   * @param timeout how long to wait; {@link Timeouts#INFINITE} to wait without limit
   * @param signal cancels the wait
   * @return a stage completed with true once the lock is acquired, or with false if the timeout
   *         elapsed first. Completes exceptionally with
   *         {@link java.util.concurrent.CancellationException} if {@code signal} is canceled first
   * @throws ObjectDisposedException if this lock has been disposed
   */
  public CompletionStage<Boolean> tryAcquireAsync(final Duration timeout,
      final CancellationSignal signal) {
    return waitNoTimeoutAsync(timeout, signal, this::tryAcquireCore, this.pool);
  }

  /**
   * @see #tryAcquireAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Boolean> tryAcquireAsync(final Duration timeout) {
    return tryAcquireAsync(timeout, CancellationSignal.none());
  }

  /**
   * Acquires the lock, waiting at most {@code timeout}
   *
   * @return a stage completed once the lock is acquired. Completes exceptionally with
   *         {@link java.util.concurrent.TimeoutException} if the timeout elapses first
   * @see #tryAcquireAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> acquireAsync(final Duration timeout,
      final CancellationSignal signal) {
    return waitWithTimeoutAsync(timeout, signal, this::tryAcquireCore, this.pool);
  }

  /**
   * @see #acquireAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> acquireAsync(final CancellationSignal signal) {
    return acquireAsync(Timeouts.INFINITE, signal);
  }

  /**
   * @see #acquireAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> acquireAsync() {
    return acquireAsync(Timeouts.INFINITE, CancellationSignal.none());
  }

  /**
   * Releases the lock, granting it to the first queued waiter if there is one
   *
   * @throws IllegalMonitorStateException if the lock is not held
   * @throws ObjectDisposedException if this lock has been disposed
   */
  public void release() {
    changeState(() -> {
      if (!this.acquired) {
        throw new IllegalMonitorStateException("the lock is not held");
      }
      this.acquired = false;
    });
  }

  @Override
  protected final void drainWaitQueue() {
    for (WaitNode current = getFirst(), next; current != null && !this.acquired; current = next) {
      next = current.getNext();
      // a completed node is only removed
      if (grant(current)) {
        this.acquired = true;
      }
    }
  }

  @Override
  protected final boolean isReadyToDispose() {
    return !this.acquired;
  }

  @Override
  public String toString() {
    synchronized (this) {
      return "AsyncExclusiveLock [acquired=" + this.acquired
          + ", queueLength=" + getQueueLength()
          + ", disposed=" + isDisposed() + "]";
    }
  }

  private static final class ExclusiveNode extends WaitNode {
    private final Consumer<ExclusiveNode> backToPool;

    ExclusiveNode(final AsyncExclusiveLock owner, final Consumer<ExclusiveNode> backToPool) {
      super(owner);
      this.backToPool = backToPool;
    }

    @Override
    protected void returnToPool() {
      this.backToPool.accept(this);
    }
  }
}

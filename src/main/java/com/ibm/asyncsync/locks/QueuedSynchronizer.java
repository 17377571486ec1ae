/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.locks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import com.ibm.asyncsync.tasks.CancellationSignal;
import com.ibm.asyncsync.tasks.ValueCompletionSource;
import com.ibm.asyncsync.util.StageSupport;
import com.ibm.asyncsync.util.Timeouts;

/**
 * A base for asynchronous synchronization primitives which keep their waiters in a FIFO queue.
 * <p>
 * The state of a primitive and its queue are guarded by the monitor of the primitive instance.
 * Subclasses try a non-waiting acquisition under that monitor, and otherwise enqueue a
 * {@link WaitNode} whose stage is returned to the caller. After every change of the state the
 * queue is {@link #drainWaitQueue() drained}: the subclass walks the queue from its head and
 * {@link #grant(WaitNode) grants} the requests which have become compatible with the state,
 * stopping at the first which is not.
 * <p>
 * Granted waiters are resumed only after the monitor has been released. Dependents of the stage of
 * a granted waiter may therefore freely use the primitive again, including releasing it from the
 * same thread, and such recursive releases are unrolled iteratively rather than growing the stack.
 * <p>
 * A primitive may be disposed with {@link #close()}, which fails every queued waiter immediately,
 * or with {@link #disposeAsync()}, which waits until the primitive is not held. Either way every
 * subsequent operation fails with {@link ObjectDisposedException}.
 */
public abstract class QueuedSynchronizer implements AutoCloseable {

  /*
   * Stack unrolling of granted waiters works like the one of a fair semaphore: the first
   * state-changing call on a thread finds the thread local list empty and becomes the thread
   * leader. Grants are appended to the list while the monitor is held, and the leader resumes them
   * in insertion order after leaving the monitor. A resumed waiter which changes the state of any
   * synchronizer on the same thread finds the list non-empty, appends its own grants and returns;
   * the leader picks them up once the stack unwinds.
   *
   * Each entry carries the token of the wait it granted. A node is reset and returned to its pool
   * once its outcome is consumed, and a resumption carrying an outdated token is ignored.
   */

  // specifically array list in order to imply indexability, entries are added during iteration
  private static final ThreadLocal<ArrayList<Resumption>> PENDING_RESUMPTIONS =
      ThreadLocal.withInitial(ArrayList::new);

  private final Executor executor;
  private final boolean runContinuationsAsynchronously;

  // guarded by this
  private WaitNode first, last;
  private int queueLength;
  private CompletableFuture<Void> disposeTask;

  private volatile boolean disposed;

  /**
   * Creates a synchronizer whose waiters are resumed on the thread which grants them
   */
  protected QueuedSynchronizer() {
    this(ForkJoinPool.commonPool(), false);
  }

  /**
   * @param executor the executor used to resume waiters asynchronously
   * @param runContinuationsAsynchronously if true, waiters are resumed on {@code executor}
   *        instead of the thread which grants them
   */
  protected QueuedSynchronizer(final Executor executor,
      final boolean runContinuationsAsynchronously) {
    this.executor = Objects.requireNonNull(executor);
    this.runContinuationsAsynchronously = runContinuationsAsynchronously;
  }

  /**
   * Re-evaluates the queue after a change of the state. Implementations walk the queue from
   * {@link #getFirst()}, remove completed nodes, {@link #grant(WaitNode) grant} the nodes which
   * are compatible with the current state and return as soon as the next node is not.
   * <p>
   * Always called while holding the monitor of this synchronizer.
   */
  protected abstract void drainWaitQueue();

  /**
   * @return true if nothing holds this synchronizer, so that a requested disposal can proceed.
   *         Called while holding the monitor of this synchronizer
   */
  protected abstract boolean isReadyToDispose();

  /**
   * @return the first node of the queue, or null if the queue is empty. Must hold the monitor
   */
  protected final WaitNode getFirst() {
    assert Thread.holdsLock(this);
    return this.first;
  }

  private void enqueueNode(final WaitNode node) {
    assert Thread.holdsLock(this);
    assert !node.queued;

    node.queued = true;
    node.previous = this.last;
    if (this.last == null) {
      this.first = node;
    } else {
      this.last.next = node;
    }
    this.last = node;
    this.queueLength++;
  }

  /**
   * Unlinks a node from the queue. Does nothing if the node is not queued. Must hold the monitor
   *
   * @param node the node to remove
   */
  protected final void removeNode(final WaitNode node) {
    assert Thread.holdsLock(this);
    if (!node.queued) {
      return;
    }

    final WaitNode previous = node.previous, next = node.next;
    if (previous == null) {
      this.first = next;
    } else {
      previous.next = next;
    }
    if (next == null) {
      this.last = previous;
    } else {
      next.previous = previous;
    }
    node.previous = node.next = null;
    node.queued = false;
    this.queueLength--;
  }

  /**
   * Completes the wait of a queued node successfully and removes the node from the queue. The
   * waiter is resumed once the current state-changing operation leaves the monitor. If the wait
   * has already completed (it was canceled or timed out) the node is only removed.
   * <p>
   * Must hold the monitor; only called from {@link #drainWaitQueue()}
   *
   * @param node the node to grant
   * @return true iff the wait was granted by this call
   */
  protected final boolean grant(final WaitNode node) {
    assert Thread.holdsLock(this);
    final OptionalInt token = node.completeNoResume(Boolean.TRUE);
    removeNode(node);
    if (token.isPresent()) {
      PENDING_RESUMPTIONS.get().add(new Resumption(node, (short) token.getAsInt()));
      return true;
    }
    return false;
  }

  /**
   * Waits until {@code fastPath} succeeds, either immediately or after the node supplied by
   * {@code nodeFactory} is granted by a later drain.
   *
   * @param timeout how long to wait; the returned stage completes with false if it elapses
   * @param signal the signal which cancels the wait
   * @param fastPath attempts the acquisition without waiting, called while holding the monitor
   * @param nodeFactory rents a node describing the request, called while holding the monitor
   * @return a stage completed with true once acquired, or with false after timing out. The stage
   *         completes exceptionally with {@link CancellationException} if the wait is canceled
   * @throws ObjectDisposedException if this synchronizer has been disposed or its disposal was
   *         requested
   * @throws IllegalArgumentException if {@code timeout} is negative and not infinite
   */
  protected final CompletionStage<Boolean> waitNoTimeoutAsync(final Duration timeout,
      final CancellationSignal signal, final BooleanSupplier fastPath,
      final Supplier<? extends WaitNode> nodeFactory) {
    Timeouts.validate(timeout);
    Objects.requireNonNull(signal, "signal");

    final WaitNode node;
    final OptionalInt token;
    synchronized (this) {
      throwIfDisposedOrDisposing();
      if (fastPath.getAsBoolean()) {
        return StageSupport.booleanStage(true);
      }
      if (timeout.isZero()) {
        return StageSupport.booleanStage(false);
      }
      if (signal.isCancellationRequested()) {
        return StageSupport.exceptionalStage(new CancellationException("the wait was canceled"));
      }

      node = nodeFactory.get();
      enqueueNode(node);
      token = node.prepareWait(timeout, signal);
    }

    // nodes are rented in WAIT_FOR_ACTIVATION, so preparing them always succeeds
    assert token.isPresent() : "rented node was not idle: " + node;
    return node.toStage((short) token.getAsInt());
  }

  /**
   * Like {@link #waitNoTimeoutAsync(Duration, CancellationSignal, BooleanSupplier, Supplier)}, but
   * the returned stage completes exceptionally with {@link TimeoutException} if {@code timeout}
   * elapses
   */
  protected final CompletionStage<Void> waitWithTimeoutAsync(final Duration timeout,
      final CancellationSignal signal, final BooleanSupplier fastPath,
      final Supplier<? extends WaitNode> nodeFactory) {
    return waitNoTimeoutAsync(timeout, signal, fastPath, nodeFactory).thenApply(acquired -> {
      if (!acquired) {
        throw new CompletionException(new TimeoutException(
            String.format("could not acquire %s within %s", getClass().getSimpleName(), timeout)));
      }
      return null;
    });
  }

  /**
   * Applies a change of the state and drains the queue, or completes a requested disposal if the
   * change made this synchronizer ready for it. Waiters granted by the drain are resumed after the
   * monitor is released.
   *
   * @param action the change, run while holding the monitor. May throw to reject the change, for
   *        example {@link IllegalMonitorStateException} when releasing a lock which is not held
   * @throws ObjectDisposedException if this synchronizer has been disposed
   */
  protected final void changeState(final Runnable action) {
    final ArrayList<Resumption> pending = PENDING_RESUMPTIONS.get();
    final boolean leader = pending.isEmpty();
    final CompletableFuture<Void> disposal;
    synchronized (this) {
      throwIfDisposed();
      action.run();
      disposal = drainOrDispose();
    }
    finish(pending, leader, disposal);
  }

  /**
   * Called on the consuming thread once the outcome of a node's wait has been consumed. A node
   * still queued at this point was canceled or timed out; removing it may unblock the nodes behind
   * it.
   */
  private void onNodeConsumed(final WaitNode node) {
    final ArrayList<Resumption> pending = PENDING_RESUMPTIONS.get();
    final boolean leader = pending.isEmpty();
    CompletableFuture<Void> disposal = null;
    synchronized (this) {
      if (node.queued) {
        removeNode(node);
        if (!this.disposed) {
          disposal = drainOrDispose();
        }
      }
    }
    finish(pending, leader, disposal);
  }

  /**
   * @return the dispose task to complete if the disposal happened, else null
   */
  private CompletableFuture<Void> drainOrDispose() {
    assert Thread.holdsLock(this);
    if (this.disposeTask != null && isReadyToDispose()) {
      return disposeCore();
    }
    drainWaitQueue();
    return null;
  }

  private CompletableFuture<Void> disposeCore() {
    assert Thread.holdsLock(this);
    this.disposed = true;

    final ArrayList<Resumption> pending = PENDING_RESUMPTIONS.get();
    for (WaitNode current = this.first, next; current != null; current = next) {
      next = current.next;
      final OptionalInt token = current.failNoResume(
          new ObjectDisposedException(getClass().getSimpleName()));
      removeNode(current);
      if (token.isPresent()) {
        pending.add(new Resumption(current, (short) token.getAsInt()));
      }
    }
    return this.disposeTask;
  }

  private static void finish(final ArrayList<Resumption> pending, final boolean leader,
      final CompletableFuture<Void> disposal) {
    if (leader) {
      resumePending(pending);
    }
    if (disposal != null) {
      disposal.complete(null);
    }
  }

  private static void resumePending(final ArrayList<Resumption> pending) {
    RuntimeException failure = null;
    try {
      // nested state changes on this thread append to the list while we iterate
      for (int i = 0; i < pending.size(); i++) {
        final Resumption resumption = pending.get(i);
        try {
          resumption.node.resumeWait(resumption.token);
        } catch (final RuntimeException e) {
          if (failure == null) {
            failure = e;
          } else {
            failure.addSuppressed(e);
          }
        }
      }
    } finally {
      pending.clear();
    }
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * @throws ObjectDisposedException if this synchronizer has been disposed
   */
  protected final void throwIfDisposed() {
    if (this.disposed) {
      throw new ObjectDisposedException(getClass().getSimpleName());
    }
  }

  /**
   * Rejects new acquisitions once disposal has been requested. Must hold the monitor
   *
   * @throws ObjectDisposedException if this synchronizer has been disposed or its disposal was
   *         requested
   */
  protected final void throwIfDisposedOrDisposing() {
    assert Thread.holdsLock(this);
    if (this.disposed || this.disposeTask != null) {
      throw new ObjectDisposedException(getClass().getSimpleName());
    }
  }

  /**
   * @return true if this synchronizer has been disposed
   */
  public final boolean isDisposed() {
    return this.disposed;
  }

  /**
   * @return the number of waiters in the queue, including waiters which have been canceled or
   *         timed out and not yet removed
   */
  public final synchronized int getQueueLength() {
    return this.queueLength;
  }

  /**
   * @return true if any waiter is queued
   */
  public final boolean hasQueuedWaiters() {
    return getQueueLength() != 0;
  }

  /**
   * Disposes this synchronizer immediately. Every queued waiter fails with
   * {@link ObjectDisposedException}, as does every subsequent operation, including releases by
   * current holders. Does nothing if already disposed.
   */
  @Override
  public void close() {
    final ArrayList<Resumption> pending = PENDING_RESUMPTIONS.get();
    final boolean leader = pending.isEmpty();
    final CompletableFuture<Void> disposal;
    synchronized (this) {
      if (this.disposed) {
        return;
      }
      disposal = disposeCore();
    }
    finish(pending, leader, disposal);
  }

  /**
   * Disposes this synchronizer once nothing holds it. New acquisitions are rejected from now on;
   * current holders may still release. When the last holder releases, waiters still queued fail
   * with {@link ObjectDisposedException} and the returned stage completes.
   *
   * @return a stage completed once this synchronizer has been disposed
   */
  public CompletionStage<Void> disposeAsync() {
    final ArrayList<Resumption> pending = PENDING_RESUMPTIONS.get();
    final boolean leader = pending.isEmpty();
    final CompletableFuture<Void> result;
    CompletableFuture<Void> disposal = null;
    synchronized (this) {
      if (this.disposed && this.disposeTask == null) {
        return StageSupport.voidStage();
      }
      if (this.disposeTask == null) {
        this.disposeTask = new CompletableFuture<>();
      }
      result = this.disposeTask;
      if (!this.disposed && isReadyToDispose()) {
        disposal = disposeCore();
      }
    }
    finish(pending, leader, disposal);
    return result.minimalCompletionStage();
  }

  @Override
  public String toString() {
    synchronized (this) {
      return getClass().getSimpleName() + " [queueLength=" + this.queueLength
          + ", disposed=" + this.disposed + "]";
    }
  }

  /**
   * A queued request of a {@link QueuedSynchronizer}. Completes with true when granted, with false
   * when its wait times out, or exceptionally when canceled or when the synchronizer is disposed.
   * <p>
   * Nodes are pooled: once the outcome of a wait is consumed, the node removes itself from the
   * queue if it is still there, resets, and {@link #returnToPool() returns to its pool}.
   */
  protected abstract static class WaitNode extends ValueCompletionSource<Boolean> {
    private final QueuedSynchronizer owner;

    // guarded by owner
    private WaitNode previous, next;
    private boolean queued;

    protected WaitNode(final QueuedSynchronizer owner) {
      super(owner.executor, owner.runContinuationsAsynchronously);
      this.owner = owner;
    }

    /**
     * @return the node behind this one in the queue, or null. Must hold the monitor of the owner
     */
    protected final WaitNode getNext() {
      assert Thread.holdsLock(this.owner);
      return this.next;
    }

    /**
     * Gives this node back to the pool it was rented from. Called after the node has been reset
     */
    protected abstract void returnToPool();

    @Override
    protected final Boolean timedOutResult() {
      return Boolean.FALSE;
    }

    @Override
    protected final void afterConsumed() {
      try {
        this.owner.onNodeConsumed(this);
      } finally {
        reset();
        returnToPool();
      }
    }

    private OptionalInt completeNoResume(final Boolean result) {
      return trySetResultNoResume(null, result);
    }

    private OptionalInt failNoResume(final Throwable e) {
      return trySetExceptionNoResume(null, e);
    }

    private void resumeWait(final short token) {
      resume(token);
    }
  }

  private static final class Resumption {
    final WaitNode node;
    final short token;

    Resumption(final WaitNode node, final short token) {
      this.node = node;
      this.token = token;
    }
  }
}

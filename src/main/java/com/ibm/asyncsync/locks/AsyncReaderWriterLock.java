/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.locks;

import java.lang.invoke.VarHandle;
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
 * An asynchronous reader/writer lock with upgradeable read locks and optimistic reads.
 * <p>
 * The lock may be held by any number of readers, or by a single writer. A reader holding the only
 * read lock may {@link #upgradeToWriteLockAsync() upgrade} to the write lock, and a writer may
 * {@link #downgradeFromWriteLock() downgrade} to a read lock. Both kinds of holder give up the
 * lock with {@link #release()}; an upgraded read lock is released together with the write lock.
 * <p>
 * Waiters are granted in FIFO order: a queued writer (or upgrader) blocks every request queued
 * behind it, while a run of readers at the head of the queue is granted together. Requests which
 * can be satisfied immediately are granted without looking at the queue, so a non-waiting
 * acquisition may overtake queued waiters.
 * <p>
 * {@link #tryOptimisticRead()} returns a {@link LockStamp} which stays {@link #validate(LockStamp)
 * valid} until the next acquisition of the write lock, so that readers may proceed without
 * acquiring anything and check afterwards whether a writer interfered:
 *
 * <pre>
 * {@code
 * LockStamp stamp = lock.tryOptimisticRead();
 * int x = this.x, y = this.y;
 * if (!lock.validate(stamp)) {
 *   // fall back to the read lock
 * }
 * }
 * </pre>
 * <p>
 * This lock is not reentrant, and it is not bound to threads: any caller may release a lock
 * acquired by another.
 */
public class AsyncReaderWriterLock extends QueuedSynchronizer {

  private enum LockType {
    READ, UPGRADE, EXCLUSIVE
  }

  private final ValueTaskPool<ReadWriteNode> pool;
  private final State state = new State(Long.MIN_VALUE);

  /**
   * Creates a lock which allocates wait nodes on demand
   */
  public AsyncReaderWriterLock() {
    super();
    this.pool = new UnconstrainedValueTaskPool<>(this::newNode);
  }

  /**
   * Creates a lock which allocates wait nodes on demand and resumes waiters on the given executor
   *
   * @param executor the executor on which waiters are resumed
   */
  public AsyncReaderWriterLock(final Executor executor) {
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
  public AsyncReaderWriterLock(final int concurrencyLevel) {
    this(concurrencyLevel, ForkJoinPool.commonPool(), false);
  }

  /**
   * @param concurrencyLevel the maximum number of simultaneously queued waiters
   * @param executor the executor on which waiters are resumed
   * @throws IllegalArgumentException if {@code concurrencyLevel} is not positive
   * @see #AsyncReaderWriterLock(int)
   */
  public AsyncReaderWriterLock(final int concurrencyLevel, final Executor executor) {
    this(concurrencyLevel, executor, true);
  }

  private AsyncReaderWriterLock(final int concurrencyLevel, final Executor executor,
      final boolean runContinuationsAsynchronously) {
    super(executor, runContinuationsAsynchronously);
    if (concurrencyLevel <= 0) {
      throw new IllegalArgumentException(
          String.format("concurrencyLevel must be positive, given %d", concurrencyLevel));
    }
    this.pool = new ConstrainedValueTaskPool<>(concurrencyLevel, this::newNode);
  }

  private ReadWriteNode newNode(final Consumer<ReadWriteNode> backToPool) {
    return new ReadWriteNode(this, backToPool);
  }

  private ReadWriteNode rent(final LockType type) {
    final ReadWriteNode node = this.pool.get();
    node.type = type;
    return node;
  }

  private boolean tryAcquireReadLock() {
    if (this.state.isReadLockAllowed()) {
      this.state.acquireReadLock();
      return true;
    }
    return false;
  }

  private boolean tryAcquireWriteLock() {
    if (this.state.isWriteLockAllowed()) {
      this.state.acquireWriteLock();
      return true;
    }
    return false;
  }

  private boolean tryUpgradeToWriteLockCore() {
    if (this.state.isUpgradeToWriteLockAllowed()) {
      this.state.acquireWriteLock();
      return true;
    }
    return false;
  }

  /**
   * @return the number of read locks currently held
   */
  public long getCurrentReadCount() {
    return this.state.readLocks;
  }

  /**
   * @return true if any read lock is held
   */
  public boolean isReadLockHeld() {
    return getCurrentReadCount() != 0L;
  }

  /**
   * @return true if the write lock is held
   */
  public boolean isWriteLockHeld() {
    return this.state.writeLock;
  }

  /**
   * Returns a stamp for an optimistic read. The stamp is invalid from the start if the write lock
   * is currently held.
   *
   * @return a stamp to pass to {@link #validate(LockStamp)}
   * @throws ObjectDisposedException if this lock has been disposed
   */
  public synchronized LockStamp tryOptimisticRead() {
    throwIfDisposed();
    return this.state.writeLock ? LockStamp.INVALID : new LockStamp(this.state.version, true);
  }

  /**
   * Checks whether the write lock has been acquired since the given stamp was issued. Reads made
   * before this call are ordered before the check.
   *
   * @param stamp a stamp obtained from {@link #tryOptimisticRead()}
   * @return true if the stamp was valid when issued and no write lock has been acquired since
   */
  public boolean validate(final LockStamp stamp) {
    VarHandle.acquireFence();
    return stamp.valid && stamp.version == this.state.version;
  }

  /**
   * Acquires a read lock if the write lock is not held, without waiting
   *
   * @return true if the read lock was acquired
   * @throws ObjectDisposedException if this lock has been disposed or its disposal was requested
   */
  public synchronized boolean tryEnterReadLock() {
    throwIfDisposedOrDisposing();
    return tryAcquireReadLock();
  }

  /**
   * Acquires a read lock, waiting at most {@code timeout}
   *
   * @param timeout how long to wait; {@link Timeouts#INFINITE} to wait without limit
   * @param signal cancels the wait
   * @return a stage completed with true once the read lock is acquired, or with false if the
   *         timeout elapsed first. Completes exceptionally with
   *         {@link java.util.concurrent.CancellationException} if {@code signal} is canceled first
   * @throws IllegalArgumentException if {@code timeout} is negative and not infinite
   * @throws ObjectDisposedException if this lock has been disposed
   */
  public CompletionStage<Boolean> tryEnterReadLockAsync(final Duration timeout,
      final CancellationSignal signal) {
    return waitNoTimeoutAsync(timeout, signal, this::tryAcquireReadLock,
        () -> rent(LockType.READ));
  }

  /**
   * @see #tryEnterReadLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Boolean> tryEnterReadLockAsync(final Duration timeout) {
    return tryEnterReadLockAsync(timeout, CancellationSignal.none());
  }

  /**
   * Acquires a read lock, waiting at most {@code timeout}
   *
   * @param timeout how long to wait; {@link Timeouts#INFINITE} to wait without limit
   * @param signal cancels the wait
   * @return a stage completed once the read lock is acquired. Completes exceptionally with
   *         {@link java.util.concurrent.TimeoutException} if the timeout elapses first, or with
   *         {@link java.util.concurrent.CancellationException} if {@code signal} is canceled first
   * @throws IllegalArgumentException if {@code timeout} is negative and not infinite
   * @throws ObjectDisposedException if this lock has been disposed
   */
  public CompletionStage<Void> enterReadLockAsync(final Duration timeout,
      final CancellationSignal signal) {
    return waitWithTimeoutAsync(timeout, signal, this::tryAcquireReadLock,
        () -> rent(LockType.READ));
  }

  /**
   * @see #enterReadLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> enterReadLockAsync(final Duration timeout) {
    return enterReadLockAsync(timeout, CancellationSignal.none());
  }

  /**
   * @see #enterReadLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> enterReadLockAsync(final CancellationSignal signal) {
    return enterReadLockAsync(Timeouts.INFINITE, signal);
  }

  /**
   * @see #enterReadLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> enterReadLockAsync() {
    return enterReadLockAsync(Timeouts.INFINITE, CancellationSignal.none());
  }

  /**
   * Acquires the write lock if no lock is held, without waiting
   *
   * @return true if the write lock was acquired
   * @throws ObjectDisposedException if this lock has been disposed or its disposal was requested
   */
  public synchronized boolean tryEnterWriteLock() {
    throwIfDisposedOrDisposing();
    return tryAcquireWriteLock();
  }

  /**
   * Acquires the write lock if no lock is held and no write lock has been acquired since the given
   * stamp was issued
   *
   * @param stamp a stamp obtained from {@link #tryOptimisticRead()}
   * @return true if the write lock was acquired
   * @throws ObjectDisposedException if this lock has been disposed or its disposal was requested
   */
  public synchronized boolean tryEnterWriteLock(final LockStamp stamp) {
    throwIfDisposedOrDisposing();
    return validate(stamp) && tryAcquireWriteLock();
  }

  /**
   * Acquires the write lock, waiting at most {@code timeout}
   *
   * @return a stage completed with true once the write lock is acquired, or with false if the
   *         timeout elapsed first
   * @see #tryEnterReadLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Boolean> tryEnterWriteLockAsync(final Duration timeout,
      final CancellationSignal signal) {
    return waitNoTimeoutAsync(timeout, signal, this::tryAcquireWriteLock,
        () -> rent(LockType.EXCLUSIVE));
  }

  /**
   * @see #tryEnterWriteLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Boolean> tryEnterWriteLockAsync(final Duration timeout) {
    return tryEnterWriteLockAsync(timeout, CancellationSignal.none());
  }

  /**
   * Acquires the write lock, waiting at most {@code timeout}
   *
   * @return a stage completed once the write lock is acquired
   * @see #enterReadLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> enterWriteLockAsync(final Duration timeout,
      final CancellationSignal signal) {
    return waitWithTimeoutAsync(timeout, signal, this::tryAcquireWriteLock,
        () -> rent(LockType.EXCLUSIVE));
  }

  /**
   * @see #enterWriteLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> enterWriteLockAsync(final Duration timeout) {
    return enterWriteLockAsync(timeout, CancellationSignal.none());
  }

  /**
   * @see #enterWriteLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> enterWriteLockAsync(final CancellationSignal signal) {
    return enterWriteLockAsync(Timeouts.INFINITE, signal);
  }

  /**
   * @see #enterWriteLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> enterWriteLockAsync() {
    return enterWriteLockAsync(Timeouts.INFINITE, CancellationSignal.none());
  }

  /**
   * Upgrades the caller's read lock to the write lock if it is the only read lock held, without
   * waiting
   *
   * @return true if the lock was upgraded
   * @throws ObjectDisposedException if this lock has been disposed or its disposal was requested
   */
  public synchronized boolean tryUpgradeToWriteLock() {
    throwIfDisposedOrDisposing();
    return tryUpgradeToWriteLockCore();
  }

  /**
   * Upgrades the caller's read lock to the write lock once all other readers have released,
   * waiting at most {@code timeout}. Two readers upgrading at the same time wait for each other
   * forever unless one of them gives up.
   *
   * @return a stage completed with true once the lock is upgraded, or with false if the timeout
   *         elapsed first
   * @see #tryEnterReadLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Boolean> tryUpgradeToWriteLockAsync(final Duration timeout,
      final CancellationSignal signal) {
    return waitNoTimeoutAsync(timeout, signal, this::tryUpgradeToWriteLockCore,
        () -> rent(LockType.UPGRADE));
  }

  /**
   * @see #tryUpgradeToWriteLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Boolean> tryUpgradeToWriteLockAsync(final Duration timeout) {
    return tryUpgradeToWriteLockAsync(timeout, CancellationSignal.none());
  }

  /**
   * Upgrades the caller's read lock to the write lock, waiting at most {@code timeout}
   *
   * @return a stage completed once the lock is upgraded
   * @see #enterReadLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> upgradeToWriteLockAsync(final Duration timeout,
      final CancellationSignal signal) {
    return waitWithTimeoutAsync(timeout, signal, this::tryUpgradeToWriteLockCore,
        () -> rent(LockType.UPGRADE));
  }

  /**
   * @see #upgradeToWriteLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> upgradeToWriteLockAsync(final Duration timeout) {
    return upgradeToWriteLockAsync(timeout, CancellationSignal.none());
  }

  /**
   * @see #upgradeToWriteLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> upgradeToWriteLockAsync(final CancellationSignal signal) {
    return upgradeToWriteLockAsync(Timeouts.INFINITE, signal);
  }

  /**
   * @see #upgradeToWriteLockAsync(Duration, CancellationSignal)
   */
  public CompletionStage<Void> upgradeToWriteLockAsync() {
    return upgradeToWriteLockAsync(Timeouts.INFINITE, CancellationSignal.none());
  }

  /**
   * Releases the write lock if it is held, and otherwise one read lock
   *
   * @throws IllegalMonitorStateException if no lock is held
   * @throws ObjectDisposedException if this lock has been disposed
   */
  public void release() {
    changeState(() -> {
      if (this.state.isWriteLockAllowed()) {
        throw new IllegalMonitorStateException("the lock is not held");
      }
      this.state.exitLock();
    });
  }

  /**
   * Exchanges the write lock for a read lock without letting any writer in between. Readers queued
   * at the head of the queue are granted as well.
   *
   * @throws IllegalMonitorStateException if the write lock is not held
   * @throws ObjectDisposedException if this lock has been disposed
   */
  public void downgradeFromWriteLock() {
    changeState(() -> {
      if (!this.state.writeLock) {
        throw new IllegalMonitorStateException("the write lock is not held");
      }
      this.state.downgradeFromWriteLock();
    });
  }

  @Override
  protected final void drainWaitQueue() {
    for (ReadWriteNode current = (ReadWriteNode) getFirst(), next; current != null;
        current = next) {
      next = (ReadWriteNode) current.getNext();

      if (current.isCompleted()) {
        removeNode(current);
        continue;
      }

      switch (current.type) {
        case UPGRADE:
          if (!this.state.isUpgradeToWriteLockAllowed()) {
            return;
          }
          if (grant(current)) {
            this.state.acquireWriteLock();
            return;
          }
          break;
        case EXCLUSIVE:
          if (!this.state.isWriteLockAllowed()) {
            return;
          }
          if (grant(current)) {
            this.state.acquireWriteLock();
            return;
          }
          break;
        default:
          if (!this.state.isReadLockAllowed()) {
            return;
          }
          if (grant(current)) {
            this.state.acquireReadLock();
          }
          break;
      }
    }
  }

  @Override
  protected final boolean isReadyToDispose() {
    return this.state.isWriteLockAllowed();
  }

  @Override
  public String toString() {
    synchronized (this) {
      return "AsyncReaderWriterLock [readLocks=" + this.state.readLocks
          + ", writeLock=" + this.state.writeLock
          + ", queueLength=" + getQueueLength()
          + ", disposed=" + isDisposed() + "]";
    }
  }

  /**
   * A value identifying the acquisitions of the write lock seen by an optimistic read.
   *
   * @see AsyncReaderWriterLock#tryOptimisticRead()
   */
  public static final class LockStamp {
    static final LockStamp INVALID = new LockStamp(0L, false);

    private final long version;
    private final boolean valid;

    private LockStamp(final long version, final boolean valid) {
      this.version = version;
      this.valid = valid;
    }

    @Override
    public boolean equals(final Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof LockStamp)) {
        return false;
      }
      final LockStamp other = (LockStamp) obj;
      return this.version == other.version && this.valid == other.valid;
    }

    @Override
    public int hashCode() {
      return 31 * Long.hashCode(this.version) + Boolean.hashCode(this.valid);
    }

    @Override
    public String toString() {
      return this.valid ? "LockStamp [version=" + this.version + "]" : "LockStamp [invalid]";
    }
  }

  /**
   * Writes happen while holding the monitor of the lock, reads may happen without it
   */
  private static final class State {
    // incremented on every acquisition of the write lock
    private volatile long version;
    private volatile long readLocks;
    private volatile boolean writeLock;

    State(final long version) {
      this.version = version;
    }

    boolean isReadLockAllowed() {
      return !this.writeLock;
    }

    boolean isWriteLockAllowed() {
      return !this.writeLock && this.readLocks == 0L;
    }

    boolean isUpgradeToWriteLockAllowed() {
      return !this.writeLock && this.readLocks == 1L;
    }

    void acquireReadLock() {
      this.readLocks = this.readLocks + 1L;
    }

    void acquireWriteLock() {
      this.readLocks = 0L;
      this.writeLock = true;
      this.version = this.version + 1L;
    }

    void downgradeFromWriteLock() {
      this.writeLock = false;
      this.readLocks = 1L;
    }

    void exitLock() {
      if (this.writeLock) {
        this.writeLock = false;
        this.readLocks = 0L;
      } else {
        this.readLocks = this.readLocks - 1L;
      }
    }
  }

  private static final class ReadWriteNode extends WaitNode {
    private final Consumer<ReadWriteNode> backToPool;

    // guarded by the lock
    private LockType type = LockType.READ;

    ReadWriteNode(final AsyncReaderWriterLock owner, final Consumer<ReadWriteNode> backToPool) {
      super(owner);
      this.backToPool = backToPool;
    }

    @Override
    protected void returnToPool() {
      this.backToPool.accept(this);
    }
  }
}

/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.locks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.Assert;
import org.junit.Test;

import com.ibm.asyncsync.tasks.CancellationSource;
import com.ibm.asyncsync.tasks.pooling.PoolExhaustedException;
import com.ibm.asyncsync.util.Reference;
import com.ibm.asyncsync.util.TestUtil;

public class AsyncExclusiveLockTest {

  @Test
  public void testMutualExclusion() throws TimeoutException {
    final AsyncExclusiveLock lock = new AsyncExclusiveLock();
    Assert.assertTrue(lock.tryAcquire());
    Assert.assertTrue(lock.isLockAcquired());
    Assert.assertFalse(lock.tryAcquire());

    final CompletableFuture<Void> second = lock.acquireAsync().toCompletableFuture();
    Assert.assertFalse(second.isDone());

    lock.release();
    TestUtil.join(second, 2, TimeUnit.SECONDS);
    Assert.assertTrue(lock.isLockAcquired());

    lock.release();
    Assert.assertFalse(lock.isLockAcquired());
  }

  @Test
  public void testFifoOrder() throws TimeoutException {
    final AsyncExclusiveLock lock = new AsyncExclusiveLock();
    Assert.assertTrue(lock.tryAcquire());

    final List<Integer> order = new ArrayList<>();
    final List<CompletableFuture<Void>> waiters = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      final int id = i;
      waiters.add(lock.acquireAsync().thenRun(() -> order.add(id)).toCompletableFuture());
    }

    for (int i = 0; i < 3; i++) {
      lock.release();
      TestUtil.join(waiters.get(i), 2, TimeUnit.SECONDS);
      if (i + 1 < waiters.size()) {
        Assert.assertFalse(waiters.get(i + 1).isDone());
      }
    }
    Assert.assertEquals(List.of(0, 1, 2), order);
    lock.release();
  }

  @Test(expected = IllegalMonitorStateException.class)
  public void testReleaseWithoutLock() {
    new AsyncExclusiveLock().release();
  }

  @Test
  public void testTimeoutAndCancel() throws TimeoutException {
    final AsyncExclusiveLock lock = new AsyncExclusiveLock();
    Assert.assertTrue(lock.tryAcquire());

    Assert.assertFalse(TestUtil.join(lock.tryAcquireAsync(Duration.ofMillis(20)), 2,
        TimeUnit.SECONDS));
    Assert.assertTrue(TestUtil.joinFailure(lock.acquireAsync(Duration.ofMillis(20),
        new CancellationSource().getSignal()), 2, TimeUnit.SECONDS) instanceof TimeoutException);

    final CancellationSource cancellation = new CancellationSource();
    final CompletionStage<Void> canceled = lock.acquireAsync(cancellation.getSignal());
    final CompletableFuture<Void> next = lock.acquireAsync().toCompletableFuture();
    cancellation.cancel();
    Assert.assertTrue(
        TestUtil.joinFailure(canceled, 2, TimeUnit.SECONDS) instanceof CancellationException);
    Assert.assertEquals(1, lock.getQueueLength());

    // the canceled waiter is skipped
    lock.release();
    TestUtil.join(next, 2, TimeUnit.SECONDS);
    lock.release();
  }

  @Test
  public void testBoundedQueue() throws TimeoutException {
    final AsyncExclusiveLock lock = new AsyncExclusiveLock(2);
    Assert.assertTrue(lock.tryAcquire());
    final CompletableFuture<Void> first = lock.acquireAsync().toCompletableFuture();
    final CompletableFuture<Void> second = lock.acquireAsync().toCompletableFuture();
    try {
      lock.acquireAsync();
      Assert.fail("queued more waiters than the concurrency level");
    } catch (final PoolExhaustedException expected) {
    }

    lock.release();
    TestUtil.join(first, 2, TimeUnit.SECONDS);
    lock.release();
    TestUtil.join(second, 2, TimeUnit.SECONDS);
    lock.release();
  }

  @Test
  public void testBoundedQueueOnExecutor() throws TimeoutException {
    final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
      final Thread thread = new Thread(r, "exclusive-lock-continuations");
      thread.setDaemon(true);
      return thread;
    });
    try {
      final AsyncExclusiveLock lock = new AsyncExclusiveLock(1, executor);
      Assert.assertTrue(lock.tryAcquire());
      final CompletableFuture<String> waiter = lock.acquireAsync()
          .thenApply(ignored -> Thread.currentThread().getName()).toCompletableFuture();
      try {
        lock.acquireAsync();
        Assert.fail("queued more waiters than the concurrency level");
      } catch (final PoolExhaustedException expected) {
      }

      lock.release();
      Assert.assertEquals("exclusive-lock-continuations",
          TestUtil.join(waiter, 2, TimeUnit.SECONDS));
      Assert.assertTrue(lock.isLockAcquired());
      lock.release();
    } finally {
      executor.shutdown();
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidConcurrencyLevel() {
    new AsyncExclusiveLock(0, Runnable::run);
  }

  @Test
  public void testDisposeAsync() throws TimeoutException {
    final AsyncExclusiveLock lock = new AsyncExclusiveLock();
    Assert.assertTrue(lock.tryAcquire());
    final CompletableFuture<Void> waiter = lock.acquireAsync().toCompletableFuture();

    final CompletionStage<Void> disposal = lock.disposeAsync();
    Assert.assertFalse(disposal.toCompletableFuture().isDone());
    try {
      lock.tryAcquireAsync(Duration.ZERO);
      Assert.fail("acquired a lock being disposed");
    } catch (final ObjectDisposedException expected) {
    }
    try {
      lock.tryAcquire();
      Assert.fail("acquired a lock being disposed");
    } catch (final ObjectDisposedException expected) {
    }

    lock.release();
    TestUtil.join(disposal, 2, TimeUnit.SECONDS);
    Assert.assertTrue(lock.isDisposed());
    Assert.assertTrue(
        TestUtil.joinFailure(waiter, 2, TimeUnit.SECONDS) instanceof ObjectDisposedException);
  }

  @Test
  public void testStackOverflow() throws TimeoutException {
    final AsyncExclusiveLock lock = new AsyncExclusiveLock();
    Assert.assertTrue(lock.tryAcquire());
    final Reference<CompletionStage<?>> lastLock = new Reference<>(null);
    for (int i = 0; i < 100_000; i++) {
      lock.acquireAsync().thenRun(lock::release);
    }
    lastLock.set(lock.acquireAsync().thenRun(lock::release));

    lock.release();
    TestUtil.join(lastLock.get(), 15, TimeUnit.SECONDS);
    Assert.assertFalse(lock.isLockAcquired());
  }
}

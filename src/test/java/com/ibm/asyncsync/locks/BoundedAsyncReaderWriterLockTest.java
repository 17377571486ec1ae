/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.locks;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.Assert;
import org.junit.Test;

import com.ibm.asyncsync.tasks.pooling.PoolExhaustedException;
import com.ibm.asyncsync.util.TestUtil;

public class BoundedAsyncReaderWriterLockTest extends AbstractAsyncReaderWriterLockTest {

  @Override
  protected AsyncReaderWriterLock createLock() {
    return new AsyncReaderWriterLock(MAX_QUEUED);
  }

  @Override
  protected boolean isBounded() {
    return true;
  }

  @Test
  public void testExhaustedQueue() throws TimeoutException {
    final AsyncReaderWriterLock lock = createLock();
    Assert.assertTrue(lock.tryEnterWriteLock());

    final CompletableFuture<?>[] reads = new CompletableFuture<?>[MAX_QUEUED];
    for (int i = 0; i < reads.length; i++) {
      reads[i] = lock.enterReadLockAsync().toCompletableFuture();
    }
    try {
      lock.enterReadLockAsync();
      Assert.fail("queued more waiters than the concurrency level");
    } catch (final PoolExhaustedException expected) {
    }
    // a non-waiting attempt needs no node
    Assert.assertFalse(lock.tryEnterReadLock());
    Assert.assertEquals(MAX_QUEUED, lock.getQueueLength());

    lock.release();
    TestUtil.join(CompletableFuture.allOf(reads), 2, TimeUnit.SECONDS);

    // the nodes went back to the pool
    final CompletableFuture<Void> write = lock.enterWriteLockAsync().toCompletableFuture();
    for (int i = 0; i < MAX_QUEUED; i++) {
      lock.release();
    }
    TestUtil.join(write, 2, TimeUnit.SECONDS);
    lock.release();
  }

  @Test
  public void testTimedOutNodesAreReused() throws TimeoutException {
    final AsyncReaderWriterLock lock = createLock();
    Assert.assertTrue(lock.tryEnterWriteLock());
    for (int i = 0; i < 3 * MAX_QUEUED; i++) {
      Assert.assertFalse(TestUtil.join(lock.tryEnterReadLockAsync(Duration.ofMillis(1)),
          2, TimeUnit.SECONDS));
    }
    Assert.assertEquals(0, lock.getQueueLength());
    lock.release();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidConcurrencyLevel() {
    new AsyncReaderWriterLock(0);
  }
}

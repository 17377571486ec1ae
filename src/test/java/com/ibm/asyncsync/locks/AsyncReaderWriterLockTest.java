/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.locks;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.Assert;
import org.junit.Test;

import com.ibm.asyncsync.util.TestUtil;

public class AsyncReaderWriterLockTest extends AbstractAsyncReaderWriterLockTest {

  @Override
  protected AsyncReaderWriterLock createLock() {
    return new AsyncReaderWriterLock();
  }

  @Override
  protected boolean isBounded() {
    return false;
  }

  @Test
  public void testGrantedOnExecutor() throws TimeoutException {
    final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
      final Thread thread = new Thread(r, "rwlock-continuations");
      thread.setDaemon(true);
      return thread;
    });
    try {
      final AsyncReaderWriterLock lock = new AsyncReaderWriterLock(executor);
      Assert.assertTrue(lock.tryEnterWriteLock());

      final CompletableFuture<String> read = lock.enterReadLockAsync()
          .thenApply(ignored -> Thread.currentThread().getName()).toCompletableFuture();
      lock.release();

      Assert.assertEquals("rwlock-continuations", TestUtil.join(read, 2, TimeUnit.SECONDS));
      Assert.assertEquals(1L, lock.getCurrentReadCount());
      lock.release();
    } finally {
      executor.shutdown();
    }
  }

  @Test
  public void testManyQueuedWaiters() throws TimeoutException {
    final AsyncReaderWriterLock lock = createLock();
    Assert.assertTrue(lock.tryEnterWriteLock());

    final CompletableFuture<?>[] reads = new CompletableFuture<?>[64];
    for (int i = 0; i < reads.length; i++) {
      reads[i] = lock.enterReadLockAsync().toCompletableFuture();
    }
    Assert.assertEquals(reads.length, lock.getQueueLength());
    Assert.assertTrue(lock.hasQueuedWaiters());

    lock.release();
    TestUtil.join(CompletableFuture.allOf(reads), 2, TimeUnit.SECONDS);
    Assert.assertEquals(reads.length, lock.getCurrentReadCount());
    Assert.assertFalse(lock.hasQueuedWaiters());
  }
}

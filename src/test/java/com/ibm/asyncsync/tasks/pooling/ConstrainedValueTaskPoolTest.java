/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks.pooling;

import org.junit.Assert;
import org.junit.Test;

public class ConstrainedValueTaskPoolTest extends AbstractValueTaskPoolTest {

  @Override
  protected ValueTaskPool<PooledSource> createPool() {
    return new ConstrainedValueTaskPool<>(CAPACITY, PooledSource::new);
  }

  @Test
  public void testExhaustion() {
    final ValueTaskPool<PooledSource> pool = createPool();
    final PooledSource first = pool.get();
    for (int i = 1; i < CAPACITY; i++) {
      pool.get();
    }
    Assert.assertEquals(0, pool.available());
    try {
      pool.get();
      Assert.fail("rented more sources than the capacity");
    } catch (final PoolExhaustedException expected) {
    }

    first.roundTrip("value");
    Assert.assertEquals(1, pool.available());
    Assert.assertSame(first, pool.get());
  }

  @Test
  public void testPreallocated() {
    final ConstrainedValueTaskPool<PooledSource> pool =
        new ConstrainedValueTaskPool<>(CAPACITY, PooledSource::new);
    Assert.assertEquals(CAPACITY, pool.capacity());
    Assert.assertEquals(CAPACITY, pool.available());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testForeignSource() {
    final ValueTaskPool<PooledSource> pool = createPool();
    final ValueTaskPool<PooledSource> other = createPool();
    final PooledSource source = other.get();
    pool.accept(source);
  }

  @Test(expected = IllegalStateException.class)
  public void testDoubleReturn() {
    final ValueTaskPool<PooledSource> pool = createPool();
    final PooledSource source = pool.get();
    pool.accept(source);
    pool.accept(source);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidCapacity() {
    new ConstrainedValueTaskPool<PooledSource>(0, PooledSource::new);
  }
}

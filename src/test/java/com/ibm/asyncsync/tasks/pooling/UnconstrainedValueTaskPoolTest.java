/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks.pooling;

import org.junit.Assert;
import org.junit.Test;

public class UnconstrainedValueTaskPoolTest extends AbstractValueTaskPoolTest {

  @Override
  protected ValueTaskPool<PooledSource> createPool() {
    return new UnconstrainedValueTaskPool<>(PooledSource::new);
  }

  @Test
  public void testGrowsOnDemand() {
    final ValueTaskPool<PooledSource> pool = createPool();
    Assert.assertEquals(0, pool.available());
    for (int i = 0; i < 10 * CAPACITY; i++) {
      pool.get();
    }
    Assert.assertEquals(0, pool.available());
  }

  @Test
  public void testReturnedSourceIsReused() {
    final ValueTaskPool<PooledSource> pool = createPool();
    final PooledSource source = pool.get();
    source.roundTrip("value");
    Assert.assertSame(source, pool.get());
  }
}

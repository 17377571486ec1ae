/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks.pooling;

import java.util.function.Consumer;
import java.util.function.Supplier;

import com.ibm.asyncsync.tasks.ManualResetCompletionSource;

/**
 * A pool of completion sources. {@link #get()} rents a source which is ready for a new wait, and
 * {@link #accept(ManualResetCompletionSource) accept} takes back a source after its outcome has
 * been consumed and it has been reset.
 * <p>
 * Pooled sources are usually constructed with the pool's {@code accept} method as their
 * "back to pool" callback, and return themselves from
 * {@code ManualResetCompletionSource#afterConsumed()}.
 *
 * @param <T> the type of pooled source
 */
public interface ValueTaskPool<T extends ManualResetCompletionSource>
    extends Supplier<T>, Consumer<T> {

  /**
   * Rents a source
   *
   * @return a source in the {@code WAIT_FOR_ACTIVATION} status
   * @throws PoolExhaustedException if the pool is bounded and every source is rented
   */
  @Override
  T get();

  /**
   * Returns a rented source to the pool
   *
   * @param source a source which was rented from this pool and has since been reset
   * @throws IllegalArgumentException if the source is not ready for a new wait
   */
  @Override
  void accept(T source);

  /**
   * @return the number of sources currently available to rent without allocating
   */
  int available();
}

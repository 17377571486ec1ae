/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks.pooling;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;
import java.util.function.Function;

import com.ibm.asyncsync.tasks.ManualResetCompletionSource;
import com.ibm.asyncsync.tasks.ManualResetCompletionSourceStatus;

/**
 * A {@link ValueTaskPool} which allocates a new source whenever its free list is empty. The pool
 * grows to the largest number of sources simultaneously rented and never shrinks.
 *
 * @param <T> the type of pooled source
 */
public final class UnconstrainedValueTaskPool<T extends ManualResetCompletionSource>
    implements ValueTaskPool<T> {
  private final ConcurrentLinkedQueue<T> free = new ConcurrentLinkedQueue<>();
  private final Function<? super Consumer<T>, ? extends T> factory;

  /**
   * @param factory creates a source given the pool's return callback
   */
  public UnconstrainedValueTaskPool(final Function<? super Consumer<T>, ? extends T> factory) {
    this.factory = Objects.requireNonNull(factory);
  }

  @Override
  public T get() {
    final T source = this.free.poll();
    return source != null ? source : Objects.requireNonNull(this.factory.apply(this));
  }

  @Override
  public void accept(final T source) {
    if (source.getStatus() != ManualResetCompletionSourceStatus.WAIT_FOR_ACTIVATION) {
      throw new IllegalArgumentException(
          String.format("a returned source must be reset, found status %s", source.getStatus()));
    }
    this.free.offer(source);
  }

  @Override
  public int available() {
    return this.free.size();
  }

  @Override
  public String toString() {
    return "UnconstrainedValueTaskPool [available=" + available() + "]";
  }
}

/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks.pooling;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Consumer;
import java.util.function.Function;

import com.ibm.asyncsync.tasks.ManualResetCompletionSource;
import com.ibm.asyncsync.tasks.ManualResetCompletionSourceStatus;

/**
 * A {@link ValueTaskPool} holding a fixed number of sources, all allocated up front. Renting more
 * sources than the capacity fails with {@link PoolExhaustedException} instead of allocating.
 * <p>
 * Each source owns one slot of the pool; a rented source leaves its slot empty until it is
 * returned, so a source which is not returned is never handed out twice.
 *
 * @param <T> the type of pooled source
 */
public final class ConstrainedValueTaskPool<T extends ManualResetCompletionSource>
    implements ValueTaskPool<T> {
  private final AtomicReferenceArray<T> slots;
  // written only during construction
  private final Map<T, Integer> homeSlots;

  /**
   * @param capacity the number of sources in the pool
   * @param factory creates a source given the pool's return callback
   * @throws IllegalArgumentException if {@code capacity} is not positive
   */
  public ConstrainedValueTaskPool(final int capacity,
      final Function<? super Consumer<T>, ? extends T> factory) {
    if (capacity <= 0) {
      throw new IllegalArgumentException(
          String.format("pool capacity must be positive, given %d", capacity));
    }
    Objects.requireNonNull(factory);

    final AtomicReferenceArray<T> slots = new AtomicReferenceArray<>(capacity);
    final Map<T, Integer> homeSlots = new IdentityHashMap<>(capacity);
    for (int i = 0; i < capacity; i++) {
      final T source = Objects.requireNonNull(factory.apply(this));
      homeSlots.put(source, i);
      slots.set(i, source);
    }
    this.homeSlots = homeSlots;
    this.slots = slots;
  }

  /**
   * @return the total number of sources owned by the pool
   */
  public int capacity() {
    return this.slots.length();
  }

  @Override
  public T get() {
    for (int i = 0; i < this.slots.length(); i++) {
      if (this.slots.get(i) != null) {
        final T source = this.slots.getAndSet(i, null);
        if (source != null) {
          return source;
        }
      }
    }
    throw new PoolExhaustedException(this.slots.length());
  }

  @Override
  public void accept(final T source) {
    final Integer slot = this.homeSlots.get(Objects.requireNonNull(source));
    if (slot == null) {
      throw new IllegalArgumentException("the source was not allocated by this pool");
    }
    if (source.getStatus() != ManualResetCompletionSourceStatus.WAIT_FOR_ACTIVATION) {
      throw new IllegalArgumentException(
          String.format("a returned source must be reset, found status %s", source.getStatus()));
    }
    if (!this.slots.compareAndSet(slot, null, source)) {
      throw new IllegalStateException("the source was already returned to the pool");
    }
  }

  @Override
  public int available() {
    int count = 0;
    for (int i = 0; i < this.slots.length(); i++) {
      if (this.slots.get(i) != null) {
        count++;
      }
    }
    return count;
  }

  @Override
  public String toString() {
    return "ConstrainedValueTaskPool [capacity=" + capacity() + ", available=" + available() + "]";
  }
}

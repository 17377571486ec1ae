/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Utility methods for creating already completed {@link CompletionStage CompletionStages}
 */
public class StageSupport {
  private StageSupport() {}

  private static final CompletionStage<Void> VOID = CompletableFuture.completedStage(null);
  private static final CompletionStage<Boolean> TRUE = CompletableFuture.completedStage(true);
  private static final CompletionStage<Boolean> FALSE = CompletableFuture.completedStage(false);

  /**
   * Gets an already completed {@link CompletionStage} of Void. This common static instance can be
   * used as an alternative to {@code StageSupport.<Void>completedStage(null)}
   * <p>
   * The returned stage cannot be completed by its users, so a single instance is shared
   *
   * @return An immediately completed {@link CompletionStage} of {@code Void}
   */
  public static CompletionStage<Void> voidStage() {
    return VOID;
  }

  /**
   * Gets a shared, already completed {@link CompletionStage} holding the given boolean
   *
   * @param value the value held by the returned stage
   * @return an immediately completed stage
   */
  public static CompletionStage<Boolean> booleanStage(final boolean value) {
    return value ? TRUE : FALSE;
  }

  /**
   * Creates a {@link CompletionStage} that is already completed with the given value.
   * <p>
   * Non-Async methods on the returned stage will run their dependent actions immediately on the
   * calling thread.
   *
   * @param t the value to be held by the returned stage
   * @return a {@link CompletionStage} that has already been completed with {@code t}
   * @see #exceptionalStage(Throwable)
   */
  public static <T> CompletionStage<T> completedStage(final T t) {
    return CompletableFuture.completedStage(t);
  }

  /**
   * Creates a {@link CompletionStage} that is already completed exceptionally. This is the
   * exceptional analog of {@link #completedStage(Object)}.
   *
   * @param ex the exception that completes the returned stage
   * @return a {@link CompletionStage} that has already been completed exceptionally with {@code ex}
   * @see #completedStage(Object)
   */
  public static <T> CompletionStage<T> exceptionalStage(final Throwable ex) {
    return CompletableFuture.failedStage(ex);
  }
}

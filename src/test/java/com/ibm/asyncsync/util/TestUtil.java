/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.util;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class TestUtil {

  public static <T> T join(final CompletionStage<T> future) {
    return future.toCompletableFuture().join();
  }

  public static <T> T join(final CompletionStage<T> future, final long time,
      final TimeUnit timeUnit) throws TimeoutException {
    try {
      return future.toCompletableFuture().get(time, timeUnit);
    } catch (InterruptedException | ExecutionException e) {
      throw new CompletionException(e);
    }
  }

  /**
   * Waits for the given stage to complete exceptionally
   *
   * @return the exception which completed the stage, unwrapped from any {@link CompletionException}
   * @throws AssertionError if the stage completes normally
   * @throws TimeoutException if the stage does not complete in time
   */
  public static Throwable joinFailure(final CompletionStage<?> future, final long time,
      final TimeUnit timeUnit) throws TimeoutException {
    final Object result;
    try {
      result = future.toCompletableFuture().get(time, timeUnit);
    } catch (final CancellationException e) {
      return e;
    } catch (final ExecutionException e) {
      return e.getCause();
    } catch (final InterruptedException e) {
      throw new CompletionException(e);
    }
    throw new AssertionError("stage completed normally with " + result);
  }
}

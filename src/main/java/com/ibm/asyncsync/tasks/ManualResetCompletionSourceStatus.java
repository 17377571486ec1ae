/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks;

/**
 * The lifecycle of a {@link ManualResetCompletionSource}. A source moves forward through these
 * states in declaration order, and only {@link ManualResetCompletionSource#reset()} moves it back
 * to {@link #WAIT_FOR_ACTIVATION}.
 */
public enum ManualResetCompletionSourceStatus {
  /**
   * The source is idle and may be armed for a new wait.
   */
  WAIT_FOR_ACTIVATION,

  /**
   * The source is armed; it is waiting for a result, a failure, cancellation or timeout.
   */
  ACTIVATED,

  /**
   * The source has completed and its outcome has not been consumed yet.
   */
  WAIT_FOR_CONSUMPTION,

  /**
   * The outcome has been consumed; the source may be reset and reused.
   */
  CONSUMED
}

/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks;

/**
 * Options controlling how a continuation attached to a {@link ManualResetCompletionSource} is
 * invoked.
 */
public enum ContinuationFlags {
  /**
   * Capture the {@link SchedulingContext} installed on the attaching thread, if any, and post the
   * continuation to it when the source completes.
   */
  USE_SCHEDULING_CONTEXT,
  /**
   * Capture the {@link ExecutionContext} of the attaching thread and restore it while the
   * continuation runs.
   */
  FLOW_EXECUTION_CONTEXT
}

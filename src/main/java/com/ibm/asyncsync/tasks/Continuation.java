/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks;

import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * A callback attached to a {@link ManualResetCompletionSource}, together with the environment
 * captured from the attaching thread.
 */
final class Continuation implements Runnable {
  private final Consumer<Object> action;
  private final Object state;
  private final SchedulingContext schedulingContext;
  private final ExecutionContext executionContext;

  Continuation(final Consumer<Object> action, final Object state,
      final Set<ContinuationFlags> flags) {
    this.action = action;
    this.state = state;
    this.schedulingContext = flags.contains(ContinuationFlags.USE_SCHEDULING_CONTEXT)
        ? SchedulingContext.current()
        : null;

    // an empty context is restored as well, the completing thread's bindings must not leak in
    this.executionContext = flags.contains(ContinuationFlags.FLOW_EXECUTION_CONTEXT)
        ? ExecutionContext.capture()
        : null;
  }

  /**
   * Invokes the continuation from the attaching thread, which already carries the captured
   * execution context
   */
  void invokeOnCurrentContext(final boolean runAsynchronously, final Executor executor) {
    if (this.schedulingContext != null) {
      this.schedulingContext.post(this);
    } else if (runAsynchronously) {
      executor.execute(this);
    } else {
      this.action.accept(this.state);
    }
  }

  /**
   * Invokes the continuation from the completing thread
   */
  void invoke(final boolean runAsynchronously, final Executor executor) {
    if (this.schedulingContext != null) {
      this.schedulingContext.post(this);
    } else if (runAsynchronously) {
      executor.execute(this);
    } else {
      run();
    }
  }

  @Override
  public void run() {
    if (this.executionContext == null) {
      this.action.accept(this.state);
    } else {
      try (Scope ignored = this.executionContext.restore()) {
        this.action.accept(this.state);
      }
    }
  }
}

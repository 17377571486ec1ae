/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Provides asynchronous analogues of synchronization primitives. These primitives use
 * {@link java.util.concurrent.CompletionStage} to coordinate instead of blocking, and queue their
 * waiters in strict FIFO order using pooled {@link com.ibm.asyncsync.tasks.ValueCompletionSource
 * completion sources}.
 */
package com.ibm.asyncsync.locks;

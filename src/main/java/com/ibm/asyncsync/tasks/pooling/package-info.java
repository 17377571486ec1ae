/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Provides pools of {@link com.ibm.asyncsync.tasks.ManualResetCompletionSource completion sources}
 * so that waiting operations do not allocate a new source per wait.
 */
package com.ibm.asyncsync.tasks.pooling;

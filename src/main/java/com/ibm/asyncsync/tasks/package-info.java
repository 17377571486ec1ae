/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Provides reusable completion sources, which deliver the outcome of an asynchronous wait to a
 * single observer and can then be reset for the next wait, together with the cancellation and
 * context types they cooperate with.
 */
package com.ibm.asyncsync.tasks;

/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks.pooling;

/**
 * Thrown when a bounded {@link ValueTaskPool} is asked for a source while every one of its sources
 * is rented.
 */
public class PoolExhaustedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public PoolExhaustedException(final int capacity) {
    super(String.format("all %d pooled completion sources are in use", capacity));
  }
}

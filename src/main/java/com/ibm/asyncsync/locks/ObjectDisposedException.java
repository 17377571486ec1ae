/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.locks;

/**
 * Thrown when a synchronization primitive is used after it has been closed, or after its disposal
 * has been requested. Waits which are still queued when a primitive is closed fail with this
 * exception.
 */
public class ObjectDisposedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public ObjectDisposedException(final String objectName) {
    super(String.format("%s has been disposed", objectName));
  }
}

/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.util;

/**
 * sometimes you need a modifiable final variable...
 *
 * @param <T>
 */
public class Reference<T> {
  private T t;

  public Reference(final T t) {
    this.t = t;
  }

  public T get() {
    return this.t;
  }

  public void set(final T t) {
    this.t = t;
  }
}

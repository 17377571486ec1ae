/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.tasks;

/**
 * A region during which some thread-bound state is installed. Closing the scope restores the state
 * that was present before it was opened; scopes are meant to be used with try-with-resources and
 * closed on the thread that opened them.
 */
@FunctionalInterface
public interface Scope extends AutoCloseable {
  @Override
  void close();
}

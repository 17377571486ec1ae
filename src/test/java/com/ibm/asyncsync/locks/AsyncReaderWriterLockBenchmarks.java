/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-async-sync
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncsync.locks;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.Main;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Group;
import org.openjdk.jmh.annotations.GroupThreads;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.RunnerException;

import com.ibm.asyncsync.util.TestUtil;

public final class AsyncReaderWriterLockBenchmarks {
  private AsyncReaderWriterLockBenchmarks() {}

  @Fork(1)
  @State(Scope.Benchmark)
  @OutputTimeUnit(TimeUnit.NANOSECONDS)
  public static class NoCompete {
    AsyncReaderWriterLock rwlock;
    int value;

    @Param({"unbounded", "bounded"})
    String impl;

    @Setup
    public void setupBenchmark() {
      this.rwlock = AsyncReaderWriterLockBenchmarks.getImpl(this.impl);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @Warmup(iterations = 10, time = 2, timeUnit = TimeUnit.SECONDS)
    @Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
    public Object allReaders() {
      // blocking on the stage can skew multithreaded runs, but it is the only way to measure the
      // asynchronous path from outside
      TestUtil.join(this.rwlock.enterReadLockAsync());
      // do some work
      Blackhole.consumeCPU(20);
      this.rwlock.release();
      return this.rwlock;
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @Warmup(iterations = 10, time = 2, timeUnit = TimeUnit.SECONDS)
    @Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
    public Object allWriters() {
      TestUtil.join(this.rwlock.enterWriteLockAsync());
      Blackhole.consumeCPU(20);
      this.rwlock.release();
      return this.rwlock;
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @Warmup(iterations = 10, time = 2, timeUnit = TimeUnit.SECONDS)
    @Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
    public int optimisticReaders() {
      final AsyncReaderWriterLock.LockStamp stamp = this.rwlock.tryOptimisticRead();
      final int read = this.value;
      if (this.rwlock.validate(stamp)) {
        return read;
      }
      TestUtil.join(this.rwlock.enterReadLockAsync());
      try {
        return this.value;
      } finally {
        this.rwlock.release();
      }
    }
  }

  @Fork(1)
  @State(Scope.Benchmark)
  @OutputTimeUnit(TimeUnit.NANOSECONDS)
  public static class Compete3to1ReadersWriters {
    AsyncReaderWriterLock rwlock;

    @Param({"unbounded", "bounded"})
    String impl;

    @Setup
    public void setupBenchmark() {
      this.rwlock = AsyncReaderWriterLockBenchmarks.getImpl(this.impl);
    }

    @Benchmark
    @Group("compete")
    @GroupThreads(3)
    @BenchmarkMode(Mode.AverageTime)
    @Warmup(iterations = 10, time = 2, timeUnit = TimeUnit.SECONDS)
    @Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
    public Object readers() {
      TestUtil.join(this.rwlock.enterReadLockAsync());
      Blackhole.consumeCPU(20);
      this.rwlock.release();
      return this.rwlock;
    }

    @Benchmark
    @Group("compete")
    @GroupThreads(1)
    @BenchmarkMode(Mode.AverageTime)
    @Warmup(iterations = 10, time = 2, timeUnit = TimeUnit.SECONDS)
    @Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
    public Object writers() {
      TestUtil.join(this.rwlock.enterWriteLockAsync());
      Blackhole.consumeCPU(20);
      this.rwlock.release();
      return this.rwlock;
    }
  }

  private static AsyncReaderWriterLock getImpl(final String impl) {
    switch (impl) {
      case "unbounded":
        return new AsyncReaderWriterLock();
      case "bounded":
        // one node per benchmark thread
        return new AsyncReaderWriterLock(4);
      default:
        throw new IllegalArgumentException("unknown lock configuration:" + impl);
    }
  }

  public static void main(final String[] args) throws RunnerException, IOException {
    Main.main(args);
  }
}

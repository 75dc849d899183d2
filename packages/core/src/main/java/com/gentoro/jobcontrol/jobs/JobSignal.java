package com.gentoro.jobcontrol.jobs;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cancellation and pause flags shared between the manager (writer) and the worker running the
 * job (reader). Raising cancellation also releases a paused worker.
 */
final class JobSignal {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition released = lock.newCondition();
  private volatile boolean cancelled;
  private volatile boolean paused;

  void cancel() {
    lock.lock();
    try {
      cancelled = true;
      released.signalAll();
    } finally {
      lock.unlock();
    }
  }

  void pause() {
    paused = true;
  }

  void resume() {
    lock.lock();
    try {
      paused = false;
      released.signalAll();
    } finally {
      lock.unlock();
    }
  }

  boolean isCancelled() {
    return cancelled;
  }

  boolean isPaused() {
    return paused;
  }

  /** Parks the calling worker while the job is paused and not cancelled. */
  void awaitResumed() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (paused && !cancelled) {
        released.await();
      }
    } finally {
      lock.unlock();
    }
  }
}

package com.copytrading.engine.order;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/** Fixed pool of locks; keys hash onto stripes so one entity is always serialized. */
public class StripedLocks {
  private final ReentrantLock[] stripes;

  public StripedLocks(int stripeCount) {
    if (stripeCount < 1) {
      throw new IllegalArgumentException("stripeCount must be >= 1");
    }
    this.stripes = new ReentrantLock[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  public <T> T withLock(Object key, Supplier<T> action) {
    ReentrantLock lock = stripeFor(key);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /** Runs the action only when the stripe is free; returns false when it was busy. */
  public boolean tryWithLock(Object key, Runnable action) {
    ReentrantLock lock = stripeFor(key);
    if (!lock.tryLock()) {
      return false;
    }
    try {
      action.run();
      return true;
    } finally {
      lock.unlock();
    }
  }

  private ReentrantLock stripeFor(Object key) {
    return stripes[Math.floorMod(key.hashCode(), stripes.length)];
  }
}

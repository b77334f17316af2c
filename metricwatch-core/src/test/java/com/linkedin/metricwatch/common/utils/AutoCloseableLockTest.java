/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricwatch.common.utils;

import java.util.concurrent.locks.ReentrantLock;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AutoCloseableLockTest {

  @Test
  public void testLockHeldUntilClose() {
    ReentrantLock lock = new ReentrantLock();
    try (AutoCloseableLock ignored = new AutoCloseableLock(lock)) {
      assertTrue(lock.isHeldByCurrentThread());
    }
    assertFalse(lock.isHeldByCurrentThread());
  }

  @Test
  public void testIdempotentClose() {
    ReentrantLock lock = new ReentrantLock();
    AutoCloseableLock autoCloseableLock = new AutoCloseableLock(lock);
    assertFalse(autoCloseableLock.isClosed());
    autoCloseableLock.close();
    assertTrue(autoCloseableLock.isClosed());

    // A second close must not unlock a lock this thread no longer holds.
    autoCloseableLock.close();
    assertTrue(autoCloseableLock.isClosed());
    assertFalse(lock.isLocked());
  }
}

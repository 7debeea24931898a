/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.core;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 在途请求计数器
 *
 * <p>{@link #markClosed()} 之后拒绝新的进入，{@link #awaitDrained(Duration)} 等待已进入的请求全部退出或超时。
 */
public final class InFlightTracker {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition drained = lock.newCondition();
  private int active;
  private boolean closed;

  /**
   * 尝试登记一个新请求
   *
   * @return 已关闭时返回 false
   */
  public boolean tryEnter() {
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      active++;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** 请求结束，必须与成功的 {@link #tryEnter()} 成对调用 */
  public void exit() {
    lock.lock();
    try {
      if (active > 0) {
        active--;
      }
      if (active == 0) {
        drained.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * 标记关闭
   *
   * @return 首次关闭返回 true，重复关闭返回 false
   */
  public boolean markClosed() {
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      closed = true;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * 等待在途请求全部结束
   *
   * @param timeout 最长等待时间
   * @return 在超时前全部结束返回 true
   * @throws InterruptedException 等待被中断
   */
  public boolean awaitDrained(Duration timeout) throws InterruptedException {
    long remainingNanos = timeout.toNanos();
    lock.lock();
    try {
      while (active > 0) {
        if (remainingNanos <= 0) {
          return false;
        }
        remainingNanos = drained.awaitNanos(remainingNanos);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  public int getActiveCount() {
    lock.lock();
    try {
      return active;
    } finally {
      lock.unlock();
    }
  }
}

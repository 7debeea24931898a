/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.core;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 指数退避计算器
 *
 * <p>用于请求重试时计算等待间隔。每次调用 {@link #nextBackoff()} 返回当前间隔并将下一次间隔乘以
 * 乘数，直到达到上限。
 */
public final class ExponentialBackoff {

  private final long minIntervalMs;
  private final long maxIntervalMs;
  private final double multiplier;
  private final AtomicLong currentIntervalMs;

  /**
   * 创建指数退避计算器
   *
   * @param minInterval 初始间隔
   * @param maxInterval 最大间隔
   * @param multiplier 乘数
   */
  public ExponentialBackoff(Duration minInterval, Duration maxInterval, double multiplier) {
    this(minInterval.toMillis(), maxInterval.toMillis(), multiplier);
  }

  /**
   * 创建指数退避计算器
   *
   * @param minIntervalMs 初始间隔（毫秒）
   * @param maxIntervalMs 最大间隔（毫秒）
   * @param multiplier 乘数
   */
  public ExponentialBackoff(long minIntervalMs, long maxIntervalMs, double multiplier) {
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    this.minIntervalMs = minIntervalMs;
    this.maxIntervalMs = Math.max(minIntervalMs, maxIntervalMs);
    this.multiplier = multiplier;
    this.currentIntervalMs = new AtomicLong(minIntervalMs);
  }

  /**
   * 获取下一个退避间隔并更新内部状态
   *
   * @return 退避间隔（毫秒）
   */
  public long nextBackoff() {
    long current = currentIntervalMs.get();
    long next = Math.min((long) (current * multiplier), maxIntervalMs);
    currentIntervalMs.set(next);
    return current;
  }


  /**
   * 将外部给出的等待时间限制在最大间隔内
   *
   * @param hint 建议等待时间（例如 Retry-After）
   * @return 实际等待时间（毫秒）
   */
  public long clamp(Duration hint) {
    long hintMs = Math.max(0, hint.toMillis());
    return Math.min(hintMs, maxIntervalMs);
  }

  @Override
  public String toString() {
    return "ExponentialBackoff{"
        + "minIntervalMs="
        + minIntervalMs
        + ", maxIntervalMs="
        + maxIntervalMs
        + ", multiplier="
        + multiplier
        + ", currentIntervalMs="
        + currentIntervalMs.get()
        + '}';
  }
}

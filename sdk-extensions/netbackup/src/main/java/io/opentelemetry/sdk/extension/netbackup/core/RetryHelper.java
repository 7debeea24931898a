/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.core;

import io.opentelemetry.sdk.extension.netbackup.client.NetBackupException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 重试工具类
 *
 * <p>提供通用的重试机制，支持：
 * <ul>
 *   <li>配置最大重试次数
 *   <li>指数退避与最大等待时间
 *   <li>服务端给出的等待提示（Retry-After）
 *   <li>配置可重试异常的判断逻辑
 * </ul>
 *
 * <p>等待期间线程被中断时立即放弃，抛出 {@link NetBackupException.Type#CANCELLED}。
 */
public final class RetryHelper {

  private static final Logger logger = Logger.getLogger(RetryHelper.class.getName());

  private RetryHelper() {
    // 工具类不允许实例化
  }

  /**
   * 执行带重试的操作
   *
   * @param operation 要执行的操作
   * @param config 重试配置
   * @param <T> 返回值类型
   * @return 操作结果
   * @throws NetBackupException 如果所有重试都失败
   */
  public static <T> T executeWithRetry(Callable<T> operation, RetryConfig config) {
    return executeWithRetry(operation, config, null);
  }

  /**
   * 执行带重试的操作
   *
   * @param operation 要执行的操作
   * @param config 重试配置
   * @param listener 重试监听器
   * @param <T> 返回值类型
   * @return 操作结果
   * @throws NetBackupException 如果所有重试都失败
   */
  public static <T> T executeWithRetry(
      Callable<T> operation, RetryConfig config, @Nullable RetryListener listener) {

    ExponentialBackoff backoff =
        new ExponentialBackoff(config.initialDelayMs, config.maxDelayMs, config.backoffMultiplier);
    Exception lastException = null;
    int attempt = 0;

    while (attempt <= config.maxRetries) {
      try {
        T result = operation.call();
        if (attempt > 0 && listener != null) {
          listener.onRetrySuccess(attempt);
        }
        return result;

      } catch (Exception e) {
        lastException = e;
        boolean shouldRetry = config.retryPredicate.test(e) && attempt < config.maxRetries;

        if (listener != null) {
          listener.onRetryAttempt(attempt, e, shouldRetry);
        }

        if (!shouldRetry) {
          break;
        }

        long delayMs = calculateDelay(e, backoff, config);
        logger.log(
            Level.FINE,
            "Retry attempt {0} failed, will retry in {1}ms: {2}",
            new Object[] {attempt, delayMs, e.getMessage()});

        sleep(delayMs, e);
        attempt++;
      }
    }

    if (lastException instanceof NetBackupException) {
      throw (NetBackupException) lastException;
    }

    String message =
        String.format(
            Locale.ROOT,
            "Operation failed after %d attempts: %s",
            attempt + 1,
            lastException != null ? lastException.getMessage() : "unknown error");
    throw new NetBackupException(
        NetBackupException.Type.TRANSIENT, message, lastException, false, 0, null);
  }

  private static long calculateDelay(Exception e, ExponentialBackoff backoff, RetryConfig config) {
    Duration hint = config.delayHint.apply(e);
    if (hint != null) {
      // 服务端提示优先，但同样计入退避序列
      backoff.nextBackoff();
      return backoff.clamp(hint);
    }
    return backoff.nextBackoff();
  }

  private static void sleep(long millis, Exception lastFailure) {
    try {
      TimeUnit.MILLISECONDS.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      NetBackupException cancelled =
          NetBackupException.cancelled("retry wait interrupted", lastFailure);
      cancelled.addSuppressed(ie);
      throw cancelled;
    }
  }

  /** 重试配置 */
  public static final class RetryConfig {
    final int maxRetries;
    final long initialDelayMs;
    final long maxDelayMs;
    final double backoffMultiplier;
    final Predicate<Exception> retryPredicate;
    final Function<Exception, Duration> delayHint;

    private RetryConfig(Builder builder) {
      this.maxRetries = builder.maxRetries;
      this.initialDelayMs = builder.initialDelayMs;
      this.maxDelayMs = builder.maxDelayMs;
      this.backoffMultiplier = builder.backoffMultiplier;
      this.retryPredicate = builder.retryPredicate;
      this.delayHint = builder.delayHint;
    }

    /** 创建构建器 */
    public static Builder builder() {
      return new Builder();
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    /** Builder for {@link RetryConfig}. */
    public static final class Builder {
      private int maxRetries = 3;
      private long initialDelayMs = 5000;
      private long maxDelayMs = 60000;
      private double backoffMultiplier = 2.0;
      private Predicate<Exception> retryPredicate = e -> true;
      private Function<Exception, Duration> delayHint = e -> null;

      private Builder() {}

      /** 设置最大重试次数 */
      public Builder setMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
          throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        return this;
      }

      /** 设置初始延迟时间 */
      public Builder setInitialDelay(Duration initialDelay) {
        this.initialDelayMs = initialDelay.toMillis();
        return this;
      }

      /** 设置初始延迟时间（毫秒） */
      public Builder setInitialDelayMs(long initialDelayMs) {
        this.initialDelayMs = initialDelayMs;
        return this;
      }

      /** 设置最大延迟时间 */
      public Builder setMaxDelay(Duration maxDelay) {
        this.maxDelayMs = maxDelay.toMillis();
        return this;
      }

      /** 设置最大延迟时间（毫秒） */
      public Builder setMaxDelayMs(long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
        return this;
      }

      /** 设置退避乘数 */
      public Builder setBackoffMultiplier(double backoffMultiplier) {
        if (backoffMultiplier < 1.0) {
          throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        this.backoffMultiplier = backoffMultiplier;
        return this;
      }

      /** 设置重试条件 */
      public Builder setRetryPredicate(Predicate<Exception> retryPredicate) {
        this.retryPredicate = retryPredicate;
        return this;
      }

      /** 设置等待提示提取函数，返回 null 表示使用退避间隔 */
      public Builder setDelayHint(Function<Exception, Duration> delayHint) {
        this.delayHint = delayHint;
        return this;
      }

      /** 只重试可恢复的 NetBackupException，并遵循其中的 Retry-After */
      public Builder retryOnRecoverableNetBackupException() {
        this.retryPredicate =
            e -> e instanceof NetBackupException && ((NetBackupException) e).isRecoverable();
        this.delayHint =
            e -> e instanceof NetBackupException ? ((NetBackupException) e).getRetryAfter() : null;
        return this;
      }

      /** 构建配置 */
      public RetryConfig build() {
        return new RetryConfig(this);
      }
    }
  }

  /** 重试监听器 */
  public interface RetryListener {
    /**
     * 重试尝试时调用
     *
     * @param attempt 当前尝试次数（从 0 开始）
     * @param exception 捕获的异常
     * @param willRetry 是否会继续重试
     */
    void onRetryAttempt(int attempt, Exception exception, boolean willRetry);

    /**
     * 重试成功时调用
     *
     * @param totalAttempts 总尝试次数
     */
    default void onRetrySuccess(int totalAttempts) {}
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.cache;

import io.opentelemetry.sdk.extension.netbackup.model.MetricValue;
import io.opentelemetry.sdk.extension.netbackup.model.StorageMetricKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 存储指标缓存
 *
 * <p>存储容量变化缓慢，采集周期内复用上一次结果以减少 API 调用。单槽位，线程安全，读写不阻塞。条目在写入后
 * {@code ttl} 内有效，有效性只取决于经过的时间。
 */
public final class StorageCache {

  private static final Logger logger = Logger.getLogger(StorageCache.class.getName());

  /** TTL 非正数时使用的默认值 */
  public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

  private final Duration ttl;
  private final long ttlNanos;
  private final LongSupplier ticker;
  private final Clock clock;
  private final AtomicReference<Entry> slot = new AtomicReference<>();
  private final AtomicReference<Instant> lastCollectionTime = new AtomicReference<>();

  /**
   * 创建缓存
   *
   * @param ttl 有效期，非正数时使用 5 分钟
   */
  public StorageCache(Duration ttl) {
    this(ttl, System::nanoTime, Clock.systemUTC());
  }

  /**
   * 创建缓存，使用自定义时钟（测试用）
   *
   * @param ttl 有效期，非正数时使用 5 分钟
   * @param ticker 单调时钟，纳秒
   * @param clock 墙上时钟，用于记录采集时间
   */
  public StorageCache(Duration ttl, LongSupplier ticker, Clock clock) {
    this.ttl = ttl.isNegative() || ttl.isZero() ? DEFAULT_TTL : ttl;
    this.ttlNanos = this.ttl.toNanos();
    this.ticker = ticker;
    this.clock = clock;
  }

  /**
   * 读取缓存
   *
   * @return 未过期时返回缓存的指标，否则为空
   */
  public Optional<List<MetricValue<StorageMetricKey>>> get() {
    Entry entry = slot.get();
    if (entry == null) {
      return Optional.empty();
    }
    if (ticker.getAsLong() - entry.writtenAtNanos >= ttlNanos) {
      logger.log(Level.FINE, "Storage cache entry expired");
      return Optional.empty();
    }
    return Optional.of(entry.values);
  }

  /**
   * 写入缓存并记录采集时间
   *
   * @param values 完整的存储指标
   */
  public void set(List<MetricValue<StorageMetricKey>> values) {
    List<MetricValue<StorageMetricKey>> copy =
        Collections.unmodifiableList(new ArrayList<>(values));
    slot.set(new Entry(copy, ticker.getAsLong()));
    lastCollectionTime.set(clock.instant());
    logger.log(Level.FINE, "Cached {0} storage metrics for {1}", new Object[] {copy.size(), ttl});
  }

  /** 清空缓存，例如上游服务器变更时 */
  public void flush() {
    slot.set(null);
    logger.log(Level.FINE, "Storage cache flushed");
  }

  public Duration getTtl() {
    return ttl;
  }

  /**
   * 最近一次写入的时间
   *
   * @return 写入时间，从未写入时返回 null
   */
  @Nullable
  public Instant getLastCollectionTime() {
    return lastCollectionTime.get();
  }

  private static final class Entry {
    final List<MetricValue<StorageMetricKey>> values;
    final long writtenAtNanos;

    Entry(List<MetricValue<StorageMetricKey>> values, long writtenAtNanos) {
      this.values = values;
      this.writtenAtNanos = writtenAtNanos;
    }
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.collector;

import com.fasterxml.jackson.databind.JsonNode;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.extension.netbackup.cache.StorageCache;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupClient;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupException;
import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.fetcher.JobsFetcher;
import io.opentelemetry.sdk.extension.netbackup.fetcher.StorageFetcher;
import io.opentelemetry.sdk.extension.netbackup.model.JobMetrics;
import io.opentelemetry.sdk.extension.netbackup.model.MetricValue;
import io.opentelemetry.sdk.extension.netbackup.model.StorageMetricKey;
import io.opentelemetry.sdk.extension.netbackup.telemetry.NetBackupTelemetry;
import io.opentelemetry.sdk.extension.netbackup.telemetry.TelemetryAttributes;
import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 并行采集器
 *
 * <p>每个采集周期并行执行两个独立单元：
 * <ul>
 *   <li>存储：先查缓存，未命中时拉取并写入缓存
 *   <li>作业：按时间窗口拉取并聚合
 * </ul>
 *
 * <p>单元失败互不影响，成功单元的指标总是返回。周期受采集超时约束，超时或调用线程被中断时取消两个单元。
 * 任一单元在最近一个周期内成功即视为健康。
 */
public final class NetBackupCollector implements Closeable {

  private static final Logger logger = Logger.getLogger(NetBackupCollector.class.getName());

  /** 连通性探测的默认超时 */
  public static final Duration DEFAULT_CONNECTIVITY_TIMEOUT = Duration.ofSeconds(5);

  private static final String PROBE_PATH = "/admin/jobs?page[limit]=1";

  private final NetBackupClient client;
  private final StorageFetcher storageFetcher;
  private final JobsFetcher jobsFetcher;
  private final StorageCache storageCache;
  private final NetBackupTelemetry telemetry;
  private final Duration collectionTimeout;
  private final Clock clock;
  private final ExecutorService executor;

  private final ReentrantLock cycleLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicReference<CollectionResult> lastResult = new AtomicReference<>();
  private final AtomicReference<Instant> lastStorageSuccess = new AtomicReference<>();
  private final AtomicReference<Instant> lastJobsSuccess = new AtomicReference<>();

  private NetBackupCollector(Builder builder) {
    NetBackupConfig config = Objects.requireNonNull(builder.config, "config is required");
    this.client = Objects.requireNonNull(builder.client, "client is required");
    this.telemetry = builder.telemetry;
    this.clock = builder.clock;
    this.collectionTimeout = config.getCollectionTimeout();
    this.storageFetcher =
        builder.storageFetcher != null
            ? builder.storageFetcher
            : new StorageFetcher(config, telemetry);
    this.jobsFetcher =
        builder.jobsFetcher != null
            ? builder.jobsFetcher
            : new JobsFetcher(config, telemetry, clock);
    this.storageCache =
        builder.storageCache != null
            ? builder.storageCache
            : new StorageCache(config.getCacheTtl());

    this.executor =
        Context.taskWrapping(
            Executors.newFixedThreadPool(
                3,
                r -> {
                  Thread t = new Thread(r, "netbackup-collector");
                  t.setDaemon(true);
                  return t;
                }));
  }

  /**
   * 创建构建器
   *
   * @return 构建器
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * 执行一个采集周期
   *
   * <p>周期之间互斥；并发调用会等待前一个周期完成。
   *
   * @return 采集结果，包含两个数据源各自的指标与错误
   * @throws IllegalStateException 采集器已关闭
   * @throws NetBackupException 调用线程被中断（CANCELLED），此时不更新健康状态与最近结果
   */
  public CollectionResult collect() {
    checkNotClosed();
    cycleLock.lock();
    try {
      checkNotClosed();
      if (Thread.currentThread().isInterrupted()) {
        throw NetBackupException.cancelled("collection cycle cancelled before start", null);
      }
      return runCycle();
    } finally {
      cycleLock.unlock();
    }
  }

  private CollectionResult runCycle() {
    Instant startedAt = clock.instant();
    long startNanos = System.nanoTime();
    long deadlineNanos = startNanos + collectionTimeout.toNanos();

    Span span = telemetry.startSpan("collect");
    span.setAttribute(TelemetryAttributes.NETBACKUP_ENDPOINT, client.getBaseUrl());
    try (Scope ignored = span.makeCurrent()) {
      Future<StorageSnapshot> storageFuture;
      Future<JobMetrics> jobsFuture;
      try {
        storageFuture = executor.submit(this::collectStorage);
      } catch (RejectedExecutionException e) {
        throw new IllegalStateException("Collector is closed", e);
      }
      try {
        jobsFuture = executor.submit(() -> jobsFetcher.fetch(client));
      } catch (RejectedExecutionException e) {
        storageFuture.cancel(true);
        throw new IllegalStateException("Collector is closed", e);
      }

      boolean[] interrupted = new boolean[1];
      Outcome<StorageSnapshot> storage =
          await(storageFuture, deadlineNanos, interrupted, "storage");
      Outcome<JobMetrics> jobs = await(jobsFuture, deadlineNanos, interrupted, "jobs");
      if (interrupted[0]) {
        Thread.currentThread().interrupt();
        NetBackupException cancelled =
            NetBackupException.cancelled("collection cycle cancelled", null);
        NetBackupTelemetry.recordError(span, cancelled);
        logger.log(Level.FINE, "Collection cycle cancelled, keeping previous result");
        throw cancelled;
      }

      Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
      StorageSnapshot storageValue = storage.value;
      CollectionResult result =
          new CollectionResult(
              storageValue != null ? storageValue.values : Collections.emptyList(),
              jobs.value != null ? jobs.value : JobMetrics.empty(),
              storage.error,
              jobs.error,
              storageValue != null && storageValue.fromCache,
              client.getApiVersion(),
              startedAt,
              duration);

      recordOutcome(result, span);
      return result;
    } finally {
      span.end();
    }
  }

  private StorageSnapshot collectStorage() {
    Optional<List<MetricValue<StorageMetricKey>>> cached = storageCache.get();
    if (cached.isPresent()) {
      logger.log(Level.FINE, "Using cached storage metrics ({0} entries)", cached.get().size());
      return new StorageSnapshot(cached.get(), true);
    }
    List<MetricValue<StorageMetricKey>> values = storageFetcher.fetch(client);
    storageCache.set(values);
    return new StorageSnapshot(values, false);
  }

  private <T> Outcome<T> await(
      Future<T> future, long deadlineNanos, boolean[] interrupted, String source) {
    if (interrupted[0]) {
      future.cancel(true);
      return Outcome.failure(
          NetBackupException.cancelled(source + " collection cancelled", null));
    }
    try {
      long remaining = Math.max(0, deadlineNanos - System.nanoTime());
      return Outcome.success(future.get(remaining, TimeUnit.NANOSECONDS));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      logger.log(
          Level.WARNING,
          "Failed to collect {0} metrics: {1}",
          new Object[] {source, cause.getMessage()});
      return Outcome.failure(cause);
    } catch (TimeoutException e) {
      future.cancel(true);
      logger.log(
          Level.WARNING,
          "Collection of {0} metrics exceeded {1}, cancelled",
          new Object[] {source, collectionTimeout});
      return Outcome.failure(
          NetBackupException.timeout(
              source + " collection exceeded timeout of " + collectionTimeout));
    } catch (InterruptedException e) {
      interrupted[0] = true;
      future.cancel(true);
      return Outcome.failure(NetBackupException.cancelled(source + " collection cancelled", e));
    } catch (CancellationException e) {
      return Outcome.failure(NetBackupException.cancelled(source + " collection cancelled", e));
    }
  }

  private void recordOutcome(CollectionResult result, Span span) {
    Instant now = clock.instant();
    if (result.getStorageError() == null) {
      lastStorageSuccess.set(now);
    } else {
      span.addEvent(
          "storage_fetch_error",
          Attributes.of(
              TelemetryAttributes.ERROR, String.valueOf(result.getStorageError().getMessage())));
    }
    if (result.getJobsError() == null) {
      lastJobsSuccess.set(now);
    } else {
      span.addEvent(
          "jobs_fetch_error",
          Attributes.of(
              TelemetryAttributes.ERROR, String.valueOf(result.getJobsError().getMessage())));
    }
    lastResult.set(result);

    span.setAttribute(TelemetryAttributes.SCRAPE_DURATION_MS, result.getDuration().toMillis());
    span.setAttribute(
        TelemetryAttributes.SCRAPE_STORAGE_METRICS_COUNT, (long) result.getStorageMetrics().size());
    span.setAttribute(
        TelemetryAttributes.SCRAPE_JOB_METRICS_COUNT, (long) result.getJobMetrics().size());
    span.setAttribute(TelemetryAttributes.SCRAPE_CACHE_HIT, result.isStorageFromCache());
    span.setAttribute(TelemetryAttributes.SCRAPE_STATUS, result.getStatus());

    Level level = result.isHealthy() ? Level.FINE : Level.WARNING;
    logger.log(
        level,
        "Collection cycle finished: status={0}, storageMetrics={1}, jobs={2}, cached={3}, "
            + "duration={4}ms",
        new Object[] {
          result.getStatus(),
          result.getStorageMetrics().size(),
          result.getJobMetrics().getTotalJobs(),
          result.isStorageFromCache(),
          result.getDuration().toMillis()
        });
  }

  // ===== 健康状态 =====

  /** 最近一个周期内至少一个数据源成功 */
  public boolean isHealthy() {
    CollectionResult result = lastResult.get();
    return result != null && result.isHealthy();
  }

  /** 最近一个周期的结果，尚未采集时返回 null */
  @Nullable
  public CollectionResult getLastResult() {
    return lastResult.get();
  }

  /** 存储数据源最近一次成功的时间（缓存命中也算成功） */
  @Nullable
  public Instant getLastStorageSuccess() {
    return lastStorageSuccess.get();
  }

  /** 作业数据源最近一次成功的时间 */
  @Nullable
  public Instant getLastJobsSuccess() {
    return lastJobsSuccess.get();
  }

  public StorageCache getStorageCache() {
    return storageCache;
  }

  /**
   * 使用默认超时探测 NetBackup 连通性
   *
   * @return 探测成功返回 true
   */
  public boolean testConnectivity() {
    return testConnectivity(DEFAULT_CONNECTIVITY_TIMEOUT);
  }

  /**
   * 探测 NetBackup 连通性，独立于采集周期
   *
   * @param timeout 超时
   * @return 探测成功返回 true
   */
  public boolean testConnectivity(Duration timeout) {
    if (closed.get()) {
      return false;
    }
    String url = client.getBaseUrl() + PROBE_PATH;
    Future<JsonNode> probe;
    try {
      probe = executor.submit(() -> client.fetchData(url, JsonNode.class));
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Collector closed, skipping connectivity test");
      return false;
    }
    try {
      probe.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      logger.log(Level.WARNING, "NetBackup connectivity test failed: {0}", cause.getMessage());
      return false;
    } catch (TimeoutException e) {
      probe.cancel(true);
      logger.log(Level.WARNING, "NetBackup connectivity test timed out after {0}", timeout);
      return false;
    } catch (InterruptedException e) {
      probe.cancel(true);
      Thread.currentThread().interrupt();
      return false;
    }
  }

  // ===== 生命周期 =====

  private void checkNotClosed() {
    if (closed.get()) {
      throw new IllegalStateException("Collector is closed");
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    close(Duration.ofSeconds(30));
  }

  /**
   * 停止接受新的采集周期，并等待进行中的周期结束
   *
   * <p>先等待持有周期锁的周期返回，再关闭线程池。
   *
   * @param timeout 最长等待时间，超时后中断进行中的单元
   */
  public void close(Duration timeout) {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    long deadlineNanos = System.nanoTime() + timeout.toNanos();
    try {
      boolean cycleFinished = cycleLock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
      if (cycleFinished) {
        cycleLock.unlock();
      }
      executor.shutdown();
      long remaining = Math.max(0, deadlineNanos - System.nanoTime());
      if (!cycleFinished || !executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
        logger.log(
            Level.WARNING, "Collection cycle did not finish within {0}, interrupting", timeout);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    logger.log(Level.INFO, "NetBackup collector closed");
  }

  private static final class StorageSnapshot {
    final List<MetricValue<StorageMetricKey>> values;
    final boolean fromCache;

    StorageSnapshot(List<MetricValue<StorageMetricKey>> values, boolean fromCache) {
      this.values = values;
      this.fromCache = fromCache;
    }
  }

  private static final class Outcome<T> {
    @Nullable final T value;
    @Nullable final Throwable error;

    private Outcome(@Nullable T value, @Nullable Throwable error) {
      this.value = value;
      this.error = error;
    }

    static <T> Outcome<T> success(T value) {
      return new Outcome<>(value, null);
    }

    static <T> Outcome<T> failure(Throwable error) {
      return new Outcome<>(null, error);
    }
  }

  /** Builder for {@link NetBackupCollector}. */
  public static final class Builder {
    @Nullable private NetBackupConfig config;
    @Nullable private NetBackupClient client;
    private NetBackupTelemetry telemetry = NetBackupTelemetry.noop();
    private Clock clock = Clock.systemUTC();
    @Nullable private StorageCache storageCache;
    @Nullable private StorageFetcher storageFetcher;
    @Nullable private JobsFetcher jobsFetcher;

    private Builder() {}

    public Builder setConfig(NetBackupConfig config) {
      this.config = config;
      return this;
    }

    public Builder setClient(NetBackupClient client) {
      this.client = client;
      return this;
    }

    public Builder setTelemetry(NetBackupTelemetry telemetry) {
      this.telemetry = telemetry;
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** 使用外部缓存，配置重载时可跨采集器复用 */
    public Builder setStorageCache(StorageCache storageCache) {
      this.storageCache = storageCache;
      return this;
    }

    public Builder setStorageFetcher(StorageFetcher storageFetcher) {
      this.storageFetcher = storageFetcher;
      return this;
    }

    public Builder setJobsFetcher(JobsFetcher jobsFetcher) {
      this.jobsFetcher = jobsFetcher;
      return this;
    }

    public NetBackupCollector build() {
      return new NetBackupCollector(this);
    }
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.extension.netbackup.cache.StorageCache;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupClient;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupException;
import io.opentelemetry.sdk.extension.netbackup.collector.CollectionResult;
import io.opentelemetry.sdk.extension.netbackup.collector.NetBackupCollector;
import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.telemetry.NetBackupMetricsBinder;
import io.opentelemetry.sdk.extension.netbackup.telemetry.NetBackupTelemetry;
import io.opentelemetry.sdk.extension.netbackup.version.ApiVersionDetector;
import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * NetBackup 指标导出器
 *
 * <p>负责组件的生命周期：
 *
 * <ul>
 *   <li>启动时协商协议版本（配置未指定时）
 *   <li>按采集周期定时执行采集
 *   <li>将最近一次结果发布为 OpenTelemetry Gauge
 *   <li>配置重载与有序关闭
 * </ul>
 */
public final class NetBackupExporter implements Closeable {

  private static final Logger logger = Logger.getLogger(NetBackupExporter.class.getName());

  private static final Duration SCHEDULER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(5);

  private final NetBackupTelemetry telemetry;
  private final Clock clock;
  private final AtomicReference<StorageCache> storageCache;
  private final ScheduledExecutorService scheduler;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final Object reloadLock = new Object();

  private final AtomicReference<NetBackupConfig> config;
  private final AtomicReference<Components> components = new AtomicReference<>();
  private final AtomicReference<CollectionResult> lastResult = new AtomicReference<>();
  private final AtomicLong cycleCount = new AtomicLong(0);

  @Nullable private volatile ScheduledFuture<?> collectTask;
  @Nullable private volatile NetBackupMetricsBinder metricsBinder;

  private NetBackupExporter(Builder builder) {
    NetBackupConfig initial = Objects.requireNonNull(builder.config, "config is required");
    this.config = new AtomicReference<>(initial);
    this.telemetry = NetBackupTelemetry.create(builder.openTelemetry, builder.flushHook);
    this.clock = builder.clock;
    this.storageCache = new AtomicReference<>(new StorageCache(initial.getCacheTtl()));

    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "netbackup-exporter");
              t.setDaemon(true);
              return t;
            });
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
   * 启动导出器：协商版本、创建客户端与采集器、注册 Gauge 并开始定时采集
   *
   * @throws NetBackupException 版本协商失败
   * @throws IllegalStateException 导出器已关闭
   */
  public void start() {
    if (closed.get()) {
      throw new IllegalStateException("Exporter is closed");
    }
    if (!started.compareAndSet(false, true)) {
      logger.log(Level.WARNING, "NetBackup exporter already started");
      return;
    }

    NetBackupConfig resolved;
    try {
      resolved = resolveVersion(config.get());
    } catch (RuntimeException e) {
      started.set(false);
      throw e;
    }
    config.set(resolved);
    components.set(createComponents(resolved));

    metricsBinder = NetBackupMetricsBinder.bind(telemetry.getMeter(), lastResult::get);

    long intervalMillis = resolved.getScrapingInterval().toMillis();
    logger.log(
        Level.INFO,
        "Starting NetBackup exporter, endpoint: {0}, apiVersion: {1}, interval: {2}ms",
        new Object[] {resolved.getBaseUrl(), resolved.getApiVersion(), intervalMillis});
    collectTask =
        scheduler.scheduleWithFixedDelay(
            this::scheduledCollect, 0, intervalMillis, TimeUnit.MILLISECONDS);
  }

  /**
   * 立即执行一个采集周期
   *
   * @return 采集结果
   * @throws IllegalStateException 尚未启动或已关闭
   * @throws NetBackupException 调用线程被中断（CANCELLED），最近结果保持不变
   */
  public CollectionResult collectNow() {
    Components current = components.get();
    if (current == null || closed.get()) {
      throw new IllegalStateException("Exporter is not running");
    }
    CollectionResult result = current.collector.collect();
    lastResult.set(result);
    cycleCount.incrementAndGet();
    return result;
  }

  private void scheduledCollect() {
    try {
      collectNow();
    } catch (IllegalStateException e) {
      // 重载或关闭过程中采集器已关闭
      logger.log(Level.FINE, "Skipping collection cycle: {0}", e.getMessage());
    } catch (NetBackupException e) {
      if (e.getType() == NetBackupException.Type.CANCELLED) {
        logger.log(Level.FINE, "Collection cycle cancelled: {0}", e.getMessage());
      } else {
        logger.log(Level.WARNING, "Collection cycle failed unexpectedly", e);
      }
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Collection cycle failed unexpectedly", e);
    }
  }

  /**
   * 应用新的配置快照
   *
   * <p>新快照未指定版本时重新协商。缓存有效期变化时重建存储缓存，否则仅在上游地址变化时清空。
   * 旧客户端在进行中的请求完成后关闭。
   *
   * @param newConfig 新快照
   * @throws NetBackupException 版本协商失败，此时继续使用旧配置
   */
  public void applyConfig(NetBackupConfig newConfig) {
    synchronized (reloadLock) {
      if (closed.get()) {
        throw new IllegalStateException("Exporter is closed");
      }
      NetBackupConfig previous = config.get();
      if (previous.equals(newConfig)) {
        logger.log(Level.FINE, "Configuration unchanged, skipping reload");
        return;
      }
      if (!started.get()) {
        if (!previous.getCacheTtl().equals(newConfig.getCacheTtl())) {
          storageCache.set(new StorageCache(newConfig.getCacheTtl()));
        }
        config.set(newConfig);
        return;
      }

      NetBackupConfig resolved = resolveVersion(newConfig);
      if (!previous.getCacheTtl().equals(resolved.getCacheTtl())) {
        // 有效期变化时换用新缓存，旧条目随旧缓存丢弃
        storageCache.set(new StorageCache(resolved.getCacheTtl()));
        logger.log(
            Level.INFO,
            "Storage cache TTL changed from {0} to {1}, cache rebuilt",
            new Object[] {previous.getCacheTtl(), resolved.getCacheTtl()});
      } else if (!previous.getBaseUrl().equals(resolved.getBaseUrl())) {
        storageCache.get().flush();
        logger.log(
            Level.INFO,
            "NetBackup endpoint changed from {0} to {1}, storage cache flushed",
            new Object[] {previous.getBaseUrl(), resolved.getBaseUrl()});
      }

      Components old = components.getAndSet(createComponents(resolved));
      config.set(resolved);
      if (old != null) {
        old.close(previous.getCloseTimeout());
      }
      logger.log(Level.INFO, "NetBackup configuration reloaded: {0}", resolved);
    }
  }

  private NetBackupConfig resolveVersion(NetBackupConfig snapshot) {
    if (snapshot.hasApiVersion()) {
      logger.log(
          Level.INFO,
          "Using configured NetBackup API version {0}, skipping detection",
          snapshot.getApiVersion());
      return snapshot;
    }
    NetBackupClient probeClient = NetBackupClient.create(snapshot, telemetry);
    try {
      String version =
          new ApiVersionDetector(
                  probeClient, snapshot.getBaseUrl(), snapshot.getApiKey(), telemetry)
              .detectVersion();
      return snapshot.withApiVersion(version);
    } finally {
      probeClient.close();
    }
  }

  private Components createComponents(NetBackupConfig snapshot) {
    NetBackupClient client = NetBackupClient.create(snapshot, telemetry);
    NetBackupCollector collector =
        NetBackupCollector.builder()
            .setConfig(snapshot)
            .setClient(client)
            .setTelemetry(telemetry)
            .setClock(clock)
            .setStorageCache(storageCache.get())
            .build();
    return new Components(client, collector);
  }

  // ===== 状态 =====

  /** 最近一个周期内至少一个数据源成功 */
  public boolean isHealthy() {
    CollectionResult result = lastResult.get();
    return result != null && result.isHealthy();
  }

  @Nullable
  public CollectionResult getLastResult() {
    return lastResult.get();
  }

  @Nullable
  public Instant getLastStorageSuccess() {
    Components current = components.get();
    return current != null ? current.collector.getLastStorageSuccess() : null;
  }

  @Nullable
  public Instant getLastJobsSuccess() {
    Components current = components.get();
    return current != null ? current.collector.getLastJobsSuccess() : null;
  }

  /**
   * 探测 NetBackup 连通性
   *
   * @return 成功返回 true；尚未启动时返回 false
   */
  public boolean testConnectivity() {
    Components current = components.get();
    return current != null && current.collector.testConnectivity();
  }

  public NetBackupConfig getConfig() {
    return config.get();
  }

  /** 当前使用的存储缓存，有效期变化的重载后会被替换 */
  public StorageCache getStorageCache() {
    return storageCache.get();
  }

  public long getCycleCount() {
    return cycleCount.get();
  }

  public boolean isStarted() {
    return started.get();
  }

  /**
   * 关闭导出器
   *
   * <p>顺序：停止调度，等待进行中的周期，关闭客户端，刷新遥测数据。
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    logger.log(Level.INFO, "Closing NetBackup exporter...");

    ScheduledFuture<?> task = collectTask;
    if (task != null) {
      task.cancel(false);
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(
          SCHEDULER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      scheduler.shutdownNow();
    }

    NetBackupMetricsBinder binder = metricsBinder;
    if (binder != null) {
      binder.close();
    }

    synchronized (reloadLock) {
      Components current = components.getAndSet(null);
      if (current != null) {
        current.close(config.get().getCloseTimeout());
      }
    }

    CompletableResultCode flushed = telemetry.flush(FLUSH_TIMEOUT);
    if (flushed.isDone() && !flushed.isSuccess()) {
      logger.log(Level.WARNING, "Telemetry flush failed during shutdown");
    }
    logger.log(Level.INFO, "NetBackup exporter closed");
  }

  private static final class Components {
    final NetBackupClient client;
    final NetBackupCollector collector;

    Components(NetBackupClient client, NetBackupCollector collector) {
      this.client = client;
      this.collector = collector;
    }

    void close(Duration timeout) {
      collector.close(timeout);
      try {
        client.close(timeout);
      } catch (NetBackupException e) {
        logger.log(Level.WARNING, "NetBackup client did not close cleanly: {0}", e.getMessage());
      }
    }
  }

  /** Builder for {@link NetBackupExporter}. */
  public static final class Builder {
    @Nullable private NetBackupConfig config;
    @Nullable private OpenTelemetry openTelemetry;
    @Nullable private Supplier<CompletableResultCode> flushHook;
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    public Builder setConfig(NetBackupConfig config) {
      this.config = config;
      return this;
    }

    /** 从 {@code netbackup.*} 属性构建配置 */
    public Builder setConfigProperties(ConfigProperties properties) {
      this.config = NetBackupConfig.fromConfigProperties(properties);
      return this;
    }

    public Builder setOpenTelemetry(OpenTelemetry openTelemetry) {
      this.openTelemetry = openTelemetry;
      return this;
    }

    /** 关闭时调用的刷新钩子，例如 {@code meterProvider::forceFlush} */
    public Builder setFlushHook(Supplier<CompletableResultCode> flushHook) {
      this.flushHook = flushHook;
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public NetBackupExporter build() {
      return new NetBackupExporter(this);
    }
  }
}

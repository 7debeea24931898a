/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.collector;

import io.opentelemetry.sdk.extension.netbackup.model.JobMetrics;
import io.opentelemetry.sdk.extension.netbackup.model.MetricValue;
import io.opentelemetry.sdk.extension.netbackup.model.StorageMetricKey;
import io.opentelemetry.sdk.extension.netbackup.telemetry.TelemetryAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * 一次采集周期的结果
 *
 * <p>存储与作业两个数据源的错误相互独立：任一数据源失败时，另一数据源的指标照常返回。
 */
public final class CollectionResult {

  private final List<MetricValue<StorageMetricKey>> storageMetrics;
  private final JobMetrics jobMetrics;
  @Nullable private final Throwable storageError;
  @Nullable private final Throwable jobsError;
  private final boolean storageFromCache;
  @Nullable private final String apiVersion;
  private final Instant startedAt;
  private final Duration duration;

  CollectionResult(
      List<MetricValue<StorageMetricKey>> storageMetrics,
      JobMetrics jobMetrics,
      @Nullable Throwable storageError,
      @Nullable Throwable jobsError,
      boolean storageFromCache,
      @Nullable String apiVersion,
      Instant startedAt,
      Duration duration) {
    this.storageMetrics = Collections.unmodifiableList(storageMetrics);
    this.jobMetrics = jobMetrics;
    this.storageError = storageError;
    this.jobsError = jobsError;
    this.storageFromCache = storageFromCache;
    this.apiVersion = apiVersion;
    this.startedAt = startedAt;
    this.duration = duration;
  }

  public List<MetricValue<StorageMetricKey>> getStorageMetrics() {
    return storageMetrics;
  }

  public JobMetrics getJobMetrics() {
    return jobMetrics;
  }

  @Nullable
  public Throwable getStorageError() {
    return storageError;
  }

  @Nullable
  public Throwable getJobsError() {
    return jobsError;
  }

  /** 存储指标是否来自缓存 */
  public boolean isStorageFromCache() {
    return storageFromCache;
  }

  @Nullable
  public String getApiVersion() {
    return apiVersion;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Duration getDuration() {
    return duration;
  }

  /** 至少一个数据源成功 */
  public boolean isHealthy() {
    return storageError == null || jobsError == null;
  }

  /**
   * 采集状态
   *
   * @return success、partial_failure 或 failed
   */
  public String getStatus() {
    if (storageError == null && jobsError == null) {
      return TelemetryAttributes.STATUS_SUCCESS;
    }
    return isHealthy()
        ? TelemetryAttributes.STATUS_PARTIAL_FAILURE
        : TelemetryAttributes.STATUS_FAILED;
  }

  @Override
  public String toString() {
    return "CollectionResult{status="
        + getStatus()
        + ", storageMetrics="
        + storageMetrics.size()
        + ", jobMetrics="
        + jobMetrics
        + ", storageFromCache="
        + storageFromCache
        + ", duration="
        + duration
        + '}';
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.ObservableDoubleGauge;
import io.opentelemetry.api.metrics.ObservableDoubleMeasurement;
import io.opentelemetry.sdk.extension.netbackup.collector.CollectionResult;
import io.opentelemetry.sdk.extension.netbackup.model.MetricKey;
import io.opentelemetry.sdk.extension.netbackup.model.MetricValue;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 将最近一次采集结果注册为 OpenTelemetry 异步 Gauge
 *
 * <p>回调只读取 {@code resultSupplier} 返回的快照，不会触发采集。尚无结果时只上报 {@code nbu_up=0}。
 */
public final class NetBackupMetricsBinder implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(NetBackupMetricsBinder.class.getName());

  public static final String DISK_BYTES = "nbu_disk_bytes";
  public static final String JOBS_BYTES = "nbu_jobs_bytes";
  public static final String JOBS_COUNT = "nbu_jobs_count";
  public static final String STATUS_COUNT = "nbu_status_count";
  public static final String API_VERSION = "nbu_api_version";
  public static final String SCRAPE_DURATION = "nbu_scrape_duration_ms";
  public static final String UP = "nbu_up";

  private static final AttributeKey<String> VERSION = AttributeKey.stringKey("version");

  private final Supplier<CollectionResult> resultSupplier;
  private final List<ObservableDoubleGauge> gauges = new ArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private NetBackupMetricsBinder(Supplier<CollectionResult> resultSupplier) {
    this.resultSupplier = resultSupplier;
  }

  /**
   * 在 meter 上注册全部 Gauge
   *
   * @param meter 目标 Meter
   * @param resultSupplier 最近一次采集结果，尚未采集时返回 null
   * @return 绑定句柄，关闭时注销回调
   */
  public static NetBackupMetricsBinder bind(
      Meter meter, Supplier<CollectionResult> resultSupplier) {
    NetBackupMetricsBinder binder = new NetBackupMetricsBinder(resultSupplier);
    binder.register(meter);
    return binder;
  }

  private void register(Meter meter) {
    gauges.add(
        gauge(
            meter,
            DISK_BYTES,
            "NetBackup storage unit capacity in bytes",
            "By",
            CollectionResult::getStorageMetrics));
    gauges.add(
        gauge(
            meter,
            JOBS_BYTES,
            "Bytes transferred by NetBackup jobs in the scrape window",
            "By",
            r -> r.getJobMetrics().byteValues()));
    gauges.add(
        gauge(
            meter,
            JOBS_COUNT,
            "Number of NetBackup jobs in the scrape window",
            "{job}",
            r -> r.getJobMetrics().countValues()));
    gauges.add(
        gauge(
            meter,
            STATUS_COUNT,
            "Number of NetBackup jobs by action and status",
            "{job}",
            r -> r.getJobMetrics().statusValues()));

    gauges.add(
        meter
            .gaugeBuilder(API_VERSION)
            .setDescription("Negotiated NetBackup REST API version")
            .buildWithCallback(
                measurement -> {
                  CollectionResult result = latest();
                  if (result != null && result.getApiVersion() != null) {
                    measurement.record(1, Attributes.of(VERSION, result.getApiVersion()));
                  }
                }));
    gauges.add(
        meter
            .gaugeBuilder(SCRAPE_DURATION)
            .setDescription("Duration of the last collection cycle")
            .setUnit("ms")
            .buildWithCallback(
                measurement -> {
                  CollectionResult result = latest();
                  if (result != null) {
                    measurement.record(result.getDuration().toMillis());
                  }
                }));
    gauges.add(
        meter
            .gaugeBuilder(UP)
            .setDescription("1 if the last collection cycle had at least one successful source")
            .buildWithCallback(
                measurement -> {
                  CollectionResult result = latest();
                  measurement.record(result != null && result.isHealthy() ? 1 : 0);
                }));
  }

  private ObservableDoubleGauge gauge(
      Meter meter,
      String name,
      String description,
      String unit,
      Function<CollectionResult, List<? extends MetricValue<? extends MetricKey>>> values) {
    return meter
        .gaugeBuilder(name)
        .setDescription(description)
        .setUnit(unit)
        .buildWithCallback(measurement -> observe(measurement, values));
  }

  private void observe(
      ObservableDoubleMeasurement measurement,
      Function<CollectionResult, List<? extends MetricValue<? extends MetricKey>>> values) {
    CollectionResult result = latest();
    if (result == null) {
      return;
    }
    for (MetricValue<? extends MetricKey> value : values.apply(result)) {
      measurement.record(value.getValue(), value.getKey().toAttributes());
    }
  }

  @Nullable
  private CollectionResult latest() {
    if (closed.get()) {
      return null;
    }
    return resultSupplier.get();
  }

  /** 已注册的 Gauge 数量 */
  public int getGaugeCount() {
    return gauges.size();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (ObservableDoubleGauge gauge : gauges) {
      gauge.close();
    }
    logger.log(Level.FINE, "Unregistered {0} NetBackup gauges", gauges.size());
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.fetcher;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.model.MetricValue;
import io.opentelemetry.sdk.extension.netbackup.model.StorageMetricKey;
import io.opentelemetry.sdk.extension.netbackup.model.api.StorageUnitAttributes;
import io.opentelemetry.sdk.extension.netbackup.telemetry.NetBackupTelemetry;
import io.opentelemetry.sdk.extension.netbackup.telemetry.TelemetryAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 存储单元容量拉取
 *
 * <p>磁带存储单元不报告容量，直接排除。其余每个存储单元生成 free 与 used 两个指标。
 */
public final class StorageFetcher
    extends AbstractPagedFetcher<
        StorageUnitAttributes, Map<StorageMetricKey, Double>, List<MetricValue<StorageMetricKey>>> {

  private static final Logger logger = Logger.getLogger(StorageFetcher.class.getName());

  static final String STORAGE_PATH = "/storage/storage-units";

  public StorageFetcher(NetBackupConfig config, NetBackupTelemetry telemetry) {
    super(config, telemetry, StorageUnitAttributes.class);
  }

  @Override
  protected String path() {
    return STORAGE_PATH;
  }

  @Override
  protected String spanName() {
    return "fetch_storage";
  }

  @Override
  protected String pageSpanName() {
    return "fetch_storage_page";
  }

  @Override
  protected Map<StorageMetricKey, Double> newAccumulator() {
    return new LinkedHashMap<>();
  }

  @Override
  @Nullable
  protected String validate(StorageUnitAttributes item) {
    if (item.getName() == null || item.getName().isEmpty()) {
      return "storage unit without name";
    }
    if (item.getStorageServerType() == null) {
      return "storage unit " + item.getName() + " without storageServerType";
    }
    return null;
  }

  @Override
  protected void fold(Map<StorageMetricKey, Double> accumulator, StorageUnitAttributes item) {
    if (item.isTape()) {
      return;
    }
    String name = item.getName();
    String type = item.getStorageServerType();
    accumulator.merge(
        new StorageMetricKey(name, type, StorageMetricKey.SIZE_FREE),
        toDouble(item.getFreeCapacityBytes()),
        Double::sum);
    accumulator.merge(
        new StorageMetricKey(name, type, StorageMetricKey.SIZE_USED),
        toDouble(item.getUsedCapacityBytes()),
        Double::sum);
  }

  @Override
  protected List<MetricValue<StorageMetricKey>> finish(
      Map<StorageMetricKey, Double> accumulator, Span span, int pages, int skippedItems) {
    List<MetricValue<StorageMetricKey>> values = new ArrayList<>(accumulator.size());
    for (Map.Entry<StorageMetricKey, Double> entry : accumulator.entrySet()) {
      values.add(MetricValue.of(entry.getKey(), entry.getValue()));
    }
    // 每个存储单元对应 free/used 两个指标
    span.setAttribute(TelemetryAttributes.NETBACKUP_STORAGE_UNITS, (long) values.size() / 2);
    logger.log(
        Level.FINE,
        "Fetched {0} storage metrics across {1} pages",
        new Object[] {values.size(), pages});
    return Collections.unmodifiableList(values);
  }

  private static double toDouble(@Nullable Long value) {
    return value != null ? value.doubleValue() : 0.0;
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.telemetry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupClient;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupException;
import io.opentelemetry.sdk.extension.netbackup.collector.CollectionResult;
import io.opentelemetry.sdk.extension.netbackup.collector.NetBackupCollector;
import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.model.api.PagedResponse;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.DoublePointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NetBackupMetricsBinderTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String STORAGE_PAGE =
      "{\"data\":[{\"attributes\":{\"name\":\"disk-1\",\"storageType\":\"DISK\","
          + "\"storageServerType\":\"MSDP\",\"freeCapacityBytes\":100,\"usedCapacityBytes\":50}}],"
          + "\"meta\":{\"pagination\":{\"offset\":0,\"last\":0}}}";
  private static final String JOBS_PAGE =
      "{\"data\":[{\"attributes\":{\"jobId\":1,\"jobType\":\"BACKUP\",\"policyType\":\"VMware\","
          + "\"status\":0,\"kilobytesTransferred\":4}},"
          + "{\"attributes\":{\"jobId\":2,\"jobType\":\"BACKUP\",\"policyType\":\"VMware\","
          + "\"status\":0,\"kilobytesTransferred\":6}}],"
          + "\"meta\":{\"pagination\":{\"offset\":0,\"last\":0}}}";

  private InMemoryMetricReader reader;
  private SdkMeterProvider meterProvider;
  private NetBackupClient client;
  private NetBackupCollector collector;
  private final AtomicReference<CollectionResult> latest = new AtomicReference<>();

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();

    client = mock(NetBackupClient.class);
    when(client.getBaseUrl()).thenReturn("https://nbu-master:1556/netbackup");
    when(client.getApiVersion()).thenReturn("12.0");
    collector =
        NetBackupCollector.builder()
            .setClient(client)
            .setConfig(
                NetBackupConfig.builder()
                    .setHost("nbu-master")
                    .setApiKey("key-0123456789")
                    .setApiVersion("12.0")
                    .build())
            .build();
  }

  @AfterEach
  void tearDown() {
    collector.close(Duration.ofSeconds(1));
    meterProvider.close();
  }

  private void collect(boolean storageFails) {
    when(client.fetchData(anyString(), eq(PagedResponse.class)))
        .thenAnswer(
            invocation -> {
              String url = invocation.getArgument(0);
              if (url.contains("/storage/")) {
                if (storageFails) {
                  throw NetBackupException.httpError(url, 500, null);
                }
                return MAPPER.readValue(STORAGE_PAGE, PagedResponse.class);
              }
              return MAPPER.readValue(JOBS_PAGE, PagedResponse.class);
            });
    latest.set(collector.collect());
  }

  private static Optional<MetricData> metric(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(m -> m.getName().equals(name)).findFirst();
  }

  private static List<DoublePointData> points(Collection<MetricData> metrics, String name) {
    return metric(metrics, name)
        .<List<DoublePointData>>map(m -> new ArrayList<>(m.getDoubleGaugeData().getPoints()))
        .orElse(Collections.emptyList());
  }

  @Test
  void reportsDownBeforeFirstCollection() {
    NetBackupMetricsBinder.bind(meterProvider.get("test"), latest::get);

    Collection<MetricData> metrics = reader.collectAllMetrics();

    assertThat(points(metrics, NetBackupMetricsBinder.UP))
        .singleElement()
        .satisfies(p -> assertThat(p.getValue()).isEqualTo(0.0));
    assertThat(points(metrics, NetBackupMetricsBinder.DISK_BYTES)).isEmpty();
  }

  @Test
  void publishesLatestResult() {
    NetBackupMetricsBinder binder =
        NetBackupMetricsBinder.bind(meterProvider.get("test"), latest::get);
    collect(false);

    Collection<MetricData> metrics = reader.collectAllMetrics();

    assertThat(binder.getGaugeCount()).isEqualTo(7);
    List<DoublePointData> disk = points(metrics, NetBackupMetricsBinder.DISK_BYTES);
    assertThat(disk).hasSize(2);
    assertThat(disk)
        .anySatisfy(
            p -> {
              assertThat(p.getAttributes().get(AttributeKey.stringKey("name")))
                  .isEqualTo("disk-1");
              assertThat(p.getAttributes().get(AttributeKey.stringKey("type"))).isEqualTo("MSDP");
              assertThat(p.getAttributes().get(AttributeKey.stringKey("size"))).isEqualTo("free");
              assertThat(p.getValue()).isEqualTo(100.0);
            });

    assertThat(points(metrics, NetBackupMetricsBinder.JOBS_COUNT))
        .singleElement()
        .satisfies(
            p -> {
              assertThat(p.getValue()).isEqualTo(2.0);
              assertThat(p.getAttributes().get(AttributeKey.stringKey("policy_type")))
                  .isEqualTo("VMware");
            });
    assertThat(points(metrics, NetBackupMetricsBinder.JOBS_BYTES))
        .singleElement()
        .satisfies(p -> assertThat(p.getValue()).isEqualTo(10 * 1024.0));
    assertThat(points(metrics, NetBackupMetricsBinder.STATUS_COUNT)).hasSize(1);
    assertThat(points(metrics, NetBackupMetricsBinder.API_VERSION))
        .singleElement()
        .satisfies(
            p ->
                assertThat(p.getAttributes().get(AttributeKey.stringKey("version")))
                    .isEqualTo("12.0"));
    assertThat(points(metrics, NetBackupMetricsBinder.UP))
        .singleElement()
        .satisfies(p -> assertThat(p.getValue()).isEqualTo(1.0));
    assertThat(metric(metrics, NetBackupMetricsBinder.SCRAPE_DURATION)).isPresent();
  }

  @Test
  void partialFailureStillReportsUp() {
    NetBackupMetricsBinder.bind(meterProvider.get("test"), latest::get);
    collect(true);

    Collection<MetricData> metrics = reader.collectAllMetrics();

    assertThat(points(metrics, NetBackupMetricsBinder.DISK_BYTES)).isEmpty();
    assertThat(points(metrics, NetBackupMetricsBinder.JOBS_COUNT)).hasSize(1);
    assertThat(points(metrics, NetBackupMetricsBinder.UP))
        .singleElement()
        .satisfies(p -> assertThat(p.getValue()).isEqualTo(1.0));
  }

  @Test
  void closeStopsReporting() {
    NetBackupMetricsBinder binder =
        NetBackupMetricsBinder.bind(meterProvider.get("test"), latest::get);
    collect(false);

    binder.close();

    // 关闭后回调不再产生数据点
    List<MetricData> reported =
        reader.collectAllMetrics().stream()
            .filter(m -> m.getName().startsWith("nbu_"))
            .filter(m -> !m.getData().getPoints().isEmpty())
            .collect(Collectors.toList());
    assertThat(reported).isEmpty();
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.fetcher;

import static io.opentelemetry.sdk.extension.netbackup.fetcher.PagedResponses.offsetOf;
import static io.opentelemetry.sdk.extension.netbackup.fetcher.PagedResponses.page;
import static io.opentelemetry.sdk.extension.netbackup.fetcher.PagedResponses.storageUnit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupClient;
import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.model.MetricValue;
import io.opentelemetry.sdk.extension.netbackup.model.StorageMetricKey;
import io.opentelemetry.sdk.extension.netbackup.model.api.PagedResponse;
import io.opentelemetry.sdk.extension.netbackup.telemetry.NetBackupTelemetry;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class StorageFetcherTest {

  private NetBackupClient client;
  private StorageFetcher fetcher;

  @BeforeEach
  void setUp() {
    client = mock(NetBackupClient.class);
    NetBackupConfig config =
        NetBackupConfig.builder()
            .setHost("nbu-master")
            .setApiKey("key-0123456789")
            .setApiVersion("12.0")
            .build();
    fetcher = new StorageFetcher(config, NetBackupTelemetry.noop());
  }

  @Test
  void producesFreeAndUsedPerUnit() {
    when(client.fetchData(anyString(), eq(PagedResponse.class)))
        .thenReturn(
            page(
                Arrays.asList(
                    storageUnit("dp-pool-1", "DISK", "PureDisk", 1000, 250),
                    storageUnit("msdp-2", "DISK", "MSDP", 5000, 4000)),
                0,
                null,
                0));

    List<MetricValue<StorageMetricKey>> values = fetcher.fetch(client);

    assertThat(values)
        .containsExactly(
            MetricValue.of(new StorageMetricKey("dp-pool-1", "PureDisk", "free"), 1000),
            MetricValue.of(new StorageMetricKey("dp-pool-1", "PureDisk", "used"), 250),
            MetricValue.of(new StorageMetricKey("msdp-2", "MSDP", "free"), 5000),
            MetricValue.of(new StorageMetricKey("msdp-2", "MSDP", "used"), 4000));
  }

  @Test
  void tapeUnitsAreExcluded() {
    when(client.fetchData(anyString(), eq(PagedResponse.class)))
        .thenReturn(
            page(
                Arrays.asList(
                    storageUnit("tape-lib", "Tape", "TLD", 0, 0),
                    storageUnit("disk-1", "DISK", "AdvancedDisk", 10, 20)),
                0,
                null,
                0));

    List<MetricValue<StorageMetricKey>> values = fetcher.fetch(client);

    assertThat(values).hasSize(2);
    assertThat(values).noneMatch(v -> v.getKey().getName().equals("tape-lib"));
  }

  @Test
  void missingCapacityCountsAsZero() {
    ObjectNode unit = storageUnit("disk-1", "DISK", "AdvancedDisk", 10, 20);
    unit.remove("usedCapacityBytes");
    when(client.fetchData(anyString(), eq(PagedResponse.class)))
        .thenReturn(page(Collections.singletonList(unit), 0, null, 0));

    List<MetricValue<StorageMetricKey>> values = fetcher.fetch(client);

    assertThat(values)
        .contains(MetricValue.of(new StorageMetricKey("disk-1", "AdvancedDisk", "used"), 0));
  }

  @Test
  void unitsWithoutNameAreSkipped() {
    ObjectNode nameless = storageUnit("x", "DISK", "AdvancedDisk", 10, 20);
    nameless.remove("name");
    when(client.fetchData(anyString(), eq(PagedResponse.class)))
        .thenReturn(
            page(
                Arrays.asList(nameless, storageUnit("disk-2", "DISK", "MSDP", 1, 2)), 0, null, 0));

    List<MetricValue<StorageMetricKey>> values = fetcher.fetch(client);

    assertThat(values).hasSize(2);
    assertThat(values).allMatch(v -> v.getKey().getName().equals("disk-2"));
  }

  @Test
  void followsPaginationAcrossPages() {
    when(client.fetchData(anyString(), eq(PagedResponse.class)))
        .thenAnswer(
            invocation -> {
              int offset = offsetOf(invocation.getArgument(0));
              if (offset == 0) {
                return page(
                    Collections.singletonList(storageUnit("a", "DISK", "MSDP", 1, 1)), 0, 1, 1);
              }
              return page(
                  Collections.singletonList(storageUnit("b", "DISK", "MSDP", 2, 2)), 1, null, 1);
            });

    List<MetricValue<StorageMetricKey>> values = fetcher.fetch(client);

    assertThat(values).hasSize(4);
    ArgumentCaptor<String> urls = ArgumentCaptor.forClass(String.class);
    verify(client, times(2)).fetchData(urls.capture(), eq(PagedResponse.class));
    assertThat(HttpUrl.get(urls.getAllValues().get(0)).encodedPath())
        .isEqualTo("/netbackup/storage/storage-units");
    assertThat(urls.getAllValues())
        .extracting(u -> HttpUrl.get(u).queryParameter("page[offset]"))
        .containsExactly("0", "1");
  }

  @Test
  void resultIsImmutable() {
    when(client.fetchData(anyString(), eq(PagedResponse.class)))
        .thenReturn(page(Collections.emptyList(), 0, null, 0));

    List<MetricValue<StorageMetricKey>> values = fetcher.fetch(client);

    assertThat(values).isEmpty();
    assertThat(values).isUnmodifiable();
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.opentelemetry.sdk.extension.netbackup.cache.StorageCache;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupException;
import io.opentelemetry.sdk.extension.netbackup.collector.CollectionResult;
import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.version.ApiVersion;
import java.io.IOException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NetBackupExporterTest {

  private static final String API_KEY = "exporter-key-0123456789";
  private static final String STORAGE_BODY =
      "{\"data\":[{\"attributes\":{\"name\":\"disk-1\",\"storageType\":\"DISK\","
          + "\"storageServerType\":\"MSDP\",\"freeCapacityBytes\":100,\"usedCapacityBytes\":50}}],"
          + "\"meta\":{\"pagination\":{\"offset\":0,\"last\":0}}}";
  private static final String JOBS_BODY =
      "{\"data\":[{\"attributes\":{\"jobId\":7,\"jobType\":\"BACKUP\",\"policyType\":\"Standard\","
          + "\"status\":0,\"kilobytesTransferred\":2}}],"
          + "\"meta\":{\"pagination\":{\"offset\":0,\"last\":0}}}";

  private MockWebServer server;
  private NetBackupDispatcher dispatcher;
  @Nullable private NetBackupExporter exporter;

  @BeforeEach
  void setUp() throws IOException {
    dispatcher = new NetBackupDispatcher(ApiVersion.V12_0);
    server = new MockWebServer();
    server.setDispatcher(dispatcher);
    server.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    if (exporter != null) {
      exporter.close();
    }
    server.shutdown();
  }

  private static NetBackupConfig.Builder configFor(MockWebServer target) {
    return NetBackupConfig.builder()
        .setScheme("http")
        .setHost(target.getHostName())
        .setPort(target.getPort())
        .setApiKey(API_KEY)
        // 定时周期足够长，测试中只有启动时的首个周期会自动触发
        .setScrapingInterval(Duration.ofHours(1))
        .setCloseTimeout(Duration.ofSeconds(2))
        .setRetryInitialBackoff(Duration.ofMillis(5))
        .setRetryMaxBackoff(Duration.ofMillis(20));
  }

  @Test
  void startDetectsVersionAndCollects() {
    exporter = NetBackupExporter.builder().setConfig(configFor(server).build()).build();

    exporter.start();

    assertThat(exporter.isStarted()).isTrue();
    assertThat(exporter.getConfig().getApiVersion()).isEqualTo(ApiVersion.V12_0);
    assertThat(dispatcher.rejectedVersions).contains(ApiVersion.V13_0);

    await().atMost(Duration.ofSeconds(5)).until(() -> exporter.getLastResult() != null);
    CollectionResult result = exporter.getLastResult();
    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getApiVersion()).isEqualTo(ApiVersion.V12_0);
    assertThat(result.getStorageMetrics()).hasSize(2);
    assertThat(result.getJobMetrics().getTotalJobs()).isEqualTo(1);
    assertThat(exporter.isHealthy()).isTrue();
    assertThat(exporter.getLastStorageSuccess()).isNotNull();
    assertThat(exporter.getLastJobsSuccess()).isNotNull();
  }

  @Test
  void configuredVersionSkipsDetection() {
    exporter =
        NetBackupExporter.builder()
            .setConfig(configFor(server).setApiVersion(ApiVersion.V12_0).build())
            .build();

    exporter.start();
    await().atMost(Duration.ofSeconds(5)).until(() -> exporter.getCycleCount() >= 1);

    // 未进行任何协商请求，所有请求都使用配置的版本
    assertThat(dispatcher.rejectedVersions).isEmpty();
    assertThat(dispatcher.seenVersions).containsExactly(ApiVersion.V12_0);
  }

  @Test
  void startFailsWhenNoVersionAccepted() {
    dispatcher.acceptedVersion = "none";
    exporter = NetBackupExporter.builder().setConfig(configFor(server).build()).build();

    assertThatThrownBy(exporter::start)
        .isInstanceOfSatisfying(
            NetBackupException.class,
            e -> assertThat(e.getType()).isEqualTo(NetBackupException.Type.VERSION_INCOMPATIBLE));
    assertThat(exporter.isStarted()).isFalse();
    assertThat(exporter.getLastResult()).isNull();
  }

  @Test
  void collectNowRequiresStart() {
    exporter = NetBackupExporter.builder().setConfig(configFor(server).build()).build();

    assertThatThrownBy(exporter::collectNow).isInstanceOf(IllegalStateException.class);
    assertThat(exporter.isHealthy()).isFalse();
    assertThat(exporter.testConnectivity()).isFalse();
  }

  @Test
  void collectNowUsesStorageCache() {
    exporter =
        NetBackupExporter.builder()
            .setConfig(configFor(server).setApiVersion(ApiVersion.V12_0).build())
            .build();
    exporter.start();
    await().atMost(Duration.ofSeconds(5)).until(() -> exporter.getCycleCount() >= 1);

    CollectionResult result = exporter.collectNow();

    assertThat(result.isStorageFromCache()).isTrue();
    assertThat(result.getStorageMetrics()).hasSize(2);
    assertThat(dispatcher.storageRequests.get()).isEqualTo(1);
    assertThat(exporter.testConnectivity()).isTrue();
  }

  @Test
  void endpointChangeFlushesCache() throws IOException {
    exporter =
        NetBackupExporter.builder()
            .setConfig(configFor(server).setApiVersion(ApiVersion.V12_0).build())
            .build();
    exporter.start();
    await().atMost(Duration.ofSeconds(5)).until(() -> exporter.getCycleCount() >= 1);
    assertThat(exporter.getStorageCache().get()).isPresent();

    NetBackupDispatcher otherDispatcher = new NetBackupDispatcher(ApiVersion.V12_0);
    try (MockWebServer other = new MockWebServer()) {
      other.setDispatcher(otherDispatcher);
      other.start();

      exporter.applyConfig(configFor(other).setApiVersion(ApiVersion.V12_0).build());

      assertThat(exporter.getStorageCache().get()).isEmpty();
      assertThat(exporter.getConfig().getPort()).isEqualTo(other.getPort());

      CollectionResult result = exporter.collectNow();
      assertThat(result.isStorageFromCache()).isFalse();
      assertThat(otherDispatcher.storageRequests.get()).isEqualTo(1);
      assertThat(dispatcher.storageRequests.get()).isEqualTo(1);
    }
  }

  @Test
  void unchangedConfigKeepsComponents() {
    NetBackupConfig config = configFor(server).setApiVersion(ApiVersion.V12_0).build();
    exporter = NetBackupExporter.builder().setConfig(config).build();
    exporter.start();
    await().atMost(Duration.ofSeconds(5)).until(() -> exporter.getCycleCount() >= 1);

    exporter.applyConfig(config.toBuilder().build());

    // 缓存未被清空
    assertThat(exporter.getStorageCache().get()).isPresent();
  }

  @Test
  void cacheTtlChangeRebuildsCache() {
    NetBackupConfig config = configFor(server).setApiVersion(ApiVersion.V12_0).build();
    exporter = NetBackupExporter.builder().setConfig(config).build();
    exporter.start();
    await().atMost(Duration.ofSeconds(5)).until(() -> exporter.getCycleCount() >= 1);
    StorageCache before = exporter.getStorageCache();

    exporter.applyConfig(config.toBuilder().setCacheTtl(Duration.ofMinutes(1)).build());

    StorageCache after = exporter.getStorageCache();
    assertThat(after).isNotSameAs(before);
    assertThat(after.getTtl()).isEqualTo(Duration.ofMinutes(1));
    assertThat(after.get()).isEmpty();

    // 新的采集器使用新缓存
    CollectionResult result = exporter.collectNow();
    assertThat(result.isStorageFromCache()).isFalse();
    assertThat(after.get()).isPresent();
    assertThat(dispatcher.storageRequests.get()).isEqualTo(2);
  }

  @Test
  void cacheTtlChangeBeforeStartApplies() {
    exporter = NetBackupExporter.builder().setConfig(configFor(server).build()).build();

    exporter.applyConfig(configFor(server).setCacheTtl(Duration.ofSeconds(30)).build());

    assertThat(exporter.getStorageCache().getTtl()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void applyConfigBeforeStartOnlyStoresSnapshot() {
    exporter = NetBackupExporter.builder().setConfig(configFor(server).build()).build();
    NetBackupConfig updated = configFor(server).setApiVersion(ApiVersion.V13_0).build();

    exporter.applyConfig(updated);

    assertThat(exporter.getConfig()).isEqualTo(updated);
    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void closeIsIdempotent() {
    exporter =
        NetBackupExporter.builder()
            .setConfig(configFor(server).setApiVersion(ApiVersion.V12_0).build())
            .build();
    exporter.start();

    exporter.close();
    exporter.close();

    assertThatThrownBy(exporter::start).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(exporter::collectNow).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(
            () -> exporter.applyConfig(configFor(server).setApiVersion("3.0").build()))
        .isInstanceOf(IllegalStateException.class);
  }

  /** 只接受一个协议版本的模拟 NetBackup 服务 */
  private static final class NetBackupDispatcher extends Dispatcher {
    volatile String acceptedVersion;
    final Set<String> rejectedVersions = ConcurrentHashMap.newKeySet();
    final Set<String> seenVersions = ConcurrentHashMap.newKeySet();
    final AtomicInteger storageRequests = new AtomicInteger();

    NetBackupDispatcher(String acceptedVersion) {
      this.acceptedVersion = acceptedVersion;
    }

    @Override
    public MockResponse dispatch(RecordedRequest request) {
      String accept = request.getHeader("Accept");
      String version =
          accept != null && accept.contains("version=")
              ? accept.substring(accept.indexOf("version=") + "version=".length())
              : "";
      if (!version.equals(acceptedVersion)) {
        rejectedVersions.add(version);
        return new MockResponse()
            .setResponseCode(406)
            .setHeader("Content-Type", "application/vnd.netbackup+json")
            .setBody("{\"errorCode\":9000,\"errorMessage\":\"unsupported version\"}");
      }
      seenVersions.add(version);

      String path = request.getPath() != null ? request.getPath() : "";
      String body;
      if (path.startsWith("/netbackup/storage/storage-units")) {
        storageRequests.incrementAndGet();
        body = STORAGE_BODY;
      } else if (path.startsWith("/netbackup/admin/jobs")) {
        body = JOBS_BODY;
      } else {
        return new MockResponse().setResponseCode(404);
      }
      return new MockResponse()
          .setHeader("Content-Type", "application/vnd.netbackup+json;version=" + version)
          .setBody(body);
    }
  }
}

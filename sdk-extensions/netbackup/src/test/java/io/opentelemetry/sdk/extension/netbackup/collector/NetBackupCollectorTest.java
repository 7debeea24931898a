/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.collector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.sdk.extension.netbackup.cache.StorageCache;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupClient;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupException;
import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.model.api.PagedResponse;
import io.opentelemetry.sdk.extension.netbackup.telemetry.TelemetryAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;

class NetBackupCollectorTest {

  private static final String BASE_URL = "https://nbu-master:1556/netbackup";
  private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final String STORAGE_PAGE =
      "{\"data\":[{\"attributes\":{\"name\":\"disk-1\",\"storageType\":\"DISK\","
          + "\"storageServerType\":\"MSDP\",\"freeCapacityBytes\":100,\"usedCapacityBytes\":50}}],"
          + "\"meta\":{\"pagination\":{\"offset\":0,\"last\":0}}}";
  private static final String JOBS_PAGE =
      "{\"data\":[{\"attributes\":{\"jobId\":1,\"jobType\":\"BACKUP\",\"policyType\":\"VMware\","
          + "\"status\":0,\"kilobytesTransferred\":4}}],"
          + "\"meta\":{\"pagination\":{\"offset\":0,\"last\":0}}}";

  private NetBackupClient client;
  private NetBackupConfig config;
  private AtomicLong ticker;
  private StorageCache cache;
  private AtomicInteger storageRequests;
  private AtomicInteger jobsRequests;
  private NetBackupCollector collector;

  @BeforeEach
  void setUp() {
    client = mock(NetBackupClient.class);
    when(client.getBaseUrl()).thenReturn(BASE_URL);
    when(client.getApiVersion()).thenReturn("13.0");

    config =
        NetBackupConfig.builder()
            .setHost("nbu-master")
            .setApiKey("key-0123456789")
            .setApiVersion("13.0")
            .setCollectionTimeout(Duration.ofSeconds(5))
            .build();
    ticker = new AtomicLong();
    cache = new StorageCache(Duration.ofMinutes(5), ticker::get, Clock.fixed(NOW, ZoneOffset.UTC));
    storageRequests = new AtomicInteger();
    jobsRequests = new AtomicInteger();
  }

  @AfterEach
  void tearDown() {
    if (collector != null) {
      collector.close(Duration.ofSeconds(1));
    }
  }

  private NetBackupCollector buildCollector(NetBackupConfig cfg) {
    collector =
        NetBackupCollector.builder()
            .setConfig(cfg)
            .setClient(client)
            .setStorageCache(cache)
            .setClock(Clock.fixed(NOW, ZoneOffset.UTC))
            .build();
    return collector;
  }

  private void respond(Answer<PagedResponse> storage, Answer<PagedResponse> jobs) {
    when(client.fetchData(anyString(), eq(PagedResponse.class)))
        .thenAnswer(
            invocation -> {
              String url = invocation.getArgument(0);
              if (url.contains("/storage/storage-units")) {
                storageRequests.incrementAndGet();
                return storage.answer(invocation);
              }
              jobsRequests.incrementAndGet();
              return jobs.answer(invocation);
            });
  }

  private static Answer<PagedResponse> body(String json) {
    return invocation -> MAPPER.readValue(json, PagedResponse.class);
  }

  private static Answer<PagedResponse> failure(NetBackupException e) {
    return invocation -> {
      throw e;
    };
  }

  @Test
  void bothSourcesSucceed() {
    respond(body(STORAGE_PAGE), body(JOBS_PAGE));

    CollectionResult result = buildCollector(config).collect();

    assertThat(result.getStorageError()).isNull();
    assertThat(result.getJobsError()).isNull();
    assertThat(result.getStorageMetrics()).hasSize(2);
    assertThat(result.getJobMetrics().getTotalJobs()).isEqualTo(1);
    assertThat(result.getStatus()).isEqualTo(TelemetryAttributes.STATUS_SUCCESS);
    assertThat(result.getApiVersion()).isEqualTo("13.0");
    assertThat(result.isStorageFromCache()).isFalse();
    assertThat(collector.isHealthy()).isTrue();
    assertThat(collector.getLastStorageSuccess()).isEqualTo(NOW);
    assertThat(collector.getLastJobsSuccess()).isEqualTo(NOW);
  }

  @Test
  void storageFailureKeepsJobMetrics() {
    respond(
        failure(NetBackupException.authenticationFailed(BASE_URL, 401)), body(JOBS_PAGE));

    CollectionResult result = buildCollector(config).collect();

    assertThat(result.getStorageError()).isInstanceOf(NetBackupException.class);
    assertThat(result.getJobsError()).isNull();
    assertThat(result.getStorageMetrics()).isEmpty();
    assertThat(result.getJobMetrics().getTotalJobs()).isEqualTo(1);
    assertThat(result.getStatus()).isEqualTo(TelemetryAttributes.STATUS_PARTIAL_FAILURE);
    // 任一数据源成功即健康
    assertThat(collector.isHealthy()).isTrue();
    assertThat(collector.getLastStorageSuccess()).isNull();
  }

  @Test
  void jobsFailureKeepsStorageMetrics() {
    respond(body(STORAGE_PAGE), failure(NetBackupException.httpError(BASE_URL, 500, null)));

    CollectionResult result = buildCollector(config).collect();

    assertThat(result.getJobsError()).isNotNull();
    assertThat(result.getStorageMetrics()).hasSize(2);
    assertThat(result.getJobMetrics().isEmpty()).isTrue();
    assertThat(collector.isHealthy()).isTrue();
  }

  @Test
  void bothFailuresAreUnhealthy() {
    respond(
        failure(NetBackupException.responseShape("bad storage", null)),
        failure(NetBackupException.responseShape("bad jobs", null)));

    CollectionResult result = buildCollector(config).collect();

    assertThat(result.getStatus()).isEqualTo(TelemetryAttributes.STATUS_FAILED);
    assertThat(result.isHealthy()).isFalse();
    assertThat(collector.isHealthy()).isFalse();
  }

  @Test
  void notHealthyBeforeFirstCycle() {
    assertThat(buildCollector(config).isHealthy()).isFalse();
    assertThat(collector.getLastResult()).isNull();
  }

  @Test
  void storageServedFromCacheWithinTtl() {
    respond(body(STORAGE_PAGE), body(JOBS_PAGE));
    buildCollector(config);

    collector.collect();
    ticker.addAndGet(Duration.ofMinutes(1).toNanos());
    CollectionResult second = collector.collect();

    assertThat(storageRequests.get()).isEqualTo(1);
    assertThat(jobsRequests.get()).isEqualTo(2);
    assertThat(second.isStorageFromCache()).isTrue();
    assertThat(second.getStorageMetrics()).hasSize(2);
  }

  @Test
  void expiredCacheTriggersExactlyOneFetch() {
    respond(body(STORAGE_PAGE), body(JOBS_PAGE));
    buildCollector(config);

    collector.collect();
    ticker.addAndGet(Duration.ofMinutes(5).toNanos());
    CollectionResult afterExpiry = collector.collect();

    assertThat(storageRequests.get()).isEqualTo(2);
    assertThat(afterExpiry.isStorageFromCache()).isFalse();
  }

  @Test
  void failedStorageFetchIsNotCached() {
    AtomicInteger calls = new AtomicInteger();
    respond(
        invocation -> {
          if (calls.incrementAndGet() == 1) {
            throw NetBackupException.transientFailure("HTTP 503", 503, null);
          }
          return MAPPER.readValue(STORAGE_PAGE, PagedResponse.class);
        },
        body(JOBS_PAGE));
    buildCollector(config);

    assertThat(collector.collect().getStorageError()).isNotNull();
    assertThat(cache.get()).isEmpty();
    assertThat(collector.collect().getStorageMetrics()).hasSize(2);
  }

  @Test
  void slowSourceIsCancelledAtDeadline() {
    respond(
        body(STORAGE_PAGE),
        invocation -> {
          Thread.sleep(10_000);
          return MAPPER.readValue(JOBS_PAGE, PagedResponse.class);
        });
    NetBackupConfig shortTimeout =
        config.toBuilder().setCollectionTimeout(Duration.ofMillis(300)).build();

    long start = System.nanoTime();
    CollectionResult result = buildCollector(shortTimeout).collect();

    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    assertThat(result.getJobsError()).isInstanceOf(NetBackupException.class);
    assertThat(((NetBackupException) result.getJobsError()).getType())
        .isEqualTo(NetBackupException.Type.TIMEOUT);
    assertThat(result.getStorageMetrics()).hasSize(2);
    assertThat(result.isHealthy()).isTrue();
  }

  @Test
  void interruptedCallerKeepsPreviousResult() {
    respond(body(STORAGE_PAGE), body(JOBS_PAGE));
    buildCollector(config);
    CollectionResult first = collector.collect();

    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> collector.collect())
          .isInstanceOfSatisfying(
              NetBackupException.class,
              e -> assertThat(e.getType()).isEqualTo(NetBackupException.Type.CANCELLED));
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }

    // 被取消的周期不覆盖健康状态
    assertThat(collector.isHealthy()).isTrue();
    assertThat(collector.getLastResult()).isSameAs(first);
    assertThat(jobsRequests.get()).isEqualTo(1);
  }

  @Test
  void interruptDuringCycleKeepsPreviousResult() throws Exception {
    respond(body(STORAGE_PAGE), body(JOBS_PAGE));
    buildCollector(config);
    CollectionResult first = collector.collect();
    Instant storageSuccess = collector.getLastStorageSuccess();

    CountDownLatch jobsStarted = new CountDownLatch(1);
    respond(
        body(STORAGE_PAGE),
        invocation -> {
          jobsStarted.countDown();
          Thread.sleep(10_000);
          return MAPPER.readValue(JOBS_PAGE, PagedResponse.class);
        });
    AtomicReference<Throwable> thrown = new AtomicReference<>();
    Thread worker =
        new Thread(
            () -> {
              try {
                collector.collect();
              } catch (RuntimeException e) {
                thrown.set(e);
              }
            });
    worker.start();
    assertThat(jobsStarted.await(5, TimeUnit.SECONDS)).isTrue();

    worker.interrupt();
    worker.join(5_000);

    assertThat(worker.isAlive()).isFalse();
    assertThat(thrown.get())
        .isInstanceOfSatisfying(
            NetBackupException.class,
            e -> assertThat(e.getType()).isEqualTo(NetBackupException.Type.CANCELLED));
    assertThat(collector.isHealthy()).isTrue();
    assertThat(collector.getLastResult()).isSameAs(first);
    assertThat(collector.getLastStorageSuccess()).isEqualTo(storageSuccess);
  }

  @Test
  void closeWaitsForInFlightCycle() throws Exception {
    respond(body(STORAGE_PAGE), body(JOBS_PAGE));
    buildCollector(config);
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    blockBaseUrl(entered, release);

    CompletableFuture<CollectionResult> cycle = CompletableFuture.supplyAsync(collector::collect);
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
    CompletableFuture<Void> closing =
        CompletableFuture.runAsync(() -> collector.close(Duration.ofSeconds(5)));
    await().atMost(Duration.ofSeconds(1)).until(collector::isClosed);

    // 周期仍在进行，close 不能返回
    assertThat(closing).isNotDone();

    release.countDown();
    CollectionResult result = cycle.get(5, TimeUnit.SECONDS);
    closing.get(5, TimeUnit.SECONDS);

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getStorageMetrics()).hasSize(2);
  }

  @Test
  void cycleBlockedPastCloseTimeoutFailsAsClosed() throws Exception {
    respond(body(STORAGE_PAGE), body(JOBS_PAGE));
    buildCollector(config);
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    blockBaseUrl(entered, release);

    CompletableFuture<CollectionResult> cycle = CompletableFuture.supplyAsync(collector::collect);
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
    collector.close(Duration.ofMillis(200));
    release.countDown();

    assertThatThrownBy(() -> cycle.get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
    assertThat(collector.getLastResult()).isNull();
  }

  @Test
  void connectivityTestRacingCloseReturnsFalse() throws Exception {
    buildCollector(config);
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    blockBaseUrl(entered, release);

    CompletableFuture<Boolean> connectivity =
        CompletableFuture.supplyAsync(() -> collector.testConnectivity(Duration.ofSeconds(1)));
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
    collector.close(Duration.ofSeconds(1));
    release.countDown();

    assertThat(connectivity.get(5, TimeUnit.SECONDS)).isFalse();
  }

  private void blockBaseUrl(CountDownLatch entered, CountDownLatch release) {
    when(client.getBaseUrl())
        .thenAnswer(
            invocation -> {
              entered.countDown();
              release.await(5, TimeUnit.SECONDS);
              return BASE_URL;
            });
  }

  @Test
  void closedCollectorRejectsCycles() {
    buildCollector(config).close(Duration.ofSeconds(1));

    assertThat(collector.isClosed()).isTrue();
    assertThatThrownBy(() -> collector.collect()).isInstanceOf(IllegalStateException.class);
    assertThat(collector.testConnectivity()).isFalse();
  }

  @Test
  void connectivityProbe() {
    when(client.fetchData(eq(BASE_URL + "/admin/jobs?page[limit]=1"), eq(JsonNode.class)))
        .thenReturn(MAPPER.createObjectNode());

    assertThat(buildCollector(config).testConnectivity(Duration.ofSeconds(1))).isTrue();
  }

  @Test
  void connectivityProbeFailure() {
    when(client.fetchData(anyString(), eq(JsonNode.class)))
        .thenThrow(NetBackupException.authenticationFailed(BASE_URL, 401));

    assertThat(buildCollector(config).testConnectivity(Duration.ofSeconds(1))).isFalse();
  }

  @Test
  void connectivityProbeTimesOut() {
    when(client.fetchData(anyString(), eq(JsonNode.class)))
        .thenAnswer(
            invocation -> {
              Thread.sleep(10_000);
              return MAPPER.createObjectNode();
            });

    assertThat(buildCollector(config).testConnectivity(Duration.ofMillis(100))).isFalse();
  }
}

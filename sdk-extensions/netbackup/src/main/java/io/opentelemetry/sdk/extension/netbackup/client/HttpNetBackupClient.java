/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.core.InFlightTracker;
import io.opentelemetry.sdk.extension.netbackup.core.RetryHelper;
import io.opentelemetry.sdk.extension.netbackup.telemetry.NetBackupTelemetry;
import io.opentelemetry.sdk.extension.netbackup.telemetry.TelemetryAttributes;
import io.opentelemetry.sdk.extension.netbackup.version.ApiVersion;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.ConnectionPool;
import okhttp3.ConnectionSpec;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okhttp3.TlsVersion;

/**
 * 基于 OkHttp 的 NetBackup 客户端实现
 *
 * <p>特性：
 * <ul>
 *   <li>共享连接池，按主机限制并发请求数
 *   <li>TLS 1.2 及以上；可选跳过证书校验（仅限测试环境）
 *   <li>网络错误、429、5xx 指数退避重试，遵循 Retry-After
 *   <li>关闭时先等待在途请求结束，再释放连接池
 * </ul>
 */
public final class HttpNetBackupClient implements NetBackupClient {

  private static final Logger logger = Logger.getLogger(HttpNetBackupClient.class.getName());

  private static final String HEADER_ACCEPT = "Accept";
  private static final String HEADER_AUTHORIZATION = "Authorization";
  private static final String HEADER_CONTENT_TYPE = "Content-Type";
  private static final String HEADER_RETRY_AFTER = "Retry-After";

  private static final String CONTENT_TYPE_JSON = "application/json";
  private static final String CONTENT_TYPE_NETBACKUP_JSON = "application/vnd.netbackup+json";
  private static final int BODY_PREVIEW_LIMIT = 200;

  private static final TextMapSetter<Request.Builder> HEADER_SETTER =
      (carrier, key, value) -> {
        if (carrier != null) {
          carrier.header(key, value);
        }
      };

  private final NetBackupConfig config;
  private final NetBackupTelemetry telemetry;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RetryHelper.RetryConfig retryConfig;
  private final InFlightTracker inFlight;
  private final AtomicBoolean released;

  /**
   * 创建 HTTP 客户端
   *
   * @param config 配置快照
   * @param telemetry 可观测性句柄
   */
  public HttpNetBackupClient(NetBackupConfig config, NetBackupTelemetry telemetry) {
    this.config = config;
    this.telemetry = telemetry;
    this.httpClient = buildHttpClient(config);
    this.objectMapper =
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    this.inFlight = new InFlightTracker();
    this.released = new AtomicBoolean(false);
    this.retryConfig =
        RetryHelper.RetryConfig.builder()
            .setMaxRetries(config.getRetryMaxAttempts())
            .setInitialDelay(config.getRetryInitialBackoff())
            .setMaxDelay(config.getRetryMaxBackoff())
            .setBackoffMultiplier(config.getRetryBackoffMultiplier())
            .retryOnRecoverableNetBackupException()
            .setRetryPredicate(this::shouldRetry)
            .build();

    logger.log(
        Level.INFO,
        "NetBackup client initialized, baseUrl: {0}, apiVersion: {1}, apiKey: {2}",
        new Object[] {
          config.getBaseUrl(),
          config.getApiVersion() != null ? config.getApiVersion() : "auto",
          config.getMaskedApiKey()
        });
  }

  // ===== OkHttp 构建 =====

  private static OkHttpClient buildHttpClient(NetBackupConfig config) {
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequestsPerHost(config.getMaxRequestsPerHost());
    dispatcher.setMaxRequests(Math.max(config.getMaxRequestsPerHost(), 64));

    ConnectionSpec tls =
        new ConnectionSpec.Builder(ConnectionSpec.MODERN_TLS)
            .tlsVersions(TlsVersion.TLS_1_3, TlsVersion.TLS_1_2)
            .build();
    List<ConnectionSpec> specs =
        "http".equals(config.getScheme())
            ? Arrays.asList(tls, ConnectionSpec.CLEARTEXT)
            : Collections.singletonList(tls);

    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(config.getConnectTimeout())
            .readTimeout(config.getReadTimeout())
            .writeTimeout(config.getConnectTimeout())
            .connectionPool(
                new ConnectionPool(
                    config.getMaxIdleConnections(),
                    config.getKeepAlive().toMillis(),
                    TimeUnit.MILLISECONDS))
            .dispatcher(dispatcher)
            .connectionSpecs(specs)
            // 重试由 RetryHelper 统一控制
            .retryOnConnectionFailure(false);

    if (config.isInsecureSkipVerify()) {
      logger.log(
          Level.WARNING,
          "SECURITY WARNING: TLS certificate verification is disabled for {0}. "
              + "This must only be used in test environments.",
          config.getBaseUrl());
      X509TrustManager trustAll = new TrustAllManager();
      try {
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(null, new TrustManager[] {trustAll}, new SecureRandom());
        builder.sslSocketFactory(sslContext.getSocketFactory(), trustAll);
        builder.hostnameVerifier((hostname, session) -> true);
      } catch (GeneralSecurityException e) {
        throw new NetBackupException(
            NetBackupException.Type.CONFIG_ERROR,
            "failed to initialize insecure TLS context",
            e);
      }
    }
    return builder.build();
  }

  // ===== 请求 =====

  @Override
  public <T> T fetchData(String url, Class<T> type) {
    String version = config.getApiVersion();
    if (version == null) {
      throw NetBackupException.configError(
          "API version has not been negotiated, cannot request " + url);
    }
    return fetchData(ApiRequest.of(url, version, config.getApiKey()), type);
  }

  @Override
  public <T> T fetchData(ApiRequest request, Class<T> type) {
    if (!inFlight.tryEnter()) {
      throw NetBackupException.clientClosed();
    }
    try {
      return RetryHelper.executeWithRetry(() -> executeOnce(request, type), retryConfig);
    } finally {
      inFlight.exit();
    }
  }

  private <T> T executeOnce(ApiRequest request, Class<T> type) {
    if (Thread.currentThread().isInterrupted()) {
      throw NetBackupException.cancelled(
          "request cancelled before start: " + request.getUrl(), null);
    }

    long startNanos = System.nanoTime();
    Span span = telemetry.startSpan("http.request", SpanKind.CLIENT);
    span.setAttribute(TelemetryAttributes.HTTP_METHOD, "GET");
    span.setAttribute(TelemetryAttributes.HTTP_URL, request.getUrl());
    span.setAttribute(TelemetryAttributes.NETBACKUP_API_VERSION, request.getApiVersion());

    try (Scope ignored = span.makeCurrent()) {
      Request.Builder builder =
          new Request.Builder()
              .url(request.getUrl())
              .get()
              .header(HEADER_ACCEPT, ApiVersion.acceptHeader(request.getApiVersion()))
              .header(HEADER_AUTHORIZATION, request.getApiKey());
      telemetry.getPropagator().inject(Context.current(), builder, HEADER_SETTER);

      try (Response response = execute(httpClient.newCall(builder.build()))) {
        span.setAttribute(TelemetryAttributes.HTTP_STATUS_CODE, (long) response.code());
        ResponseBody body = response.body();
        if (body != null && body.contentLength() >= 0) {
          span.setAttribute(TelemetryAttributes.HTTP_RESPONSE_CONTENT_LENGTH, body.contentLength());
        }
        return handleResponse(request, response, type);
      }
    } catch (NetBackupException e) {
      NetBackupTelemetry.recordError(span, e);
      throw e;
    } finally {
      span.setAttribute(
          TelemetryAttributes.HTTP_DURATION_MS,
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
      span.end();
    }
  }

  /**
   * 执行请求并等待响应
   *
   * <p>请求交给 OkHttp 调度器异步执行，调用线程等待结果；调用线程被中断时取消请求。
   */
  private static Response execute(Call call) {
    CompletableFuture<Response> future = new CompletableFuture<>();
    call.enqueue(
        new Callback() {
          @Override
          public void onFailure(Call c, IOException e) {
            future.completeExceptionally(e);
          }

          @Override
          public void onResponse(Call c, Response response) {
            if (!future.complete(response)) {
              response.close();
            }
          }
        });

    try {
      return future.get();
    } catch (InterruptedException e) {
      call.cancel();
      future.whenComplete(
          (response, error) -> {
            if (response != null) {
              response.close();
            }
          });
      Thread.currentThread().interrupt();
      throw NetBackupException.cancelled(
          "request cancelled: " + call.request().url().redact(), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (call.isCanceled()) {
        throw NetBackupException.cancelled(
            "request cancelled: " + call.request().url().redact(), cause);
      }
      throw NetBackupException.networkFailure(
          "request to " + call.request().url().redact() + " failed: " + cause.getMessage(), cause);
    }
  }

  private <T> T handleResponse(ApiRequest request, Response response, Class<T> type) {
    int code = response.code();
    String url = request.getUrl();
    String contentType = response.header(HEADER_CONTENT_TYPE);

    if (code == 406) {
      throw NetBackupException.versionNotSupported(
          url, request.getApiVersion(), ApiVersion.SUPPORTED);
    }
    if (code == 401 || code == 403) {
      throw NetBackupException.authenticationFailed(url, code);
    }
    if (code == 429 || code >= 500) {
      Duration retryAfter = parseRetryAfter(response.header(HEADER_RETRY_AFTER));
      logger.log(
          Level.FINE,
          "Transient HTTP response: url={0}, code={1}, retryAfter={2}",
          new Object[] {url, code, retryAfter});
      throw NetBackupException.transientFailure(
          "HTTP " + code + " from " + url, code, retryAfter);
    }
    if (!response.isSuccessful()) {
      throw NetBackupException.httpError(url, code, contentType);
    }

    ResponseBody body = response.body();
    if (body == null) {
      throw NetBackupException.responseShape("empty response body, URL: " + url, null);
    }

    if (!isJsonContentType(contentType)) {
      throw NetBackupException.responseShape(
          String.format(
              Locale.ROOT,
              "expected JSON response but got content type %s (HTTP %d), URL: %s, body preview: %s",
              contentType,
              code,
              url,
              bodyPreview(body)),
          null);
    }

    try {
      return objectMapper.readValue(body.byteStream(), type);
    } catch (JsonProcessingException e) {
      throw NetBackupException.responseShape(
          "failed to decode "
              + type.getSimpleName()
              + " from "
              + url
              + ": "
              + e.getOriginalMessage(),
          e);
    } catch (IOException e) {
      throw NetBackupException.networkFailure(
          "failed to read response body from " + url + ": " + e.getMessage(), e);
    }
  }

  private boolean shouldRetry(Exception e) {
    // 连接池释放后不再重试
    return !released.get()
        && e instanceof NetBackupException
        && ((NetBackupException) e).isRecoverable();
  }

  static boolean isJsonContentType(@Nullable String contentType) {
    if (contentType == null) {
      return false;
    }
    String lower = contentType.toLowerCase(Locale.ROOT);
    return lower.contains(CONTENT_TYPE_JSON) || lower.contains(CONTENT_TYPE_NETBACKUP_JSON);
  }

  private static String bodyPreview(ResponseBody body) {
    try {
      String text = body.string();
      return text.length() > BODY_PREVIEW_LIMIT
          ? text.substring(0, BODY_PREVIEW_LIMIT) + "..."
          : text;
    } catch (IOException e) {
      return "<unreadable: " + e.getMessage() + ">";
    }
  }

  /**
   * 解析 Retry-After 头，支持秒数与 HTTP 日期两种格式
   *
   * @param value 头的值
   * @return 等待时间，无法解析时返回 null
   */
  @Nullable
  static Duration parseRetryAfter(@Nullable String value) {
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    String trimmed = value.trim();
    try {
      long seconds = Long.parseLong(trimmed);
      return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
    } catch (NumberFormatException ignored) {
      // 不是秒数，尝试 HTTP 日期
    }
    try {
      ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
      Duration delay = Duration.between(ZonedDateTime.now(at.getZone()), at);
      return delay.isNegative() ? Duration.ZERO : delay;
    } catch (DateTimeParseException e) {
      logger.log(Level.FINE, "Ignoring unparseable Retry-After header: {0}", trimmed);
      return null;
    }
  }

  // ===== 生命周期 =====

  @Override
  @Nullable
  public String getApiVersion() {
    return config.getApiVersion();
  }

  @Override
  public String getBaseUrl() {
    return config.getBaseUrl();
  }

  @Override
  public boolean isClosed() {
    return inFlight.isClosed();
  }

  /** 当前在途请求数 */
  public int getActiveRequestCount() {
    return inFlight.getActiveCount();
  }

  @Override
  public void close() {
    beginClose();
    Duration timeout = config.getCloseTimeout();
    try {
      if (!inFlight.awaitDrained(timeout)) {
        logger.log(
            Level.WARNING,
            "Timeout waiting for {0} active requests during shutdown",
            inFlight.getActiveCount());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while waiting for active requests during shutdown");
    } finally {
      releaseResources();
    }
  }

  @Override
  public void close(Duration timeout) {
    beginClose();
    boolean drained;
    try {
      drained = inFlight.awaitDrained(timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      releaseResources();
      throw NetBackupException.cancelled("interrupted while waiting for active requests", e);
    }
    releaseResources();
    if (!drained) {
      int active = inFlight.getActiveCount();
      logger.log(
          Level.WARNING, "Deadline passed while waiting for {0} active requests", active);
      throw NetBackupException.timeout(
          "deadline of " + timeout + " passed while waiting for " + active + " active requests");
    }
  }

  private void beginClose() {
    if (!inFlight.markClosed()) {
      throw NetBackupException.alreadyClosed();
    }
    logger.log(
        Level.FINE,
        "Closing NetBackup client, active requests: {0}",
        inFlight.getActiveCount());
  }

  /** 只回收空闲连接；仍在进行的交换不受影响，完成后随连接池一起回收。 */
  private void releaseResources() {
    if (!released.compareAndSet(false, true)) {
      return;
    }
    ExecutorService executor = httpClient.dispatcher().executorService();
    executor.shutdown();
    httpClient.connectionPool().evictAll();
    logger.log(Level.INFO, "NetBackup client closed");
  }

  /** 信任所有证书，仅在 insecureSkipVerify 打开时使用 */
  private static final class TrustAllManager implements X509TrustManager {
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}

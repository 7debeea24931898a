/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.config;

import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;

/**
 * NetBackup 采集配置快照
 *
 * <p>不可变对象：所有字段在 {@link Builder#build()} 时校验。协议版本协商或配置重载时通过
 * {@link #withApiVersion(String)} / {@link #toBuilder()} 生成新的快照，不会修改已有实例。
 */
public final class NetBackupConfig {

  // ===== 配置键常量 =====

  // 服务端地址
  private static final String SCHEME = "netbackup.scheme";
  private static final String HOST = "netbackup.host";
  private static final String PORT = "netbackup.port";
  private static final String URI = "netbackup.uri";

  // 认证与协议版本
  private static final String API_KEY = "netbackup.api.key";
  private static final String API_VERSION = "netbackup.api.version";

  // 采集配置
  private static final String SCRAPING_INTERVAL = "netbackup.scraping.interval";
  private static final String CACHE_TTL = "netbackup.cache.ttl";
  private static final String COLLECTION_TIMEOUT = "netbackup.collection.timeout";

  // 连接池配置
  private static final String CONNECT_TIMEOUT = "netbackup.http.connect.timeout";
  private static final String READ_TIMEOUT = "netbackup.http.read.timeout";
  private static final String MAX_IDLE_CONNECTIONS = "netbackup.http.max.idle.connections";
  private static final String KEEP_ALIVE = "netbackup.http.keep.alive";
  private static final String MAX_REQUESTS_PER_HOST = "netbackup.http.max.requests.per.host";
  private static final String CLOSE_TIMEOUT = "netbackup.http.close.timeout";
  private static final String INSECURE_SKIP_VERIFY = "netbackup.tls.insecure.skip.verify";

  // 重试配置
  private static final String RETRY_MAX_ATTEMPTS = "netbackup.retry.max.attempts";
  private static final String RETRY_INITIAL_BACKOFF = "netbackup.retry.initial.backoff";
  private static final String RETRY_MAX_BACKOFF = "netbackup.retry.max.backoff";
  private static final String RETRY_BACKOFF_MULTIPLIER = "netbackup.retry.backoff.multiplier";

  // ===== 默认值常量 =====
  private static final String DEFAULT_SCHEME = "https";
  private static final int DEFAULT_PORT = 1556;
  private static final String DEFAULT_URI = "/netbackup";
  private static final Duration DEFAULT_SCRAPING_INTERVAL = Duration.ofMinutes(5);
  private static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);
  private static final Duration DEFAULT_COLLECTION_TIMEOUT = Duration.ofMinutes(2);
  private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(1);
  private static final int DEFAULT_MAX_IDLE_CONNECTIONS = 100;
  private static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(90);
  private static final int DEFAULT_MAX_REQUESTS_PER_HOST = 20;
  private static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(30);
  private static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;
  private static final Duration DEFAULT_RETRY_INITIAL_BACKOFF = Duration.ofSeconds(5);
  private static final Duration DEFAULT_RETRY_MAX_BACKOFF = Duration.ofSeconds(60);
  private static final double DEFAULT_RETRY_BACKOFF_MULTIPLIER = 2.0;

  private static final Pattern API_VERSION_PATTERN = Pattern.compile("^\\d+\\.\\d+$");

  // ===== 配置字段 =====
  private final String scheme;
  private final String host;
  private final int port;
  private final String uri;
  private final String apiKey;
  @Nullable private final String apiVersion;
  private final Duration scrapingInterval;
  private final Duration cacheTtl;
  private final Duration collectionTimeout;
  private final Duration connectTimeout;
  private final Duration readTimeout;
  private final int maxIdleConnections;
  private final Duration keepAlive;
  private final int maxRequestsPerHost;
  private final Duration closeTimeout;
  private final boolean insecureSkipVerify;
  private final int retryMaxAttempts;
  private final Duration retryInitialBackoff;
  private final Duration retryMaxBackoff;
  private final double retryBackoffMultiplier;

  private NetBackupConfig(Builder builder) {
    this.scheme = builder.scheme;
    this.host = builder.host;
    this.port = builder.port;
    this.uri = builder.uri;
    this.apiKey = builder.apiKey;
    this.apiVersion = builder.apiVersion;
    this.scrapingInterval = builder.scrapingInterval;
    this.cacheTtl = builder.cacheTtl;
    this.collectionTimeout = builder.collectionTimeout;
    this.connectTimeout = builder.connectTimeout;
    this.readTimeout = builder.readTimeout;
    this.maxIdleConnections = builder.maxIdleConnections;
    this.keepAlive = builder.keepAlive;
    this.maxRequestsPerHost = builder.maxRequestsPerHost;
    this.closeTimeout = builder.closeTimeout;
    this.insecureSkipVerify = builder.insecureSkipVerify;
    this.retryMaxAttempts = builder.retryMaxAttempts;
    this.retryInitialBackoff = builder.retryInitialBackoff;
    this.retryMaxBackoff = builder.retryMaxBackoff;
    this.retryBackoffMultiplier = builder.retryBackoffMultiplier;
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
   * 从 OpenTelemetry 配置属性创建配置
   *
   * @param properties 配置属性
   * @return 配置快照
   */
  public static NetBackupConfig fromConfigProperties(ConfigProperties properties) {
    return builder().fromConfigProperties(properties).build();
  }

  /**
   * 基于当前快照创建构建器
   *
   * @return 预填充当前值的构建器
   */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * 返回设置了协议版本的新快照
   *
   * @param version 协商得到的协议版本
   * @return 新的配置快照
   */
  public NetBackupConfig withApiVersion(String version) {
    return toBuilder().setApiVersion(version).build();
  }

  // ===== Getters =====

  public String getScheme() {
    return scheme;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public String getUri() {
    return uri;
  }

  public String getApiKey() {
    return apiKey;
  }

  /**
   * 获取协议版本
   *
   * @return 协议版本，未设置时返回 null（需要自动协商）
   */
  @Nullable
  public String getApiVersion() {
    return apiVersion;
  }

  public boolean hasApiVersion() {
    return apiVersion != null;
  }

  /** 作业采集时间窗口，同时也是默认的采集周期 */
  public Duration getScrapingInterval() {
    return scrapingInterval;
  }

  public Duration getCacheTtl() {
    return cacheTtl;
  }

  public Duration getCollectionTimeout() {
    return collectionTimeout;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public int getMaxIdleConnections() {
    return maxIdleConnections;
  }

  public Duration getKeepAlive() {
    return keepAlive;
  }

  public int getMaxRequestsPerHost() {
    return maxRequestsPerHost;
  }

  public Duration getCloseTimeout() {
    return closeTimeout;
  }

  public boolean isInsecureSkipVerify() {
    return insecureSkipVerify;
  }

  public int getRetryMaxAttempts() {
    return retryMaxAttempts;
  }

  public Duration getRetryInitialBackoff() {
    return retryInitialBackoff;
  }

  public Duration getRetryMaxBackoff() {
    return retryMaxBackoff;
  }

  public double getRetryBackoffMultiplier() {
    return retryBackoffMultiplier;
  }

  /**
   * 获取 NetBackup 基础 URL
   *
   * <p>格式：scheme://host:port/uri，例如 {@code https://nbu-master:1556/netbackup}
   *
   * @return 基础 URL
   */
  public String getBaseUrl() {
    return String.format(Locale.ROOT, "%s://%s:%d%s", scheme, host, port, uri);
  }

  /**
   * 拼接基础 URL 与 API 路径
   *
   * @param path API 路径，例如 {@code /admin/jobs}
   * @return 解析后的 URL 构建器，可继续添加查询参数
   */
  public HttpUrl.Builder urlBuilder(String path) {
    HttpUrl base = HttpUrl.get(getBaseUrl() + path);
    return base.newBuilder();
  }

  /**
   * 获取脱敏的 API Key，用于日志输出
   *
   * <p>显示前 4 位和后 4 位，长度不超过 8 时全部隐藏。
   *
   * @return 脱敏后的 API Key
   */
  public String getMaskedApiKey() {
    return maskApiKey(apiKey);
  }

  static String maskApiKey(String key) {
    if (key.length() <= 8) {
      return "****";
    }
    return key.substring(0, 4) + "****" + key.substring(key.length() - 4);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NetBackupConfig)) {
      return false;
    }
    NetBackupConfig that = (NetBackupConfig) o;
    return port == that.port
        && maxIdleConnections == that.maxIdleConnections
        && maxRequestsPerHost == that.maxRequestsPerHost
        && insecureSkipVerify == that.insecureSkipVerify
        && retryMaxAttempts == that.retryMaxAttempts
        && Double.compare(retryBackoffMultiplier, that.retryBackoffMultiplier) == 0
        && scheme.equals(that.scheme)
        && host.equals(that.host)
        && uri.equals(that.uri)
        && apiKey.equals(that.apiKey)
        && Objects.equals(apiVersion, that.apiVersion)
        && scrapingInterval.equals(that.scrapingInterval)
        && cacheTtl.equals(that.cacheTtl)
        && collectionTimeout.equals(that.collectionTimeout)
        && connectTimeout.equals(that.connectTimeout)
        && readTimeout.equals(that.readTimeout)
        && keepAlive.equals(that.keepAlive)
        && closeTimeout.equals(that.closeTimeout)
        && retryInitialBackoff.equals(that.retryInitialBackoff)
        && retryMaxBackoff.equals(that.retryMaxBackoff);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scheme, host, port, uri, apiKey, apiVersion, scrapingInterval, cacheTtl);
  }

  @Override
  public String toString() {
    return "NetBackupConfig{"
        + "baseUrl="
        + getBaseUrl()
        + ", apiKey="
        + getMaskedApiKey()
        + ", apiVersion="
        + (apiVersion != null ? apiVersion : "auto")
        + ", scrapingInterval="
        + scrapingInterval
        + ", cacheTtl="
        + cacheTtl
        + ", insecureSkipVerify="
        + insecureSkipVerify
        + '}';
  }

  /** Builder for {@link NetBackupConfig}. */
  public static final class Builder {
    private String scheme = DEFAULT_SCHEME;
    private String host = "";
    private int port = DEFAULT_PORT;
    private String uri = DEFAULT_URI;
    private String apiKey = "";
    @Nullable private String apiVersion;
    private Duration scrapingInterval = DEFAULT_SCRAPING_INTERVAL;
    private Duration cacheTtl = DEFAULT_CACHE_TTL;
    private Duration collectionTimeout = DEFAULT_COLLECTION_TIMEOUT;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration readTimeout = DEFAULT_READ_TIMEOUT;
    private int maxIdleConnections = DEFAULT_MAX_IDLE_CONNECTIONS;
    private Duration keepAlive = DEFAULT_KEEP_ALIVE;
    private int maxRequestsPerHost = DEFAULT_MAX_REQUESTS_PER_HOST;
    private Duration closeTimeout = DEFAULT_CLOSE_TIMEOUT;
    private boolean insecureSkipVerify = false;
    private int retryMaxAttempts = DEFAULT_RETRY_MAX_ATTEMPTS;
    private Duration retryInitialBackoff = DEFAULT_RETRY_INITIAL_BACKOFF;
    private Duration retryMaxBackoff = DEFAULT_RETRY_MAX_BACKOFF;
    private double retryBackoffMultiplier = DEFAULT_RETRY_BACKOFF_MULTIPLIER;

    private Builder() {}

    private Builder(NetBackupConfig config) {
      this.scheme = config.scheme;
      this.host = config.host;
      this.port = config.port;
      this.uri = config.uri;
      this.apiKey = config.apiKey;
      this.apiVersion = config.apiVersion;
      this.scrapingInterval = config.scrapingInterval;
      this.cacheTtl = config.cacheTtl;
      this.collectionTimeout = config.collectionTimeout;
      this.connectTimeout = config.connectTimeout;
      this.readTimeout = config.readTimeout;
      this.maxIdleConnections = config.maxIdleConnections;
      this.keepAlive = config.keepAlive;
      this.maxRequestsPerHost = config.maxRequestsPerHost;
      this.closeTimeout = config.closeTimeout;
      this.insecureSkipVerify = config.insecureSkipVerify;
      this.retryMaxAttempts = config.retryMaxAttempts;
      this.retryInitialBackoff = config.retryInitialBackoff;
      this.retryMaxBackoff = config.retryMaxBackoff;
      this.retryBackoffMultiplier = config.retryBackoffMultiplier;
    }

    /**
     * 从配置属性加载配置
     *
     * @param properties 配置属性
     * @return this
     */
    public Builder fromConfigProperties(ConfigProperties properties) {
      this.scheme = properties.getString(SCHEME, DEFAULT_SCHEME);
      this.host = properties.getString(HOST, "");
      this.port = properties.getInt(PORT, DEFAULT_PORT);
      this.uri = properties.getString(URI, DEFAULT_URI);
      this.apiKey = properties.getString(API_KEY, "");

      String version = properties.getString(API_VERSION);
      if (version != null && !version.isEmpty()) {
        this.apiVersion = version;
      }

      this.scrapingInterval = properties.getDuration(SCRAPING_INTERVAL, DEFAULT_SCRAPING_INTERVAL);
      this.cacheTtl = properties.getDuration(CACHE_TTL, DEFAULT_CACHE_TTL);
      this.collectionTimeout =
          properties.getDuration(COLLECTION_TIMEOUT, DEFAULT_COLLECTION_TIMEOUT);
      this.connectTimeout = properties.getDuration(CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT);
      this.readTimeout = properties.getDuration(READ_TIMEOUT, DEFAULT_READ_TIMEOUT);
      this.maxIdleConnections =
          properties.getInt(MAX_IDLE_CONNECTIONS, DEFAULT_MAX_IDLE_CONNECTIONS);
      this.keepAlive = properties.getDuration(KEEP_ALIVE, DEFAULT_KEEP_ALIVE);
      this.maxRequestsPerHost =
          properties.getInt(MAX_REQUESTS_PER_HOST, DEFAULT_MAX_REQUESTS_PER_HOST);
      this.closeTimeout = properties.getDuration(CLOSE_TIMEOUT, DEFAULT_CLOSE_TIMEOUT);
      this.insecureSkipVerify = properties.getBoolean(INSECURE_SKIP_VERIFY, false);

      this.retryMaxAttempts = properties.getInt(RETRY_MAX_ATTEMPTS, DEFAULT_RETRY_MAX_ATTEMPTS);
      this.retryInitialBackoff =
          properties.getDuration(RETRY_INITIAL_BACKOFF, DEFAULT_RETRY_INITIAL_BACKOFF);
      this.retryMaxBackoff = properties.getDuration(RETRY_MAX_BACKOFF, DEFAULT_RETRY_MAX_BACKOFF);
      this.retryBackoffMultiplier =
          properties.getDouble(RETRY_BACKOFF_MULTIPLIER, DEFAULT_RETRY_BACKOFF_MULTIPLIER);
      return this;
    }

    public Builder setScheme(String scheme) {
      this.scheme = scheme;
      return this;
    }

    public Builder setHost(String host) {
      this.host = host;
      return this;
    }

    public Builder setPort(int port) {
      this.port = port;
      return this;
    }

    public Builder setUri(String uri) {
      this.uri = uri;
      return this;
    }

    public Builder setApiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    /** 设置协议版本，null 表示启动时自动协商 */
    public Builder setApiVersion(@Nullable String apiVersion) {
      this.apiVersion = apiVersion;
      return this;
    }

    public Builder setScrapingInterval(Duration scrapingInterval) {
      this.scrapingInterval = scrapingInterval;
      return this;
    }

    public Builder setCacheTtl(Duration cacheTtl) {
      this.cacheTtl = cacheTtl;
      return this;
    }

    public Builder setCollectionTimeout(Duration collectionTimeout) {
      this.collectionTimeout = collectionTimeout;
      return this;
    }

    public Builder setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder setReadTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
      return this;
    }

    public Builder setMaxIdleConnections(int maxIdleConnections) {
      this.maxIdleConnections = maxIdleConnections;
      return this;
    }

    public Builder setKeepAlive(Duration keepAlive) {
      this.keepAlive = keepAlive;
      return this;
    }

    public Builder setMaxRequestsPerHost(int maxRequestsPerHost) {
      this.maxRequestsPerHost = maxRequestsPerHost;
      return this;
    }

    public Builder setCloseTimeout(Duration closeTimeout) {
      this.closeTimeout = closeTimeout;
      return this;
    }

    public Builder setInsecureSkipVerify(boolean insecureSkipVerify) {
      this.insecureSkipVerify = insecureSkipVerify;
      return this;
    }

    public Builder setRetryMaxAttempts(int retryMaxAttempts) {
      this.retryMaxAttempts = retryMaxAttempts;
      return this;
    }

    public Builder setRetryInitialBackoff(Duration retryInitialBackoff) {
      this.retryInitialBackoff = retryInitialBackoff;
      return this;
    }

    public Builder setRetryMaxBackoff(Duration retryMaxBackoff) {
      this.retryMaxBackoff = retryMaxBackoff;
      return this;
    }

    public Builder setRetryBackoffMultiplier(double retryBackoffMultiplier) {
      this.retryBackoffMultiplier = retryBackoffMultiplier;
      return this;
    }

    /**
     * 构建配置
     *
     * @return 配置快照
     * @throws IllegalArgumentException 配置不合法时
     */
    public NetBackupConfig build() {
      validate();
      return new NetBackupConfig(this);
    }

    private void validate() {
      if (!"http".equals(scheme) && !"https".equals(scheme)) {
        throw new IllegalArgumentException(
            "invalid NBU server scheme: " + scheme + " (must be http or https)");
      }
      if (host.isEmpty()) {
        throw new IllegalArgumentException("NBU server host is required");
      }
      if (port < 1 || port > 65535) {
        throw new IllegalArgumentException("invalid NBU server port: " + port);
      }
      if (apiKey.isEmpty()) {
        throw new IllegalArgumentException("NBU server API key is required");
      }
      if (apiVersion != null && !API_VERSION_PATTERN.matcher(apiVersion).matches()) {
        throw new IllegalArgumentException(
            "invalid API version format: "
                + apiVersion
                + " (must be in format X.Y, e.g., 12.0)");
      }
      if (!uri.isEmpty() && !uri.startsWith("/")) {
        throw new IllegalArgumentException("NBU server URI must start with '/': " + uri);
      }
      requirePositive(scrapingInterval, "scrapingInterval");
      requirePositive(collectionTimeout, "collectionTimeout");
      requirePositive(connectTimeout, "connectTimeout");
      requirePositive(readTimeout, "readTimeout");
      requirePositive(keepAlive, "keepAlive");
      requirePositive(closeTimeout, "closeTimeout");
      if (maxIdleConnections < 0) {
        throw new IllegalArgumentException("maxIdleConnections must be >= 0");
      }
      if (maxRequestsPerHost < 1) {
        throw new IllegalArgumentException("maxRequestsPerHost must be >= 1");
      }
      if (retryMaxAttempts < 0) {
        throw new IllegalArgumentException("retryMaxAttempts must be >= 0");
      }
      if (retryBackoffMultiplier < 1.0) {
        throw new IllegalArgumentException("retryBackoffMultiplier must be >= 1.0");
      }
      if (retryInitialBackoff.isNegative() || retryMaxBackoff.compareTo(retryInitialBackoff) < 0) {
        throw new IllegalArgumentException(
            "retryMaxBackoff must be >= retryInitialBackoff and both non-negative");
      }
    }

    private static void requirePositive(Duration value, String name) {
      if (value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException(name + " must be positive");
      }
    }
  }
}

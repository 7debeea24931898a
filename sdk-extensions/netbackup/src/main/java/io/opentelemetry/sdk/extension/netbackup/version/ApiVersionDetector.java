/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.version;

import com.fasterxml.jackson.databind.JsonNode;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.extension.netbackup.client.ApiRequest;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupClient;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupException;
import io.opentelemetry.sdk.extension.netbackup.telemetry.NetBackupTelemetry;
import io.opentelemetry.sdk.extension.netbackup.telemetry.TelemetryAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 协议版本协商器
 *
 * <p>按优先级降序依次探测候选版本（13.0 → 12.0 → 3.0）：
 * <ul>
 *   <li>2xx：接受该版本，停止探测
 *   <li>406：服务端不支持该版本，继续下一个
 *   <li>其他错误（认证失败、网络错误、5xx 等）：立即失败，不再探测
 * </ul>
 *
 * <p>协商器不修改任何配置；调用方使用返回值生成新的配置快照。
 */
public final class ApiVersionDetector {

  private static final Logger logger = Logger.getLogger(ApiVersionDetector.class.getName());

  static final String PROBE_PATH = "/admin/jobs";
  static final String PROBE_QUERY = "?page[limit]=1";

  private final NetBackupClient client;
  private final String baseUrl;
  private final String apiKey;
  private final List<String> candidates;
  private final NetBackupTelemetry telemetry;

  /**
   * 创建协商器，使用默认候选版本列表
   *
   * @param client NetBackup 客户端
   * @param baseUrl 基础 URL
   * @param apiKey API Key
   * @param telemetry 可观测性句柄
   */
  public ApiVersionDetector(
      NetBackupClient client, String baseUrl, String apiKey, NetBackupTelemetry telemetry) {
    this(client, baseUrl, apiKey, ApiVersion.SUPPORTED, telemetry);
  }

  /**
   * 创建协商器
   *
   * @param client NetBackup 客户端
   * @param baseUrl 基础 URL
   * @param apiKey API Key
   * @param candidates 候选版本，按优先级降序
   * @param telemetry 可观测性句柄
   */
  public ApiVersionDetector(
      NetBackupClient client,
      String baseUrl,
      String apiKey,
      List<String> candidates,
      NetBackupTelemetry telemetry) {
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("candidates must not be empty");
    }
    this.client = client;
    this.baseUrl = baseUrl;
    this.apiKey = apiKey;
    this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    this.telemetry = telemetry;
  }

  /**
   * 探测服务端支持的最高版本
   *
   * @return 第一个被接受的版本
   * @throws NetBackupException 所有候选均被拒绝（VERSION_INCOMPATIBLE），或遇到非 406 错误
   */
  public String detectVersion() {
    Span span = telemetry.startSpan("detect_version");
    span.setAttribute(TelemetryAttributes.NETBACKUP_ENDPOINT, baseUrl);
    List<String> attempted = new ArrayList<>();
    String url = baseUrl + PROBE_PATH + PROBE_QUERY;

    try (Scope ignored = span.makeCurrent()) {
      for (String version : candidates) {
        attempted.add(version);
        logger.log(
            Level.FINE,
            "Probing NetBackup API version {0} at {1}",
            new Object[] {version, baseUrl});
        try {
          client.fetchData(ApiRequest.of(url, version, apiKey), JsonNode.class);
        } catch (NetBackupException e) {
          if (e.getType() == NetBackupException.Type.VERSION_NOT_SUPPORTED) {
            span.addEvent(
                "version_attempt", attemptAttributes(version, e.getStatusCode(), "not_supported"));
            logger.log(Level.FINE, "API version {0} not supported (HTTP 406)", version);
            continue;
          }
          span.addEvent("version_attempt", attemptAttributes(version, e.getStatusCode(), "failed"));
          logger.log(
              Level.WARNING,
              "API version detection aborted at version {0}: {1}",
              new Object[] {version, e.getMessage()});
          throw e;
        }

        span.addEvent("version_attempt", attemptAttributes(version, 200, "accepted"));
        span.setAttribute(TelemetryAttributes.NETBACKUP_API_VERSION, version);
        logger.log(
            Level.INFO,
            "Detected NetBackup API version {0} at {1}",
            new Object[] {version, baseUrl});
        return version;
      }

      NetBackupException incompatible = NetBackupException.versionIncompatible(baseUrl, attempted);
      logger.log(Level.SEVERE, incompatible.getMessage());
      throw incompatible;
    } catch (NetBackupException e) {
      NetBackupTelemetry.recordError(span, e);
      throw e;
    } finally {
      span.setAttribute(
          TelemetryAttributes.NETBACKUP_ATTEMPTED_VERSIONS, String.join(",", attempted));
      span.end();
    }
  }

  public List<String> getCandidates() {
    return candidates;
  }

  private static Attributes attemptAttributes(String version, int statusCode, String outcome) {
    return Attributes.of(
        TelemetryAttributes.NETBACKUP_API_VERSION,
        version,
        TelemetryAttributes.HTTP_STATUS_CODE,
        (long) statusCode,
        TelemetryAttributes.NETBACKUP_OUTCOME,
        outcome);
  }
}

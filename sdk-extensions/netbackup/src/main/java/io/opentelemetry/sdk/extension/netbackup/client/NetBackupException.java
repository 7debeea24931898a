/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.client;

import java.time.Duration;
import java.util.List;
import javax.annotation.Nullable;

/**
 * NetBackup 相关异常
 *
 * <p>封装协议协商、HTTP 请求、响应解析与客户端生命周期中的各类错误。{@link #isRecoverable()}
 * 决定请求是否会被重试。
 */
public class NetBackupException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** 异常类型 */
  public enum Type {
    /** 所有候选协议版本均被拒绝 */
    VERSION_INCOMPATIBLE,
    /** 服务端拒绝当前协议版本（HTTP 406） */
    VERSION_NOT_SUPPORTED,
    /** 临时错误：网络异常、429、5xx */
    TRANSIENT,
    /** 认证失败（HTTP 401/403） */
    AUTHENTICATION_FAILED,
    /** 其他非 2xx 响应 */
    HTTP_ERROR,
    /** 响应格式不符合预期 */
    RESPONSE_SHAPE,
    /** 客户端已关闭，拒绝新请求 */
    CLIENT_CLOSED,
    /** 重复关闭 */
    ALREADY_CLOSED,
    /** 超时 */
    TIMEOUT,
    /** 调用方取消 */
    CANCELLED,
    /** 配置错误 */
    CONFIG_ERROR
  }

  private final Type type;
  private final boolean recoverable;
  private final int statusCode;
  @Nullable private final Duration retryAfter;

  /**
   * 创建 NetBackup 异常
   *
   * @param type 异常类型
   * @param message 异常消息
   */
  public NetBackupException(Type type, String message) {
    this(type, message, null);
  }

  /**
   * 创建 NetBackup 异常
   *
   * @param type 异常类型
   * @param message 异常消息
   * @param cause 原始异常
   */
  public NetBackupException(Type type, String message, @Nullable Throwable cause) {
    this(type, message, cause, isRecoverableType(type), 0, null);
  }

  /**
   * 创建 NetBackup 异常
   *
   * @param type 异常类型
   * @param message 异常消息
   * @param cause 原始异常
   * @param recoverable 是否可恢复
   * @param statusCode HTTP 状态码，非 HTTP 错误为 0
   * @param retryAfter 服务端建议的重试间隔
   */
  public NetBackupException(
      Type type,
      String message,
      @Nullable Throwable cause,
      boolean recoverable,
      int statusCode,
      @Nullable Duration retryAfter) {
    super(formatMessage(type, message), cause);
    this.type = type;
    this.recoverable = recoverable;
    this.statusCode = statusCode;
    this.retryAfter = retryAfter;
  }

  public Type getType() {
    return type;
  }

  /**
   * 检查异常是否可恢复（可重试）
   *
   * @return 是否可恢复
   */
  public boolean isRecoverable() {
    return recoverable;
  }

  /**
   * 获取 HTTP 状态码
   *
   * @return 状态码，非 HTTP 错误时为 0
   */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * 获取服务端通过 Retry-After 给出的重试间隔
   *
   * @return 重试间隔，未提供时返回 null
   */
  @Nullable
  public Duration getRetryAfter() {
    return retryAfter;
  }

  private static boolean isRecoverableType(Type type) {
    return type == Type.TRANSIENT;
  }

  private static String formatMessage(Type type, String message) {
    return "[" + type.name() + "] " + message;
  }

  // ===== 便捷工厂方法 =====

  public static NetBackupException versionNotSupported(
      String url, String version, List<String> supportedVersions) {
    return new NetBackupException(
        Type.VERSION_NOT_SUPPORTED,
        "API version "
            + version
            + " is not supported by the NetBackup server (HTTP 406 Not Acceptable). "
            + "Supported versions: "
            + String.join(", ", supportedVersions)
            + ". Verify the server release or leave the API version unset to enable "
            + "automatic detection. URL: "
            + url,
        null,
        false,
        406,
        null);
  }

  public static NetBackupException versionIncompatible(
      String baseUrl, List<String> attemptedVersions) {
    return new NetBackupException(
        Type.VERSION_INCOMPATIBLE,
        "none of the API versions ["
            + String.join(", ", attemptedVersions)
            + "] is supported by the NetBackup server at "
            + baseUrl
            + ". Check the server release and network path, or configure the API version "
            + "explicitly");
  }

  public static NetBackupException transientFailure(
      String message, int statusCode, @Nullable Duration retryAfter) {
    return new NetBackupException(Type.TRANSIENT, message, null, true, statusCode, retryAfter);
  }

  public static NetBackupException networkFailure(String message, Throwable cause) {
    return new NetBackupException(Type.TRANSIENT, message, cause, true, 0, null);
  }

  public static NetBackupException authenticationFailed(String url, int statusCode) {
    return new NetBackupException(
        Type.AUTHENTICATION_FAILED,
        "authentication failed (HTTP " + statusCode + "), verify the API key. URL: " + url,
        null,
        false,
        statusCode,
        null);
  }

  public static NetBackupException httpError(
      String url, int statusCode, @Nullable String contentType) {
    return new NetBackupException(
        Type.HTTP_ERROR,
        "HTTP request failed with status "
            + statusCode
            + ", URL: "
            + url
            + ", content type: "
            + (contentType != null ? contentType : "none"),
        null,
        false,
        statusCode,
        null);
  }

  public static NetBackupException responseShape(String message, @Nullable Throwable cause) {
    return new NetBackupException(Type.RESPONSE_SHAPE, message, cause);
  }

  public static NetBackupException clientClosed() {
    return new NetBackupException(Type.CLIENT_CLOSED, "client is closed, request rejected");
  }

  public static NetBackupException alreadyClosed() {
    return new NetBackupException(Type.ALREADY_CLOSED, "client already closed");
  }

  public static NetBackupException timeout(String message) {
    return new NetBackupException(Type.TIMEOUT, message);
  }

  public static NetBackupException cancelled(String message, @Nullable Throwable cause) {
    return new NetBackupException(Type.CANCELLED, message, cause);
  }

  public static NetBackupException configError(String message) {
    return new NetBackupException(Type.CONFIG_ERROR, message);
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.client;

import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.telemetry.NetBackupTelemetry;
import java.io.Closeable;
import java.time.Duration;
import javax.annotation.Nullable;

/**
 * NetBackup REST API 客户端接口
 *
 * <p>实现必须线程安全。所有失败以 {@link NetBackupException} 抛出；调用线程被中断时取消在途请求并抛出
 * {@link NetBackupException.Type#CANCELLED}。
 */
public interface NetBackupClient extends Closeable {

  /**
   * 使用配置中的协议版本与凭据获取数据
   *
   * @param url 完整 URL
   * @param type 反序列化目标类型
   * @param <T> 结果类型
   * @return 解析后的响应
   * @throws NetBackupException 请求失败、响应格式错误或客户端已关闭
   */
  <T> T fetchData(String url, Class<T> type);

  /**
   * 使用显式协议版本与凭据获取数据，用于协议版本协商
   *
   * @param request 请求参数
   * @param type 反序列化目标类型
   * @param <T> 结果类型
   * @return 解析后的响应
   * @throws NetBackupException 请求失败、响应格式错误或客户端已关闭
   */
  <T> T fetchData(ApiRequest request, Class<T> type);

  /**
   * 获取客户端使用的协议版本
   *
   * @return 协议版本，未协商时返回 null
   */
  @Nullable
  String getApiVersion();

  /** 获取 NetBackup 基础 URL */
  String getBaseUrl();

  /**
   * 关闭客户端
   *
   * <p>拒绝新请求，在配置的关闭超时内等待在途请求结束，然后释放连接池。超时后记录警告并继续释放。
   *
   * @throws NetBackupException 重复关闭时抛出 {@link NetBackupException.Type#ALREADY_CLOSED}
   */
  @Override
  void close();

  /**
   * 在指定时限内关闭客户端
   *
   * @param timeout 等待在途请求的最长时间
   * @throws NetBackupException 重复关闭（ALREADY_CLOSED）或等待超时（TIMEOUT）
   */
  void close(Duration timeout);

  /** 检查客户端是否已关闭 */
  boolean isClosed();

  /**
   * 创建基于 HTTP 的客户端
   *
   * @param config 配置快照
   * @param telemetry 可观测性句柄
   * @return 客户端
   */
  static NetBackupClient create(NetBackupConfig config, NetBackupTelemetry telemetry) {
    return new HttpNetBackupClient(config, telemetry);
  }
}

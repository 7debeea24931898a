/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * OpenTelemetry SDK Extension - NetBackup
 *
 * <p>从 NetBackup REST API 采集存储与作业指标，包括：
 *
 * <ul>
 *   <li>协议版本自动协商
 *   <li>分页拉取与重试
 *   <li>存储指标缓存
 *   <li>存储与作业并行采集
 *   <li>以 Gauge 形式发布到 OpenTelemetry
 * </ul>
 *
 * <p>配置项使用 {@code netbackup.*} 前缀，参见 {@link io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig}。
 *
 * @see io.opentelemetry.sdk.extension.netbackup.NetBackupExporter
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.netbackup;

import javax.annotation.ParametersAreNonnullByDefault;

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * NetBackup HTTP 客户端。
 *
 * <ul>
 *   <li>{@link io.opentelemetry.sdk.extension.netbackup.client.NetBackupClient} - 客户端接口
 *   <li>{@link io.opentelemetry.sdk.extension.netbackup.client.HttpNetBackupClient} - 基于 OkHttp 的实现
 *   <li>{@link io.opentelemetry.sdk.extension.netbackup.client.NetBackupException} - 类型化异常
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.netbackup.client;

import javax.annotation.ParametersAreNonnullByDefault;

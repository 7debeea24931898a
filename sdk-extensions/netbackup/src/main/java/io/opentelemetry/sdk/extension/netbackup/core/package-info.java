/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 通用基础组件：指数退避、重试、进行中请求跟踪。
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.netbackup.core;

import javax.annotation.ParametersAreNonnullByDefault;

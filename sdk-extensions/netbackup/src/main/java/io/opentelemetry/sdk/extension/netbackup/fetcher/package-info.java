/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 分页拉取与实体转换。
 *
 * <p>{@link io.opentelemetry.sdk.extension.netbackup.fetcher.AbstractPagedFetcher} 负责分页循环和逐条解码，子类只定义路径、校验和聚合方式。
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.netbackup.fetcher;

import javax.annotation.ParametersAreNonnullByDefault;

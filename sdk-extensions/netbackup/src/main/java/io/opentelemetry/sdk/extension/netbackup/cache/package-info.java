/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 存储指标缓存。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.netbackup.cache;

import javax.annotation.ParametersAreNonnullByDefault;

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 并行采集与健康状态。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.netbackup.collector;

import javax.annotation.ParametersAreNonnullByDefault;

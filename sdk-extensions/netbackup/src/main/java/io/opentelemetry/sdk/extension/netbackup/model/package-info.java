/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 指标模型：维度键与取值。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.netbackup.model;

import javax.annotation.ParametersAreNonnullByDefault;

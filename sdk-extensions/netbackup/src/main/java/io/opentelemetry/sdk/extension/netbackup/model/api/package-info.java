/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** NetBackup REST API 响应结构。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.netbackup.model.api;

import javax.annotation.ParametersAreNonnullByDefault;

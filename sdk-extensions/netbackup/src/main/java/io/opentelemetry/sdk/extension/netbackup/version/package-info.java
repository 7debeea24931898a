/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 协议版本协商。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.netbackup.version;

import javax.annotation.ParametersAreNonnullByDefault;

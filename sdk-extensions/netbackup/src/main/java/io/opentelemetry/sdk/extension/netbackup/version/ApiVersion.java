/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.version;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * NetBackup REST API 协议版本
 *
 * <p>候选版本按优先级降序排列：
 * <ul>
 *   <li>13.0 - NetBackup 11.0+
 *   <li>12.0 - NetBackup 10.5
 *   <li>3.0 - NetBackup 10.0 - 10.4
 * </ul>
 */
public final class ApiVersion {

  public static final String V13_0 = "13.0";
  public static final String V12_0 = "12.0";
  public static final String V3_0 = "3.0";

  /** 支持的版本，按协商顺序排列 */
  public static final List<String> SUPPORTED =
      Collections.unmodifiableList(Arrays.asList(V13_0, V12_0, V3_0));

  private static final String MEDIA_TYPE = "application/vnd.netbackup+json";

  private ApiVersion() {}

  /**
   * 构建指定版本的 Accept 头
   *
   * @param version 协议版本
   * @return 例如 {@code application/vnd.netbackup+json;version=12.0}
   */
  public static String acceptHeader(String version) {
    return MEDIA_TYPE + ";version=" + version;
  }
}

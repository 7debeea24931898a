/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.client;

import java.util.Objects;

/** 单次 API 调用的参数：目标 URL、协议版本与凭据。 */
public final class ApiRequest {

  private final String url;
  private final String apiVersion;
  private final String apiKey;

  private ApiRequest(String url, String apiVersion, String apiKey) {
    this.url = Objects.requireNonNull(url, "url");
    this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
    this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
  }

  public static ApiRequest of(String url, String apiVersion, String apiKey) {
    return new ApiRequest(url, apiVersion, apiKey);
  }

  public String getUrl() {
    return url;
  }

  public String getApiVersion() {
    return apiVersion;
  }

  public String getApiKey() {
    return apiKey;
  }

  @Override
  public String toString() {
    // 不输出凭据
    return "ApiRequest{url=" + url + ", apiVersion=" + apiVersion + '}';
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.telemetry;

import io.opentelemetry.api.common.AttributeKey;

/** Span、事件与指标使用的属性键。 */
public final class TelemetryAttributes {

  // ===== NetBackup =====
  public static final AttributeKey<String> NETBACKUP_ENDPOINT =
      AttributeKey.stringKey("netbackup.endpoint");
  public static final AttributeKey<Long> NETBACKUP_STORAGE_UNITS =
      AttributeKey.longKey("netbackup.storage_units");
  public static final AttributeKey<String> NETBACKUP_API_VERSION =
      AttributeKey.stringKey("netbackup.api_version");
  public static final AttributeKey<String> NETBACKUP_ATTEMPTED_VERSIONS =
      AttributeKey.stringKey("netbackup.attempted_versions");
  public static final AttributeKey<String> NETBACKUP_TIME_WINDOW =
      AttributeKey.stringKey("netbackup.time_window");
  public static final AttributeKey<String> NETBACKUP_START_TIME =
      AttributeKey.stringKey("netbackup.start_time");
  public static final AttributeKey<Long> NETBACKUP_TOTAL_JOBS =
      AttributeKey.longKey("netbackup.total_jobs");
  public static final AttributeKey<Long> NETBACKUP_TOTAL_PAGES =
      AttributeKey.longKey("netbackup.total_pages");
  public static final AttributeKey<Long> NETBACKUP_PAGE_OFFSET =
      AttributeKey.longKey("netbackup.page_offset");
  public static final AttributeKey<Long> NETBACKUP_ITEMS_IN_PAGE =
      AttributeKey.longKey("netbackup.items_in_page");
  public static final AttributeKey<Long> NETBACKUP_SKIPPED_ITEMS =
      AttributeKey.longKey("netbackup.skipped_items");
  public static final AttributeKey<String> NETBACKUP_OUTCOME =
      AttributeKey.stringKey("netbackup.outcome");

  // ===== 采集周期 =====
  public static final AttributeKey<Long> SCRAPE_DURATION_MS =
      AttributeKey.longKey("scrape.duration_ms");
  public static final AttributeKey<Long> SCRAPE_STORAGE_METRICS_COUNT =
      AttributeKey.longKey("scrape.storage_metrics_count");
  public static final AttributeKey<Long> SCRAPE_JOB_METRICS_COUNT =
      AttributeKey.longKey("scrape.job_metrics_count");
  public static final AttributeKey<String> SCRAPE_STATUS = AttributeKey.stringKey("scrape.status");
  public static final AttributeKey<Boolean> SCRAPE_CACHE_HIT =
      AttributeKey.booleanKey("scrape.cache_hit");

  // ===== HTTP =====
  public static final AttributeKey<String> HTTP_METHOD = AttributeKey.stringKey("http.method");
  public static final AttributeKey<String> HTTP_URL = AttributeKey.stringKey("http.url");
  public static final AttributeKey<Long> HTTP_STATUS_CODE =
      AttributeKey.longKey("http.status_code");
  public static final AttributeKey<Long> HTTP_RESPONSE_CONTENT_LENGTH =
      AttributeKey.longKey("http.response_content_length");
  public static final AttributeKey<Long> HTTP_DURATION_MS =
      AttributeKey.longKey("http.duration_ms");

  public static final AttributeKey<String> ERROR = AttributeKey.stringKey("error");

  // ===== 采集状态取值 =====
  public static final String STATUS_SUCCESS = "success";
  public static final String STATUS_PARTIAL_FAILURE = "partial_failure";
  public static final String STATUS_FAILED = "failed";

  private TelemetryAttributes() {}
}

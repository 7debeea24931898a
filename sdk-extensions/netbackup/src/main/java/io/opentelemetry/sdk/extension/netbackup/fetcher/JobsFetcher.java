/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.fetcher;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.model.JobMetrics;
import io.opentelemetry.sdk.extension.netbackup.model.api.JobAttributes;
import io.opentelemetry.sdk.extension.netbackup.telemetry.NetBackupTelemetry;
import io.opentelemetry.sdk.extension.netbackup.telemetry.TelemetryAttributes;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;

/**
 * 作业统计拉取
 *
 * <p>拉取结束时间晚于 {@code now - scrapingInterval} 的全部作业，按作业类型、策略类型、状态聚合传输字节数与
 * 作业数，同时按作业类型、状态聚合作业数。
 */
public final class JobsFetcher
    extends AbstractPagedFetcher<JobAttributes, JobsFetcher.WindowAccumulator, JobMetrics> {

  private static final Logger logger = Logger.getLogger(JobsFetcher.class.getName());

  static final String JOBS_PATH = "/admin/jobs";
  static final String QUERY_SORT = "sort";
  static final String QUERY_FILTER = "filter";
  private static final long BYTES_PER_KILOBYTE = 1024L;

  private final Clock clock;

  public JobsFetcher(NetBackupConfig config, NetBackupTelemetry telemetry) {
    this(config, telemetry, Clock.systemUTC());
  }

  public JobsFetcher(NetBackupConfig config, NetBackupTelemetry telemetry, Clock clock) {
    super(config, telemetry, JobAttributes.class);
    this.clock = clock;
  }

  @Override
  protected String path() {
    return JOBS_PATH;
  }

  @Override
  protected String spanName() {
    return "fetch_jobs";
  }

  @Override
  protected String pageSpanName() {
    return "fetch_job_page";
  }

  @Override
  protected WindowAccumulator newAccumulator() {
    Instant windowStart = clock.instant().minus(config.getScrapingInterval());
    return new WindowAccumulator(windowStart);
  }

  @Override
  protected void customizeQuery(HttpUrl.Builder url, WindowAccumulator accumulator) {
    url.addQueryParameter(QUERY_SORT, "jobId");
    url.addQueryParameter(QUERY_FILTER, "endTime gt " + accumulator.getWindowStartText());
  }

  @Override
  @Nullable
  protected String validate(JobAttributes item) {
    if (item.getJobType() == null || item.getJobType().isEmpty()) {
      return "job " + item.getJobId() + " without jobType";
    }
    if (item.getStatus() == null) {
      return "job " + item.getJobId() + " without status";
    }
    return null;
  }

  @Override
  protected void fold(WindowAccumulator accumulator, JobAttributes item) {
    String policyType = item.getPolicyType() != null ? item.getPolicyType() : "";
    long kilobytes = item.getKilobytesTransferred() != null ? item.getKilobytesTransferred() : 0L;
    accumulator.metrics.addJob(
        item.getJobType(),
        policyType,
        String.valueOf(item.getStatus()),
        (double) (kilobytes * BYTES_PER_KILOBYTE));
  }

  @Override
  protected JobMetrics finish(
      WindowAccumulator accumulator, Span span, int pages, int skippedItems) {
    JobMetrics result = accumulator.metrics.build();
    span.setAttribute(
        TelemetryAttributes.NETBACKUP_TIME_WINDOW, config.getScrapingInterval().toString());
    span.setAttribute(TelemetryAttributes.NETBACKUP_START_TIME, accumulator.getWindowStartText());
    span.setAttribute(TelemetryAttributes.NETBACKUP_TOTAL_JOBS, result.getTotalJobs());
    logger.log(
        Level.FINE,
        "Fetched {0} jobs since {1} across {2} pages",
        new Object[] {result.getTotalJobs(), accumulator.getWindowStartText(), pages});
    return result;
  }

  /** 一次作业拉取的时间窗口与聚合状态 */
  public static final class WindowAccumulator {
    private final Instant windowStart;
    private final String windowStartText;
    private final JobMetrics.Accumulator metrics = JobMetrics.accumulator();

    WindowAccumulator(Instant windowStart) {
      this.windowStart = windowStart;
      this.windowStartText = DateTimeFormatter.ISO_INSTANT.format(windowStart);
    }

    public Instant getWindowStart() {
      return windowStart;
    }

    /** RFC 3339 UTC 格式的窗口起点 */
    public String getWindowStartText() {
      return windowStartText;
    }
  }
}

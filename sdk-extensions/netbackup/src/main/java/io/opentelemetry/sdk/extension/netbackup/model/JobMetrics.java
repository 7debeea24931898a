/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个时间窗口内的作业聚合结果
 *
 * <p>通过 {@link Accumulator} 逐条累加，{@link Accumulator#build()} 后不可变。
 */
public final class JobMetrics {

  private static final JobMetrics EMPTY =
      new JobMetrics(Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap(), 0);

  private final Map<JobMetricKey, Double> bytes;
  private final Map<JobMetricKey, Double> counts;
  private final Map<JobStatusKey, Double> statusCounts;
  private final long totalJobs;

  private JobMetrics(
      Map<JobMetricKey, Double> bytes,
      Map<JobMetricKey, Double> counts,
      Map<JobStatusKey, Double> statusCounts,
      long totalJobs) {
    this.bytes = bytes;
    this.counts = counts;
    this.statusCounts = statusCounts;
    this.totalJobs = totalJobs;
  }

  public static JobMetrics empty() {
    return EMPTY;
  }

  public static Accumulator accumulator() {
    return new Accumulator();
  }

  /** 每个维度传输的字节数 */
  public Map<JobMetricKey, Double> getBytes() {
    return bytes;
  }

  /** 每个维度的作业数 */
  public Map<JobMetricKey, Double> getCounts() {
    return counts;
  }

  /** 每个作业类型/状态的作业数 */
  public Map<JobStatusKey, Double> getStatusCounts() {
    return statusCounts;
  }

  public long getTotalJobs() {
    return totalJobs;
  }

  public boolean isEmpty() {
    return totalJobs == 0;
  }

  /** 指标条目总数（三类之和） */
  public int size() {
    return bytes.size() + counts.size() + statusCounts.size();
  }

  public List<MetricValue<JobMetricKey>> byteValues() {
    return toValues(bytes);
  }

  public List<MetricValue<JobMetricKey>> countValues() {
    return toValues(counts);
  }

  public List<MetricValue<JobStatusKey>> statusValues() {
    return toValues(statusCounts);
  }

  private static <K extends MetricKey> List<MetricValue<K>> toValues(Map<K, Double> map) {
    List<MetricValue<K>> values = new ArrayList<>(map.size());
    for (Map.Entry<K, Double> entry : map.entrySet()) {
      values.add(MetricValue.of(entry.getKey(), entry.getValue()));
    }
    return values;
  }

  @Override
  public String toString() {
    return "JobMetrics{totalJobs="
        + totalJobs
        + ", bytes="
        + bytes.size()
        + ", counts="
        + counts.size()
        + ", statusCounts="
        + statusCounts.size()
        + '}';
  }

  /** 非线程安全的累加器，单个分页序列内使用 */
  public static final class Accumulator {
    private final Map<JobMetricKey, Double> bytes = new LinkedHashMap<>();
    private final Map<JobMetricKey, Double> counts = new LinkedHashMap<>();
    private final Map<JobStatusKey, Double> statusCounts = new LinkedHashMap<>();
    private long totalJobs;

    private Accumulator() {}

    /**
     * 累加一个作业
     *
     * @param jobType 作业类型
     * @param policyType 策略类型
     * @param status 状态码
     * @param transferredBytes 传输字节数
     */
    public void addJob(String jobType, String policyType, String status, double transferredBytes) {
      JobMetricKey key = new JobMetricKey(jobType, policyType, status);
      counts.merge(key, 1.0, Double::sum);
      bytes.merge(key, transferredBytes, Double::sum);
      statusCounts.merge(new JobStatusKey(jobType, status), 1.0, Double::sum);
      totalJobs++;
    }

    public long getTotalJobs() {
      return totalJobs;
    }

    public JobMetrics build() {
      if (totalJobs == 0) {
        return EMPTY;
      }
      return new JobMetrics(
          Collections.unmodifiableMap(new LinkedHashMap<>(bytes)),
          Collections.unmodifiableMap(new LinkedHashMap<>(counts)),
          Collections.unmodifiableMap(new LinkedHashMap<>(statusCounts)),
          totalJobs);
    }
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** 作业维度：作业类型、策略类型、状态码。 */
public final class JobMetricKey implements MetricKey {

  /** 维度名称 */
  public static final List<String> LABEL_NAMES =
      Collections.unmodifiableList(Arrays.asList("action", "policy_type", "status"));

  private final String action;
  private final String policyType;
  private final String status;

  public JobMetricKey(String action, String policyType, String status) {
    this.action = Objects.requireNonNull(action, "action");
    this.policyType = Objects.requireNonNull(policyType, "policyType");
    this.status = Objects.requireNonNull(status, "status");
  }

  public String getAction() {
    return action;
  }

  public String getPolicyType() {
    return policyType;
  }

  public String getStatus() {
    return status;
  }

  @Override
  public List<String> labels() {
    return Collections.unmodifiableList(Arrays.asList(action, policyType, status));
  }

  @Override
  public List<String> labelNames() {
    return LABEL_NAMES;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof JobMetricKey)) {
      return false;
    }
    JobMetricKey that = (JobMetricKey) o;
    return action.equals(that.action)
        && policyType.equals(that.policyType)
        && status.equals(that.status);
  }

  @Override
  public int hashCode() {
    return Objects.hash(action, policyType, status);
  }

  @Override
  public String toString() {
    return "JobMetricKey{"
        + "action="
        + action
        + ", policyType="
        + policyType
        + ", status="
        + status
        + '}';
  }
}

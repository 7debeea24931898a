/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** 作业状态维度：作业类型、状态码。 */
public final class JobStatusKey implements MetricKey {

  /** 维度名称 */
  public static final List<String> LABEL_NAMES =
      Collections.unmodifiableList(Arrays.asList("action", "status"));

  private final String action;
  private final String status;

  public JobStatusKey(String action, String status) {
    this.action = Objects.requireNonNull(action, "action");
    this.status = Objects.requireNonNull(status, "status");
  }

  public String getAction() {
    return action;
  }

  public String getStatus() {
    return status;
  }

  @Override
  public List<String> labels() {
    return Collections.unmodifiableList(Arrays.asList(action, status));
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
    if (!(o instanceof JobStatusKey)) {
      return false;
    }
    JobStatusKey that = (JobStatusKey) o;
    return action.equals(that.action)
        && status.equals(that.status);
  }

  @Override
  public int hashCode() {
    return Objects.hash(action, status);
  }

  @Override
  public String toString() {
    return "JobStatusKey{"
        + "action="
        + action
        + ", status="
        + status
        + '}';
  }
}

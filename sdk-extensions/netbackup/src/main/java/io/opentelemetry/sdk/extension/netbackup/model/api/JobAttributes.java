/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.model.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import javax.annotation.Nullable;

/** {@code /admin/jobs} 条目的 attributes 节点 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class JobAttributes {

  @Nullable private final Long jobId;
  @Nullable private final String jobType;
  @Nullable private final String policyType;
  @Nullable private final String policyName;
  @Nullable private final String clientName;
  @Nullable private final Integer status;
  @Nullable private final Long kilobytesTransferred;
  @Nullable private final String endTime;

  @JsonCreator
  public JobAttributes(
      @JsonProperty("jobId") @Nullable Long jobId,
      @JsonProperty("jobType") @Nullable String jobType,
      @JsonProperty("policyType") @Nullable String policyType,
      @JsonProperty("policyName") @Nullable String policyName,
      @JsonProperty("clientName") @Nullable String clientName,
      @JsonProperty("status") @Nullable Integer status,
      @JsonProperty("kilobytesTransferred") @Nullable Long kilobytesTransferred,
      @JsonProperty("endTime") @Nullable String endTime) {
    this.jobId = jobId;
    this.jobType = jobType;
    this.policyType = policyType;
    this.policyName = policyName;
    this.clientName = clientName;
    this.status = status;
    this.kilobytesTransferred = kilobytesTransferred;
    this.endTime = endTime;
  }

  @Nullable
  public Long getJobId() {
    return jobId;
  }

  @Nullable
  public String getJobType() {
    return jobType;
  }

  @Nullable
  public String getPolicyType() {
    return policyType;
  }

  @Nullable
  public String getPolicyName() {
    return policyName;
  }

  @Nullable
  public String getClientName() {
    return clientName;
  }

  @Nullable
  public Integer getStatus() {
    return status;
  }

  @Nullable
  public Long getKilobytesTransferred() {
    return kilobytesTransferred;
  }

  @Nullable
  public String getEndTime() {
    return endTime;
  }
}

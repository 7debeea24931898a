/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.model.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import javax.annotation.Nullable;

/** {@code /storage/storage-units} 条目的 attributes 节点 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StorageUnitAttributes {

  /** 磁带存储单元不报告容量 */
  public static final String STORAGE_TYPE_TAPE = "Tape";

  @Nullable private final String name;
  @Nullable private final String storageType;
  @Nullable private final String storageServerType;
  @Nullable private final Long freeCapacityBytes;
  @Nullable private final Long usedCapacityBytes;
  @Nullable private final Long totalCapacityBytes;

  @JsonCreator
  public StorageUnitAttributes(
      @JsonProperty("name") @Nullable String name,
      @JsonProperty("storageType") @Nullable String storageType,
      @JsonProperty("storageServerType") @Nullable String storageServerType,
      @JsonProperty("freeCapacityBytes") @Nullable Long freeCapacityBytes,
      @JsonProperty("usedCapacityBytes") @Nullable Long usedCapacityBytes,
      @JsonProperty("totalCapacityBytes") @Nullable Long totalCapacityBytes) {
    this.name = name;
    this.storageType = storageType;
    this.storageServerType = storageServerType;
    this.freeCapacityBytes = freeCapacityBytes;
    this.usedCapacityBytes = usedCapacityBytes;
    this.totalCapacityBytes = totalCapacityBytes;
  }

  @Nullable
  public String getName() {
    return name;
  }

  @Nullable
  public String getStorageType() {
    return storageType;
  }

  @Nullable
  public String getStorageServerType() {
    return storageServerType;
  }

  @Nullable
  public Long getFreeCapacityBytes() {
    return freeCapacityBytes;
  }

  @Nullable
  public Long getUsedCapacityBytes() {
    return usedCapacityBytes;
  }

  @Nullable
  public Long getTotalCapacityBytes() {
    return totalCapacityBytes;
  }

  public boolean isTape() {
    return STORAGE_TYPE_TAPE.equals(storageType);
  }
}

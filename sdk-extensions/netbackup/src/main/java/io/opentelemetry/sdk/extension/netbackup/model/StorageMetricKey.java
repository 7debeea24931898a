/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** 存储单元容量维度：名称、存储服务器类型、容量类别（free/used）。 */
public final class StorageMetricKey implements MetricKey {

  /** 维度名称 */
  public static final List<String> LABEL_NAMES =
      Collections.unmodifiableList(Arrays.asList("name", "type", "size"));

  /** 剩余容量 */
  public static final String SIZE_FREE = "free";

  /** 已用容量 */
  public static final String SIZE_USED = "used";

  private final String name;
  private final String type;
  private final String size;

  public StorageMetricKey(String name, String type, String size) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
    this.size = Objects.requireNonNull(size, "size");
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public String getSize() {
    return size;
  }

  @Override
  public List<String> labels() {
    return Collections.unmodifiableList(Arrays.asList(name, type, size));
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
    if (!(o instanceof StorageMetricKey)) {
      return false;
    }
    StorageMetricKey that = (StorageMetricKey) o;
    return name.equals(that.name)
        && type.equals(that.type)
        && size.equals(that.size);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, size);
  }

  @Override
  public String toString() {
    return "StorageMetricKey{"
        + "name="
        + name
        + ", type="
        + type
        + ", size="
        + size
        + '}';
  }
}

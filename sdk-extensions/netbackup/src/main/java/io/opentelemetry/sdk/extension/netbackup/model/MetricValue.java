/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.model;

import java.util.Objects;

/**
 * 带维度的指标值
 *
 * @param <K> 维度键类型
 */
public final class MetricValue<K extends MetricKey> {

  private final K key;
  private final double value;

  public MetricValue(K key, double value) {
    this.key = Objects.requireNonNull(key, "key");
    this.value = value;
  }

  public static <K extends MetricKey> MetricValue<K> of(K key, double value) {
    return new MetricValue<>(key, value);
  }

  public K getKey() {
    return key;
  }

  public double getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricValue)) {
      return false;
    }
    MetricValue<?> that = (MetricValue<?>) o;
    return Double.compare(value, that.value) == 0 && key.equals(that.key);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return key + "=" + value;
  }
}

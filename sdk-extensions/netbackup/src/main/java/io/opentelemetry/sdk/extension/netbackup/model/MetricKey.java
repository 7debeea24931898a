/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.model;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import java.util.List;

/**
 * 指标维度键
 *
 * <p>实现必须是不可变值对象，equals/hashCode 基于全部字段，可直接作为 Map 键使用。
 */
public interface MetricKey {

  /** 按 {@link #labelNames()} 顺序排列的维度取值 */
  List<String> labels();

  /** 维度名称 */
  List<String> labelNames();

  /** 转换为 OpenTelemetry 属性 */
  default Attributes toAttributes() {
    List<String> names = labelNames();
    List<String> values = labels();
    AttributesBuilder builder = Attributes.builder();
    for (int i = 0; i < names.size(); i++) {
      builder.put(names.get(i), values.get(i));
    }
    return builder.build();
  }
}

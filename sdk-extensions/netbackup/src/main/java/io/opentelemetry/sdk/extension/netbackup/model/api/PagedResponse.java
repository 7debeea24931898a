/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.model.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * JSON:API 分页响应
 *
 * <p>{@code data} 中的条目保持为原始 JSON 节点，由各个 fetcher 逐条解析，单条格式错误不影响其余条目。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PagedResponse {

  private final List<JsonNode> data;
  @Nullable private final Meta meta;

  @JsonCreator
  public PagedResponse(
      @JsonProperty("data") @Nullable List<JsonNode> data,
      @JsonProperty("meta") @Nullable Meta meta) {
    this.data = data != null ? Collections.unmodifiableList(data) : Collections.emptyList();
    this.meta = meta;
  }

  public List<JsonNode> getData() {
    return data;
  }

  @Nullable
  public Meta getMeta() {
    return meta;
  }

  /**
   * 获取分页信息
   *
   * @return 分页信息，响应中缺失时返回 null
   */
  @Nullable
  public PaginationMeta getPagination() {
    return meta != null ? meta.getPagination() : null;
  }

  /** 响应元数据 */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static final class Meta {
    @Nullable private final PaginationMeta pagination;

    @JsonCreator
    public Meta(@JsonProperty("pagination") @Nullable PaginationMeta pagination) {
      this.pagination = pagination;
    }

    @Nullable
    public PaginationMeta getPagination() {
      return pagination;
    }
  }
}

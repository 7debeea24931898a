/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.model.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import javax.annotation.Nullable;

/** {@code meta.pagination} 节点。{@code next} 在最后一页时缺失。 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PaginationMeta {

  private final int offset;
  @Nullable private final Integer next;
  private final int last;
  private final int limit;
  private final int count;
  private final int page;
  private final int pages;
  private final int first;

  @JsonCreator
  public PaginationMeta(
      @JsonProperty("offset") int offset,
      @JsonProperty("next") @Nullable Integer next,
      @JsonProperty("last") int last,
      @JsonProperty("limit") int limit,
      @JsonProperty("count") int count,
      @JsonProperty("page") int page,
      @JsonProperty("pages") int pages,
      @JsonProperty("first") int first) {
    this.offset = offset;
    this.next = next;
    this.last = last;
    this.limit = limit;
    this.count = count;
    this.page = page;
    this.pages = pages;
    this.first = first;
  }

  public int getOffset() {
    return offset;
  }

  @Nullable
  public Integer getNext() {
    return next;
  }

  public int getLast() {
    return last;
  }

  public int getLimit() {
    return limit;
  }

  public int getCount() {
    return count;
  }

  public int getPage() {
    return page;
  }

  public int getPages() {
    return pages;
  }

  public int getFirst() {
    return first;
  }

  @Override
  public String toString() {
    return "PaginationMeta{offset="
        + offset
        + ", next="
        + next
        + ", last="
        + last
        + ", limit="
        + limit
        + ", count="
        + count
        + '}';
  }
}

/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.fetcher;

import io.opentelemetry.sdk.extension.netbackup.model.api.PaginationMeta;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * 一页已解析的条目
 *
 * @param <T> 条目类型
 */
public final class Page<T> {

  private final PageCursor cursor;
  private final List<T> items;
  private final int skippedItems;
  private final PageCursor nextCursor;
  @Nullable private final PaginationMeta pagination;

  Page(
      PageCursor cursor,
      List<T> items,
      int skippedItems,
      PageCursor nextCursor,
      @Nullable PaginationMeta pagination) {
    this.cursor = cursor;
    this.items = Collections.unmodifiableList(items);
    this.skippedItems = skippedItems;
    this.nextCursor = nextCursor;
    this.pagination = pagination;
  }

  /** 请求本页使用的游标 */
  public PageCursor getCursor() {
    return cursor;
  }

  public List<T> getItems() {
    return items;
  }

  /** 因格式不符被跳过的条目数 */
  public int getSkippedItems() {
    return skippedItems;
  }

  /** 下一页游标，序列结束时为终止游标 */
  public PageCursor getNextCursor() {
    return nextCursor;
  }

  public boolean isLast() {
    return nextCursor.isTerminal();
  }

  @Nullable
  public PaginationMeta getPagination() {
    return pagination;
  }
}

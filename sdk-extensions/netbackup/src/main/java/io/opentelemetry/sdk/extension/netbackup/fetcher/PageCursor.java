/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.fetcher;

/**
 * 分页游标
 *
 * <p>只能向前移动；终止游标表示序列结束。
 */
public final class PageCursor {

  private final int offset;
  private final int limit;
  private final boolean terminal;

  private PageCursor(int offset, int limit, boolean terminal) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1");
    }
    this.offset = offset;
    this.limit = limit;
    this.terminal = terminal;
  }

  /** 第一页游标 */
  public static PageCursor first(int limit) {
    return new PageCursor(0, limit, false);
  }

  /** 指定偏移的游标 */
  public static PageCursor at(int offset, int limit) {
    return new PageCursor(offset, limit, false);
  }

  /**
   * 移动到下一页
   *
   * @param next 服务端给出的下一页偏移
   * @return 新游标
   * @throws IllegalArgumentException next 不大于当前偏移
   */
  public PageCursor advanceTo(int next) {
    if (next <= offset) {
      throw new IllegalArgumentException(
          "cursor must move forward: current offset " + offset + ", next " + next);
    }
    return new PageCursor(next, limit, false);
  }

  /** 标记序列结束 */
  public PageCursor terminate() {
    return terminal ? this : new PageCursor(offset, limit, true);
  }

  public int getOffset() {
    return offset;
  }

  public int getLimit() {
    return limit;
  }

  public boolean isTerminal() {
    return terminal;
  }

  @Override
  public String toString() {
    return "PageCursor{offset="
        + offset
        + ", limit="
        + limit
        + (terminal ? ", terminal" : "")
        + '}';
  }
}

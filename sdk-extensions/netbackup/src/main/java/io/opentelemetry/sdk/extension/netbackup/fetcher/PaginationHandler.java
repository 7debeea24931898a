/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.fetcher;

import io.opentelemetry.sdk.extension.netbackup.client.NetBackupException;
import io.opentelemetry.sdk.extension.netbackup.model.api.PaginationMeta;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 分页驱动
 *
 * <p>按顺序逐页拉取，每页开始前检查线程中断。以下任一情况结束序列：空页、{@code offset == last}、缺少
 * {@code next}、{@code next} 未前移、达到最大页数。
 */
public final class PaginationHandler {

  private static final Logger logger = Logger.getLogger(PaginationHandler.class.getName());

  /** 单页处理函数，返回下一页游标 */
  @FunctionalInterface
  public interface PageStep {
    PageCursor fetch(PageCursor cursor);
  }

  private PaginationHandler() {}

  /**
   * 从起始游标开始遍历所有页
   *
   * @param start 起始游标
   * @param maxPages 最大页数
   * @param step 单页处理函数
   * @return 实际拉取的页数
   * @throws NetBackupException 线程被中断（CANCELLED）或单页处理失败
   */
  public static int paginate(PageCursor start, int maxPages, PageStep step) {
    PageCursor cursor = start;
    int pages = 0;
    while (!cursor.isTerminal()) {
      if (Thread.currentThread().isInterrupted()) {
        throw NetBackupException.cancelled(
            "pagination cancelled before offset " + cursor.getOffset(), null);
      }
      if (pages >= maxPages) {
        logger.log(
            Level.WARNING,
            "Pagination stopped after {0} pages at offset {1}",
            new Object[] {pages, cursor.getOffset()});
        break;
      }
      cursor = step.fetch(cursor);
      pages++;
    }
    return pages;
  }

  /**
   * 根据当前页计算下一页游标
   *
   * @param current 当前游标
   * @param itemCount 当前页条目数（含被跳过的）
   * @param pagination 分页元数据
   * @return 下一页游标或终止游标
   */
  public static PageCursor nextCursor(
      PageCursor current, int itemCount, @Nullable PaginationMeta pagination) {
    if (itemCount == 0) {
      return current.terminate();
    }
    if (pagination == null) {
      logger.log(
          Level.FINE,
          "No pagination metadata at offset {0}, treating as last page",
          current.getOffset());
      return current.terminate();
    }
    if (pagination.getOffset() == pagination.getLast()) {
      return current.terminate();
    }
    Integer next = pagination.getNext();
    if (next == null) {
      return current.terminate();
    }
    if (next <= current.getOffset()) {
      logger.log(
          Level.WARNING,
          "Malformed pagination cursor: next offset {0} does not advance past {1}, stopping",
          new Object[] {next, current.getOffset()});
      return current.terminate();
    }
    return current.advanceTo(next);
  }
}

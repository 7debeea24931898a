/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.fetcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupClient;
import io.opentelemetry.sdk.extension.netbackup.client.NetBackupException;
import io.opentelemetry.sdk.extension.netbackup.config.NetBackupConfig;
import io.opentelemetry.sdk.extension.netbackup.model.api.PagedResponse;
import io.opentelemetry.sdk.extension.netbackup.telemetry.NetBackupTelemetry;
import io.opentelemetry.sdk.extension.netbackup.telemetry.TelemetryAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;

/**
 * 分页实体拉取基类
 *
 * <p>子类提供 API 路径、条目类型、查询参数、条目校验与聚合逻辑。基类负责：
 * <ul>
 *   <li>按固定页大小逐页请求并推进游标
 *   <li>逐条解析 {@code data[].attributes}，格式不符的条目跳过并计数
 *   <li>每页前检查中断，取消时丢弃部分聚合结果
 *   <li>Span 与日志
 * </ul>
 *
 * @param <T> 条目类型
 * @param <A> 聚合器类型，每次 {@link #fetch(NetBackupClient)} 新建
 * @param <R> 结果类型
 */
public abstract class AbstractPagedFetcher<T, A, R> {

  private static final Logger logger = Logger.getLogger(AbstractPagedFetcher.class.getName());

  /** 页大小，NetBackup API 允许的最大值 */
  public static final int PAGE_LIMIT = 100;

  /** 单个序列的最大页数 */
  public static final int MAX_PAGES = 10_000;

  static final String QUERY_PAGE_LIMIT = "page[limit]";
  static final String QUERY_PAGE_OFFSET = "page[offset]";

  private static final ObjectMapper ITEM_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  protected final NetBackupConfig config;
  protected final NetBackupTelemetry telemetry;
  private final Class<T> itemType;

  protected AbstractPagedFetcher(
      NetBackupConfig config, NetBackupTelemetry telemetry, Class<T> itemType) {
    this.config = config;
    this.telemetry = telemetry;
    this.itemType = itemType;
  }

  // ===== 子类扩展点 =====

  /** API 路径，例如 {@code /admin/jobs} */
  protected abstract String path();

  /** 整个序列的 Span 名称 */
  protected abstract String spanName();

  /** 单页 Span 名称 */
  protected abstract String pageSpanName();

  /** 新建聚合器 */
  protected abstract A newAccumulator();

  /** 追加查询参数（排序、过滤等） */
  protected void customizeQuery(HttpUrl.Builder url, A accumulator) {}

  /**
   * 校验已解析的条目
   *
   * @return 问题描述，条目合法时返回 null
   */
  @Nullable
  protected abstract String validate(T item);

  /** 将一条合法条目累加到聚合器 */
  protected abstract void fold(A accumulator, T item);

  /** 所有页处理完成后生成结果 */
  protected abstract R finish(A accumulator, Span span, int pages, int skippedItems);

  // ===== 拉取 =====

  /**
   * 拉取单页
   *
   * @param client 客户端
   * @param cursor 游标
   * @return 已解析的页
   */
  public Page<T> fetchPage(NetBackupClient client, PageCursor cursor) {
    return fetchPage(client, cursor, newAccumulator());
  }

  private Page<T> fetchPage(NetBackupClient client, PageCursor cursor, A accumulator) {
    Span span = telemetry.startSpan(pageSpanName());
    span.setAttribute(TelemetryAttributes.NETBACKUP_PAGE_OFFSET, (long) cursor.getOffset());
    try (Scope ignored = span.makeCurrent()) {
      HttpUrl.Builder url =
          config
              .urlBuilder(path())
              .addQueryParameter(QUERY_PAGE_LIMIT, Integer.toString(cursor.getLimit()))
              .addQueryParameter(QUERY_PAGE_OFFSET, Integer.toString(cursor.getOffset()));
      customizeQuery(url, accumulator);

      PagedResponse response = client.fetchData(url.build().toString(), PagedResponse.class);
      List<JsonNode> data = response.getData();
      List<T> items = new ArrayList<>(data.size());
      int skipped = 0;
      for (int i = 0; i < data.size(); i++) {
        T item = decodeItem(data.get(i), cursor.getOffset() + i);
        if (item == null) {
          skipped++;
        } else {
          items.add(item);
        }
      }

      PageCursor next =
          PaginationHandler.nextCursor(cursor, data.size(), response.getPagination());
      span.setAttribute(TelemetryAttributes.NETBACKUP_ITEMS_IN_PAGE, (long) data.size());
      span.setAttribute(TelemetryAttributes.NETBACKUP_SKIPPED_ITEMS, (long) skipped);
      return new Page<>(cursor, items, skipped, next, response.getPagination());
    } catch (NetBackupException e) {
      NetBackupTelemetry.recordError(span, e);
      throw e;
    } finally {
      span.end();
    }
  }

  @Nullable
  private T decodeItem(JsonNode node, int position) {
    JsonNode attributes = node.get("attributes");
    if (attributes == null || !attributes.isObject()) {
      logger.log(
          Level.WARNING,
          "Skipping {0} item at position {1}: missing attributes object",
          new Object[] {path(), position});
      return null;
    }
    T item;
    try {
      item = ITEM_MAPPER.treeToValue(attributes, itemType);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      logger.log(
          Level.WARNING,
          "Skipping {0} item at position {1}: {2}",
          new Object[] {path(), position, e.getMessage()});
      return null;
    }
    if (item == null) {
      return null;
    }
    String problem = validate(item);
    if (problem != null) {
      logger.log(
          Level.WARNING,
          "Skipping {0} item at position {1}: {2}",
          new Object[] {path(), position, problem});
      return null;
    }
    return item;
  }

  /**
   * 拉取并聚合全部页
   *
   * @param client 客户端
   * @return 聚合结果
   * @throws NetBackupException 任一页请求失败或线程被中断
   */
  public R fetch(NetBackupClient client) {
    Span span = telemetry.startSpan(spanName());
    span.setAttribute(TelemetryAttributes.NETBACKUP_ENDPOINT, path());
    try (Scope ignored = span.makeCurrent()) {
      A accumulator = newAccumulator();
      int[] skipped = new int[1];
      int pages =
          PaginationHandler.paginate(
              PageCursor.first(PAGE_LIMIT),
              MAX_PAGES,
              cursor -> {
                Page<T> page = fetchPage(client, cursor, accumulator);
                for (T item : page.getItems()) {
                  fold(accumulator, item);
                }
                skipped[0] += page.getSkippedItems();
                return page.getNextCursor();
              });

      span.setAttribute(TelemetryAttributes.NETBACKUP_TOTAL_PAGES, (long) pages);
      span.setAttribute(TelemetryAttributes.NETBACKUP_SKIPPED_ITEMS, (long) skipped[0]);
      if (skipped[0] > 0) {
        logger.log(
            Level.WARNING,
            "Skipped {0} malformed items while fetching {1}",
            new Object[] {skipped[0], path()});
      }
      return finish(accumulator, span, pages, skipped[0]);
    } catch (NetBackupException e) {
      NetBackupTelemetry.recordError(span, e);
      throw e;
    } finally {
      span.end();
    }
  }
}

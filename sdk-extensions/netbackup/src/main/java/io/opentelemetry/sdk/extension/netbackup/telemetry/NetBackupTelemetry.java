/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.netbackup.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.sdk.common.CompletableResultCode;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 注入式可观测性句柄
 *
 * <p>所有组件在构造时接收同一个实例。未提供 {@link OpenTelemetry} 时使用 {@link
 * OpenTelemetry#noop()}，调用方无需判空。
 */
public final class NetBackupTelemetry {

  private static final Logger logger = Logger.getLogger(NetBackupTelemetry.class.getName());

  /** Instrumentation scope 名称 */
  public static final String INSTRUMENTATION_NAME = "io.opentelemetry.sdk.extension.netbackup";

  private static final NetBackupTelemetry NOOP = new NetBackupTelemetry(OpenTelemetry.noop(), null);

  private final OpenTelemetry openTelemetry;
  private final Tracer tracer;
  private final Meter meter;
  @Nullable private final Supplier<CompletableResultCode> flushHook;

  private NetBackupTelemetry(
      OpenTelemetry openTelemetry, @Nullable Supplier<CompletableResultCode> flushHook) {
    this.openTelemetry = openTelemetry;
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
    this.meter = openTelemetry.getMeter(INSTRUMENTATION_NAME);
    this.flushHook = flushHook;
  }

  /** 返回不产生任何数据的实例 */
  public static NetBackupTelemetry noop() {
    return NOOP;
  }

  /**
   * 创建可观测性句柄
   *
   * @param openTelemetry OpenTelemetry 实例，null 时使用 noop
   * @param flushHook 关闭时调用的刷新钩子，可为 null
   * @return 句柄
   */
  public static NetBackupTelemetry create(
      @Nullable OpenTelemetry openTelemetry,
      @Nullable Supplier<CompletableResultCode> flushHook) {
    if (openTelemetry == null && flushHook == null) {
      return NOOP;
    }
    return new NetBackupTelemetry(
        openTelemetry != null ? openTelemetry : OpenTelemetry.noop(), flushHook);
  }

  public OpenTelemetry getOpenTelemetry() {
    return openTelemetry;
  }

  public Tracer getTracer() {
    return tracer;
  }

  public Meter getMeter() {
    return meter;
  }

  public TextMapPropagator getPropagator() {
    return openTelemetry.getPropagators().getTextMapPropagator();
  }

  /**
   * 以当前上下文为父节点创建 Span
   *
   * @param name Span 名称
   * @param kind Span 类型
   * @return 已启动的 Span，调用方负责 end
   */
  public Span startSpan(String name, SpanKind kind) {
    return tracer.spanBuilder(name).setSpanKind(kind).startSpan();
  }

  /** 创建 INTERNAL 类型的 Span */
  public Span startSpan(String name) {
    return startSpan(name, SpanKind.INTERNAL);
  }

  /**
   * 在 Span 上记录错误
   *
   * @param span 目标 Span
   * @param error 错误
   */
  public static void recordError(Span span, Throwable error) {
    span.recordException(error);
    span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
    span.setAttribute(TelemetryAttributes.ERROR, String.valueOf(error.getMessage()));
  }

  /**
   * 刷新已缓冲的遥测数据
   *
   * @param timeout 最长等待时间
   * @return 刷新结果，未配置钩子时直接成功
   */
  public CompletableResultCode flush(Duration timeout) {
    if (flushHook == null) {
      return CompletableResultCode.ofSuccess();
    }
    CompletableResultCode result;
    try {
      result = flushHook.get();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Telemetry flush hook failed", e);
      return CompletableResultCode.ofFailure();
    }
    result.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
    if (!result.isDone()) {
      logger.log(Level.WARNING, "Telemetry flush did not complete within {0}", timeout);
    }
    return result;
  }
}

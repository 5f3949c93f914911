/*
 * どこで: userhub サービス層
 * 何を: ダッシュボード集約の結果と上流依存ごとのエラー・所要時間を記録する
 * なぜ: 縮退率や stale フォールバック増加を Prometheus から直接観測できるようにするため
 */
package com.example.userhub.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DashboardMetrics {

  public static final String RESULT_FRESH_HIT = "fresh_hit";
  public static final String RESULT_ASSEMBLED = "assembled";
  public static final String RESULT_DEGRADED = "degraded";
  public static final String RESULT_STALE_FALLBACK = "stale_fallback";
  public static final String RESULT_ERROR = "error";

  private static final String METRIC_DASHBOARD_TOTAL = "userhub.dashboard.total";
  private static final String METRIC_DEPENDENCY_ERROR_TOTAL =
      "userhub.dashboard.dependency.error.total";
  private static final String METRIC_DEPENDENCY_DURATION = "userhub.dashboard.dependency.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> dashboardCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> dependencyTimers = new ConcurrentHashMap<>();

  public DashboardMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordDashboardResult(String result) {
    dashboardCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DASHBOARD_TOTAL)
                    .description("Userhub dashboard request outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDependencyError(String dependency, String reason) {
    final String key = dependency + "|" + reason;
    dependencyErrorCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_DEPENDENCY_ERROR_TOTAL)
                    .description("Userhub dashboard upstream dependency errors")
                    .tags(Tags.of("dependency", dependency, "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDependencyDuration(String dependency, String result, Duration duration) {
    final String key = dependency + "|" + result;
    dependencyTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_DEPENDENCY_DURATION)
                    .description("Userhub dashboard upstream call duration")
                    .tags(Tags.of("dependency", dependency, "result", result))
                    .register(meterRegistry))
        .record(duration);
  }
}

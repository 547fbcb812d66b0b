/*
 * どこで: Reporting サービス層
 * 何を: 締め結果/所要時間/クレーム件数/追記数と ACTIVE レポート数を記録する
 * なぜ: 週次締めの成否と規模を Prometheus から直接観測できるようにするため
 */
package com.example.reporting.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ReportingMetrics {

  private static final String METRIC_FREEZE_TOTAL = "reporting.freeze.total";
  private static final String METRIC_FREEZE_DURATION = "reporting.freeze.duration";
  private static final String METRIC_FREEZE_EVENTS = "reporting.freeze.events";
  private static final String METRIC_EVENTS_APPENDED = "reporting.events.appended.total";
  private static final String METRIC_NARRATIVE_FAILURE = "reporting.narrative.failure.total";
  private static final String METRIC_ACTIVE_HEALED = "reporting.active.healed.total";
  private static final String METRIC_ACTIVE_CURRENT = "reporting.active.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger activeReportsCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> freezeCounters = new ConcurrentHashMap<>();
  private final Timer freezeDurationTimer;
  private final DistributionSummary freezeEventsSummary;
  private final Counter eventsAppendedCounter;
  private final Counter narrativeFailureCounter;
  private final Counter activeHealedCounter;

  public ReportingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_ACTIVE_CURRENT, activeReportsCurrent, AtomicInteger::get)
        .description("Number of active reports as last observed by the lifecycle engine")
        .register(meterRegistry);
    this.freezeDurationTimer =
        Timer.builder(METRIC_FREEZE_DURATION)
            .description("Duration of the freeze transaction including rollover")
            .register(meterRegistry);
    this.freezeEventsSummary =
        DistributionSummary.builder(METRIC_FREEZE_EVENTS)
            .description("Number of events owned by a report when it was frozen")
            .register(meterRegistry);
    this.eventsAppendedCounter =
        Counter.builder(METRIC_EVENTS_APPENDED)
            .description("Total number of activity events appended")
            .register(meterRegistry);
    this.narrativeFailureCounter =
        Counter.builder(METRIC_NARRATIVE_FAILURE)
            .description("Narrative generations that failed and were dropped")
            .register(meterRegistry);
    this.activeHealedCounter =
        Counter.builder(METRIC_ACTIVE_HEALED)
            .description("Active reports recreated after being found missing")
            .register(meterRegistry);
  }

  public void recordFreezeResult(String result) {
    freezeCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_FREEZE_TOTAL)
                    .description("Report freeze outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordFreezeDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    freezeDurationTimer.record(duration);
  }

  public void recordFrozenEventCount(int eventCount) {
    freezeEventsSummary.record(Math.max(eventCount, 0));
  }

  public void recordEventAppended() {
    eventsAppendedCounter.increment();
  }

  public void recordNarrativeFailure() {
    narrativeFailureCounter.increment();
  }

  public void updateActiveReportsCurrent(int activeReports) {
    activeReportsCurrent.set(Math.max(activeReports, 0));
  }

  public void recordActiveReportHealed() {
    activeHealedCounter.increment();
  }
}

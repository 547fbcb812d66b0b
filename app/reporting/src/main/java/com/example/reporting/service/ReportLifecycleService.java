/*
 * どこで: Reporting サービス層
 * 何を: ACTIVE レポートの作成と締め(期間確定/イベント帰属/集計/ロールオーバー)を担う
 * なぜ: 「ACTIVE は常に1件」「イベントはちょうど1つのレポートに属する」をストア上で保つため
 */
package com.example.reporting.service;

import com.example.common.RunIds;
import com.example.reporting.model.EventRecord;
import com.example.reporting.model.ReportRecord;
import com.example.reporting.model.ReportSummary;
import com.example.reporting.repository.EventRepository;
import com.example.reporting.repository.ReportRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class ReportLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(ReportLifecycleService.class);
  private static final String MDC_FREEZE_RUN_ID = "freeze_run_id";
  private static final String RESULT_SUCCESS = "success";
  private static final String RESULT_NO_ACTIVE = "no_active";
  private static final String RESULT_ALREADY_FROZEN = "already_frozen";
  private static final String RESULT_PERSISTENCE_ERROR = "persistence_error";
  private static final String RESULT_ROLLOVER_FAILED = "rollover_failed";

  private final ReportRepository reportRepository;
  private final EventRepository eventRepository;
  private final ReportAggregator aggregator;
  private final ReportSummaryCodec summaryCodec;
  private final ReportingMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * ACTIVE レポートを新規作成する。
   *
   * @return 作成したレポートの ID
   * @throws InvariantViolationException ACTIVE が既に存在する場合
   */
  public long createNewActiveReport() {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    try {
      final Long reportId =
          transactionTemplate.execute(
              status -> {
                reportRepository.lockReportStream();
                final Optional<ReportRecord> active = reportRepository.findActive();
                if (active.isPresent()) {
                  throw new InvariantViolationException(
                      "active report already exists id=" + active.get().id());
                }
                final Instant now = Instant.now(clock);
                // 直前の period_end から始め、締めと次期間の開始の間に隙間を作らない
                final Instant periodStart =
                    reportRepository
                        .findLastFrozen()
                        .map(ReportRecord::periodEnd)
                        .filter(periodEnd -> !periodEnd.isAfter(now))
                        .orElse(now);
                return reportRepository.insertActive(periodStart, now);
              });
      if (reportId == null) {
        throw new IllegalStateException("active report insert returned no id");
      }
      metrics.updateActiveReportsCurrent(1);
      logger.info("active report created reportId={}", reportId);
      return reportId;
    } catch (InvariantViolationException ex) {
      metrics.updateActiveReportsCurrent(1);
      throw ex;
    } catch (DuplicateKeyException ex) {
      // 部分ユニークインデックスに弾かれた場合も同じ不変条件違反として扱う
      metrics.updateActiveReportsCurrent(1);
      throw new InvariantViolationException("active report already exists", ex);
    } catch (DataAccessException | TransactionException ex) {
      throw new ReportPersistenceException("failed to create active report", ex);
    }
  }

  /**
   * 現在の ACTIVE レポートを締め、次の ACTIVE レポートを開く。
   *
   * @return 締めたレポートの ID
   * @throws NoActiveReportException ACTIVE が無かった場合(新しい ACTIVE は作成済み)
   * @throws AlreadyFrozenException 並行実行で既に締められていた場合
   * @throws ReportPersistenceException ストア障害。締め前なら何も変わっていない
   */
  public long freezeCurrentReport() {
    MDC.put(MDC_FREEZE_RUN_ID, RunIds.newRunId());
    final long startedNanos = System.nanoTime();
    try {
      final long frozenReportId = freeze();
      metrics.recordFreezeResult(RESULT_SUCCESS);
      return frozenReportId;
    } catch (NoActiveReportException ex) {
      metrics.recordFreezeResult(RESULT_NO_ACTIVE);
      throw ex;
    } catch (AlreadyFrozenException ex) {
      metrics.recordFreezeResult(RESULT_ALREADY_FROZEN);
      throw ex;
    } catch (ReportPersistenceException ex) {
      metrics.recordFreezeResult(
          ex.frozenReportId().isPresent() ? RESULT_ROLLOVER_FAILED : RESULT_PERSISTENCE_ERROR);
      throw ex;
    } finally {
      metrics.recordFreezeDuration(Duration.ofNanos(System.nanoTime() - startedNanos));
      MDC.remove(MDC_FREEZE_RUN_ID);
    }
  }

  private long freeze() {
    final Optional<ReportRecord> active;
    try {
      active = reportRepository.findActive();
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to read active report", ex);
    }
    if (active.isEmpty()) {
      throw healMissingActiveReport();
    }

    final FrozenReport frozen = freezeInTransaction(active.get().id());
    metrics.updateActiveReportsCurrent(0);
    metrics.recordFrozenEventCount(frozen.eventCount());
    logger.info(
        "report frozen reportId={} eventCount={} claimed={} periodEnd={}",
        frozen.reportId(),
        frozen.eventCount(),
        frozen.claimed(),
        frozen.periodEnd());

    rollover(frozen.reportId());
    return frozen.reportId();
  }

  private FrozenReport freezeInTransaction(long reportId) {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    try {
      final FrozenReport frozen =
          transactionTemplate.execute(
              status -> {
                // advisory lock → 行ロックの順で取り、並行した締めを1本に絞る
                reportRepository.lockReportStream();
                final ReportRecord report =
                    reportRepository
                        .findByIdForUpdate(reportId)
                        .orElseThrow(
                            () ->
                                new IllegalStateException(
                                    "active report disappeared reportId=" + reportId));
                if (!report.isActive() || report.periodEnd() != null) {
                  throw new AlreadyFrozenException(reportId);
                }
                final Instant periodEnd = Instant.now(clock);
                final int claimed =
                    eventRepository.claimForPeriod(reportId, report.periodStart(), periodEnd);
                final List<EventRecord> events = eventRepository.findAllByReport(reportId);
                final Map<String, Long> baseline =
                    reportRepository
                        .findLastFrozenBefore(reportId)
                        .map(summaryCodec::readTotals)
                        .orElseGet(Map::of);
                final ReportSummary summary = aggregator.summarize(events, baseline);
                final int updated =
                    reportRepository.markFrozen(
                        reportId, periodEnd, periodEnd, events.size(), summaryCodec.write(summary));
                if (updated == 0) {
                  throw new AlreadyFrozenException(reportId);
                }
                return new FrozenReport(reportId, events.size(), claimed, periodEnd);
              });
      if (frozen == null) {
        throw new IllegalStateException("freeze transaction returned no result");
      }
      return frozen;
    } catch (DataAccessException | TransactionException ex) {
      throw new ReportPersistenceException("failed to freeze report id=" + reportId, ex);
    }
  }

  private void rollover(long frozenReportId) {
    try {
      createNewActiveReport();
    } catch (InvariantViolationException ex) {
      // 別の呼び出しが先に次の ACTIVE を作っていれば目的は達成済み
      logger.warn(
          "rollover skipped because an active report already exists frozenReportId={}",
          frozenReportId);
    } catch (ReportPersistenceException ex) {
      throw new ReportPersistenceException(
          "report frozen id=" + frozenReportId + " but rollover failed", frozenReportId, ex);
    }
  }

  private NoActiveReportException healMissingActiveReport() {
    final NoActiveReportException missing =
        new NoActiveReportException("no active report to freeze");
    try {
      final long healedId = createNewActiveReport();
      metrics.recordActiveReportHealed();
      logger.warn("no active report found; created reportId={}", healedId);
    } catch (InvariantViolationException ex) {
      logger.info("no active report found but another caller already created one");
    } catch (ReportPersistenceException ex) {
      missing.addSuppressed(ex);
    }
    return missing;
  }

  /** 現在の ACTIVE レポートを返す。無ければ作成する。 */
  public ReportRecord getOrCreateActiveReport() {
    final Optional<ReportRecord> active = findActive();
    if (active.isPresent()) {
      return active.get();
    }
    long reportId;
    try {
      reportId = createNewActiveReport();
      metrics.recordActiveReportHealed();
    } catch (InvariantViolationException ex) {
      // 並行して作成された ACTIVE をそのまま使う
      return findActive()
          .orElseThrow(() -> new IllegalStateException("active report vanished after conflict", ex));
    }
    return getReport(reportId);
  }

  public Optional<ReportRecord> findActive() {
    try {
      return reportRepository.findActive();
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to read active report", ex);
    }
  }

  public ReportRecord getReport(long reportId) {
    try {
      return reportRepository
          .findById(reportId)
          .orElseThrow(() -> new ReportNotFoundException(reportId));
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to read report id=" + reportId, ex);
    }
  }

  public Optional<ReportRecord> getLastFrozenReport() {
    try {
      return reportRepository.findLastFrozen();
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to read last frozen report", ex);
    }
  }

  public List<ReportRecord> listFrozenReports(int limit, int offset) {
    try {
      return reportRepository.findAllFrozen(limit, offset);
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to list frozen reports", ex);
    }
  }

  public List<EventRecord> getReportEvents(long reportId, int limit) {
    getReport(reportId);
    try {
      return eventRepository.findByReport(reportId, limit, 0);
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to read events of report id=" + reportId, ex);
    }
  }

  /** 未割当(現在の期間に積まれている)イベントを新しい順に返す。 */
  public List<EventRecord> getRecentEvents(int limit) {
    try {
      return eventRepository.findRecentUnassigned(limit);
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to read recent events", ex);
    }
  }

  public long getActiveEventCount() {
    try {
      return eventRepository.countUnassigned();
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to count unassigned events", ex);
    }
  }

  /**
   * 配信済みフラグを立てる。FROZEN 以外は対象外。
   *
   * @throws ReportNotFoundException レポートが存在しない場合
   * @throws IllegalArgumentException レポートが FROZEN でない場合
   */
  public ReportRecord markReportEmailed(long reportId) {
    final ReportRecord report = getReport(reportId);
    if (report.isActive()) {
      throw new IllegalArgumentException("report is not frozen id=" + reportId);
    }
    try {
      final int updated = reportRepository.markEmailed(reportId, Instant.now(clock));
      if (updated == 0) {
        throw new IllegalArgumentException("report is not frozen id=" + reportId);
      }
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to mark report emailed id=" + reportId, ex);
    }
    logger.info("report marked emailed reportId={}", reportId);
    return getReport(reportId);
  }

  public Optional<ReportSummary> parseSummary(ReportRecord report) {
    return summaryCodec.read(report);
  }

  private record FrozenReport(long reportId, int eventCount, int claimed, Instant periodEnd) {}
}

/*
 * どこで: Reporting 締めワーカー
 * 何を: 週次スケジュールで締めを起動する
 * なぜ: 手動介入なしで期間を確定し、次の期間を開くため
 */
package com.example.reporting.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reporting.freeze.enabled", havingValue = "true")
public class ReportFreezeWorker {

  private static final Logger logger = LoggerFactory.getLogger(ReportFreezeWorker.class);

  private final ReportLifecycleService reportLifecycleService;

  @Scheduled(cron = "${reporting.freeze.cron}", zone = "${reporting.freeze.zone:UTC}")
  public void run() {
    // スケジューラスレッドを止めないよう、失敗はログに残して次回へ回す
    try {
      final long frozenReportId = reportLifecycleService.freezeCurrentReport();
      logger.info("scheduled freeze completed reportId={}", frozenReportId);
    } catch (NoActiveReportException ex) {
      logger.warn("scheduled freeze skipped: {}", ex.getMessage());
    } catch (AlreadyFrozenException ex) {
      logger.info("scheduled freeze skipped because report was frozen concurrently reportId={}",
          ex.reportId());
    } catch (ReportPersistenceException ex) {
      logger.error("scheduled freeze failed", ex);
    }
  }
}

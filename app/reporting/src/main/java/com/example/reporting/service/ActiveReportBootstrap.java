/*
 * どこで: Reporting 起動処理
 * 何を: 起動完了時に ACTIVE レポートが存在することを保証する
 * なぜ: 初回デプロイ直後のイベントも帰属先の期間を持てるようにするため
 */
package com.example.reporting.service;

import com.example.reporting.model.ReportRecord;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reporting.bootstrap.enabled", havingValue = "true", matchIfMissing = true)
public class ActiveReportBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(ActiveReportBootstrap.class);

  private final ReportLifecycleService reportLifecycleService;

  @EventListener(ApplicationReadyEvent.class)
  public void ensureActiveReport() {
    try {
      final ReportRecord active = reportLifecycleService.getOrCreateActiveReport();
      logger.info(
          "active report ready reportId={} periodStart={}", active.id(), active.periodStart());
    } catch (ReportPersistenceException ex) {
      // 最初の参照や締めで再度自己修復されるため起動は継続する
      logger.error("failed to ensure active report at startup", ex);
    }
  }
}

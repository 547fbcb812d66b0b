/*
 * どこで: ActiveReportBootstrap のユニットテスト
 * 何を: 起動時の ACTIVE 確保と障害時の継続を検証する
 */
package com.example.reporting.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.reporting.TestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ActiveReportBootstrapTest {

  @Mock private ReportLifecycleService reportLifecycleService;

  @Test
  void ensureActiveReportDelegatesToLifecycle() {
    when(reportLifecycleService.getOrCreateActiveReport())
        .thenReturn(TestFixtures.activeReport(1, TestFixtures.BASE_TIME));

    new ActiveReportBootstrap(reportLifecycleService).ensureActiveReport();

    verify(reportLifecycleService).getOrCreateActiveReport();
  }

  @Test
  void ensureActiveReportDoesNotFailStartup() {
    when(reportLifecycleService.getOrCreateActiveReport())
        .thenThrow(
            new ReportPersistenceException(
                "failed", new DataAccessResourceFailureException("down")));

    assertThatCode(() -> new ActiveReportBootstrap(reportLifecycleService).ensureActiveReport())
        .doesNotThrowAnyException();
  }
}

/*
 * どこで: Reporting サービス層
 * 何を: ストア障害(クレーム/読み取り/書き込み)を示す例外
 * なぜ: 締めが未コミットであることを呼び出し側へ伝え、全体の再試行を促すため
 */
package com.example.reporting.service;

import java.util.Optional;

public class ReportPersistenceException extends RuntimeException {

  private final Long frozenReportId;

  public ReportPersistenceException(String message, Throwable cause) {
    this(message, null, cause);
  }

  /**
   * 締めはコミット済みだが後続の新規 ACTIVE 作成に失敗した場合に使う。
   *
   * @param frozenReportId 締め済みレポートの ID
   */
  public ReportPersistenceException(String message, Long frozenReportId, Throwable cause) {
    super(message, cause);
    this.frozenReportId = frozenReportId;
  }

  public Optional<Long> frozenReportId() {
    return Optional.ofNullable(frozenReportId);
  }
}

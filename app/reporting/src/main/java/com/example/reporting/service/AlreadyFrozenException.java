/*
 * どこで: Reporting サービス層
 * 何を: 同一レポートへの二重締めを検出したことを示す例外
 * なぜ: 並行実行時に二重集計せず即座に失敗させるため(呼び出し側の再試行は安全)
 */
package com.example.reporting.service;

public class AlreadyFrozenException extends RuntimeException {

  private final long reportId;

  public AlreadyFrozenException(long reportId) {
    super("report already frozen id=" + reportId);
    this.reportId = reportId;
  }

  public long reportId() {
    return reportId;
  }
}

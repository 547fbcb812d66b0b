/*
 * どこで: Reporting サービス層
 * 何を: 指定 ID のレポートが存在しないことを示す例外
 * なぜ: 参照 API で 404 を返すため
 */
package com.example.reporting.service;

public class ReportNotFoundException extends RuntimeException {

  public ReportNotFoundException(long reportId) {
    super("report not found id=" + reportId);
  }
}

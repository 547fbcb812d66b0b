/*
 * どこで: Reporting サービス層
 * 何を: 締め対象の ACTIVE レポートが存在しないことを示す例外
 * なぜ: 自己修復で新しい ACTIVE を作った上で、元の締め要求は失敗として返すため
 */
package com.example.reporting.service;

public class NoActiveReportException extends RuntimeException {

  public NoActiveReportException(String message) {
    super(message);
  }
}

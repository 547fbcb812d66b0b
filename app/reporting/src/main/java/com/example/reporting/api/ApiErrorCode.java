/*
 * どこで: Reporting API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.reporting.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  REPORT_NOT_FOUND,
  ACTIVE_REPORT_EXISTS,
  NO_ACTIVE_REPORT,
  REPORT_ALREADY_FROZEN,
  PERSISTENCE_ERROR
}

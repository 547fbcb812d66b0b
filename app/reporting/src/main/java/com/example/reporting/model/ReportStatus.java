/*
 * どこで: Reporting ドメインモデル
 * 何を: レポートの状態を表す列挙
 * なぜ: ACTIVE から FROZEN への一方向遷移を DB と処理ロジックで一致させるため
 */
package com.example.reporting.model;

public enum ReportStatus {
  ACTIVE,
  FROZEN
}

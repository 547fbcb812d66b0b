/*
 * どこで: Reporting ドメインモデル
 * 何を: activity_events テーブルのスナップショット
 * なぜ: 集計・参照・スロットリング判定で同じ形を使うため
 */
package com.example.reporting.model;

import java.time.Instant;

public record EventRecord(
    long id,
    String eventType,
    String eventSubtype,
    Long objectId,
    Long userId,
    String eventDataJson,
    String source,
    Instant eventTimestamp,
    Long reportId) {

  public boolean isUnassigned() {
    return reportId == null;
  }
}

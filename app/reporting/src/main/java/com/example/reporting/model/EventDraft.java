/*
 * どこで: Reporting ドメインモデル
 * 何を: 採番前のイベント(INSERT 入力)
 * なぜ: report_id を持たない状態でしか登録できないことを型で表すため
 */
package com.example.reporting.model;

import java.time.Instant;

public record EventDraft(
    String eventType,
    String eventSubtype,
    Long objectId,
    Long userId,
    String eventDataJson,
    String source,
    Instant eventTimestamp) {}

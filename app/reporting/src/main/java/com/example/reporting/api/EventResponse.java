/*
 * どこで: Reporting API
 * 何を: イベント1件の表現
 * なぜ: event_data を文字列ではなく JSON オブジェクトとして返すため
 */
package com.example.reporting.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventResponse(
    long id,
    String eventType,
    String eventSubtype,
    Long objectId,
    Long userId,
    Map<String, Object> eventData,
    String source,
    Instant eventTimestamp,
    Long reportId) {}

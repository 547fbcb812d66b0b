/*
 * どこで: Reporting API
 * 何を: イベント一覧のレスポンスを表す
 * なぜ: 一覧を配列直返しせずオブジェクトで包むため
 */
package com.example.reporting.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventsResponse(Long reportId, List<EventResponse> events) {
  public EventsResponse {
    events = events == null ? List.of() : List.copyOf(events);
  }
}

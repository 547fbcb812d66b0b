/*
 * どこで: Reporting API
 * 何を: イベント追記の結果を表す
 * なぜ: 採番された ID を呼び出し元へ返すため
 */
package com.example.reporting.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AppendEventResponse(long eventId) {}

/*
 * どこで: Reporting API
 * 何を: 現在の ACTIVE レポートと未締めイベント数を表す
 * なぜ: 次回締めの規模を事前に把握できるようにするため
 */
package com.example.reporting.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ActiveReportResponse(ReportResponse report, long pendingEventCount) {}

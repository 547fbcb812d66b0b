/*
 * どこで: Reporting API
 * 何を: ドメインレコードを API レスポンスへ変換する
 * なぜ: JSON 列の解析をコントローラから切り離すため
 */
package com.example.reporting.api;

import com.example.reporting.model.EventRecord;
import com.example.reporting.model.EventTypeDefinition;
import com.example.reporting.model.ReportRecord;
import com.example.reporting.model.ReportSummary;
import com.example.reporting.service.EventDataCodec;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReportingApiMapper {

  private final EventDataCodec eventDataCodec;

  public ReportResponse toResponse(ReportRecord report, ReportSummary summary) {
    return new ReportResponse(
        report.id(),
        report.status().name().toLowerCase(Locale.ROOT),
        report.periodStart(),
        report.periodEnd(),
        report.frozenAt(),
        report.eventCount(),
        summary,
        report.emailed(),
        report.emailedAt(),
        report.createdAt());
  }

  public EventResponse toResponse(EventRecord event) {
    return new EventResponse(
        event.id(),
        event.eventType(),
        event.eventSubtype(),
        event.objectId(),
        event.userId(),
        eventDataCodec.read(event.eventDataJson()),
        event.source(),
        event.eventTimestamp(),
        event.reportId());
  }

  public EventTypeResponse toResponse(String eventType, EventTypeDefinition definition) {
    return new EventTypeResponse(
        eventType,
        definition.label(),
        definition.pluralLabel(),
        definition.verb(),
        definition.category().name().toLowerCase(Locale.ROOT));
  }
}

/*
 * どこで: Reporting API
 * 何を: 締めの起動とレポート参照/配信済み記録のエンドポイントを提供する
 * なぜ: 配信などの下流処理がストアに直接触れずにレポートを読めるようにするため
 */
package com.example.reporting.api;

import com.example.reporting.model.ReportRecord;
import com.example.reporting.service.ReportLifecycleService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/reports")
@RequiredArgsConstructor
@Validated
public class ReportController {

  private final ReportLifecycleService reportLifecycleService;
  private final ReportingApiMapper mapper;

  @PostMapping("/freeze")
  public ReportResponse freeze() {
    final long frozenReportId = reportLifecycleService.freezeCurrentReport();
    return toResponse(reportLifecycleService.getReport(frozenReportId));
  }

  @GetMapping("/active")
  public ActiveReportResponse active() {
    final ReportRecord active = reportLifecycleService.getOrCreateActiveReport();
    return new ActiveReportResponse(
        toResponse(active), reportLifecycleService.getActiveEventCount());
  }

  @GetMapping("/latest")
  public ResponseEntity<ReportResponse> latest() {
    return reportLifecycleService
        .getLastFrozenReport()
        .map(this::toResponse)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @GetMapping
  public ReportsResponse list(
      @RequestParam(value = "limit", defaultValue = "10")
          @Min(value = 1, message = "limit must be between 1 and 100")
          @Max(value = 100, message = "limit must be between 1 and 100")
          int limit,
      @RequestParam(value = "offset", defaultValue = "0")
          @Min(value = 0, message = "offset must not be negative")
          int offset) {
    return new ReportsResponse(
        reportLifecycleService.listFrozenReports(limit, offset).stream()
            .map(this::toResponse)
            .toList(),
        limit,
        offset);
  }

  @GetMapping("/{report_id}")
  public ReportResponse get(@PathVariable("report_id") long reportId) {
    return toResponse(reportLifecycleService.getReport(reportId));
  }

  @GetMapping("/{report_id}/events")
  public EventsResponse events(
      @PathVariable("report_id") long reportId,
      @RequestParam(value = "limit", defaultValue = "100")
          @Min(value = 1, message = "limit must be between 1 and 1000")
          @Max(value = 1000, message = "limit must be between 1 and 1000")
          int limit) {
    return new EventsResponse(
        reportId,
        reportLifecycleService.getReportEvents(reportId, limit).stream()
            .map(mapper::toResponse)
            .toList());
  }

  @PostMapping("/{report_id}/emailed")
  public ReportResponse markEmailed(@PathVariable("report_id") long reportId) {
    return toResponse(reportLifecycleService.markReportEmailed(reportId));
  }

  private ReportResponse toResponse(ReportRecord report) {
    return mapper.toResponse(report, reportLifecycleService.parseSummary(report).orElse(null));
  }
}

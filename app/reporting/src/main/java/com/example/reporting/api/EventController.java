/*
 * どこで: Reporting API
 * 何を: イベント追記と未締めイベント参照のエンドポイントを提供する
 * なぜ: 生産者がコアに依存せず HTTP だけでイベントを送れるようにするため
 */
package com.example.reporting.api;

import com.example.reporting.service.ActivityEventService;
import com.example.reporting.service.ReportLifecycleService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/events")
@RequiredArgsConstructor
@Validated
public class EventController {

  private final ActivityEventService activityEventService;
  private final ReportLifecycleService reportLifecycleService;
  private final ReportingApiMapper mapper;

  @PostMapping
  public ResponseEntity<AppendEventResponse> append(
      @Valid @RequestBody AppendEventRequest request) {
    final long eventId = activityEventService.append(request);
    return ResponseEntity.status(HttpStatus.CREATED).body(new AppendEventResponse(eventId));
  }

  @GetMapping("/unassigned")
  public EventsResponse unassigned(
      @RequestParam(value = "limit", defaultValue = "10")
          @Min(value = 1, message = "limit must be between 1 and 100")
          @Max(value = 100, message = "limit must be between 1 and 100")
          int limit) {
    return new EventsResponse(
        null,
        reportLifecycleService.getRecentEvents(limit).stream().map(mapper::toResponse).toList());
  }

  @GetMapping("/counts")
  public EventCountsResponse counts(
      @RequestParam(value = "report_id", required = false) Long reportId) {
    final Map<String, Long> counts = activityEventService.countByType(reportId);
    final long total = counts.values().stream().mapToLong(Long::longValue).sum();
    return new EventCountsResponse(reportId, counts, total);
  }

  @GetMapping("/by-type")
  public EventsResponse byType(
      @RequestParam("event_type") @NotBlank(message = "event_type is required") String eventType,
      @RequestParam(value = "report_id", required = false) Long reportId,
      @RequestParam(value = "limit", defaultValue = "50")
          @Min(value = 1, message = "limit must be between 1 and 500")
          @Max(value = 500, message = "limit must be between 1 and 500")
          int limit) {
    return new EventsResponse(
        reportId,
        activityEventService.findByType(eventType, reportId, limit).stream()
            .map(mapper::toResponse)
            .toList());
  }

  @GetMapping("/last")
  public ResponseEntity<EventResponse> last(
      @RequestParam("event_type") @NotBlank(message = "event_type is required") String eventType,
      @RequestParam("object_id") long objectId) {
    return activityEventService
        .lastEventFor(eventType, objectId)
        .map(mapper::toResponse)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}

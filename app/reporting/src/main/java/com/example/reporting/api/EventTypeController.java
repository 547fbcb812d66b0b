/*
 * どこで: Reporting API
 * 何を: イベント種別表の参照と実行時登録のエンドポイントを提供する
 * なぜ: 新しい種別を持ち込む生産者がハイライト文言を自分で定義できるようにするため
 */
package com.example.reporting.api;

import com.example.reporting.model.EventCategory;
import com.example.reporting.model.EventTypeDefinition;
import com.example.reporting.service.EventTypeCatalog;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/event-types")
@RequiredArgsConstructor
@Validated
public class EventTypeController {

  private final EventTypeCatalog eventTypeCatalog;
  private final ReportingApiMapper mapper;

  @GetMapping
  public EventTypesResponse list() {
    return new EventTypesResponse(
        eventTypeCatalog.definitions().entrySet().stream()
            .map(entry -> mapper.toResponse(entry.getKey(), entry.getValue()))
            .toList());
  }

  /** 新規なら 201、既存定義の置き換えなら 200 を返す。 */
  @PutMapping("/{event_type}")
  public ResponseEntity<EventTypeResponse> register(
      @PathVariable("event_type")
          @Size(max = 64, message = "event_type must be at most 64 characters")
          @Pattern(regexp = "[a-z0-9_]+", message = "event_type must be snake_case")
          String eventType,
      @Valid @RequestBody RegisterEventTypeRequest request) {
    final EventTypeDefinition definition =
        new EventTypeDefinition(
            request.label(),
            request.pluralLabel(),
            request.verb(),
            request.category() == null
                ? null
                : EventCategory.valueOf(request.category().toUpperCase(Locale.ROOT)));
    final boolean created = eventTypeCatalog.register(eventType, definition);
    return ResponseEntity.status(created ? HttpStatus.CREATED : HttpStatus.OK)
        .body(mapper.toResponse(eventType, definition));
  }
}

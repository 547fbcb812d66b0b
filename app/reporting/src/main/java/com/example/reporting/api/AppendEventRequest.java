/*
 * どこで: Reporting API
 * 何を: イベント追記リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.example.reporting.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AppendEventRequest(
    @NotBlank(message = "event_type is required")
        @Size(max = 64, message = "event_type must be at most 64 characters")
        @Pattern(regexp = "[a-z0-9_]+", message = "event_type must be snake_case")
        String eventType,
    @Size(max = 64, message = "event_subtype must be at most 64 characters") String eventSubtype,
    Long objectId,
    Long userId,
    Map<String, Object> eventData,
    @Size(max = 64, message = "source must be at most 64 characters") String source) {}

package com.example.reporting.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventTypesResponse(List<EventTypeResponse> eventTypes) {
  public EventTypesResponse {
    eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
  }
}

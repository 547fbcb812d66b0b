/*
 * どこで: Reporting ナラティブ連携 DTO
 * 何を: Messages API のリクエスト本文
 * なぜ: snake_case の外部仕様へ合わせるため
 */
package com.example.reporting.narrative.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessagesRequest(String model, int maxTokens, List<Message> messages) {

  public record Message(String role, String content) {}
}

/*
 * どこで: Reporting ナラティブ連携 DTO
 * 何を: Messages API のレスポンス本文(必要な項目のみ)
 * なぜ: 先頭 text ブロックだけを取り出すため
 */
package com.example.reporting.narrative.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MessagesResponse(List<ContentBlock> content) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ContentBlock(String type, String text) {}
}

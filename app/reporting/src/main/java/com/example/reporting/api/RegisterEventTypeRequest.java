/*
 * どこで: Reporting API
 * 何を: イベント種別登録リクエストの入力を保持する
 * なぜ: 生産者が設定ファイルを変えずに自分の種別の表示情報を追加できるようにするため
 */
package com.example.reporting.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegisterEventTypeRequest(
    @NotBlank(message = "label is required")
        @Size(max = 64, message = "label must be at most 64 characters")
        String label,
    @Size(max = 64, message = "plural_label must be at most 64 characters") String pluralLabel,
    @Size(max = 64, message = "verb must be at most 64 characters") String verb,
    @Pattern(
            regexp = "content|identity|engagement|system",
            message = "category must be one of content, identity, engagement, system")
        String category) {}

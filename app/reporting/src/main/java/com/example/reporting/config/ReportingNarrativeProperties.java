/*
 * どこで: Reporting アプリの設定バインド
 * 何を: ナラティブ生成 API の接続設定を保持する
 * なぜ: API キー未設定時に機能自体を無効化できるようにするため
 */
package com.example.reporting.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reporting.narrative")
public record ReportingNarrativeProperties(
    boolean enabled,
    String baseUrl,
    String apiKey,
    String model,
    int maxTokens,
    Duration timeout,
    int recentEventLimit) {

  public ReportingNarrativeProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.anthropic.com" : baseUrl;
    model = model == null || model.isBlank() ? "claude-3-5-haiku-20241022" : model;
    maxTokens = maxTokens <= 0 ? 500 : maxTokens;
    timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
    recentEventLimit = recentEventLimit <= 0 ? 10 : recentEventLimit;
  }

  public boolean isConfigured() {
    return enabled && apiKey != null && !apiKey.isBlank();
  }
}

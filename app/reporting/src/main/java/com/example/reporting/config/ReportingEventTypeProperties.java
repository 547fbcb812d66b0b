/*
 * どこで: Reporting アプリの設定バインド
 * 何を: イベント種別 → 表示ラベル/動詞/分類 の対応表を保持する
 * なぜ: 新しい種別の追加を設定変更だけで済ませるため
 */
package com.example.reporting.config;

import com.example.reporting.model.EventTypeDefinition;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reporting")
public record ReportingEventTypeProperties(Map<String, EventTypeDefinition> eventTypes) {

  public ReportingEventTypeProperties {
    eventTypes = eventTypes == null ? Map.of() : Map.copyOf(eventTypes);
  }
}

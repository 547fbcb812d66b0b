/*
 * どこで: Reporting サービス層
 * 何を: event_data(任意の構造化ペイロード)と JSON 文字列を相互変換する
 * なぜ: 集計が読む action/object/context を欠損なく往復させるため
 */
package com.example.reporting.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EventDataCodec {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public String write(Map<String, Object> eventData) {
    if (eventData == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(eventData);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("event_data is not serializable", ex);
    }
  }

  public Map<String, Object> read(String eventDataJson) {
    if (eventDataJson == null || eventDataJson.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(eventDataJson, MAP_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("event_data is not a JSON object", ex);
    }
  }

  /** {@code event_data.<section>.<key>} を空でない文字列として取り出す。 */
  public static Optional<String> textAt(Map<String, Object> eventData, String section, String key) {
    final Object sectionValue = eventData.get(section);
    if (!(sectionValue instanceof Map<?, ?> sectionMap)) {
      return Optional.empty();
    }
    final Object value = sectionMap.get(key);
    if (value == null || value.toString().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.toString());
  }
}

/*
 * どこで: Reporting サービス層
 * 何を: イベント種別の表示情報を引き、ハイライト文言と説明文を組み立てる
 * なぜ: 種別を閉じた列挙にせず、未知の種別も汎用文言で扱えるようにするため
 */
package com.example.reporting.service;

import com.example.reporting.config.ReportingEventTypeProperties;
import com.example.reporting.model.EventCategory;
import com.example.reporting.model.EventTypeDefinition;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EventTypeCatalog {

  private static final Logger logger = LoggerFactory.getLogger(EventTypeCatalog.class);
  private static final int UNKNOWN_PRIORITY = EventCategory.values().length;

  private final ConcurrentMap<String, EventTypeDefinition> definitions;

  public EventTypeCatalog(ReportingEventTypeProperties properties) {
    this.definitions = new ConcurrentHashMap<>(properties.eventTypes());
  }

  /**
   * 実行時に種別を登録する。同名は上書き。登録はプロセス内だけで保持される。
   *
   * @return 新規登録なら true、既存定義の置き換えなら false
   */
  public boolean register(String eventType, EventTypeDefinition definition) {
    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("eventType is required");
    }
    if (definition == null) {
      throw new IllegalArgumentException("definition is required");
    }
    final boolean created = definitions.put(eventType, definition) == null;
    logger.info("event type registered eventType={} created={}", eventType, created);
    return created;
  }

  public Optional<EventTypeDefinition> find(String eventType) {
    return Optional.ofNullable(definitions.get(eventType));
  }

  public boolean isRegistered(String eventType) {
    return definitions.containsKey(eventType);
  }

  /** 種別名の昇順で並べた登録済み定義のスナップショット。 */
  public SortedMap<String, EventTypeDefinition> definitions() {
    return Collections.unmodifiableSortedMap(new TreeMap<>(definitions));
  }

  public int priorityOf(String eventType) {
    return find(eventType).map(definition -> definition.category().ordinal()).orElse(UNKNOWN_PRIORITY);
  }

  public String highlight(String eventType, long count) {
    return find(eventType)
        .map(
            definition ->
                String.format(
                    Locale.ROOT,
                    "%d new %s %s",
                    count,
                    definition.labelFor(count),
                    definition.verb()))
        .orElseGet(() -> String.format(Locale.ROOT, "%d %s events", count, eventType));
  }

  /** "post_published" → "Post Published" */
  public String displayName(String eventType) {
    return Arrays.stream(eventType.split("_"))
        .filter(part -> !part.isEmpty())
        .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1))
        .collect(Collectors.joining(" "));
  }

  /** ナラティブ用の1行説明。object の title/name と context の user_name があれば添える。 */
  public String describe(String eventType, Map<String, Object> eventData) {
    final StringBuilder description = new StringBuilder(displayName(eventType));
    EventDataCodec.textAt(eventData, "object", "title")
        .or(() -> EventDataCodec.textAt(eventData, "object", "name"))
        .ifPresent(title -> description.append(": \"").append(title).append('"'));
    EventDataCodec.textAt(eventData, "context", "user_name")
        .ifPresent(user -> description.append(" by ").append(user));
    return description.toString();
  }
}

/*
 * どこで: Reporting サービス層
 * 何を: 生産者からのイベント追記と未締めイベントの参照を担う
 * なぜ: 追記は常に未割当で行い、帰属の決定を締め処理だけに任せるため
 */
package com.example.reporting.service;

import com.example.reporting.api.AppendEventRequest;
import com.example.reporting.model.EventDraft;
import com.example.reporting.model.EventRecord;
import com.example.reporting.repository.EventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ActivityEventService {

  private static final Logger logger = LoggerFactory.getLogger(ActivityEventService.class);
  static final String DEFAULT_SOURCE = "core";

  private final EventRepository eventRepository;
  private final EventDataCodec eventDataCodec;
  private final EventTypeCatalog eventTypeCatalog;
  private final ReportingMetrics metrics;
  private final Clock clock;

  /**
   * イベントを未割当で追記する。event_timestamp はサーバ時刻で確定する。
   *
   * @return 採番されたイベント ID
   * @throws ReportPersistenceException ストアへの書き込みに失敗した場合
   */
  public long append(AppendEventRequest request) {
    final String source =
        request.source() == null || request.source().isBlank() ? DEFAULT_SOURCE : request.source();
    final EventDraft draft =
        new EventDraft(
            request.eventType(),
            request.eventSubtype(),
            request.objectId(),
            request.userId(),
            eventDataCodec.write(request.eventData()),
            source,
            Instant.now(clock));
    final long eventId;
    try {
      eventId = eventRepository.insert(draft);
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException(
          "failed to append event type=" + request.eventType(), ex);
    }
    metrics.recordEventAppended();
    if (!eventTypeCatalog.isRegistered(request.eventType())) {
      logger.debug("event appended with unregistered type eventType={}", request.eventType());
    }
    logger.info(
        "event appended eventId={} eventType={} source={}", eventId, request.eventType(), source);
    return eventId;
  }

  /** reportId が null なら未割当イベントを数える。 */
  public Map<String, Long> countByType(Long reportId) {
    try {
      return eventRepository.countByType(reportId);
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to count events reportId=" + reportId, ex);
    }
  }

  public Optional<EventRecord> lastEventFor(String eventType, long objectId) {
    try {
      return eventRepository.findLastEventFor(eventType, objectId);
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to read last event type=" + eventType, ex);
    }
  }

  public List<EventRecord> findByType(String eventType, Long reportId, int limit) {
    try {
      return eventRepository.findByType(eventType, reportId, limit);
    } catch (DataAccessException ex) {
      throw new ReportPersistenceException("failed to read events type=" + eventType, ex);
    }
  }
}

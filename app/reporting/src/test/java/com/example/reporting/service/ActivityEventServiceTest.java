/*
 * どこで: ActivityEventService のユニットテスト
 * 何を: 追記時の既定値補完/時刻確定/障害変換を検証する
 * なぜ: 追記されたイベントが必ず未割当かつサーバ時刻で保存されることを保証するため
 */
package com.example.reporting.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.reporting.TestFixtures;
import com.example.reporting.api.AppendEventRequest;
import com.example.reporting.model.EventDraft;
import com.example.reporting.repository.EventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ActivityEventServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-15T10:00:00Z");

  @Mock private EventRepository eventRepository;

  private SimpleMeterRegistry registry;
  private ActivityEventService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service =
        new ActivityEventService(
            eventRepository,
            new EventDataCodec(new ObjectMapper()),
            new EventTypeCatalog(TestFixtures.eventTypes()),
            new ReportingMetrics(registry),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void appendStoresServerTimestampAndDefaultSource() {
    when(eventRepository.insert(any(EventDraft.class))).thenReturn(11L);
    final AppendEventRequest request =
        new AppendEventRequest(
            "post_published",
            "post",
            42L,
            7L,
            Map.of("context", Map.of("user_name", "alice")),
            null);

    final long eventId = service.append(request);

    assertThat(eventId).isEqualTo(11L);
    final ArgumentCaptor<EventDraft> captor = ArgumentCaptor.forClass(EventDraft.class);
    verify(eventRepository).insert(captor.capture());
    final EventDraft draft = captor.getValue();
    assertThat(draft.eventType()).isEqualTo("post_published");
    assertThat(draft.objectId()).isEqualTo(42L);
    assertThat(draft.userId()).isEqualTo(7L);
    assertThat(draft.source()).isEqualTo("core");
    assertThat(draft.eventTimestamp()).isEqualTo(FIXED_NOW);
    assertThat(draft.eventDataJson()).isEqualTo("{\"context\":{\"user_name\":\"alice\"}}");
    assertThat(registry.get("reporting.events.appended.total").counter().count()).isEqualTo(1.0d);
  }

  @Test
  void appendKeepsExplicitSourceAndAcceptsUnknownType() {
    when(eventRepository.insert(any(EventDraft.class))).thenReturn(12L);

    service.append(new AppendEventRequest("webhook_fired", null, null, null, null, "shop"));

    final ArgumentCaptor<EventDraft> captor = ArgumentCaptor.forClass(EventDraft.class);
    verify(eventRepository).insert(captor.capture());
    assertThat(captor.getValue().source()).isEqualTo("shop");
    assertThat(captor.getValue().eventDataJson()).isNull();
  }

  @Test
  void appendWrapsStorageFailure() {
    when(eventRepository.insert(any(EventDraft.class)))
        .thenThrow(new DataAccessResourceFailureException("down"));

    assertThatThrownBy(
            () ->
                service.append(
                    new AppendEventRequest("post_published", null, null, null, null, null)))
        .isInstanceOf(ReportPersistenceException.class)
        .hasMessageContaining("post_published");
    assertThat(registry.get("reporting.events.appended.total").counter().count()).isZero();
  }

  @Test
  void countByTypeWrapsStorageFailure() {
    when(eventRepository.countByType(null)).thenThrow(new DataAccessResourceFailureException("down"));

    assertThatThrownBy(() -> service.countByType(null))
        .isInstanceOf(ReportPersistenceException.class);
  }
}

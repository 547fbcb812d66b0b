/*
 * どこで: Reporting API のWeb層テスト(イベント)
 * 何を: イベント追記の入力検証と参照系レスポンスを検証する
 * なぜ: 生産者に一貫した BAD_REQUEST 応答を返すため
 */
package com.example.reporting.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.reporting.TestFixtures;
import com.example.reporting.service.ActivityEventService;
import com.example.reporting.service.EventDataCodec;
import com.example.reporting.service.ReportLifecycleService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(EventController.class)
@Import({ApiExceptionHandler.class, ReportingApiMapper.class, EventDataCodec.class})
class EventControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ActivityEventService activityEventService;
  @MockitoBean private ReportLifecycleService reportLifecycleService;

  @Test
  void appendReturnsCreatedEventId() throws Exception {
    when(activityEventService.append(any(AppendEventRequest.class))).thenReturn(21L);
    final String body =
        """
        {
          "event_type": "post_published",
          "object_id": 42,
          "user_id": 7,
          "event_data": {"object": {"title": "Hello"}, "context": {"user_name": "alice"}}
        }
        """;

    mockMvc
        .perform(post("/v1/events").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.event_id").value(21));
  }

  @Test
  void appendRejectsMissingEventType() throws Exception {
    mockMvc
        .perform(
            post("/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"object_id\": 42}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("event_type is required"));

    verifyNoInteractions(activityEventService);
  }

  @Test
  void appendRejectsNonSnakeCaseEventType() throws Exception {
    mockMvc
        .perform(
            post("/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"event_type\": \"Post Published\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("event_type must be snake_case"));
  }

  @Test
  void appendRejectsMissingBody() throws Exception {
    mockMvc
        .perform(post("/v1/events").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is required"));
  }

  @Test
  void unassignedReturnsRecentEvents() throws Exception {
    when(reportLifecycleService.getRecentEvents(10))
        .thenReturn(
            List.of(TestFixtures.event(5, "post_published", TestFixtures.authoredBy("alice"))));

    mockMvc
        .perform(get("/v1/events/unassigned"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.events[0].id").value(5))
        .andExpect(jsonPath("$.events[0].event_type").value("post_published"))
        .andExpect(jsonPath("$.events[0].event_data.context.user_name").value("alice"));
  }

  @Test
  void countsSumsPerTypeCounts() throws Exception {
    final Map<String, Long> counts = new LinkedHashMap<>();
    counts.put("comment_posted", 3L);
    counts.put("post_published", 2L);
    when(activityEventService.countByType(null)).thenReturn(counts);

    mockMvc
        .perform(get("/v1/events/counts"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.counts.comment_posted").value(3))
        .andExpect(jsonPath("$.total").value(5));
  }

  @Test
  void lastReturnsNoContentWhenNothingRecorded() throws Exception {
    when(activityEventService.lastEventFor("post_edited", 42L)).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/v1/events/last").param("event_type", "post_edited").param("object_id", "42"))
        .andExpect(status().isNoContent());
  }

  @Test
  void lastRequiresObjectId() throws Exception {
    mockMvc
        .perform(get("/v1/events/last").param("event_type", "post_edited"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("object_id is required"));
  }
}

/*
 * どこで: Reporting ナラティブ連携
 * 何を: Anthropic Messages API を呼び出して週次要約文を生成する
 * なぜ: API キーが設定されている環境でだけレポートに自然文の要約を添えるため
 */
package com.example.reporting.narrative;

import com.example.reporting.config.ReportingNarrativeProperties;
import com.example.reporting.model.EventRecord;
import com.example.reporting.model.TrendEntry;
import com.example.reporting.narrative.dto.MessagesRequest;
import com.example.reporting.narrative.dto.MessagesResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class AnthropicNarrativeGenerator implements NarrativeGenerator {

  private static final Logger logger = LoggerFactory.getLogger(AnthropicNarrativeGenerator.class);
  private static final String MESSAGES_PATH = "/v1/messages";
  private static final String HEADER_API_KEY = "x-api-key";
  private static final String HEADER_API_VERSION = "anthropic-version";
  private static final String API_VERSION = "2023-06-01";
  private static final String ROLE_USER = "user";
  private static final String BLOCK_TYPE_TEXT = "text";

  private final RestClient narrativeRestClient;
  private final ReportingNarrativeProperties properties;
  private final NarrativePromptBuilder promptBuilder;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public AnthropicNarrativeGenerator(
      RestClient narrativeRestClient,
      ReportingNarrativeProperties properties,
      NarrativePromptBuilder promptBuilder) {
    this.narrativeRestClient = narrativeRestClient;
    this.properties = properties;
    this.promptBuilder = promptBuilder;
  }

  @Override
  public Optional<String> generate(
      List<EventRecord> events, Map<String, Long> totals, Map<String, TrendEntry> trends) {
    final String prompt =
        promptBuilder.build(events, totals, trends, properties.recentEventLimit());
    final MessagesRequest request =
        new MessagesRequest(
            properties.model(),
            properties.maxTokens(),
            List.of(new MessagesRequest.Message(ROLE_USER, prompt)));
    try {
      final MessagesResponse response =
          narrativeRestClient
              .post()
              .uri(MESSAGES_PATH)
              .header(HEADER_API_KEY, properties.apiKey())
              .header(HEADER_API_VERSION, API_VERSION)
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(MessagesResponse.class);
      return Optional.of(extractText(response));
    } catch (RestClientResponseException ex) {
      logger.warn(
          "narrative request failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new NarrativeGenerationException(
          NarrativeGenerationException.Reason.BAD_GATEWAY, "narrative request failed", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        throw new NarrativeGenerationException(
            NarrativeGenerationException.Reason.TIMEOUT, "narrative request timeout", ex);
      }
      throw new NarrativeGenerationException(
          NarrativeGenerationException.Reason.BAD_GATEWAY, "narrative connection failed", ex);
    }
  }

  private String extractText(MessagesResponse response) {
    if (response == null || response.content() == null) {
      throw new NarrativeGenerationException(
          NarrativeGenerationException.Reason.INVALID_RESPONSE, "narrative response is empty");
    }
    return response.content().stream()
        .filter(block -> BLOCK_TYPE_TEXT.equals(block.type()))
        .map(MessagesResponse.ContentBlock::text)
        .filter(text -> text != null && !text.isBlank())
        .findFirst()
        .orElseThrow(
            () ->
                new NarrativeGenerationException(
                    NarrativeGenerationException.Reason.INVALID_RESPONSE,
                    "narrative response has no text block"));
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}

/*
 * どこで: Reporting 設定
 * 何を: NarrativeGenerator を設定に応じて選んで提供する
 * なぜ: 未設定時は DISABLED を注入し、集計側で有無の分岐を持たせないため
 */
package com.example.reporting.config;

import com.example.reporting.narrative.AnthropicNarrativeGenerator;
import com.example.reporting.narrative.NarrativeGenerator;
import com.example.reporting.narrative.NarrativePromptBuilder;
import java.net.http.HttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class NarrativeConfig {

  private static final Logger logger = LoggerFactory.getLogger(NarrativeConfig.class);

  @Bean
  NarrativeGenerator narrativeGenerator(
      RestClient.Builder builder,
      ReportingNarrativeProperties properties,
      NarrativePromptBuilder promptBuilder) {
    if (!properties.isConfigured()) {
      logger.info("narrative overlay disabled enabled={}", properties.enabled());
      return NarrativeGenerator.DISABLED;
    }
    final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(properties.timeout()).build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.timeout());
    final RestClient restClient =
        builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
    logger.info(
        "narrative overlay enabled baseUrl={} model={}", properties.baseUrl(), properties.model());
    return new AnthropicNarrativeGenerator(restClient, properties, promptBuilder);
  }
}

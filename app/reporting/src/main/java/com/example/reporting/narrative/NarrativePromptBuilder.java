/*
 * どこで: Reporting ナラティブ連携
 * 何を: 件数/前回比/直近イベントからプロンプト本文を組み立てる
 * なぜ: 生成 API の差し替えと無関係にプロンプト内容をテストできるようにするため
 */
package com.example.reporting.narrative;

import com.example.reporting.model.EventRecord;
import com.example.reporting.model.TrendDirection;
import com.example.reporting.model.TrendEntry;
import com.example.reporting.service.EventDataCodec;
import com.example.reporting.service.EventTypeCatalog;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NarrativePromptBuilder {

  private static final String INTRODUCTION =
      "You are a friendly coworker reviewing site activity for the week. "
          + "Write a conversational summary as if you're telling a colleague what happened on their website. "
          + "Be warm, encouraging, and focus on the most important changes. "
          + "Use 'you' to address them directly. "
          + "Keep it concise (3-5 sentences max). Don't list every event - highlight the main activities.\n\n";
  private static final String INSTRUCTIONS =
      "\n## Instructions\n"
          + "Write a friendly 3-5 sentence summary highlighting the most important activities. "
          + "Mention trends if significant. Use a warm, encouraging tone. "
          + "Don't just list numbers - tell a story about what happened on the site this week.";

  private final EventTypeCatalog eventTypeCatalog;
  private final EventDataCodec eventDataCodec;

  public String build(
      List<EventRecord> events,
      Map<String, Long> totals,
      Map<String, TrendEntry> trends,
      int recentEventLimit) {
    final StringBuilder prompt = new StringBuilder(INTRODUCTION);

    prompt.append("## Event Summary\n");
    prompt.append("Total events this week: ").append(events.size()).append("\n\n");
    if (!totals.isEmpty()) {
      prompt.append("Event breakdown:\n");
      totals.forEach(
          (type, count) ->
              prompt
                  .append("- ")
                  .append(eventTypeCatalog.displayName(type))
                  .append(": ")
                  .append(count)
                  .append('\n'));
      prompt.append('\n');
    }

    if (!trends.isEmpty()) {
      prompt.append("## Trends vs. Last Week\n");
      trends.forEach(
          (type, trend) -> {
            if (trend.direction() == TrendDirection.SAME) {
              return;
            }
            final String arrow = trend.direction() == TrendDirection.UP ? "↑" : "↓";
            prompt
                .append("- ")
                .append(eventTypeCatalog.displayName(type))
                .append(": ")
                .append(arrow)
                .append(' ')
                .append(String.format(Locale.ROOT, "%.1f", Math.abs(trend.changePercent())))
                .append("% (")
                .append(trend.previous())
                .append(" → ")
                .append(trend.current())
                .append(")\n");
          });
      prompt.append('\n');
    }

    // events は新しい順で渡される
    prompt.append("## Recent Events\n");
    events.stream()
        .limit(recentEventLimit)
        .forEach(
            event ->
                prompt
                    .append("- ")
                    .append(
                        eventTypeCatalog.describe(
                            event.eventType(), eventDataCodec.read(event.eventDataJson())))
                    .append('\n'));

    prompt.append(INSTRUCTIONS);
    return prompt.toString();
  }
}

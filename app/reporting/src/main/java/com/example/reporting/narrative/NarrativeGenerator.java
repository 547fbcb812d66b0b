/*
 * どこで: Reporting ナラティブ連携
 * 何を: 集計結果から自然文の要約を作る外部関数の型
 * なぜ: 任意機能を継承や実行時型判定ではなく、注入される関数(無効値つき)として扱うため
 */
package com.example.reporting.narrative;

import com.example.reporting.model.EventRecord;
import com.example.reporting.model.TrendEntry;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@FunctionalInterface
public interface NarrativeGenerator {

  /** 設定されていない状態。常に「ナラティブなし」を返す。 */
  NarrativeGenerator DISABLED = (events, totals, trends) -> Optional.empty();

  /**
   * ストアを変更してはならない。失敗時は例外を投げてよい(呼び出し側で「ナラティブなし」に落とす)。
   */
  Optional<String> generate(
      List<EventRecord> events, Map<String, Long> totals, Map<String, TrendEntry> trends);
}

/*
 * どこで: Reporting 集計モデル
 * 何を: 前回比の向きを表す列挙
 * なぜ: summary_data に "up"/"down"/"same" の固定文字列で保存するため
 */
package com.example.reporting.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TrendDirection {
  UP,
  DOWN,
  SAME;

  public static TrendDirection of(double changePercent) {
    if (changePercent > 0) {
      return UP;
    }
    if (changePercent < 0) {
      return DOWN;
    }
    return SAME;
  }

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}

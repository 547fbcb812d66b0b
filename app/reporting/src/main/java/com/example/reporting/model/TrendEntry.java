/*
 * どこで: Reporting 集計モデル
 * 何を: イベント種別ごとの前回比
 * なぜ: 下流の描画側が current/previous/変化率をそのまま表示できるようにするため
 */
package com.example.reporting.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrendEntry(long current, long previous, double changePercent, TrendDirection direction) {}

/*
 * どこで: Reporting API
 * 何を: 種別ごとのイベント件数を表す
 * なぜ: 締め前の途中経過をダッシュボードから確認するため
 */
package com.example.reporting.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventCountsResponse(Long reportId, Map<String, Long> counts, long total) {}

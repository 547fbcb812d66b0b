/*
 * どこで: common ユーティリティのユニットテスト
 * 何を: Instant/Timestamp 変換の NULL 透過と UTC 保持を検証する
 * なぜ: NULL 許容カラムの読み書きで NPE や時差ずれを起こさないため
 */
package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T23:55:00Z");

  @Test
  void nullPassesThroughBothDirections() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }

  @Test
  void conversionKeepsTheSameInstant() {
    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(FIXED_NOW);

    assertThat(timestamp.getTime()).isEqualTo(FIXED_NOW.toEpochMilli());
    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(FIXED_NOW);
  }

  @Test
  void runIdsAreUnique() {
    assertThat(RunIds.newRunId()).isNotEqualTo(RunIds.newRunId());
  }
}

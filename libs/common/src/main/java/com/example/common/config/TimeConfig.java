/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を DI 可能にする
 * なぜ: 集計期間の境界をテストで固定クロックに差し替えられるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock systemClock() {
    return Clock.systemUTC();
  }
}

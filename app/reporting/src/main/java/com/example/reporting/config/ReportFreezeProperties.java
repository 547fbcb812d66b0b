/*
 * どこで: Reporting アプリの設定バインド
 * 何を: 定期締めのスケジュール設定を保持する
 * なぜ: 締め曜日/時刻と有効/無効を運用で調整できるようにするため
 */
package com.example.reporting.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reporting.freeze")
public record ReportFreezeProperties(boolean enabled, String cron, String zone) {}

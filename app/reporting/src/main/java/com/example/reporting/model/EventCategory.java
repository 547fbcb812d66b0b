/*
 * どこで: Reporting ドメインモデル
 * 何を: イベント種別の分類と表示優先度
 * なぜ: ハイライトを content, identity, engagement, system の順に並べるため
 */
package com.example.reporting.model;

public enum EventCategory {
  CONTENT,
  IDENTITY,
  ENGAGEMENT,
  SYSTEM
}

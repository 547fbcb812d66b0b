/*
 * どこで: Reporting ドメインモデル
 * 何を: イベント種別ごとの表示ラベル/動詞/分類
 * なぜ: 種別追加のたびにコアを変更せず、設定だけでハイライト文言を決めるため
 */
package com.example.reporting.model;

public record EventTypeDefinition(
    String label, String pluralLabel, String verb, EventCategory category) {

  public EventTypeDefinition {
    if (label == null || label.isBlank()) {
      throw new IllegalArgumentException("label is required");
    }
    pluralLabel = pluralLabel == null || pluralLabel.isBlank() ? label + "s" : pluralLabel;
    verb = verb == null || verb.isBlank() ? "recorded" : verb;
    category = category == null ? EventCategory.SYSTEM : category;
  }

  public String labelFor(long count) {
    return count == 1 ? label : pluralLabel;
  }
}

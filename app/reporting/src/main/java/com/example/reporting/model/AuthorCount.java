/*
 * どこで: Reporting 集計モデル
 * 何を: 投稿者ごとの公開件数
 * なぜ: レポートの上位投稿者欄に使うため
 */
package com.example.reporting.model;

public record AuthorCount(String name, long count) {}

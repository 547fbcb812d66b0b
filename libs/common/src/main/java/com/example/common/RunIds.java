/*
 * どこで: 共通ユーティリティ
 * 何を: バッチ実行単位の識別子を採番する
 * なぜ: 締め処理などの一連のログを MDC で突き合わせるため
 */
package com.example.common;

import java.util.UUID;

public final class RunIds {
  private RunIds() {}

  public static String newRunId() {
    return UUID.randomUUID().toString();
  }
}

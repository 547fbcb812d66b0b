/*
 * どこで: Reporting ナラティブ連携
 * 何を: 要約生成 API 呼び出しの失敗を表現する
 * なぜ: 失敗理由をログに残しつつ、締め処理は継続させるため
 */
package com.example.reporting.narrative;

public class NarrativeGenerationException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public NarrativeGenerationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public NarrativeGenerationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}

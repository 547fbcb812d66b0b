/*
 * どこで: Reporting サービス層
 * 何を: ACTIVE レポートが既にある状態での新規作成を示す例外
 * なぜ: 呼び出し側の誤り(先に締めるべき)としてリトライ対象外で返すため
 */
package com.example.reporting.service;

public class InvariantViolationException extends RuntimeException {

  public InvariantViolationException(String message) {
    super(message);
  }

  public InvariantViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}

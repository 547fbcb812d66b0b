/*
 * どこで: Reporting API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: ライフサイクルの失敗種別ごとに一貫したエラー応答を返すため
 */
package com.example.reporting.api;

import com.example.reporting.service.AlreadyFrozenException;
import com.example.reporting.service.InvariantViolationException;
import com.example.reporting.service.NoActiveReportException;
import com.example.reporting.service.ReportNotFoundException;
import com.example.reporting.service.ReportPersistenceException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ReportNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleReportNotFound(ReportNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.REPORT_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(InvariantViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleInvariantViolation(
      InvariantViolationException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.ACTIVE_REPORT_EXISTS, ex.getMessage()));
  }

  @ExceptionHandler(NoActiveReportException.class)
  public ResponseEntity<ApiErrorResponse> handleNoActiveReport(NoActiveReportException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.NO_ACTIVE_REPORT, ex.getMessage()));
  }

  @ExceptionHandler(AlreadyFrozenException.class)
  public ResponseEntity<ApiErrorResponse> handleAlreadyFrozen(AlreadyFrozenException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.REPORT_ALREADY_FROZEN, ex.getMessage()));
  }

  @ExceptionHandler(ReportPersistenceException.class)
  public ResponseEntity<ApiErrorResponse> handleReportPersistence(ReportPersistenceException ex) {
    logger.error("report persistence failure", ex);
    return serviceUnavailable(ex.getMessage());
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    // ドライバ由来の文言は返さない
    logger.error("data access failure", ex);
    return serviceUnavailable("storage is unavailable");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return badRequest(ex.getParameterName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleHandlerMethodValidation(
      HandlerMethodValidationException ex) {
    final String message =
        ex.getAllErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private ResponseEntity<ApiErrorResponse> serviceUnavailable(String message) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse(ApiErrorCode.PERSISTENCE_ERROR, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}

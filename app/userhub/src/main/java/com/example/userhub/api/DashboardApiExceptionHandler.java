/*
 * どこで: userhub API 層
 * 何を: ダッシュボード API の例外を標準エラー形式へ変換する
 * なぜ: 上流障害は 503、入力不備は 400 と失敗時の契約を一定に保つため
 */
package com.example.userhub.api;

import com.example.userhub.service.DependencyUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class DashboardApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(DashboardApiExceptionHandler.class);

  @ExceptionHandler(DependencyUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleDependencyUnavailable(
      DependencyUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ApiErrorResponse(
                "DEPENDENCY_UNAVAILABLE",
                "dashboard dependency unavailable: " + ex.dependencyName()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getName() + " is invalid"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException ex) {
    logger.error("dashboard request failed unexpectedly", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("INTERNAL_ERROR", "dashboard request failed"));
  }
}

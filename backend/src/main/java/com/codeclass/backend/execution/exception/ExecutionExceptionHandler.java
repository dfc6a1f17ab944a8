package com.codeclass.backend.execution.exception;

import com.codeclass.backend.execution.dto.response.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 실행 API 예외를 HTTP 응답으로 변환한다.
 */
@Slf4j
@RestControllerAdvice
public class ExecutionExceptionHandler {

  @ExceptionHandler(RunConflictException.class)
  public ResponseEntity<ErrorResponse> conflict(RunConflictException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse(e.getMessage(), HttpStatus.CONFLICT.value(), e.getRunId(), null));
  }

  @ExceptionHandler(RunThrottledException.class)
  public ResponseEntity<ErrorResponse> throttled(RunThrottledException e) {
    // 헤더는 정수 초, 올림
    long retryAfter = Math.max(1, (e.getRemaining().toMillis() + 999) / 1000);
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
            .body(new ErrorResponse(e.getMessage(), HttpStatus.TOO_MANY_REQUESTS.value(), null,
                    e.getRemainingSeconds()));
  }

  @ExceptionHandler(QueueOverloadedException.class)
  public ResponseEntity<ErrorResponse> overloaded(QueueOverloadedException e) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ErrorResponse(e.getMessage(), HttpStatus.SERVICE_UNAVAILABLE.value(), e.getRunId(), null));
  }

  @ExceptionHandler(RunNotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(RunNotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ErrorResponse.of(e.getMessage(), HttpStatus.NOT_FOUND.value()));
  }

  @ExceptionHandler(RunAccessDeniedException.class)
  public ResponseEntity<ErrorResponse> forbidden(RunAccessDeniedException e) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .body(ErrorResponse.of("Unauthorized", HttpStatus.FORBIDDEN.value()));
  }

  @ExceptionHandler(RunNotCancellableException.class)
  public ResponseEntity<ErrorResponse> notCancellable(RunNotCancellableException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse(e.getMessage(), HttpStatus.CONFLICT.value(), e.getRunId(), null));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> invalid(MethodArgumentNotValidException e) {
    String detail = e.getBindingResult().getFieldErrors().stream()
            .map(this::describe)
            .collect(Collectors.joining(", "));
    log.debug("Rejected invalid execution request: {}", detail);
    return ResponseEntity.badRequest()
            .body(ErrorResponse.of("Invalid request: " + detail, HttpStatus.BAD_REQUEST.value()));
  }

  private String describe(FieldError error) {
    return error.getField() + " " + error.getDefaultMessage();
  }
}

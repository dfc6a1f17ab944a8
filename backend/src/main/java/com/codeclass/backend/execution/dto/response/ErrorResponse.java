package com.codeclass.backend.execution.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 오류 응답.
 */
@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
  private String detail;
  private int statusCode;
  // 관련된 Run (충돌한 Run, 과부하로 실패 처리된 Run)
  private Long runId;
  // 다시 시도할 수 있을 때까지 남은 초
  private Double retryAfter;

  public static ErrorResponse of(String detail, int statusCode) {
    return new ErrorResponse(detail, statusCode, null, null);
  }
}

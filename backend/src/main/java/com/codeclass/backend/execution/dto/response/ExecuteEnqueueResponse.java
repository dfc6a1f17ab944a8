package com.codeclass.backend.execution.dto.response;

import com.codeclass.backend.execution.model.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 실행 접수 응답 (202).
 */
@Getter
@AllArgsConstructor
public class ExecuteEnqueueResponse {
  // 폴링에 사용할 실행 ID
  private Long runId;
  // 항상 queued
  private RunStatus status;
  // 대기열 길이 (알 수 없으면 null)
  private Integer position;
  private String message;
}

package com.codeclass.backend.execution.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 실행 요청 바디.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteRequest {
  // 실행 언어 (python, java, c, cpp, javascript)
  @NotBlank
  private String language;
  @NotEmpty
  private List<@Valid FileData> files;
  // 실행을 연결할 attempt
  @NotNull
  private Long attemptId;
  // 기본 빌드 커맨드를 대체
  private String buildCommand;
  // 기본 실행 커맨드를 대체
  private String runCommand;
  // 표준 입력
  private String stdin;
}

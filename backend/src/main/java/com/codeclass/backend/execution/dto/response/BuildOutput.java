package com.codeclass.backend.execution.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 빌드 단계 출력.
 */
@Getter
@AllArgsConstructor
public class BuildOutput {
  private String stdout;
  private String stderr;
  private Integer exitCode;
  // 초
  private Double executionTime;
}

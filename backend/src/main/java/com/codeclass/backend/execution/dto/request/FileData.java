package com.codeclass.backend.execution.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 요청에 포함된 파일 하나.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class FileData {
  // 파일 이름 (예: Main.java). 작업 디렉토리 내 위치로 쓰인다
  @NotBlank
  private String name;
  // 프로젝트 내 경로 (예: src/Main.java)
  private String path;
  @NotNull
  private String content;
  // 진입 파일 여부
  private Boolean isMain;
}

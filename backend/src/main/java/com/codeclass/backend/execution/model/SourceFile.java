package com.codeclass.backend.execution.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 프로젝트를 구성하는 소스 파일 하나.
 */
@Getter
@ToString(exclude = "content")
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class SourceFile {
  @JsonProperty("name")
  private String name;

  @JsonProperty("path")
  private String path;

  @JsonProperty("content")
  private String content;

  @JsonProperty("is_main")
  private boolean main;
}

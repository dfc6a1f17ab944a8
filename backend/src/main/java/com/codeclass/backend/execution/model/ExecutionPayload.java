package com.codeclass.backend.execution.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 재현용 실행 요청 원본.
 *
 * <p>Run 생성 시 그대로 직렬화되어 저장되며 이후 변경되지 않는다. 분산 워커는 이 값을 저장소에서 다시
 * 읽어 실행한다. 필드 이름은 웹 계층의 JSON 설정과 무관하게 고정이다.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"attempt_id", "language", "files", "stdin", "build_command", "run_command"})
public class ExecutionPayload {
  @JsonProperty("attempt_id")
  private Long attemptId;

  @JsonProperty("language")
  private String language;

  @JsonProperty("files")
  private List<SourceFile> files;

  @JsonProperty("stdin")
  private String stdin;

  @JsonProperty("build_command")
  private String buildCommand;

  @JsonProperty("run_command")
  private String runCommand;
}

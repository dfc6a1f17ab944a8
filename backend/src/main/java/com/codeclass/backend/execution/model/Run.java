package com.codeclass.backend.execution.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * 코드 실행 요청 하나와 그 결과의 영속 기록.
 *
 * <p>상태 전이는 {@code RunRepository}의 조건부 갱신으로만 일어난다.
 */
@Entity
@Table(name = "runs", indexes = {
        @Index(name = "idx_runs_attempt_status", columnList = "attempt_id, status"),
        @Index(name = "idx_runs_created", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class Run {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "attempt_id", nullable = false)
  private Long attemptId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private RunStatus status = RunStatus.QUEUED;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "finished_at")
  private Instant finishedAt;

  // 빌드 단계 결과 (빌드가 없으면 모두 null)
  @Lob
  @Column(name = "build_stdout")
  private String buildStdout;

  @Lob
  @Column(name = "build_stderr")
  private String buildStderr;

  @Column(name = "build_exit_code")
  private Integer buildExitCode;

  @Column(name = "build_time")
  private Double buildTime;

  // 실행 단계 결과
  @Lob
  private String stdout;

  @Lob
  private String stderr;

  @Column(name = "exit_code")
  private Integer exitCode;

  @Column(name = "run_time")
  private Double runTime;

  @Lob
  @Column(name = "code_snapshot")
  private String codeSnapshot;

  @Column(name = "snapshot_hash", length = 64)
  private String snapshotHash;

  @Lob
  @Column(name = "request_json", updatable = false)
  private String requestJson;

  public Run(Long attemptId, Instant createdAt) {
    this.attemptId = attemptId;
    this.createdAt = createdAt;
    this.status = RunStatus.QUEUED;
  }
}

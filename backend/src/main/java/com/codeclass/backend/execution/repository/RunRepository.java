package com.codeclass.backend.execution.repository;

import com.codeclass.backend.execution.model.Run;
import com.codeclass.backend.execution.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Run 저장소.
 *
 * <p>상태 전이 메서드는 모두 "현재 상태가 기대값일 때만" 갱신하는 조건부 UPDATE 이다. 반환값이 0이면
 * 다른 주체가 먼저 전이시킨 것이므로 호출자는 아무것도 하지 않는다.
 */
public interface RunRepository extends JpaRepository<Run, Long> {

  Optional<Run> findFirstByAttemptIdAndStatusInOrderByCreatedAtAsc(Long attemptId, Collection<RunStatus> statuses);

  Optional<Run> findFirstByAttemptIdOrderByCreatedAtDesc(Long attemptId);

  List<Run> findByStatusAndCreatedAtBefore(RunStatus status, Instant cutoff);

  List<Run> findByStatusAndStartedAtBefore(RunStatus status, Instant cutoff);

  // queued -> running. startedAt은 여기서 한 번만 기록된다.
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Run r set r.status = :running, r.startedAt = :startedAt "
          + "where r.id = :id and r.status = :queued")
  int claim(@Param("id") Long id,
            @Param("startedAt") Instant startedAt,
            @Param("queued") RunStatus queued,
            @Param("running") RunStatus running);

  default boolean markRunning(Long id, Instant startedAt) {
    return claim(id, startedAt, RunStatus.QUEUED, RunStatus.RUNNING) == 1;
  }

  // running -> 종료 상태
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Run r set r.status = :status, r.finishedAt = :finishedAt, "
          + "r.buildStdout = :buildStdout, r.buildStderr = :buildStderr, "
          + "r.buildExitCode = :buildExitCode, r.buildTime = :buildTime, "
          + "r.stdout = :stdout, r.stderr = :stderr, r.exitCode = :exitCode, r.runTime = :runTime "
          + "where r.id = :id and r.status = :running")
  int complete(@Param("id") Long id,
               @Param("status") RunStatus status,
               @Param("finishedAt") Instant finishedAt,
               @Param("buildStdout") String buildStdout,
               @Param("buildStderr") String buildStderr,
               @Param("buildExitCode") Integer buildExitCode,
               @Param("buildTime") Double buildTime,
               @Param("stdout") String stdout,
               @Param("stderr") String stderr,
               @Param("exitCode") Integer exitCode,
               @Param("runTime") Double runTime,
               @Param("running") RunStatus running);

  // queued/running -> error (인프라 오류, 큐 거절, 방치된 실행)
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Run r set r.status = :error, r.stderr = :message, r.finishedAt = :finishedAt "
          + "where r.id = :id and r.status in :from")
  int fail(@Param("id") Long id,
           @Param("message") String message,
           @Param("finishedAt") Instant finishedAt,
           @Param("from") Collection<RunStatus> from,
           @Param("error") RunStatus error);

  default boolean markFailed(Long id, String message, Instant finishedAt, RunStatus expected) {
    return fail(id, message, finishedAt, List.of(expected), RunStatus.ERROR) == 1;
  }

  // queued -> cancelled
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Run r set r.status = :cancelled, r.finishedAt = :finishedAt "
          + "where r.id = :id and r.status = :queued")
  int cancel(@Param("id") Long id,
             @Param("finishedAt") Instant finishedAt,
             @Param("queued") RunStatus queued,
             @Param("cancelled") RunStatus cancelled);

  default boolean markCancelled(Long id, Instant finishedAt) {
    return cancel(id, finishedAt, RunStatus.QUEUED, RunStatus.CANCELLED) == 1;
  }
}

package com.codeclass.backend.execution.queue;

import com.codeclass.backend.execution.model.ExecutionJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis 리스트를 브로커로 쓰는 분산 큐.
 *
 * <p>메시지에는 Run 식별자만 담긴다. 실행에 필요한 요청은 Run의 재현용 필드에 있으므로 워커는 저장소에서
 * 다시 읽는다. 브로커가 작업을 잃어버린 경우는 {@code StaleRunReconciler}가 정리한다.
 */
@Slf4j
public class RedisExecutionQueue extends WorkerPoolExecutionQueue {
  private final StringRedisTemplate redis;
  private final String key;
  private final int capacity;

  public RedisExecutionQueue(JobProcessor processor, StringRedisTemplate redis, String key,
                             int capacity, int maxConcurrent, Duration pollTimeout) {
    super("redis", processor, maxConcurrent, pollTimeout);
    this.redis = redis;
    this.key = key;
    this.capacity = capacity;
  }

  @Override
  public EnqueueResult enqueue(ExecutionJob job) {
    try {
      Long size = redis.opsForList().size(key);
      if (size != null && size >= capacity) {
        log.error("Queue full, rejecting run {}", job.getRunId());
        return EnqueueResult.rejected(EnqueueResult.OVERLOADED);
      }
      redis.opsForList().leftPush(key, String.valueOf(job.getRunId()));
    } catch (DataAccessException e) {
      log.error("Failed to enqueue run {} to Redis", job.getRunId(), e);
      return EnqueueResult.rejected("Queue unavailable: " + e.getMessage());
    }
    log.info("Enqueued run {} to Redis (attempt {})", job.getRunId(), job.getAttemptId());
    return EnqueueResult.accepted();
  }

  @Override
  public Integer position() {
    try {
      Long size = redis.opsForList().size(key);
      return size == null ? null : size.intValue();
    } catch (DataAccessException e) {
      log.warn("Could not read queue length: {}", e.getMessage());
      return null;
    }
  }

  @Override
  protected Runnable take(Duration timeout) {
    String value = redis.opsForList().rightPop(key, timeout);
    if (value == null) {
      return null;
    }
    Long runId;
    try {
      runId = Long.valueOf(value.trim());
    } catch (NumberFormatException e) {
      log.error("Dropping malformed queue message '{}'", value);
      return null;
    }
    return () -> processor.processStored(runId);
  }
}

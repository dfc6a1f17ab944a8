package com.codeclass.backend.execution.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

import static com.codeclass.backend.execution.queue.InMemoryExecutionQueueTest.job;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisExecutionQueueTest {
  private static final String KEY = "execution:jobs";

  private StringRedisTemplate redis;
  private ListOperations<String, String> ops;
  private JobProcessor processor;
  private RedisExecutionQueue queue;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    redis = mock(StringRedisTemplate.class);
    ops = mock(ListOperations.class);
    processor = mock(JobProcessor.class);
    when(redis.opsForList()).thenReturn(ops);
    queue = new RedisExecutionQueue(processor, redis, KEY, 3, 2, Duration.ofMillis(50));
  }

  @Test
  void pushesOnlyRunId() {
    when(ops.size(KEY)).thenReturn(0L);

    EnqueueResult result = queue.enqueue(job(42));

    assertThat(result.isAccepted()).isTrue();
    verify(ops).leftPush(KEY, "42");
  }

  @Test
  void rejectsWhenListAtCapacity() {
    when(ops.size(KEY)).thenReturn(3L);

    EnqueueResult result = queue.enqueue(job(7));

    assertThat(result.isAccepted()).isFalse();
    assertThat(result.getReason()).isEqualTo(EnqueueResult.OVERLOADED);
    verify(ops, never()).leftPush(anyString(), anyString());
  }

  @Test
  void brokerFailureIsRejection() {
    when(ops.size(KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));

    EnqueueResult result = queue.enqueue(job(7));

    assertThat(result.isAccepted()).isFalse();
    assertThat(result.getReason()).startsWith("Queue unavailable: ");
    assertThat(queue.position()).isNull();
  }

  @Test
  void takeHandsStoredRunToProcessor() throws Exception {
    when(ops.rightPop(KEY, Duration.ofMillis(50))).thenReturn("9");

    Runnable task = queue.take(Duration.ofMillis(50));
    task.run();

    verify(processor).processStored(9L);
  }

  @Test
  void malformedMessageIsDropped() throws Exception {
    when(ops.rightPop(any(String.class), any(Duration.class))).thenReturn("not-a-number");

    assertThat(queue.take(Duration.ofMillis(50))).isNull();
  }

  @Test
  void positionIsListLength() {
    when(ops.size(KEY)).thenReturn(5L);

    assertThat(queue.position()).isEqualTo(5);
  }
}

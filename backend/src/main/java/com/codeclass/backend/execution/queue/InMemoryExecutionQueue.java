package com.codeclass.backend.execution.queue;

import com.codeclass.backend.execution.model.ExecutionJob;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 단일 서버용 프로세스 내부 큐. 용량이 고정된 FIFO 이다.
 */
@Slf4j
public class InMemoryExecutionQueue extends WorkerPoolExecutionQueue {
  private final BlockingQueue<ExecutionJob> queue;
  private final Duration enqueueTimeout;

  public InMemoryExecutionQueue(JobProcessor processor, int capacity, int maxConcurrent,
                                Duration enqueueTimeout, Duration pollTimeout) {
    super("in-process", processor, maxConcurrent, pollTimeout);
    this.queue = new ArrayBlockingQueue<>(capacity, true);
    this.enqueueTimeout = enqueueTimeout;
  }

  @Override
  public EnqueueResult enqueue(ExecutionJob job) {
    if (isStopped()) {
      return EnqueueResult.rejected("Execution queue is shut down");
    }
    try {
      if (!queue.offer(job, enqueueTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.error("Queue full, rejecting run {}", job.getRunId());
        return EnqueueResult.rejected(EnqueueResult.OVERLOADED);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return EnqueueResult.rejected("Enqueueing interrupted");
    }
    log.info("Enqueued run {} (attempt {}, position {})", job.getRunId(), job.getAttemptId(), queue.size());
    return EnqueueResult.accepted();
  }

  @Override
  public Integer position() {
    return queue.size();
  }

  @Override
  protected Runnable take(Duration timeout) throws InterruptedException {
    ExecutionJob job = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    if (job == null) {
      return null;
    }
    return () -> processor.process(job);
  }
}

package com.codeclass.backend.execution.queue;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 크기 워커 풀과 공유 동시 실행 제한을 갖는 큐의 공통 골격.
 *
 * <p>워커는 작업을 하나 꺼낸 뒤 제한 슬롯을 얻고 나서야 실행한다. 따라서 워커 수와 관계없이 동시에 실행되는
 * 작업은 {@code maxConcurrent}를 넘지 않는다. 하위 클래스는 작업을 꺼내는 방법만 정한다.
 */
@Slf4j
public abstract class WorkerPoolExecutionQueue implements ExecutionQueue {
  // 저장소 오류 등으로 꺼내기에 실패했을 때 다시 시도하기 전 대기 시간
  private static final long FAILURE_BACKOFF_MILLIS = 1_000L;
  // 종료 대기 중 진행 상황을 남기는 주기
  private static final long DRAIN_LOG_INTERVAL_SECONDS = 30L;

  protected final JobProcessor processor;
  private final Semaphore limiter;
  private final int maxConcurrent;
  private final Duration pollTimeout;
  private final String name;
  private ExecutorService workers;
  private volatile boolean running;
  private volatile boolean stopped;

  protected WorkerPoolExecutionQueue(String name, JobProcessor processor, int maxConcurrent, Duration pollTimeout) {
    this.name = name;
    this.processor = processor;
    this.maxConcurrent = maxConcurrent;
    this.limiter = new Semaphore(maxConcurrent, true);
    this.pollTimeout = pollTimeout;
  }

  /**
   * 다음 작업을 최대 {@code timeout} 동안 기다려 꺼낸다. 없으면 null.
   */
  protected abstract Runnable take(Duration timeout) throws InterruptedException;

  @Override
  public synchronized void start(int workerCount) {
    if (running) {
      log.warn("{} workers already running", name);
      return;
    }
    if (stopped) {
      throw new IllegalStateException(name + " queue has been shut down");
    }
    running = true;
    if (workerCount > 0) {
      workers = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory(name));
      for (int i = 0; i < workerCount; i++) {
        int workerId = i;
        workers.execute(() -> workerLoop(workerId));
      }
    }
    log.info("Started {} {} workers (max concurrent executions: {})", workerCount, name, maxConcurrent);
  }

  @Override
  public void shutdown() {
    ExecutorService pool;
    synchronized (this) {
      if (stopped) {
        return;
      }
      stopped = true;
      running = false;
      pool = workers;
      workers = null;
    }
    if (pool == null) {
      return;
    }
    // 실행 중인 작업은 자체 타임아웃까지 끝나도록 둔다
    pool.shutdown();
    try {
      while (!pool.awaitTermination(DRAIN_LOG_INTERVAL_SECONDS, TimeUnit.SECONDS)) {
        log.info("Waiting for {} in-flight {} jobs to finish", activeCount(), name);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for {} workers to finish", name);
      return;
    }
    log.info("{} workers shut down", name);
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  protected boolean isStopped() {
    return stopped;
  }

  /**
   * 현재 제한 슬롯을 잡고 실행 중인 작업 수.
   */
  public int activeCount() {
    return maxConcurrent - limiter.availablePermits();
  }

  private void workerLoop(int workerId) {
    log.info("{} worker {} started", name, workerId);
    while (running) {
      Runnable job;
      try {
        job = take(pollTimeout);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (RuntimeException e) {
        log.error("{} worker {} failed to dequeue", name, workerId, e);
        if (!pause(FAILURE_BACKOFF_MILLIS)) {
          break;
        }
        continue;
      }
      if (job == null) {
        // 종료 플래그 확인
        continue;
      }

      try {
        limiter.acquire();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("{} worker {} interrupted before a slot was free; job left unprocessed", name, workerId);
        break;
      }
      try {
        job.run();
      } catch (RuntimeException e) {
        log.error("{} worker {} error", name, workerId, e);
      } finally {
        limiter.release();
      }
    }
    log.info("{} worker {} stopped", name, workerId);
  }

  private boolean pause(long millis) {
    try {
      Thread.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final String prefix;

    WorkerThreadFactory(String name) {
      this.prefix = name + "-worker-";
    }

    @Override
    public Thread newThread(Runnable r) {
      return new Thread(r, prefix + threadCounter.getAndIncrement());
    }
  }
}

package com.codeclass.backend.execution.queue;

import com.codeclass.backend.execution.model.ExecutionJob;
import com.codeclass.backend.execution.model.ExecutionPayload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryExecutionQueueTest {
  private InMemoryExecutionQueue queue;

  @AfterEach
  void tearDown() {
    if (queue != null) {
      queue.shutdown();
    }
  }

  @Test
  void rejectsWhenFullAndAcceptsAgainAfterDrain() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(1);
    queue = new InMemoryExecutionQueue(new RecordingProcessor(started, release), 2, 1,
            Duration.ofMillis(50), Duration.ofMillis(50));

    assertThat(queue.enqueue(job(1)).isAccepted()).isTrue();
    assertThat(queue.enqueue(job(2)).isAccepted()).isTrue();

    EnqueueResult rejected = queue.enqueue(job(3));
    assertThat(rejected.isAccepted()).isFalse();
    assertThat(rejected.getReason()).isEqualTo(EnqueueResult.OVERLOADED);
    assertThat(queue.position()).isEqualTo(2);

    queue.start(1);
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(queue.enqueue(job(4)).isAccepted()).isTrue();
    release.countDown();
  }

  @Test
  void processesInFifoOrder() throws Exception {
    List<Long> order = new CopyOnWriteArrayList<>();
    CountDownLatch done = new CountDownLatch(5);
    queue = new InMemoryExecutionQueue(new JobProcessor() {
      @Override
      public void process(ExecutionJob job) {
        order.add(job.getRunId());
        done.countDown();
      }

      @Override
      public void processStored(Long runId) {
        throw new UnsupportedOperationException();
      }
    }, 10, 1, Duration.ofMillis(50), Duration.ofMillis(50));

    for (long i = 1; i <= 5; i++) {
      queue.enqueue(job(i));
    }
    queue.start(1);

    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(order).containsExactly(1L, 2L, 3L, 4L, 5L);
  }

  @Test
  void limiterCapsConcurrentJobsAcrossWorkers() throws Exception {
    AtomicInteger current = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    CountDownLatch done = new CountDownLatch(8);
    queue = new InMemoryExecutionQueue(new JobProcessor() {
      @Override
      public void process(ExecutionJob job) {
        int now = current.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
        sleep(100);
        current.decrementAndGet();
        done.countDown();
      }

      @Override
      public void processStored(Long runId) {
        throw new UnsupportedOperationException();
      }
    }, 20, 2, Duration.ofMillis(50), Duration.ofMillis(50));

    queue.start(4);
    for (long i = 1; i <= 8; i++) {
      queue.enqueue(job(i));
    }

    assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
    assertThat(peak.get()).isLessThanOrEqualTo(2);
    assertThat(queue.activeCount()).isZero();
  }

  @Test
  void shutdownWaitsForRunningJobAndRejectsNewOnes() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    AtomicInteger finished = new AtomicInteger();
    queue = new InMemoryExecutionQueue(new JobProcessor() {
      @Override
      public void process(ExecutionJob job) {
        started.countDown();
        sleep(300);
        finished.incrementAndGet();
      }

      @Override
      public void processStored(Long runId) {
        throw new UnsupportedOperationException();
      }
    }, 10, 1, Duration.ofMillis(50), Duration.ofMillis(50));
    queue.start(1);
    queue.enqueue(job(1));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    queue.shutdown();

    assertThat(finished.get()).isEqualTo(1);
    assertThat(queue.isRunning()).isFalse();
    assertThat(queue.enqueue(job(2)).isAccepted()).isFalse();
  }

  @Test
  void workerSurvivesFailingJob() throws Exception {
    CountDownLatch second = new CountDownLatch(1);
    queue = new InMemoryExecutionQueue(new JobProcessor() {
      @Override
      public void process(ExecutionJob job) {
        if (job.getRunId() == 1L) {
          throw new IllegalStateException("boom");
        }
        second.countDown();
      }

      @Override
      public void processStored(Long runId) {
        throw new UnsupportedOperationException();
      }
    }, 10, 1, Duration.ofMillis(50), Duration.ofMillis(50));
    queue.start(1);

    queue.enqueue(job(1));
    queue.enqueue(job(2));

    assertThat(second.await(5, TimeUnit.SECONDS)).isTrue();
  }

  static ExecutionJob job(long runId) {
    ExecutionPayload payload = new ExecutionPayload(100L + runId, "python", List.of(), "", null, null);
    return new ExecutionJob(runId, payload, Instant.now());
  }

  @Test
  void workersRunOnNamedPoolThreads() throws Exception {
    List<String> threadNames = new CopyOnWriteArrayList<>();
    CountDownLatch done = new CountDownLatch(4);
    queue = new InMemoryExecutionQueue(new JobProcessor() {
      @Override
      public void process(ExecutionJob job) {
        threadNames.add(Thread.currentThread().getName());
        sleep(100);
        done.countDown();
      }

      @Override
      public void processStored(Long runId) {
        throw new UnsupportedOperationException();
      }
    }, 10, 2, Duration.ofMillis(50), Duration.ofMillis(50));

    for (long i = 1; i <= 4; i++) {
      queue.enqueue(job(i));
    }
    queue.start(2);

    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(threadNames).allSatisfy(name -> assertThat(name).matches("in-process-worker-[01]"));
  }

  @Test
  void startWithoutWorkersLeavesJobsQueuedAndShutsDownCleanly() {
    queue = new InMemoryExecutionQueue(new RecordingProcessor(new CountDownLatch(1), new CountDownLatch(1)), 5, 1,
            Duration.ofMillis(50), Duration.ofMillis(50));

    queue.enqueue(job(1));
    queue.start(0);

    assertThat(queue.isRunning()).isTrue();
    assertThat(queue.position()).isEqualTo(1);
    queue.shutdown();
    assertThat(queue.isRunning()).isFalse();
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static final class RecordingProcessor implements JobProcessor {
    private final CountDownLatch started;
    private final CountDownLatch release;

    RecordingProcessor(CountDownLatch started, CountDownLatch release) {
      this.started = started;
      this.release = release;
    }

    @Override
    public void process(ExecutionJob job) {
      started.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }

    @Override
    public void processStored(Long runId) {
      throw new UnsupportedOperationException();
    }
  }
}

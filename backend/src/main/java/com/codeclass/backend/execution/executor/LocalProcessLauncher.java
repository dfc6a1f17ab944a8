package com.codeclass.backend.execution.executor;

import com.codeclass.backend.execution.config.ExecutionProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호스트에서 {@code sh -c}로 커맨드를 실행한다.
 *
 * <p>격리를 제공하지 않으므로 신뢰할 수 있는 환경이나 외부에서 이미 격리된 배포에서만 사용한다.
 */
@Slf4j
public class LocalProcessLauncher implements ProcessLauncher {
  // 프로세스 종료 후 출력 수집을 기다리는 시간
  private static final long DRAIN_GRACE_MILLIS = 2_000L;

  private final int maxOutputBytes;
  private final ExecutorService ioExecutor;

  public LocalProcessLauncher(ExecutionProperties properties) {
    this(properties.getMaxOutputBytes());
  }

  public LocalProcessLauncher(int maxOutputBytes) {
    this.maxOutputBytes = maxOutputBytes;
    AtomicInteger counter = new AtomicInteger();
    this.ioExecutor = Executors.newCachedThreadPool(r -> {
      Thread thread = new Thread(r, "launcher-io-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  @Override
  public PhaseResult launch(String language, String command, Path workDir, String stdin, Duration timeout) {
    long startNanos = System.nanoTime();
    Process process;
    try {
      process = new ProcessBuilder("sh", "-c", command)
              .directory(workDir.toFile())
              .start();
    } catch (IOException e) {
      log.warn("Failed to start command '{}': {}", command, e.getMessage());
      return PhaseResult.failedToStart("Failed to start command: " + e.getMessage(), elapsedSeconds(startNanos));
    }

    BoundedOutputBuffer stdout = new BoundedOutputBuffer(maxOutputBytes);
    BoundedOutputBuffer stderr = new BoundedOutputBuffer(maxOutputBytes);
    Future<?> stdoutPump = ioExecutor.submit(() -> pump(process.getInputStream(), stdout));
    Future<?> stderrPump = ioExecutor.submit(() -> pump(process.getErrorStream(), stderr));
    ioExecutor.submit(() -> feedStdin(process, stdin));

    boolean timedOut = false;
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        timedOut = true;
        destroyTree(process);
        process.waitFor(DRAIN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException e) {
      destroyTree(process);
      Thread.currentThread().interrupt();
      return new PhaseResult(stdout.asString(), "Execution interrupted", PhaseResult.NO_EXIT_CODE,
              elapsedSeconds(startNanos), false);
    }
    double elapsed = elapsedSeconds(startNanos);

    // 백그라운드 자식이 파이프를 잡고 있으면 여기서 끊는다
    awaitPump(stdoutPump, process.getInputStream());
    awaitPump(stderrPump, process.getErrorStream());

    if (timedOut) {
      return new PhaseResult(stdout.asString(), stderr.asString(), PhaseResult.NO_EXIT_CODE, elapsed, true);
    }
    return new PhaseResult(stdout.asString(), stderr.asString(), process.exitValue(), elapsed, false);
  }

  private void pump(InputStream in, BoundedOutputBuffer target) {
    try (in) {
      target.drain(in);
    } catch (IOException e) {
      // 강제 종료로 스트림이 닫히면 여기로 온다
      log.debug("Output stream closed: {}", e.getMessage());
    }
  }

  private void feedStdin(Process process, String stdin) {
    try (OutputStream out = process.getOutputStream()) {
      if (stdin != null && !stdin.isEmpty()) {
        out.write(stdin.getBytes(StandardCharsets.UTF_8));
        out.flush();
      }
    } catch (IOException e) {
      // 입력을 다 읽기 전에 종료한 프로그램
      log.debug("Could not write stdin: {}", e.getMessage());
    }
  }

  private void awaitPump(Future<?> pump, InputStream stream) {
    try {
      pump.get(DRAIN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      closeQuietly(stream);
      pump.cancel(true);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      log.debug("Output pump failed: {}", e.getMessage());
    }
  }

  private void destroyTree(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  private void closeQuietly(InputStream stream) {
    try {
      stream.close();
    } catch (IOException e) {
      log.debug("Failed to close stream: {}", e.getMessage());
    }
  }

  private static double elapsedSeconds(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000_000.0;
  }

  public void close() {
    ioExecutor.shutdownNow();
  }
}

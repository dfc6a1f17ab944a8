package com.codeclass.backend.execution.executor;

import com.codeclass.backend.execution.config.ExecutionProperties;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.WaitContainerResultCallback;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 단계마다 일회용 Docker 컨테이너를 띄워 커맨드를 실행한다.
 *
 * <p>작업 디렉토리만 {@code /workspace}로 마운트하고 네트워크는 끊는다. 메모리, CPU, 프로세스 수는
 * {@code execution.docker.*} 값으로 제한된다.
 */
@Slf4j
public class DockerProcessLauncher implements ProcessLauncher {
  private static final String WORKSPACE = "/workspace";

  private final DockerClient docker;
  private final ExecutionProperties.Docker limits;
  private final int maxOutputBytes;
  private final AtomicInteger waitThreadCounter = new AtomicInteger();
  private final ExecutorService waitExecutor = Executors.newCachedThreadPool(r -> {
    Thread thread = new Thread(r, "docker-wait-" + waitThreadCounter.incrementAndGet());
    thread.setDaemon(true);
    return thread;
  });

  public DockerProcessLauncher(DockerClient docker, ExecutionProperties properties) {
    this.docker = docker;
    this.limits = properties.getDocker();
    this.maxOutputBytes = properties.getMaxOutputBytes();
  }

  @Override
  public PhaseResult launch(String language, String command, Path workDir, String stdin, Duration timeout) {
    long startNanos = System.nanoTime();
    String image = resolveImage(language);
    if (image == null) {
      return PhaseResult.failedToStart("No container image configured for language: " + language, 0);
    }

    BoundedOutputBuffer stdout = new BoundedOutputBuffer(maxOutputBytes);
    BoundedOutputBuffer stderr = new BoundedOutputBuffer(maxOutputBytes);
    String containerId = null;
    ResultCallback.Adapter<Frame> logCallback = null;
    try {
      // 컨테이너 자원/보안 제한 설정
      HostConfig hostConfig = HostConfig.newHostConfig()
              .withBinds(new Bind(workDir.toAbsolutePath().toString(), new Volume(WORKSPACE)))
              .withReadonlyRootfs(limits.isReadOnlyRootfs())
              .withTmpFs(Map.of("/tmp", "rw,size=64m"))
              .withNetworkMode("none")
              .withMemory(limits.getMemoryBytes())
              .withCpuPeriod(limits.getCpuPeriod())
              .withCpuQuota(limits.getCpuQuota())
              .withPidsLimit(limits.getPidsLimit());

      containerId = docker.createContainerCmd(image)
              .withHostConfig(hostConfig)
              .withWorkingDir(WORKSPACE)
              .withCmd("sh", "-c", command)
              .withAttachStdin(true)
              .withAttachStdout(true)
              .withAttachStderr(true)
              .withStdinOpen(true)
              .withStdInOnce(true)
              .exec()
              .getId();

      // stdout/stderr 수집
      logCallback = new ResultCallback.Adapter<>() {
        @Override
        public void onNext(Frame frame) {
          byte[] payload = frame.getPayload();
          if (frame.getStreamType() == StreamType.STDERR) {
            stderr.write(payload, 0, payload.length);
          } else {
            stdout.write(payload, 0, payload.length);
          }
        }
      };

      byte[] input = stdin == null ? new byte[0] : stdin.getBytes(StandardCharsets.UTF_8);
      docker.attachContainerCmd(containerId)
              .withStdOut(true)
              .withStdErr(true)
              .withFollowStream(true)
              .withStdIn(new ByteArrayInputStream(input))
              .exec(logCallback);
      logCallback.awaitStarted();

      docker.startContainerCmd(containerId).exec();

      String id = containerId;
      CompletableFuture<Integer> waitFuture = CompletableFuture.supplyAsync(
              () -> docker.waitContainerCmd(id)
                      .exec(new WaitContainerResultCallback())
                      .awaitStatusCode(),
              waitExecutor
      );

      try {
        int exitCode = waitFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        double elapsed = elapsedSeconds(startNanos);
        logCallback.awaitCompletion(2, TimeUnit.SECONDS);
        return new PhaseResult(stdout.asString(), stderr.asString(), exitCode, elapsed, false);
      } catch (TimeoutException e) {
        // 타임아웃 발생 시 강제 종료
        double elapsed = elapsedSeconds(startNanos);
        killQuietly(containerId);
        return new PhaseResult(stdout.asString(), stderr.asString(), PhaseResult.NO_EXIT_CODE, elapsed, true);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return PhaseResult.failedToStart("Execution interrupted", elapsedSeconds(startNanos));
    } catch (ExecutionException | RuntimeException e) {
      log.error("Container execution failed (image={}, command='{}')", image, command, e);
      return PhaseResult.failedToStart("Container execution failed: " + e.getMessage(), elapsedSeconds(startNanos));
    } finally {
      if (logCallback != null) {
        try {
          logCallback.close();
        } catch (IOException e) {
          log.debug("Failed to close attach stream: {}", e.getMessage());
        }
      }
      if (containerId != null) {
        removeQuietly(containerId);
      }
    }
  }

  private String resolveImage(String language) {
    if (language == null) {
      return null;
    }
    return limits.getImages().get(language.toLowerCase(Locale.ROOT));
  }

  private void killQuietly(String containerId) {
    try {
      docker.killContainerCmd(containerId).exec();
    } catch (RuntimeException e) {
      log.debug("Kill of container {} failed: {}", containerId, e.getMessage());
    }
  }

  private void removeQuietly(String containerId) {
    try {
      docker.removeContainerCmd(containerId).withForce(true).exec();
    } catch (RuntimeException e) {
      log.warn("Failed to remove container {}: {}", containerId, e.getMessage());
    }
  }

  private static double elapsedSeconds(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000_000.0;
  }

  public void close() {
    waitExecutor.shutdownNow();
  }
}

package com.codeclass.backend.execution.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 실행 서브시스템 설정값 ({@code execution.*}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "execution")
public class ExecutionProperties {
  // 동시에 실행될 수 있는 작업 수
  private int maxConcurrent = 4;
  // 같은 attempt의 연속 실행 최소 간격
  private Duration throttle = Duration.ofSeconds(2);
  private Duration runTimeout = Duration.ofSeconds(30);
  private Duration buildTimeout = Duration.ofSeconds(120);
  // 이 크기(바이트) 이하일 때만 전체 소스를 보관한다
  private long snapshotSizeThreshold = 256 * 1024;
  // stdout/stderr 각각의 최대 보관 크기
  private int maxOutputBytes = 1024 * 1024;
  // 임시 작업 디렉토리의 상위 경로. 비어 있으면 시스템 임시 디렉토리
  private String scratchDir;
  private Launcher launcher = Launcher.LOCAL;

  private final Queue queue = new Queue();
  private final Docker docker = new Docker();
  private final Redis redis = new Redis();
  private final Reconcile reconcile = new Reconcile();

  public enum Launcher {
    LOCAL,
    DOCKER
  }

  public enum Backend {
    IN_PROCESS,
    REDIS
  }

  @Getter
  @Setter
  public static class Queue {
    private Backend backend = Backend.IN_PROCESS;
    private int capacity = 200;
    private int workers = 2;
    private Duration enqueueTimeout = Duration.ofSeconds(1);
    // 워커가 종료 플래그를 확인하는 주기
    private Duration pollTimeout = Duration.ofSeconds(1);
  }

  @Getter
  @Setter
  public static class Docker {
    private String host = "unix:///var/run/docker.sock";
    private long memoryBytes = 256L * 1024 * 1024;
    private long cpuPeriod = 100_000L;
    private long cpuQuota = 100_000L;
    private long pidsLimit = 64L;
    private boolean readOnlyRootfs = true;
    // 언어 -> 이미지
    private Map<String, String> images = new HashMap<>(Map.of(
            "python", "python:3.12-slim",
            "java", "eclipse-temurin:17-jdk",
            "c", "gcc:13",
            "cpp", "gcc:13",
            "c++", "gcc:13",
            "javascript", "node:20-slim",
            "js", "node:20-slim"
    ));
  }

  @Getter
  @Setter
  public static class Redis {
    private String key = "execution:jobs";
    // false면 이 프로세스는 작업을 넣기만 하고 소비하지 않는다
    private boolean workerEnabled = true;
  }

  @Getter
  @Setter
  public static class Reconcile {
    private Duration interval = Duration.ofSeconds(60);
    private Duration queuedGrace = Duration.ofMinutes(10);
    // 비어 있으면 build + run 타임아웃 + 60초
    private Duration runningGrace;
  }

  public Duration effectiveRunningGrace() {
    if (reconcile.getRunningGrace() != null) {
      return reconcile.getRunningGrace();
    }
    return buildTimeout.plus(runTimeout).plusSeconds(60);
  }

  /**
   * queued Run을 버려진 것으로 볼 때까지의 유예 시간.
   *
   * <p>로컬 큐는 가득 찼을 때 마지막 작업이 시작되기까지 걸릴 수 있는 시간보다 짧게 잡지 않는다.
   */
  public Duration effectiveQueuedGrace() {
    Duration configured = reconcile.getQueuedGrace();
    if (queue.getBackend() != Backend.IN_PROCESS) {
      return configured;
    }
    int slots = Math.max(1, maxConcurrent);
    long batches = (queue.getCapacity() + slots - 1) / slots;
    Duration drain = buildTimeout.plus(runTimeout).multipliedBy(batches);
    return drain.compareTo(configured) > 0 ? drain : configured;
  }
}

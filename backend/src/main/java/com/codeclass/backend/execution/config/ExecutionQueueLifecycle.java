package com.codeclass.backend.execution.config;

import com.codeclass.backend.execution.queue.ExecutionQueue;
import org.springframework.context.SmartLifecycle;

/**
 * 컨텍스트가 올라오면 워커를 시작하고, 내려갈 때 실행 중인 작업을 마친 뒤 멈춘다.
 */
public class ExecutionQueueLifecycle implements SmartLifecycle {
  private final ExecutionQueue queue;
  private final ExecutionProperties properties;

  public ExecutionQueueLifecycle(ExecutionQueue queue, ExecutionProperties properties) {
    this.queue = queue;
    this.properties = properties;
  }

  @Override
  public void start() {
    queue.start(workerCount());
  }

  @Override
  public void stop() {
    queue.shutdown();
  }

  @Override
  public boolean isRunning() {
    return queue.isRunning();
  }

  // 분산 모드에서 워커를 끈 노드는 작업을 넣기만 한다
  private int workerCount() {
    if (properties.getQueue().getBackend() == ExecutionProperties.Backend.REDIS
            && !properties.getRedis().isWorkerEnabled()) {
      return 0;
    }
    return properties.getQueue().getWorkers();
  }
}

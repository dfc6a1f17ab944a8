package com.codeclass.backend.execution.queue;

import com.codeclass.backend.execution.model.ExecutionJob;

/**
 * 실행 대기열과 워커 풀.
 *
 * <p>구현체는 구성 시점에 하나만 선택된다 ({@code execution.queue.backend}).
 */
public interface ExecutionQueue {

  /**
   * 작업을 넣는다. 가득 차 있거나 사용할 수 없으면 오래 막히지 않고 거절한다.
   */
  EnqueueResult enqueue(ExecutionJob job);

  /**
   * 대기 중인 작업 수. 알 수 없으면 null.
   */
  Integer position();

  void start(int workerCount);

  /**
   * 새 작업 꺼내기를 멈추고 실행 중인 작업이 끝날 때까지 기다린다.
   */
  void shutdown();

  boolean isRunning();
}

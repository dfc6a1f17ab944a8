package com.codeclass.backend.execution.queue;

import com.codeclass.backend.execution.model.ExecutionJob;

/**
 * 큐 워커가 꺼낸 작업을 실제로 처리하는 쪽. 두 백엔드가 같은 구현을 공유한다.
 */
public interface JobProcessor {

  /** 요청 전체를 함께 받은 작업을 처리한다. */
  void process(ExecutionJob job);

  /** Run 식별자만 받은 경우. 요청은 저장소에서 다시 읽는다. */
  void processStored(Long runId);
}

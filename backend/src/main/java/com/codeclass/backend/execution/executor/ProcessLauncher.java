package com.codeclass.backend.execution.executor;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 커맨드 하나를 작업 디렉토리에서 실행하는 전략.
 *
 * <p>격리 수준(호스트 프로세스, 컨테이너 등)은 구현체가 결정한다. 구현체는 타임아웃이 지나면 프로세스
 * 트리를 종료하고 그 시점까지의 출력을 돌려줘야 하며, 예외를 던지지 않고 실패도 {@link PhaseResult}로
 * 표현한다.
 */
public interface ProcessLauncher {

  /**
   * @param language 요청 언어 (실행 환경 선택용)
   * @param command  셸 커맨드
   * @param workDir  소스가 기록된 작업 디렉토리
   * @param stdin    표준 입력, 없으면 null
   * @param timeout  벽시계 기준 제한 시간
   */
  PhaseResult launch(String language, String command, Path workDir, String stdin, Duration timeout);
}

package com.codeclass.backend.execution.config;

import com.codeclass.backend.execution.executor.LanguageSpecFactory;
import com.codeclass.backend.execution.executor.LocalProcessLauncher;
import com.codeclass.backend.execution.executor.ProcessLauncher;
import com.codeclass.backend.execution.executor.ProjectExecutor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 실행기 구성. {@code execution.launcher}가 없거나 local이면 호스트 프로세스 런처를 쓴다.
 */
@Configuration
public class ExecutorConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "execution", name = "launcher", havingValue = "local", matchIfMissing = true)
  public LocalProcessLauncher localProcessLauncher(ExecutionProperties properties) {
    return new LocalProcessLauncher(properties);
  }

  @Bean
  public ProjectExecutor projectExecutor(ProcessLauncher launcher, LanguageSpecFactory specFactory,
                                         ExecutionProperties properties) {
    return new ProjectExecutor(launcher, specFactory, properties);
  }
}

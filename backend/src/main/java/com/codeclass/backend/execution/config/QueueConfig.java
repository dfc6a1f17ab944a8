package com.codeclass.backend.execution.config;

import com.codeclass.backend.execution.queue.ExecutionQueue;
import com.codeclass.backend.execution.queue.InMemoryExecutionQueue;
import com.codeclass.backend.execution.queue.JobProcessor;
import com.codeclass.backend.execution.queue.RedisExecutionQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 큐 백엔드 선택. 어느 쪽이든 같은 {@link JobProcessor}를 쓴다.
 */
@Slf4j
@Configuration
public class QueueConfig {

  @Bean
  public ExecutionQueue executionQueue(ExecutionProperties properties, JobProcessor processor,
                                       ObjectProvider<StringRedisTemplate> redisTemplate) {
    ExecutionProperties.Queue queue = properties.getQueue();
    if (queue.getBackend() == ExecutionProperties.Backend.REDIS) {
      log.info("Using Redis execution queue (key={})", properties.getRedis().getKey());
      return new RedisExecutionQueue(processor, redisTemplate.getObject(), properties.getRedis().getKey(),
              queue.getCapacity(), properties.getMaxConcurrent(), queue.getPollTimeout());
    }
    log.info("Using in-process execution queue (capacity={})", queue.getCapacity());
    return new InMemoryExecutionQueue(processor, queue.getCapacity(), properties.getMaxConcurrent(),
            queue.getEnqueueTimeout(), queue.getPollTimeout());
  }

  @Bean
  public ExecutionQueueLifecycle executionQueueLifecycle(ExecutionQueue executionQueue, ExecutionProperties properties) {
    return new ExecutionQueueLifecycle(executionQueue, properties);
  }
}

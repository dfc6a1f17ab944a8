package com.codeclass.backend.execution.config;

import com.codeclass.backend.execution.executor.DockerProcessLauncher;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Docker Engine API 클라이언트 구성. {@code execution.launcher=docker}일 때만 활성화된다.
 */
@Configuration
@ConditionalOnProperty(prefix = "execution", name = "launcher", havingValue = "docker")
public class DockerConfig {
  @Bean
  public DockerClient dockerClient(ExecutionProperties properties) {
    DefaultDockerClientConfig config = DefaultDockerClientConfig.createDefaultConfigBuilder()
            .withDockerHost(properties.getDocker().getHost())
            .build();

    // Docker는 HTTP로 통신
    ApacheDockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
            .dockerHost(config.getDockerHost())
            .sslConfig(config.getSSLConfig())
            .build();

    return DockerClientImpl.getInstance(config, httpClient);
  }

  @Bean(destroyMethod = "close")
  public DockerProcessLauncher processLauncher(DockerClient dockerClient, ExecutionProperties properties) {
    return new DockerProcessLauncher(dockerClient, properties);
  }
}

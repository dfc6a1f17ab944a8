package com.codeclass.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 코드 실행 백엔드 진입점.
 */
@EnableScheduling
@ConfigurationPropertiesScan
@SpringBootApplication
public class CodeclassApplication {
  public static void main(String[] args) {
    SpringApplication.run(CodeclassApplication.class, args);
  }
}

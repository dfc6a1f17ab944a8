package com.codeclass.backend.execution.executor;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * 언어별 기본 스펙 제공.
 */
@Component
public class LanguageSpecFactory {
  public Optional<ExecutionSpec> findSpec(String language) {
    if (language == null) {
      return Optional.empty();
    }

    switch (language.toLowerCase(Locale.ROOT)) {
      case "python":
        // 의존성 파일이 있을 때만 설치
        return Optional.of(new ExecutionSpec("pip install -r requirements.txt", "python3 main.py", "requirements.txt"));

      case "java":
        // Java는 컴파일 후 실행
        return Optional.of(new ExecutionSpec("javac *.java", "java Main", null));

      case "c":
        return Optional.of(new ExecutionSpec("gcc *.c -o app", "./app", null));

      case "cpp":
      case "c++":
        return Optional.of(new ExecutionSpec("g++ *.cpp -o app", "./app", null));

      case "js":
      case "javascript":
        // JavaScript는 즉시 실행
        return Optional.of(new ExecutionSpec(null, "node main.js", null));

      default:
        return Optional.empty();
    }
  }
}

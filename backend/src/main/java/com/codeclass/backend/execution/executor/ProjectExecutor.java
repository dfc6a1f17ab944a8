package com.codeclass.backend.execution.executor;

import com.codeclass.backend.execution.config.ExecutionProperties;
import com.codeclass.backend.execution.model.SourceFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 멀티 파일 프로젝트를 빌드 후 실행한다.
 *
 * <p>상태를 갖지 않으며 동시성 제어도 하지 않는다. 매 호출마다 새 임시 디렉토리를 만들고 어떤 경로로
 * 끝나든 지운다.
 */
@Slf4j
public class ProjectExecutor {
  private final ProcessLauncher launcher;
  private final LanguageSpecFactory specFactory;
  private final Duration buildTimeout;
  private final Duration runTimeout;
  private final Path scratchRoot;

  public ProjectExecutor(ProcessLauncher launcher, LanguageSpecFactory specFactory, ExecutionProperties properties) {
    this(launcher, specFactory, properties.getBuildTimeout(), properties.getRunTimeout(),
            properties.getScratchDir() == null || properties.getScratchDir().isBlank()
                    ? null : Paths.get(properties.getScratchDir()));
  }

  public ProjectExecutor(ProcessLauncher launcher, LanguageSpecFactory specFactory,
                         Duration buildTimeout, Duration runTimeout, Path scratchRoot) {
    this.launcher = launcher;
    this.specFactory = specFactory;
    this.buildTimeout = buildTimeout;
    this.runTimeout = runTimeout;
    // 파일 경로 검사는 정규화된 절대 경로끼리 비교한다
    this.scratchRoot = scratchRoot == null ? null : scratchRoot.toAbsolutePath().normalize();
  }

  public ExecutionOutcome run(String language, List<SourceFile> files, String stdin,
                              String buildCommand, String runCommand) throws IOException {
    Path workDir = createWorkDir();
    try {
      String invalid = writeFiles(workDir, files);
      if (invalid != null) {
        return ExecutionOutcome.error("Invalid file name: " + invalid, null);
      }

      // 요청 값이 우선, 없으면 언어 기본값
      Optional<ExecutionSpec> spec = specFactory.findSpec(language);
      String buildCmd = firstNonBlank(buildCommand, spec.map(ExecutionSpec::getBuildCommand).orElse(null));
      String runCmd = firstNonBlank(runCommand, spec.map(ExecutionSpec::getRunCommand).orElse(null));

      PhaseResult buildResult = null;
      if (buildCmd != null && shouldBuild(workDir, buildCommand, spec)) {
        buildResult = launcher.launch(language, buildCmd, workDir, null, buildTimeout);
        log.debug("Build phase finished: {}", buildResult);
        if (!buildResult.isSuccessful()) {
          return ExecutionOutcome.compilationError(buildResult);
        }
      }

      if (runCmd == null) {
        return ExecutionOutcome.error("No run command specified for " + language, buildResult);
      }

      PhaseResult runResult = launcher.launch(language, runCmd, workDir, stdin == null ? "" : stdin, runTimeout);
      log.debug("Run phase finished: {}", runResult);
      return ExecutionOutcome.of(runResult, buildResult);
    } finally {
      deleteDir(workDir);
    }
  }

  // 기본 빌드는 전제 파일(예: requirements.txt)이 없으면 건너뛴다. 명시적 빌드 커맨드는 항상 실행한다.
  private boolean shouldBuild(Path workDir, String requestedBuild, Optional<ExecutionSpec> spec) {
    if (requestedBuild != null && !requestedBuild.isBlank()) {
      return true;
    }
    String required = spec.map(ExecutionSpec::getBuildRequiredFile).orElse(null);
    return required == null || Files.exists(workDir.resolve(required));
  }

  private Path createWorkDir() throws IOException {
    Path dir;
    if (scratchRoot == null) {
      dir = Files.createTempDirectory("run-");
    } else {
      Files.createDirectories(scratchRoot);
      dir = Files.createTempDirectory(scratchRoot, "run-");
    }
    return dir.toAbsolutePath().normalize();
  }

  // 잘못된 파일 이름이 있으면 그 이름을 돌려준다
  private String writeFiles(Path workDir, List<SourceFile> files) throws IOException {
    if (files == null) {
      return null;
    }
    for (SourceFile file : files) {
      String name = file.getName();
      if (name == null || name.isBlank()) {
        return String.valueOf(name);
      }
      Path target = workDir.resolve(name).normalize();
      if (Paths.get(name).isAbsolute() || !target.startsWith(workDir) || target.equals(workDir)) {
        return name;
      }
      Files.createDirectories(target.getParent());
      Files.writeString(target, file.getContent() == null ? "" : file.getContent(), StandardCharsets.UTF_8);
    }
    return null;
  }

  private void deleteDir(Path path) {
    try (Stream<Path> walk = Files.walk(path)) {
      walk.sorted(Comparator.reverseOrder()).forEach(p -> {
        try {
          Files.delete(p);
        } catch (IOException e) {
          log.warn("Failed to delete {}: {}", p, e.getMessage());
        }
      });
    } catch (IOException e) {
      log.warn("Failed to clean up work dir {}: {}", path, e.getMessage());
    }
  }

  private static String firstNonBlank(String preferred, String fallback) {
    if (preferred != null && !preferred.isBlank()) {
      return preferred;
    }
    return fallback;
  }
}

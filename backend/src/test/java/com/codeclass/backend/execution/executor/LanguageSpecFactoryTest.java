package com.codeclass.backend.execution.executor;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageSpecFactoryTest {
  private final LanguageSpecFactory factory = new LanguageSpecFactory();

  @Test
  void pythonInstallsRequirementsOnlyWhenPresent() {
    ExecutionSpec spec = factory.findSpec("python").orElseThrow();

    assertThat(spec.getBuildCommand()).isEqualTo("pip install -r requirements.txt");
    assertThat(spec.getBuildRequiredFile()).isEqualTo("requirements.txt");
    assertThat(spec.getRunCommand()).isEqualTo("python3 main.py");
  }

  @Test
  void compiledLanguagesAlwaysBuild() {
    assertThat(factory.findSpec("java").orElseThrow().getBuildCommand()).isEqualTo("javac *.java");
    assertThat(factory.findSpec("c").orElseThrow().getRunCommand()).isEqualTo("./app");
    assertThat(factory.findSpec("C++").orElseThrow().getBuildCommand()).isEqualTo("g++ *.cpp -o app");
    assertThat(factory.findSpec("cpp").orElseThrow().getBuildRequiredFile()).isNull();
  }

  @Test
  void javascriptHasNoBuild() {
    ExecutionSpec spec = factory.findSpec("js").orElseThrow();

    assertThat(spec.getBuildCommand()).isNull();
    assertThat(spec.getRunCommand()).isEqualTo("node main.js");
  }

  @Test
  void unknownLanguageHasNoDefaults() {
    assertThat(factory.findSpec("cobol")).isEmpty();
    assertThat(factory.findSpec(null)).isEqualTo(Optional.empty());
  }
}

package com.consullo.snip.app;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for launcher configuration handling.
 *
 * @since 1.0
 */
public class SnipLauncherTest {

  @Test
  @DisplayName("Malformed configuration is a startup failure")
  void loadConfig_MalformedJson_StartupException(@TempDir final Path dir) throws Exception {
    final Path file = dir.resolve("snipsnip.json");
    Files.writeString(file, "{ not json");

    assertThatThrownBy(() -> SnipLauncher.loadConfig(file)).isInstanceOf(StartupException.class);
  }

  @Test
  @DisplayName("Out-of-range configuration is a startup failure")
  void loadConfig_InvalidValue_StartupException(@TempDir final Path dir) throws Exception {
    final Path file = dir.resolve("snipsnip.json");
    Files.writeString(file, "{\"thresholds\": {\"rectangleMinPx\": -1}}");

    assertThatThrownBy(() -> SnipLauncher.loadConfig(file)).isInstanceOf(StartupException.class);
  }

  @Test
  @DisplayName("Blank font family is a startup failure")
  void loadConfig_BlankFontFamily_StartupException(@TempDir final Path dir) throws Exception {
    final Path file = dir.resolve("snipsnip.json");
    Files.writeString(file, "{\"defaultFontFamily\": \"  \"}");

    assertThatThrownBy(() -> SnipLauncher.loadConfig(file))
        .isInstanceOf(StartupException.class)
        .hasCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Missing configuration falls back to defaults")
  void loadConfig_Missing_Defaults(@TempDir final Path dir) throws Exception {
    assertThat(SnipLauncher.loadConfig(dir.resolve("none.json")).magnifier().zoom()).isEqualTo(8);
  }
}

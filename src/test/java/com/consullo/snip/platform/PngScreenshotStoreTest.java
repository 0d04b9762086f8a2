package com.consullo.snip.platform;

import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.window.WindowInfo;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for PNG persistence and file naming.
 *
 * @since 1.0
 */
public class PngScreenshotStoreTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T07:08:09Z"), ZoneOffset.UTC);

  @Test
  @DisplayName("Region capture is named by timestamp only")
  void fileName_NoWindow_TimestampOnly() {
    assertThat(PngScreenshotStore.fileName(LocalDateTime.of(2024, 3, 5, 7, 8, 9), null))
        .isEqualTo("2024-03-05_07-08-09.png");
  }

  @Test
  @DisplayName("Window capture appends the process name")
  void fileName_Window_AppendsProcess() {
    final WindowInfo w = new WindowInfo("w", new DoubleRectangle(0, 0, 1, 1), "firefox", 1);

    assertThat(PngScreenshotStore.fileName(LocalDateTime.of(2024, 3, 5, 7, 8, 9), w))
        .isEqualTo("2024-03-05_07-08-09_firefox.png");
  }

  @Test
  @DisplayName("Save creates the folder and writes a readable PNG")
  void save_MissingFolder_CreatesAndWrites(@TempDir final Path dir) throws Exception {
    final Path folder = dir.resolve("shots/nested");
    final PngScreenshotStore store = new PngScreenshotStore(folder, CLOCK);

    final Path saved = store.save(new BufferedImage(12, 7, BufferedImage.TYPE_INT_ARGB), null);

    assertThat(saved).isEqualTo(folder.resolve("2024-03-05_07-08-09.png"));
    assertThat(Files.exists(saved)).isTrue();
    final BufferedImage read = ImageIO.read(saved.toFile());
    assertThat(read.getWidth()).isEqualTo(12);
    assertThat(read.getHeight()).isEqualTo(7);
  }
}

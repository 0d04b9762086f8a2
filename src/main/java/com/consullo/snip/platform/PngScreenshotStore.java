package com.consullo.snip.platform;

import com.consullo.snip.window.WindowInfo;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import javax.imageio.ImageIO;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes captures as timestamped PNG files, suffixed with the process name when a window was clicked.
 *
 * @since 1.0
 */
public final class PngScreenshotStore implements ScreenshotStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(PngScreenshotStore.class);

  static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

  private final Path folder;
  private final Clock clock;

  public PngScreenshotStore(final Path folder) {
    this(folder, Clock.systemDefaultZone());
  }

  /**
   * Creates a store.
   *
   * @param folder target folder, created on first save
   * @param clock clock for the file name timestamp
   */
  public PngScreenshotStore(final Path folder, final Clock clock) {
    Validate.notNull(folder, "folder must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.folder = folder;
    this.clock = clock;
  }

  @Override
  public Path save(final BufferedImage image, final WindowInfo selectedWindow) throws IOException {
    Validate.notNull(image, "image must not be null");
    Files.createDirectories(folder);

    final Path target = folder.resolve(fileName(LocalDateTime.now(clock), selectedWindow));
    if (!ImageIO.write(image, "png", target.toFile())) {
      throw new IOException("No PNG writer available");
    }
    LOGGER.info("Screenshot saved to {}", target.toAbsolutePath());
    return target;
  }

  static String fileName(final LocalDateTime time, final WindowInfo selectedWindow) {
    final String timestamp = TIMESTAMP.format(time);
    if (selectedWindow != null && StringUtils.isNotEmpty(selectedWindow.processName())) {
      return timestamp + "_" + selectedWindow.processName() + ".png";
    }
    return timestamp + ".png";
  }
}

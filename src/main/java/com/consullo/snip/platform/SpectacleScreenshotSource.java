package com.consullo.snip.platform;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import javax.imageio.ImageIO;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Captures the whole desktop with Spectacle, streaming the PNG through standard output.
 *
 * @since 1.0
 */
public final class SpectacleScreenshotSource implements ScreenshotSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpectacleScreenshotSource.class);

  static final List<String> COMMAND =
      List.of("spectacle", "--fullscreen", "--background", "--nonotify", "--output", "/proc/self/fd/1");

  private final CommandRunner runner;

  public SpectacleScreenshotSource(final CommandRunner runner) {
    Validate.notNull(runner, "runner must not be null");
    this.runner = runner;
  }

  @Override
  public BufferedImage captureDesktop() throws CaptureFailedException {
    final CommandResult result;
    try {
      result = runner.run(COMMAND);
    } catch (final IOException e) {
      throw new CaptureFailedException("Could not run spectacle", e);
    }
    if (!result.isSuccess()) {
      throw new CaptureFailedException("Spectacle failed with exit code " + result.exitCode());
    }

    final BufferedImage image;
    try {
      image = ImageIO.read(new ByteArrayInputStream(result.stdout()));
    } catch (final IOException e) {
      throw new CaptureFailedException("Could not decode spectacle output", e);
    }
    if (image == null) {
      throw new CaptureFailedException("Spectacle output is not a readable image (" + result.stdout().length
          + " bytes)");
    }
    LOGGER.info("Captured desktop {}x{}", image.getWidth(), image.getHeight());
    return image;
  }
}

package com.consullo.snip.app;

import com.consullo.snip.config.SnipConfig;
import com.consullo.snip.config.SnipConfigLoader;
import com.consullo.snip.overlay.OverlaySession;
import com.consullo.snip.platform.CommandRunner;
import com.consullo.snip.platform.PngScreenshotStore;
import com.consullo.snip.platform.ProcessCommandRunner;
import com.consullo.snip.platform.WlCopyClipboard;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.nio.file.Path;
import javax.swing.JOptionPane;
import javax.swing.SwingUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: load configuration, gather the desktop state, open the overlay.
 *
 * <p>Exit status 0 once the overlay has been shown (completed or cancelled), 1 when it cannot be opened.
 *
 * @since 1.0
 */
public final class SnipLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(SnipLauncher.class);

  private SnipLauncher() {
  }

  public static void main(final String[] args) {
    final CommandRunner runner = new ProcessCommandRunner();

    final SnipConfig config;
    final PreparedCapture capture;
    try {
      config = loadConfig(SnipConfigLoader.resolveConfigFile());
      capture = SnipSessionFactory.forKde(runner).prepare();
    } catch (final StartupException e) {
      fail(e);
      return;
    }

    final OverlaySession session = SnipSessionFactory.newSession(capture, config);
    final CaptureOutput output = new CaptureOutput(
        new PngScreenshotStore(config.screenshotsFolder()),
        new WlCopyClipboard(runner));

    SwingUtilities.invokeLater(() -> new CropOverlayFrame(session, runner, output, SnipLauncher::exit).open());
  }

  static SnipConfig loadConfig(final Path file) throws StartupException {
    try {
      return new SnipConfigLoader().load(file);
    } catch (final IOException | IllegalArgumentException e) {
      throw new StartupException("Invalid configuration " + file + ": " + e.getMessage(), e);
    }
  }

  private static void fail(final StartupException e) {
    LOGGER.error("Startup failed: {}", e.getMessage(), e);
    if (!GraphicsEnvironment.isHeadless()) {
      JOptionPane.showMessageDialog(null, e.getMessage(), "Error", JOptionPane.ERROR_MESSAGE);
    }
    exit(CaptureOutput.EXIT_FAILURE);
  }

  private static void exit(final int status) {
    LOGGER.debug("Exiting with status {}", status);
    System.exit(status);
  }
}

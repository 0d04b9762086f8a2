package com.consullo.snip.app;

import com.consullo.snip.config.SnipConfig;
import com.consullo.snip.overlay.OverlaySession;
import com.consullo.snip.platform.CaptureFailedException;
import com.consullo.snip.platform.CommandRunner;
import com.consullo.snip.platform.DisplayQuery;
import com.consullo.snip.platform.KScreenDoctorDisplayQuery;
import com.consullo.snip.platform.KWinScriptWindowEnumerator;
import com.consullo.snip.platform.MonitorCropper;
import com.consullo.snip.platform.MonitorInfo;
import com.consullo.snip.platform.ScreenshotSource;
import com.consullo.snip.platform.SpectacleScreenshotSource;
import com.consullo.snip.platform.WindowEnumerator;
import com.consullo.snip.window.WindowInfo;
import com.consullo.snip.window.WindowRegistry;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gathers the desktop state an overlay session starts from.
 *
 * <p>Order matters: the window list is read before the screenshot so that the capture tool's own windows never
 * show up as targets.
 *
 * @since 1.0
 */
public final class SnipSessionFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(SnipSessionFactory.class);

  private final DisplayQuery displayQuery;
  private final WindowEnumerator windowEnumerator;
  private final ScreenshotSource screenshotSource;

  public SnipSessionFactory(final DisplayQuery displayQuery, final WindowEnumerator windowEnumerator,
      final ScreenshotSource screenshotSource) {
    Validate.notNull(displayQuery, "displayQuery must not be null");
    Validate.notNull(windowEnumerator, "windowEnumerator must not be null");
    Validate.notNull(screenshotSource, "screenshotSource must not be null");
    this.displayQuery = displayQuery;
    this.windowEnumerator = windowEnumerator;
    this.screenshotSource = screenshotSource;
  }

  /**
   * Factory wired to the KDE Plasma / Wayland command-line tools.
   *
   * @param runner command runner
   * @return factory
   */
  public static SnipSessionFactory forKde(final CommandRunner runner) {
    return new SnipSessionFactory(
        new KScreenDoctorDisplayQuery(runner),
        new KWinScriptWindowEnumerator(runner),
        new SpectacleScreenshotSource(runner));
  }

  /**
   * Queries the active monitor, lists windows, captures the desktop and crops it to the monitor.
   *
   * @return gathered state
   * @throws StartupException if there is no active monitor or the capture fails
   */
  public PreparedCapture prepare() throws StartupException {
    final MonitorInfo monitor;
    try {
      final Optional<MonitorInfo> active = displayQuery.activeMonitor();
      if (active.isEmpty()) {
        throw new StartupException("Could not detect monitor geometry");
      }
      monitor = active.get();
    } catch (final IOException e) {
      throw new StartupException("Could not query the active monitor", e);
    }

    final List<WindowInfo> windows = queryWindows();

    try {
      final BufferedImage desktop = screenshotSource.captureDesktop();
      final BufferedImage screenshot = MonitorCropper.crop(desktop, monitor.physicalBounds());
      return new PreparedCapture(monitor, screenshot, windows);
    } catch (final CaptureFailedException e) {
      throw new StartupException("Screen capture failed: " + e.getMessage(), e);
    }
  }

  /**
   * Creates the overlay session for a prepared capture.
   *
   * @param capture prepared desktop state
   * @param config tool configuration
   * @return a fresh, active session
   */
  public static OverlaySession newSession(final PreparedCapture capture, final SnipConfig config) {
    Validate.notNull(capture, "capture must not be null");
    final WindowRegistry registry = new WindowRegistry(capture.windows(), capture.monitor().geometry());
    return new OverlaySession(capture.screenshot(), capture.monitor().geometry(), registry, config);
  }

  private List<WindowInfo> queryWindows() {
    try {
      final List<WindowInfo> windows = windowEnumerator.visibleWindows();
      LOGGER.info("Found {} visible windows", windows.size());
      return windows;
    } catch (final IOException | RuntimeException e) {
      LOGGER.warn("Window query failed, continuing without window snapping: {}", e.getMessage(), e);
      return Collections.emptyList();
    }
  }
}

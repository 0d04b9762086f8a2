package com.consullo.snip.platform;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts one monitor out of a full-desktop screenshot.
 *
 * @since 1.0
 */
public final class MonitorCropper {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonitorCropper.class);

  private MonitorCropper() {
  }

  /**
   * Returns the monitor's physical region of the desktop image, clamped to the image.
   *
   * @param desktop full virtual-desktop screenshot
   * @param physicalBounds monitor bounds in physical pixels
   * @return monitor bitmap (a sub-image sharing the desktop raster)
   * @throws CaptureFailedException if the bounds do not intersect the image
   */
  public static BufferedImage crop(final BufferedImage desktop, final Rectangle physicalBounds)
      throws CaptureFailedException {
    Validate.notNull(desktop, "desktop must not be null");
    Validate.notNull(physicalBounds, "physicalBounds must not be null");

    LOGGER.debug("Desktop screenshot {}x{}, monitor bounds {}", desktop.getWidth(), desktop.getHeight(),
        physicalBounds);
    final Rectangle clamped = physicalBounds.intersection(new Rectangle(0, 0, desktop.getWidth(), desktop.getHeight()));
    if (clamped.isEmpty()) {
      throw new CaptureFailedException("Monitor bounds " + physicalBounds + " lie outside the "
          + desktop.getWidth() + "x" + desktop.getHeight() + " screenshot");
    }
    return desktop.getSubimage(clamped.x, clamped.y, clamped.width, clamped.height);
  }
}

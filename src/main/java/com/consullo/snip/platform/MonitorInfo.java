package com.consullo.snip.platform;

import com.consullo.snip.geometry.DoubleRectangle;
import java.awt.Rectangle;
import org.apache.commons.lang3.Validate;

/**
 * The monitor the overlay opens on.
 *
 * @param name output name (e.g. {@code DP-1})
 * @param geometry position and size in logical units
 * @param physicalBounds position and size in physical pixels, used to crop the desktop screenshot
 * @param scale output scale factor
 * @since 1.0
 */
public record MonitorInfo(String name, DoubleRectangle geometry, Rectangle physicalBounds, double scale) {

  public MonitorInfo {
    Validate.notNull(name, "name must not be null");
    Validate.notNull(geometry, "geometry must not be null");
    Validate.notNull(physicalBounds, "physicalBounds must not be null");
    Validate.isTrue(scale > 0, "scale must be positive");
    physicalBounds = new Rectangle(physicalBounds);
  }

  @Override
  public Rectangle physicalBounds() {
    return new Rectangle(physicalBounds);
  }
}

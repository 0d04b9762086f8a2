package com.consullo.snip.geometry;

import java.awt.Point;

/**
 * A point in PANEL space: pixels of the rendered overlay surface.
 *
 * <p>Mouse events, the virtual keyboard cursor and every committed drawing operation live in this space. To
 * hit-test against window geometry use {@link ScaleFactors#toMonitorSpace(PanelPoint)}; to sample the screenshot
 * use {@link ScaleFactors#toSourceSpace(PanelPoint)}.
 *
 * @param x x coordinate
 * @param y y coordinate
 * @since 1.0
 */
public record PanelPoint(double x, double y) {

  public static PanelPoint of(final Point point) {
    return new PanelPoint(point.x, point.y);
  }

  public PanelPoint translate(final double dx, final double dy) {
    return new PanelPoint(x + dx, y + dy);
  }

  public Point toAwtPoint() {
    return new Point((int) x, (int) y);
  }
}

package com.consullo.snip.geometry;

import java.awt.Rectangle;

/**
 * Double-precision rectangle in one of the three coordinate spaces (source, monitor, panel).
 *
 * <p>The rectangle does not carry its space; callers keep track of it through the conversion methods on
 * {@link ScaleFactors}.
 *
 * @param x left edge
 * @param y top edge
 * @param width width (non-negative for normalized rectangles)
 * @param height height (non-negative for normalized rectangles)
 * @since 1.0
 */
public record DoubleRectangle(double x, double y, double width, double height) {

  public static final DoubleRectangle ZERO = new DoubleRectangle(0.0, 0.0, 0.0, 0.0);

  /**
   * Returns true when the point lies inside the rectangle. Both edges are inclusive.
   *
   * @param px x coordinate
   * @param py y coordinate
   * @return true if contained
   */
  public boolean contains(final double px, final double py) {
    return px >= x && px <= x + width && py >= y && py <= y + height;
  }

  public double maxX() {
    return x + width;
  }

  public double maxY() {
    return y + height;
  }

  public boolean hasArea() {
    return width > 0 && height > 0;
  }

  /**
   * Returns true if the two rectangles share a region of positive area. Touching edges do not count.
   *
   * @param other other rectangle
   * @return true on positive-area overlap
   */
  public boolean overlaps(final DoubleRectangle other) {
    final double overlapWidth = Math.min(maxX(), other.maxX()) - Math.max(x, other.x);
    final double overlapHeight = Math.min(maxY(), other.maxY()) - Math.max(y, other.y);
    return overlapWidth > 0 && overlapHeight > 0;
  }

  public DoubleRectangle translate(final double dx, final double dy) {
    return new DoubleRectangle(x + dx, y + dy, width, height);
  }

  /**
   * Converts to integer pixels. Both corners are truncated once, so the right/bottom edge of adjacent
   * rectangles stays consistent.
   *
   * @return integer rectangle
   */
  public Rectangle toPixelRectangle() {
    final int left = (int) x;
    final int top = (int) y;
    final int right = (int) (x + width);
    final int bottom = (int) (y + height);
    return new Rectangle(left, top, right - left, bottom - top);
  }
}

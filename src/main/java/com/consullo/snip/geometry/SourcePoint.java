package com.consullo.snip.geometry;

/**
 * A point in SOURCE space: pixels of the captured screenshot.
 *
 * @param x x coordinate
 * @param y y coordinate
 * @since 1.0
 */
public record SourcePoint(double x, double y) {

  public int pixelX() {
    return (int) x;
  }

  public int pixelY() {
    return (int) y;
  }
}

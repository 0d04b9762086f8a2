package com.consullo.snip.geometry;

/**
 * Stateless rectangle helpers shared by the state machine and the renderer.
 *
 * @since 1.0
 */
public final class Geometry {

  private Geometry() {
  }

  /**
   * Builds the normalized rectangle spanned by two panel points, in any order.
   *
   * @param start first corner (may be null)
   * @param end second corner (may be null)
   * @return normalized rectangle, or {@link DoubleRectangle#ZERO} if either corner is missing
   */
  public static DoubleRectangle selectionRectangle(final PanelPoint start, final PanelPoint end) {
    if (start == null || end == null) {
      return DoubleRectangle.ZERO;
    }
    final double x = Math.min(start.x(), end.x());
    final double y = Math.min(start.y(), end.y());
    final double width = Math.abs(end.x() - start.x());
    final double height = Math.abs(end.y() - start.y());
    return new DoubleRectangle(x, y, width, height);
  }

  public static int clamp(final int value, final int min, final int max) {
    return Math.max(min, Math.min(max, value));
  }

  public static double clamp(final double value, final double min, final double max) {
    return Math.max(min, Math.min(max, value));
  }
}

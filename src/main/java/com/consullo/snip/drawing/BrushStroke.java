package com.consullo.snip.drawing;

import com.consullo.snip.geometry.PanelPoint;
import java.awt.Color;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Freehand stroke. Rendered only when it has at least two points.
 *
 * @param points ordered panel-space points
 * @param color stroke color
 * @param strokeWidth stroke width in panel pixels
 * @since 1.0
 */
public record BrushStroke(List<PanelPoint> points, Color color, float strokeWidth) implements DrawingOperation {

  public BrushStroke {
    Validate.notNull(points, "points must not be null");
    Validate.notNull(color, "color must not be null");
    points = List.copyOf(points);
  }

  public boolean isRenderable() {
    return points.size() >= 2;
  }

  @Override
  public <R> R accept(final DrawingOperationVisitor<R> visitor) {
    return visitor.visitStroke(this);
  }
}

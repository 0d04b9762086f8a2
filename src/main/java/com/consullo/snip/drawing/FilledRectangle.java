package com.consullo.snip.drawing;

import com.consullo.snip.geometry.DoubleRectangle;
import java.awt.Color;
import org.apache.commons.lang3.Validate;

/**
 * Opaque filled rectangle (redaction box).
 *
 * @param rect panel-space rectangle
 * @param color fill color
 * @since 1.0
 */
public record FilledRectangle(DoubleRectangle rect, Color color) implements DrawingOperation {

  public FilledRectangle {
    Validate.notNull(rect, "rect must not be null");
    Validate.notNull(color, "color must not be null");
  }

  @Override
  public <R> R accept(final DrawingOperationVisitor<R> visitor) {
    return visitor.visitRectangle(this);
  }
}

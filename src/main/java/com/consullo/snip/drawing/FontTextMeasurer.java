package com.consullo.snip.drawing;

import com.consullo.snip.geometry.DoubleRectangle;
import java.awt.Font;
import java.awt.font.FontRenderContext;
import java.awt.font.LineMetrics;

/**
 * {@link TextMeasurer} backed by AWT font metrics, using the same antialiased render context as the overlay.
 *
 * @since 1.0
 */
public final class FontTextMeasurer implements TextMeasurer {

  private final FontRenderContext renderContext = new FontRenderContext(null, true, true);

  @Override
  public DoubleRectangle bounds(final TextAnnotation annotation) {
    final Font font = annotation.font(annotation.fontSize());
    final double width = font.getStringBounds(annotation.text(), renderContext).getWidth();
    final LineMetrics metrics = font.getLineMetrics(annotation.text(), renderContext);
    final double ascent = metrics.getAscent();
    final double height = ascent + metrics.getDescent() + metrics.getLeading();
    return new DoubleRectangle(annotation.position().x(), annotation.position().y() - ascent, width, height);
  }
}

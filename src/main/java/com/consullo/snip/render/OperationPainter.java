package com.consullo.snip.render;

import com.consullo.snip.drawing.BrushStroke;
import com.consullo.snip.drawing.DrawingOperation;
import com.consullo.snip.drawing.DrawingOperationVisitor;
import com.consullo.snip.drawing.FilledRectangle;
import com.consullo.snip.drawing.TextAnnotation;
import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.geometry.PanelPoint;
import com.consullo.snip.geometry.ScaleFactors;
import java.awt.BasicStroke;
import java.awt.Graphics2D;
import java.awt.geom.GeneralPath;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Paints drawing operations onto a graphics context, scaling panel-space coordinates by the source factors.
 *
 * <p>The overlay uses {@link ScaleFactors#IDENTITY} (panel pixels); the composite passes the frame's factors so the
 * same operations land on the full-resolution screenshot.
 *
 * @since 1.0
 */
public final class OperationPainter implements DrawingOperationVisitor<Void> {

  private final Graphics2D g2d;
  private final ScaleFactors scale;

  public OperationPainter(final Graphics2D g2d, final ScaleFactors scale) {
    Validate.notNull(g2d, "g2d must not be null");
    Validate.notNull(scale, "scale must not be null");
    this.g2d = g2d;
    this.scale = scale;
  }

  public void paintAll(final List<DrawingOperation> operations) {
    for (DrawingOperation op : operations) {
      op.accept(this);
    }
  }

  @Override
  public Void visitStroke(final BrushStroke stroke) {
    if (!stroke.isRenderable()) {
      return null;
    }
    g2d.setColor(stroke.color());
    g2d.setStroke(new BasicStroke((float) scale.toSourceLength(stroke.strokeWidth()), BasicStroke.CAP_ROUND,
        BasicStroke.JOIN_ROUND));
    final List<PanelPoint> points = stroke.points();
    final GeneralPath path = new GeneralPath();
    path.moveTo((float) (points.get(0).x() * scale.sourceX()), (float) (points.get(0).y() * scale.sourceY()));
    for (int i = 1; i < points.size(); i++) {
      path.lineTo((float) (points.get(i).x() * scale.sourceX()), (float) (points.get(i).y() * scale.sourceY()));
    }
    g2d.draw(path);
    return null;
  }

  @Override
  public Void visitRectangle(final FilledRectangle rectangle) {
    final DoubleRectangle r = rectangle.rect();
    g2d.setColor(rectangle.color());
    g2d.fillRect(
        (int) (r.x() * scale.sourceX()),
        (int) (r.y() * scale.sourceY()),
        (int) (r.width() * scale.sourceX()),
        (int) (r.height() * scale.sourceY()));
    return null;
  }

  @Override
  public Void visitText(final TextAnnotation text) {
    g2d.setColor(text.color());
    g2d.setFont(text.font((int) scale.toSourceLength(text.fontSize())));
    g2d.drawString(
        text.text(),
        (int) (text.position().x() * scale.sourceX()),
        (int) (text.position().y() * scale.sourceY()));
    return null;
  }
}

package com.consullo.snip.composite;

import com.consullo.snip.drawing.DrawingOperation;
import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.geometry.Geometry;
import com.consullo.snip.geometry.ScaleFactors;
import com.consullo.snip.render.OperationPainter;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens the screenshot and the committed annotations into one full-resolution image and extracts the crop.
 *
 * @since 1.0
 */
public final class CompositeCropper {

  private static final Logger LOGGER = LoggerFactory.getLogger(CompositeCropper.class);

  /**
   * Produces the final image for a panel-space crop rectangle.
   *
   * @param source captured screenshot (source space)
   * @param operations committed operations in paint order (panel space)
   * @param panelRect crop rectangle in panel space
   * @param scale scale factors of the current frame
   * @return independent copy of the cropped composite
   */
  public BufferedImage crop(final BufferedImage source, final List<DrawingOperation> operations,
      final DoubleRectangle panelRect, final ScaleFactors scale) {
    Validate.notNull(source, "source must not be null");
    Validate.notNull(operations, "operations must not be null");
    Validate.notNull(panelRect, "panelRect must not be null");
    Validate.notNull(scale, "scale must not be null");

    final Rectangle region = sourceRegion(panelRect, scale, source.getWidth(), source.getHeight());
    LOGGER.debug("Cropping {} operations to source region {}", operations.size(), region);

    final BufferedImage composite = composite(source, operations, scale);
    final BufferedImage view = composite.getSubimage(region.x, region.y, region.width, region.height);

    // getSubimage shares the raster with the composite
    final BufferedImage copy = new BufferedImage(region.width, region.height, BufferedImage.TYPE_INT_ARGB);
    final Graphics2D g = copy.createGraphics();
    try {
      g.drawImage(view, 0, 0, null);
    } finally {
      g.dispose();
    }
    return copy;
  }

  /**
   * Draws the screenshot and replays every operation scaled from panel to source space.
   *
   * @param source captured screenshot
   * @param operations committed operations in paint order
   * @param scale scale factors of the current frame
   * @return full-resolution composite
   */
  public BufferedImage composite(final BufferedImage source, final List<DrawingOperation> operations,
      final ScaleFactors scale) {
    final BufferedImage composite =
        new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
    final Graphics2D g2d = composite.createGraphics();
    try {
      g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      g2d.drawImage(source, 0, 0, null);
      new OperationPainter(g2d, scale).paintAll(operations);
    } finally {
      g2d.dispose();
    }
    return composite;
  }

  /**
   * Converts a panel-space rectangle to a source pixel region that lies inside the image and is at least 1x1.
   *
   * @param panelRect rectangle in panel space
   * @param scale scale factors of the current frame
   * @param sourceWidth image width
   * @param sourceHeight image height
   * @return clamped source region
   */
  public static Rectangle sourceRegion(final DoubleRectangle panelRect, final ScaleFactors scale,
      final int sourceWidth, final int sourceHeight) {
    final int x = Geometry.clamp((int) (panelRect.x() * scale.sourceX()), 0, sourceWidth - 1);
    final int y = Geometry.clamp((int) (panelRect.y() * scale.sourceY()), 0, sourceHeight - 1);
    final int w = Geometry.clamp((int) (panelRect.width() * scale.sourceX()), 1, sourceWidth - x);
    final int h = Geometry.clamp((int) (panelRect.height() * scale.sourceY()), 1, sourceHeight - y);
    return new Rectangle(x, y, w, h);
  }
}

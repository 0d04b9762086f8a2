package com.consullo.snip.render;

import com.consullo.snip.config.MagnifierConfig;
import com.consullo.snip.geometry.Geometry;
import com.consullo.snip.geometry.PanelPoint;
import com.consullo.snip.geometry.ScaleFactors;
import com.consullo.snip.geometry.SourcePoint;

/**
 * Placement and sampling of the magnifier loupe for one frame. Pure function of its inputs.
 *
 * @param x loupe left edge (panel space)
 * @param y loupe top edge (panel space)
 * @param size loupe diameter
 * @param pixelSize display pixels per source pixel (the zoom factor)
 * @param srcLeft first sampled source column
 * @param srcTop first sampled source row
 * @param srcRight sampled source columns end (exclusive)
 * @param srcBottom sampled source rows end (exclusive)
 * @param firstGridX x of the first vertical grid line
 * @param firstGridY y of the first horizontal grid line
 * @since 1.0
 */
public record MagnifierGeometry(
    int x,
    int y,
    int size,
    int pixelSize,
    int srcLeft,
    int srcTop,
    int srcRight,
    int srcBottom,
    int firstGridX,
    int firstGridY) {

  /**
   * Computes the loupe for a cursor position. The loupe sits below-right of the cursor, flips to the other side
   * when it would leave the panel, and is finally clamped inside the panel.
   *
   * @param cursor keyboard cursor in panel space
   * @param panelWidth panel width
   * @param panelHeight panel height
   * @param scale scale factors of the current frame
   * @param sourceWidth screenshot width
   * @param sourceHeight screenshot height
   * @param config magnifier settings
   * @return loupe geometry
   */
  public static MagnifierGeometry compute(
      final PanelPoint cursor,
      final int panelWidth,
      final int panelHeight,
      final ScaleFactors scale,
      final int sourceWidth,
      final int sourceHeight,
      final MagnifierConfig config) {
    final int size = config.size();
    final int offset = config.offset();
    final int cx = (int) cursor.x();
    final int cy = (int) cursor.y();

    int magX = cx + offset;
    int magY = cy + offset;
    if (magX + size > panelWidth) {
      magX = cx - offset - size;
    }
    if (magY + size > panelHeight) {
      magY = cy - offset - size;
    }
    magX = Geometry.clamp(magX, 0, panelWidth - size);
    magY = Geometry.clamp(magY, 0, panelHeight - size);

    final int sourcePixels = config.sourcePixels();
    final SourcePoint center = scale.toSourceSpace(cursor);
    final int srcCenterX = center.pixelX();
    final int srcCenterY = center.pixelY();

    final int srcLeft = Geometry.clamp(srcCenterX - sourcePixels / 2, 0, sourceWidth - 1);
    final int srcTop = Geometry.clamp(srcCenterY - sourcePixels / 2, 0, sourceHeight - 1);
    final int srcRight = Geometry.clamp(srcLeft + sourcePixels, 0, sourceWidth);
    final int srcBottom = Geometry.clamp(srcTop + sourcePixels, 0, sourceHeight);

    final int pixelSize = config.zoom();
    final double gridOffsetX = ((srcCenterX - sourcePixels / 2.0) - srcLeft) * pixelSize;
    final double gridOffsetY = ((srcCenterY - sourcePixels / 2.0) - srcTop) * pixelSize;

    return new MagnifierGeometry(
        magX,
        magY,
        size,
        pixelSize,
        srcLeft,
        srcTop,
        srcRight,
        srcBottom,
        magX + gridPhase(gridOffsetX, pixelSize),
        magY + gridPhase(gridOffsetY, pixelSize));
  }

  /**
   * Distance from the loupe edge to the first grid line, in (0, pixelSize].
   *
   * @param gridOffset offset of the sampled area relative to the ideal centered area, in display pixels
   * @param pixelSize display pixels per source pixel
   * @return phase of the grid
   */
  static int gridPhase(final double gridOffset, final int pixelSize) {
    final double remainder = ((gridOffset % pixelSize) + pixelSize) % pixelSize;
    return (int) (pixelSize - remainder);
  }

  public int centerX() {
    return x + size / 2;
  }

  public int centerY() {
    return y + size / 2;
  }
}

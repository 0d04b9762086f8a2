package com.consullo.snip.render;

import com.consullo.snip.config.MagnifierConfig;
import com.consullo.snip.drawing.BrushStroke;
import com.consullo.snip.drawing.DrawingOperation;
import com.consullo.snip.drawing.DrawingOperations;
import com.consullo.snip.drawing.FilledRectangle;
import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.geometry.PanelPoint;
import com.consullo.snip.geometry.ScaleFactors;
import com.consullo.snip.overlay.OverlaySession;
import com.consullo.snip.overlay.ToolMode;
import com.consullo.snip.overlay.ToolSettings;
import com.consullo.snip.overlay.ToolbarButton;
import com.consullo.snip.overlay.ToolbarLayout;
import com.consullo.snip.window.WindowInfo;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.geom.Ellipse2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Paints one overlay frame from the session state.
 *
 * <p>Layers, in order: screenshot, dim overlay with the selection cut out, committed operations, in-progress
 * operation, hovered window, selection border and size badge, keyboard crosshair and magnifier, instruction banner,
 * toolbar. The pass reads the session only; the single write is recording the toolbar layout it painted, which is
 * the same for unchanged state.
 *
 * @since 1.0
 */
public final class OverlayRenderer {

  static final Color DIM = new Color(0, 0, 0, 100);
  static final Color HOVER_FILL = new Color(100, 150, 255, 80);
  static final Color HOVER_BORDER = new Color(100, 150, 255);
  static final Color LABEL_SHADOW = new Color(0, 0, 0, 100);
  static final Color BADGE_BACKGROUND = new Color(0, 0, 0, 180);
  static final Color CROSSHAIR = new Color(255, 255, 255, 200);
  static final Color GRID = new Color(128, 128, 128, 100);
  static final Color LOUPE_OUTER_BORDER = new Color(0, 0, 0, 150);
  static final Color BANNER_BACKGROUND = new Color(0, 0, 0, 200);
  static final Color TOOLBAR_BACKGROUND = new Color(0, 0, 0, 180);
  static final Color BUTTON = new Color(60, 60, 60);
  static final Color BUTTON_BORDER = new Color(100, 100, 100);
  static final Color BUTTON_ACTIVE = new Color(100, 150, 255);
  static final Color BUTTON_ACTIVE_BORDER = new Color(150, 200, 255);

  private static final Font BADGE_FONT = new Font("SansSerif", Font.BOLD, 14);
  private static final Font BANNER_FONT = new Font("SansSerif", Font.PLAIN, 12);
  private static final Font BUTTON_FONT = new Font("SansSerif", Font.PLAIN, 12);
  private static final Font SIZE_FONT = new Font("SansSerif", Font.BOLD, 12);
  private static final Font FONT_BUTTON_FONT = new Font("SansSerif", Font.PLAIN, 10);

  private static final int FONT_NAME_MAX = 10;

  /**
   * Paints a full frame.
   *
   * @param g2d panel graphics
   * @param session session state
   */
  public void paint(final Graphics2D g2d, final OverlaySession session) {
    g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);

    // Recomputed every frame from the current panel size
    final ScaleFactors scale = session.scaleFactors();
    final int width = session.panelWidth();
    final int height = session.panelHeight();
    final List<DrawingOperation> operations = session.drawing().operations();

    g2d.drawImage(session.screenshot(), 0, 0, width, height, null);

    final Rectangle selection = session.hasCropSelection() ? session.selectionRectangle().toPixelRectangle() : null;
    paintDimmedOverlay(g2d, width, height, selection);

    paintOperations(g2d, operations);
    paintInProgress(g2d, session);
    paintHoveredWindow(g2d, session, scale);

    if (selection != null && selection.width > 0 && selection.height > 0) {
      paintSelection(g2d, operations, selection, scale);
    }

    final PanelPoint cursor = session.cursorPosition();
    if (cursor != null && session.isKeyboardSelecting()) {
      paintCrosshair(g2d, cursor, width, height);
      final MagnifierConfig magnifier = session.config().magnifier();
      if (session.tool() == ToolMode.CROP || magnifier.showInAllTools()) {
        paintMagnifier(g2d, session.screenshot(),
            MagnifierGeometry.compute(cursor, width, height, scale, session.screenshot().getWidth(),
                session.screenshot().getHeight(), magnifier));
      }
    }

    paintBanner(g2d, width,
        InstructionBanner.textFor(session.tool(), session.isKeyboardSelecting(), session.selectionStart() != null));

    final ToolbarLayout layout = ToolbarLayout.compute(width, session.tool());
    paintToolbar(g2d, layout, session.tool(), session.settings());
    session.recordToolbar(layout);
  }

  /**
   * Dims the panel, leaving the selection untouched. The dim area is drawn as up to four bands around the
   * selection so the cut-out is never painted twice.
   *
   * @param g2d graphics
   * @param width panel width
   * @param height panel height
   * @param selection selection in panel pixels, or null
   */
  void paintDimmedOverlay(final Graphics2D g2d, final int width, final int height, final Rectangle selection) {
    g2d.setColor(DIM);
    if (selection != null && selection.width > 0 && selection.height > 0) {
      final int bottom = selection.y + selection.height;
      final int right = selection.x + selection.width;
      g2d.fillRect(0, 0, width, selection.y);
      g2d.fillRect(0, bottom, width, height - bottom);
      g2d.fillRect(0, selection.y, selection.x, selection.height);
      g2d.fillRect(right, selection.y, width - right, selection.height);
    } else {
      g2d.fillRect(0, 0, width, height);
    }
  }

  void paintOperations(final Graphics2D g2d, final List<DrawingOperation> operations) {
    new OperationPainter(g2d, ScaleFactors.IDENTITY).paintAll(operations);
  }

  void paintInProgress(final Graphics2D g2d, final OverlaySession session) {
    final DrawingOperations drawing = session.drawing();
    final ToolSettings settings = session.settings();
    final OperationPainter painter = new OperationPainter(g2d, ScaleFactors.IDENTITY);

    if (drawing.strokePoints().size() >= 2) {
      painter.visitStroke(new BrushStroke(drawing.strokePoints(), settings.color(), settings.brushWidth()));
    }
    if (session.tool() == ToolMode.RECTANGLE && drawing.hasRectangleInProgress()) {
      painter.visitRectangle(new FilledRectangle(drawing.rectangleInProgress(), settings.color()));
    }
  }

  private void paintHoveredWindow(final Graphics2D g2d, final OverlaySession session, final ScaleFactors scale) {
    final WindowInfo hovered = session.hoveredWindow();
    if (hovered == null || session.isDragging() || session.isKeyboardSelecting()
        || session.tool() != ToolMode.CROP) {
      return;
    }
    final DoubleRectangle panelRect = scale.toPanelRect(hovered.geometry());
    final int x = (int) panelRect.x();
    final int y = (int) panelRect.y();
    final int w = (int) panelRect.width();
    final int h = (int) panelRect.height();

    g2d.setColor(HOVER_FILL);
    g2d.fillRect(x, y, w, h);
    g2d.setColor(HOVER_BORDER);
    g2d.setStroke(new BasicStroke(2f));
    g2d.drawRect(x, y, w, h);

    if (session.config().displayProcessInfoWhenHovering()) {
      final String label = hovered.label();
      final int lineHeight = g2d.getFontMetrics().getHeight();
      g2d.setColor(LABEL_SHADOW);
      g2d.drawString(label, x + 5, y + lineHeight + 1);
      g2d.setColor(Color.WHITE);
      g2d.drawString(label, x + 5, y + lineHeight);
    }
  }

  private void paintSelection(final Graphics2D g2d, final List<DrawingOperation> operations,
      final Rectangle selection, final ScaleFactors scale) {
    // Annotations inside the cut-out stay visible above the hover highlight
    final Shape clip = g2d.getClip();
    g2d.setClip(selection.x, selection.y, selection.width, selection.height);
    paintOperations(g2d, operations);
    g2d.setClip(clip);

    g2d.setColor(Color.WHITE);
    g2d.setStroke(new BasicStroke(2f));
    g2d.drawRect(selection.x, selection.y, selection.width, selection.height);

    // Size badge in source pixels
    final String sizeText =
        (int) (selection.width * scale.sourceX()) + " x " + (int) (selection.height * scale.sourceY());
    g2d.setFont(BADGE_FONT);
    final FontMetrics metrics = g2d.getFontMetrics();
    final int textWidth = metrics.stringWidth(sizeText);
    final int textX = selection.x + (selection.width - textWidth) / 2;
    final int textY = selection.y + selection.height + 20;

    g2d.setColor(BADGE_BACKGROUND);
    g2d.fillRoundRect(textX - 5, textY - 15, textWidth + 10, 20, 5, 5);
    g2d.setColor(Color.WHITE);
    g2d.drawString(sizeText, textX, textY);
  }

  private void paintCrosshair(final Graphics2D g2d, final PanelPoint cursor, final int width, final int height) {
    final int x = (int) cursor.x();
    final int y = (int) cursor.y();
    g2d.setColor(CROSSHAIR);
    g2d.setStroke(new BasicStroke(1f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 1f, new float[] {5f}, 0f));
    g2d.drawLine(x, 0, x, height);
    g2d.drawLine(0, y, width, y);
  }

  void paintMagnifier(final Graphics2D g2d, final BufferedImage screenshot, final MagnifierGeometry m) {
    final Shape oldClip = g2d.getClip();
    g2d.setClip(new Ellipse2D.Float(m.x(), m.y(), m.size(), m.size()));

    final Object oldInterpolation = g2d.getRenderingHint(RenderingHints.KEY_INTERPOLATION);
    g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
    g2d.drawImage(screenshot,
        m.x(), m.y(), m.x() + m.size(), m.y() + m.size(),
        m.srcLeft(), m.srcTop(), m.srcRight(), m.srcBottom(),
        null);
    g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION,
        oldInterpolation != null ? oldInterpolation : RenderingHints.VALUE_INTERPOLATION_BILINEAR);

    // Pixel grid
    g2d.setColor(GRID);
    g2d.setStroke(new BasicStroke(1f));
    final int right = m.x() + m.size();
    final int bottom = m.y() + m.size();
    for (int x = m.firstGridX(); x < right; x += m.pixelSize()) {
      g2d.drawLine(x, m.y(), x, bottom);
    }
    for (int y = m.firstGridY(); y < bottom; y += m.pixelSize()) {
      g2d.drawLine(m.x(), y, right, y);
    }

    g2d.setClip(oldClip);

    // Target pixel
    final int cross = m.pixelSize() / 2;
    g2d.setColor(Color.RED);
    g2d.drawLine(m.centerX() - cross, m.centerY(), m.centerX() + cross, m.centerY());
    g2d.drawLine(m.centerX(), m.centerY() - cross, m.centerX(), m.centerY() + cross);

    g2d.setColor(Color.WHITE);
    g2d.setStroke(new BasicStroke(2f));
    g2d.drawOval(m.x(), m.y(), m.size(), m.size());
    g2d.setColor(LOUPE_OUTER_BORDER);
    g2d.setStroke(new BasicStroke(1f));
    g2d.drawOval(m.x() - 1, m.y() - 1, m.size() + 2, m.size() + 2);
  }

  private void paintBanner(final Graphics2D g2d, final int width, final String text) {
    g2d.setFont(BANNER_FONT);
    final int textWidth = g2d.getFontMetrics().stringWidth(text);
    g2d.setColor(BANNER_BACKGROUND);
    g2d.fillRoundRect((width - textWidth) / 2 - 10, 10, textWidth + 20, 25, 10, 10);
    g2d.setColor(Color.WHITE);
    g2d.drawString(text, (width - textWidth) / 2, 27);
  }

  private void paintToolbar(final Graphics2D g2d, final ToolbarLayout layout, final ToolMode tool,
      final ToolSettings settings) {
    final Rectangle bg = layout.background();
    g2d.setColor(TOOLBAR_BACKGROUND);
    g2d.fillRoundRect(bg.x, bg.y, bg.width, bg.height, 10, 10);

    for (Map.Entry<ToolbarButton, Rectangle> e : layout.buttons().entrySet()) {
      final ToolbarButton button = e.getKey();
      final Rectangle r = e.getValue();
      final boolean active = button.isToolSelect() && button.tool() == tool;

      g2d.setColor(active ? BUTTON_ACTIVE : BUTTON);
      g2d.fillRoundRect(r.x, r.y, r.width, r.height, 5, 5);
      g2d.setColor(active ? BUTTON_ACTIVE_BORDER : BUTTON_BORDER);
      g2d.setStroke(new BasicStroke(1f));
      g2d.drawRoundRect(r.x, r.y, r.width, r.height, 5, 5);

      switch (button) {
        case COLOR:
          // Color preview square
          final int side = r.height - 10;
          g2d.setColor(settings.color());
          g2d.fillRect(r.x + 5, r.y + 5, side, side);
          g2d.setColor(Color.WHITE);
          g2d.drawRect(r.x + 5, r.y + 5, side, side);
          break;
        case FONT:
          drawCentered(g2d, fontButtonLabel(settings.fontFamily()), r, FONT_BUTTON_FONT);
          break;
        default:
          drawCentered(g2d, button.label(), r, BUTTON_FONT);
          break;
      }
    }

    layout.sizeValueSlot().ifPresent(slot -> drawCentered(g2d, settings.sizeLabel(tool), slot, SIZE_FONT));
  }

  /**
   * Font names longer than ten characters are cut to nine plus an ellipsis.
   *
   * @param family font family
   * @return button label
   */
  static String fontButtonLabel(final String family) {
    if (family.length() > FONT_NAME_MAX) {
      return StringUtils.left(family, FONT_NAME_MAX - 1) + "...";
    }
    return family;
  }

  private static void drawCentered(final Graphics2D g2d, final String text, final Rectangle r, final Font font) {
    g2d.setColor(Color.WHITE);
    g2d.setFont(font);
    final FontMetrics fm = g2d.getFontMetrics();
    final int x = r.x + (r.width - fm.stringWidth(text)) / 2;
    final int y = r.y + (r.height + fm.getAscent() - fm.getDescent()) / 2;
    g2d.drawString(text, x, y);
  }
}

package com.consullo.snip.overlay;

import com.consullo.snip.geometry.PanelPoint;
import java.awt.Rectangle;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Screen rectangles of the toolbar controls for one frame.
 *
 * <p>The renderer computes the layout while painting and records it on the session; the next pointer-down is
 * hit-tested against the recorded layout.
 *
 * @since 1.0
 */
public final class ToolbarLayout {

  public static final int TOOLBAR_Y = 50;
  public static final int BUTTON_HEIGHT = 28;
  public static final int TOOL_BUTTON_WIDTH = 60;
  public static final int SPACING = 10;
  public static final int SIZE_CONTROL_WIDTH = 80;
  public static final int SIZE_BUTTON_WIDTH = 24;
  public static final int SIZE_VALUE_WIDTH = 28;
  public static final int COLOR_BUTTON_WIDTH = 50;
  public static final int FONT_BUTTON_WIDTH = 80;

  private static final List<ToolbarButton> TOOL_BUTTONS =
      List.of(ToolbarButton.CROP, ToolbarButton.BRUSH, ToolbarButton.TEXT, ToolbarButton.RECTANGLE);

  private static final ToolbarLayout EMPTY =
      new ToolbarLayout(new EnumMap<>(ToolbarButton.class), new Rectangle(), null);

  private final Map<ToolbarButton, Rectangle> buttons;
  private final Rectangle background;
  private final Rectangle sizeValueSlot;

  private ToolbarLayout(final Map<ToolbarButton, Rectangle> buttons, final Rectangle background,
      final Rectangle sizeValueSlot) {
    this.buttons = Collections.unmodifiableMap(buttons);
    this.background = background;
    this.sizeValueSlot = sizeValueSlot;
  }

  /**
   * Layout used before the first frame has been painted: nothing is clickable.
   *
   * @return empty layout
   */
  public static ToolbarLayout empty() {
    return EMPTY;
  }

  /**
   * Lays the toolbar out centered in a panel of the given width.
   *
   * @param panelWidth panel width in pixels
   * @param tool active tool (decides whether size and font controls are present)
   * @return layout
   */
  public static ToolbarLayout compute(final int panelWidth, final ToolMode tool) {
    final int toolsWidth = TOOL_BUTTONS.size() * TOOL_BUTTON_WIDTH + (TOOL_BUTTONS.size() - 1) * SPACING;
    final int totalWidth = toolsWidth + SPACING * 2 + SIZE_CONTROL_WIDTH + SPACING + COLOR_BUTTON_WIDTH + SPACING
        + FONT_BUTTON_WIDTH;
    final int startX = panelWidth / 2 - totalWidth / 2;

    final Map<ToolbarButton, Rectangle> buttons = new EnumMap<>(ToolbarButton.class);
    Rectangle sizeValueSlot = null;

    int x = startX;
    for (ToolbarButton b : TOOL_BUTTONS) {
      buttons.put(b, new Rectangle(x, TOOLBAR_Y, TOOL_BUTTON_WIDTH, BUTTON_HEIGHT));
      x += TOOL_BUTTON_WIDTH + SPACING;
    }

    if (tool.hasSizeControl()) {
      x += SPACING;
      buttons.put(ToolbarButton.SIZE_DOWN, new Rectangle(x, TOOLBAR_Y, SIZE_BUTTON_WIDTH, BUTTON_HEIGHT));
      x += SIZE_BUTTON_WIDTH + 2;
      sizeValueSlot = new Rectangle(x, TOOLBAR_Y, SIZE_VALUE_WIDTH, BUTTON_HEIGHT);
      x += SIZE_VALUE_WIDTH;
      buttons.put(ToolbarButton.SIZE_UP, new Rectangle(x, TOOLBAR_Y, SIZE_BUTTON_WIDTH, BUTTON_HEIGHT));
      x += SIZE_BUTTON_WIDTH + SPACING;
    } else {
      x += SIZE_CONTROL_WIDTH + SPACING;
    }

    x += SPACING;
    buttons.put(ToolbarButton.COLOR, new Rectangle(x, TOOLBAR_Y, COLOR_BUTTON_WIDTH, BUTTON_HEIGHT));
    x += COLOR_BUTTON_WIDTH + SPACING;

    if (tool == ToolMode.TEXT) {
      buttons.put(ToolbarButton.FONT, new Rectangle(x, TOOLBAR_Y, FONT_BUTTON_WIDTH, BUTTON_HEIGHT));
    }

    final Rectangle background = new Rectangle(startX - 10, TOOLBAR_Y - 5, totalWidth + 20, BUTTON_HEIGHT + 10);
    return new ToolbarLayout(buttons, background, sizeValueSlot);
  }

  /**
   * Returns the control under the point, if any.
   *
   * @param point panel-space point
   * @return hit control, or empty
   */
  public Optional<ToolbarButton> hit(final PanelPoint point) {
    for (Map.Entry<ToolbarButton, Rectangle> e : buttons.entrySet()) {
      if (e.getValue().contains(point.x(), point.y())) {
        return Optional.of(e.getKey());
      }
    }
    return Optional.empty();
  }

  public Optional<Rectangle> bounds(final ToolbarButton button) {
    return Optional.ofNullable(buttons.get(button));
  }

  public Map<ToolbarButton, Rectangle> buttons() {
    return buttons;
  }

  public Rectangle background() {
    return background;
  }

  /**
   * Slot between the size buttons that shows the current value.
   *
   * @return slot, or empty when the active tool has no size control
   */
  public Optional<Rectangle> sizeValueSlot() {
    return Optional.ofNullable(sizeValueSlot);
  }
}

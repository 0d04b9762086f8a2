package com.consullo.snip.render;

import com.consullo.snip.overlay.ToolMode;

/**
 * Text of the instruction banner at the top of the overlay.
 *
 * @since 1.0
 */
public final class InstructionBanner {

  static final String KEYBOARD_SELECTING =
      "Arrows to adjust selection (Shift=faster) | Enter to confirm | ESC to cancel";
  static final String KEYBOARD_NAVIGATING =
      "Arrows to move (Shift=faster) | Space to start selection | Enter on window | ESC to cancel";
  static final String CROP = "Click+drag to select | Click on window | Arrow keys for precision | ESC to cancel";
  static final String BRUSH = "Click+drag to draw | ESC to cancel";
  static final String TEXT = "Click to add text | Click text to edit, drag to move | ESC to cancel";
  static final String RECTANGLE = "Click+drag to draw rectangle | ESC to cancel";

  private InstructionBanner() {
  }

  /**
   * Selects the banner text. Keyboard navigation with a selection wins over keyboard navigation alone, which wins
   * over the per-tool message.
   *
   * @param tool active tool
   * @param keyboardSelecting true in keyboard-navigation mode
   * @param selectionStarted true when a selection start point exists
   * @return banner text
   */
  public static String textFor(final ToolMode tool, final boolean keyboardSelecting, final boolean selectionStarted) {
    if (keyboardSelecting && selectionStarted) {
      return KEYBOARD_SELECTING;
    }
    if (keyboardSelecting) {
      return KEYBOARD_NAVIGATING;
    }
    switch (tool) {
      case CROP:
        return CROP;
      case BRUSH:
        return BRUSH;
      case TEXT:
        return TEXT;
      case RECTANGLE:
        return RECTANGLE;
      default:
        throw new IllegalStateException("Unhandled tool: " + tool);
    }
  }
}

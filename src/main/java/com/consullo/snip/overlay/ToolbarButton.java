package com.consullo.snip.overlay;

/**
 * Controls drawn in the toolbar strip.
 *
 * @since 1.0
 */
public enum ToolbarButton {
  CROP("Crop", ToolMode.CROP),
  BRUSH("Brush", ToolMode.BRUSH),
  TEXT("Text", ToolMode.TEXT),
  RECTANGLE("Rect", ToolMode.RECTANGLE),
  SIZE_DOWN("-", null),
  SIZE_UP("+", null),
  COLOR("Color", null),
  FONT("Font", null);

  private final String label;
  private final ToolMode tool;

  ToolbarButton(final String label, final ToolMode tool) {
    this.label = label;
    this.tool = tool;
  }

  public String label() {
    return label;
  }

  /**
   * Tool selected by this button.
   *
   * @return tool, or null for non tool-select buttons
   */
  public ToolMode tool() {
    return tool;
  }

  public boolean isToolSelect() {
    return tool != null;
  }
}

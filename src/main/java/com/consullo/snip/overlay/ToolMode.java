package com.consullo.snip.overlay;

/**
 * Active annotation tool. Exactly one is active at a time.
 *
 * @since 1.0
 */
public enum ToolMode {
  CROP,
  BRUSH,
  TEXT,
  RECTANGLE;

  /**
   * Returns true for the tools that expose a size control (brush width or font size).
   *
   * @return true for brush and text
   */
  public boolean hasSizeControl() {
    return this == BRUSH || this == TEXT;
  }
}

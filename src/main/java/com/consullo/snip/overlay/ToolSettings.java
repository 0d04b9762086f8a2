package com.consullo.snip.overlay;

import java.awt.Color;
import org.apache.commons.lang3.Validate;

/**
 * Current color, brush width, font size and font family. Shared by every tool and kept across tool switches.
 *
 * @since 1.0
 */
public final class ToolSettings {

  public static final float MIN_BRUSH_WIDTH = 1f;
  public static final float MAX_BRUSH_WIDTH = 20f;
  public static final float BRUSH_WIDTH_STEP = 1f;
  public static final int MIN_FONT_SIZE = 12;
  public static final int MAX_FONT_SIZE = 48;
  public static final int FONT_SIZE_STEP = 2;

  public static final Color DEFAULT_COLOR = new Color(255, 0, 0);
  public static final float DEFAULT_BRUSH_WIDTH = 3f;
  public static final int DEFAULT_FONT_SIZE = 18;

  private Color color = DEFAULT_COLOR;
  private float brushWidth = DEFAULT_BRUSH_WIDTH;
  private int fontSize = DEFAULT_FONT_SIZE;
  private String fontFamily;

  public ToolSettings(final String fontFamily) {
    Validate.notBlank(fontFamily, "fontFamily must not be blank");
    this.fontFamily = fontFamily;
  }

  public Color color() {
    return color;
  }

  public void setColor(final Color color) {
    Validate.notNull(color, "color must not be null");
    this.color = color;
  }

  public float brushWidth() {
    return brushWidth;
  }

  public int fontSize() {
    return fontSize;
  }

  public String fontFamily() {
    return fontFamily;
  }

  public void setFontFamily(final String fontFamily) {
    Validate.notBlank(fontFamily, "fontFamily must not be blank");
    this.fontFamily = fontFamily;
  }

  /**
   * Steps the size of the given tool up (positive) or down (negative). Tools without a size are ignored.
   *
   * @param tool active tool
   * @param direction +1 or -1
   */
  public void adjustSize(final ToolMode tool, final int direction) {
    if (tool == ToolMode.BRUSH) {
      brushWidth = Math.max(MIN_BRUSH_WIDTH, Math.min(MAX_BRUSH_WIDTH, brushWidth + direction * BRUSH_WIDTH_STEP));
    } else if (tool == ToolMode.TEXT) {
      fontSize = Math.max(MIN_FONT_SIZE, Math.min(MAX_FONT_SIZE, fontSize + direction * FONT_SIZE_STEP));
    }
  }

  /**
   * Size value shown between the toolbar's - and + buttons.
   *
   * @param tool active tool
   * @return brush width or font size as text, empty for other tools
   */
  public String sizeLabel(final ToolMode tool) {
    if (tool == ToolMode.BRUSH) {
      return Integer.toString((int) brushWidth);
    }
    if (tool == ToolMode.TEXT) {
      return Integer.toString(fontSize);
    }
    return "";
  }
}

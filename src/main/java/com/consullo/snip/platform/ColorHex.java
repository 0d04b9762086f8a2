package com.consullo.snip.platform;

import java.awt.Color;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * {@code #rrggbb} conversion for colors exchanged with external pickers.
 *
 * @since 1.0
 */
public final class ColorHex {

  private ColorHex() {
  }

  /**
   * Formats the RGB part of a color, ignoring alpha.
   *
   * @param color color
   * @return lowercase {@code #rrggbb}
   */
  public static String toHex(final Color color) {
    return String.format("#%02x%02x%02x", color.getRed(), color.getGreen(), color.getBlue());
  }

  /**
   * Parses {@code #rrggbb} (the leading {@code #} is optional, surrounding whitespace ignored).
   *
   * @param text hex text
   * @return opaque color, or empty when the text is not a six digit hex color
   */
  public static Optional<Color> parse(final String text) {
    String hex = StringUtils.trimToEmpty(text);
    if (hex.startsWith("#")) {
      hex = hex.substring(1);
    }
    if (hex.length() != 6) {
      return Optional.empty();
    }
    try {
      return Optional.of(new Color(Integer.parseInt(hex, 16)));
    } catch (final NumberFormatException e) {
      return Optional.empty();
    }
  }
}

package com.consullo.snip.config;

import org.apache.commons.lang3.Validate;

/**
 * Magnifier loupe settings.
 *
 * @param zoom display pixels per source pixel
 * @param offset distance between cursor and loupe, in panel pixels
 * @param size loupe diameter in panel pixels
 * @param showInAllTools if true the loupe follows the keyboard cursor in every tool, otherwise only in Crop mode
 * @since 1.0
 */
public record MagnifierConfig(int zoom, int offset, int size, boolean showInAllTools) {

  public static final MagnifierConfig DEFAULT = new MagnifierConfig(8, 20, 160, false);

  public MagnifierConfig {
    Validate.isTrue(zoom >= 1, "magnifier zoom must be at least 1");
    Validate.isTrue(size >= zoom, "magnifier size must be at least the zoom factor");
    Validate.isTrue(offset >= 0, "magnifier offset must not be negative");
  }

  /**
   * Number of source pixels visible across the loupe.
   *
   * @return source pixels per loupe diameter
   */
  public int sourcePixels() {
    return size / zoom;
  }
}

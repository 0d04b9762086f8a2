package com.consullo.snip.overlay;

import org.apache.commons.lang3.Validate;

/**
 * Drag-versus-click cutoffs, in panel pixels. The three values differ on purpose and are kept separate.
 *
 * @param cropDragMinPx a crop selection wider OR taller than this is a drag-to-crop; otherwise a click (strict)
 * @param rectangleMinPx a rectangle must be wider AND taller than this to be committed (strict)
 * @param textClickMaxPx a text drag moving less than this on both axes is an edit click (strict)
 * @since 1.0
 */
public record InteractionThresholds(int cropDragMinPx, int rectangleMinPx, int textClickMaxPx) {

  public static final InteractionThresholds DEFAULT = new InteractionThresholds(5, 2, 5);

  public InteractionThresholds {
    Validate.isTrue(cropDragMinPx >= 0, "cropDragMinPx must not be negative");
    Validate.isTrue(rectangleMinPx >= 0, "rectangleMinPx must not be negative");
    Validate.isTrue(textClickMaxPx >= 0, "textClickMaxPx must not be negative");
  }
}

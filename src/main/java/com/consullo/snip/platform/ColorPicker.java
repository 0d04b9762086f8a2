package com.consullo.snip.platform;

import java.awt.Color;
import java.util.Optional;

/**
 * Blocking color-selection dialog.
 *
 * @since 1.0
 */
public interface ColorPicker {

  /**
   * Shows the picker.
   *
   * @param currentColor color to preselect
   * @return chosen color, or empty when the user cancelled
   */
  Optional<Color> pick(Color currentColor);
}

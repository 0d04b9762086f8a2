package com.consullo.snip.platform;

import java.util.List;
import java.util.Optional;

/**
 * Blocking font-family selection dialog.
 *
 * @since 1.0
 */
public interface FontPicker {

  /**
   * Shows the picker.
   *
   * @param availableFamilies families to choose from
   * @param currentFamily family to preselect
   * @return chosen family, or empty when the user cancelled
   */
  Optional<String> pick(List<String> availableFamilies, String currentFamily);
}

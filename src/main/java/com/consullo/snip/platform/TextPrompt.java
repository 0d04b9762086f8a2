package com.consullo.snip.platform;

import java.util.Optional;

/**
 * Blocking single-line text input dialog.
 *
 * @since 1.0
 */
public interface TextPrompt {

  /**
   * Shows the prompt.
   *
   * @param title dialog title
   * @param initialValue prefilled text (may be null)
   * @return entered text (possibly blank), or empty when the user cancelled
   */
  Optional<String> prompt(String title, String initialValue);
}

package com.consullo.snip.platform;

import java.awt.Component;
import java.util.List;
import java.util.Optional;
import javax.swing.JOptionPane;
import org.apache.commons.lang3.Validate;

/**
 * Font family chooser shown as a combo-box input dialog.
 *
 * @since 1.0
 */
public final class SwingFontPicker implements FontPicker {

  private final Component parent;

  public SwingFontPicker(final Component parent) {
    this.parent = parent;
  }

  @Override
  public Optional<String> pick(final List<String> availableFamilies, final String currentFamily) {
    Validate.notEmpty(availableFamilies, "availableFamilies must not be empty");
    final Object chosen = JOptionPane.showInputDialog(
        parent,
        "Select a font:",
        "Font",
        JOptionPane.PLAIN_MESSAGE,
        null,
        availableFamilies.toArray(),
        currentFamily);
    return Optional.ofNullable((String) chosen);
  }
}

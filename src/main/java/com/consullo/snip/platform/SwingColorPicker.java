package com.consullo.snip.platform;

import java.awt.Color;
import java.awt.Component;
import java.util.Optional;
import javax.swing.JColorChooser;

/**
 * {@link JColorChooser} based picker.
 *
 * @since 1.0
 */
public final class SwingColorPicker implements ColorPicker {

  static final String TITLE = "Choose Color";

  private final Component parent;

  /**
   * Creates a picker.
   *
   * @param parent dialog owner, or null
   */
  public SwingColorPicker(final Component parent) {
    this.parent = parent;
  }

  @Override
  public Optional<Color> pick(final Color currentColor) {
    return Optional.ofNullable(JColorChooser.showDialog(parent, TITLE, currentColor));
  }
}

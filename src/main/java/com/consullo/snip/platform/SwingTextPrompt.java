package com.consullo.snip.platform;

import java.awt.Component;
import java.util.Optional;
import javax.swing.JOptionPane;

/**
 * Single-line text input through {@link JOptionPane}.
 *
 * @since 1.0
 */
public final class SwingTextPrompt implements TextPrompt {

  private final Component parent;

  public SwingTextPrompt(final Component parent) {
    this.parent = parent;
  }

  @Override
  public Optional<String> prompt(final String title, final String initialValue) {
    final Object entered = JOptionPane.showInputDialog(
        parent,
        "Enter text:",
        title,
        JOptionPane.PLAIN_MESSAGE,
        null,
        null,
        initialValue);
    return Optional.ofNullable((String) entered);
  }
}

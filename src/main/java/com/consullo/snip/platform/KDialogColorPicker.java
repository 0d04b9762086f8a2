package com.consullo.snip.platform;

import java.awt.Color;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native KDE color dialog through {@code kdialog --getcolor}.
 *
 * @since 1.0
 */
public final class KDialogColorPicker implements ColorPicker {

  private static final Logger LOGGER = LoggerFactory.getLogger(KDialogColorPicker.class);

  private final CommandRunner runner;

  public KDialogColorPicker(final CommandRunner runner) {
    Validate.notNull(runner, "runner must not be null");
    this.runner = runner;
  }

  @Override
  public Optional<Color> pick(final Color currentColor) {
    Validate.notNull(currentColor, "currentColor must not be null");
    try {
      final CommandResult result =
          runner.run(List.of("kdialog", "--getcolor", "--default", ColorHex.toHex(currentColor)));
      if (!result.isSuccess()) {
        // Cancel
        return Optional.empty();
      }
      final Optional<Color> color = ColorHex.parse(result.text());
      if (color.isEmpty()) {
        LOGGER.warn("kdialog returned an unreadable color '{}'", result.text());
      }
      return color;
    } catch (final IOException e) {
      LOGGER.warn("kdialog color picker failed: {}", e.getMessage(), e);
      return Optional.empty();
    }
  }
}

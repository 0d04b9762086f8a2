package com.consullo.snip.config;

import com.consullo.snip.overlay.InteractionThresholds;
import java.nio.file.Path;
import org.apache.commons.lang3.Validate;

/**
 * Tool configuration values.
 *
 * @param screenshotsFolder folder that receives saved PNG files
 * @param useKDialogForColorPicking if true the color button runs {@code kdialog --getcolor} instead of the Swing chooser
 * @param defaultFontFamily initial font family of the text tool
 * @param displayProcessInfoWhenHovering if true the hovered window shows a "process (pid)" caption
 * @param magnifier magnifier loupe settings
 * @param thresholds drag-versus-click cutoffs
 * @since 1.0
 */
public record SnipConfig(
    Path screenshotsFolder,
    boolean useKDialogForColorPicking,
    String defaultFontFamily,
    boolean displayProcessInfoWhenHovering,
    MagnifierConfig magnifier,
    InteractionThresholds thresholds) {

  public static final String DEFAULT_FONT_FAMILY = "SansSerif";

  public SnipConfig {
    Validate.notNull(screenshotsFolder, "screenshotsFolder must not be null");
    Validate.notBlank(defaultFontFamily, "defaultFontFamily must not be blank");
    Validate.notNull(magnifier, "magnifier must not be null");
    Validate.notNull(thresholds, "thresholds must not be null");
  }

  public static Path defaultScreenshotsFolder() {
    return Path.of(System.getProperty("user.home"), "Pictures", "SnipSnip");
  }

  public static SnipConfig defaults() {
    return new SnipConfig(
        defaultScreenshotsFolder(),
        false,
        DEFAULT_FONT_FAMILY,
        false,
        MagnifierConfig.DEFAULT,
        InteractionThresholds.DEFAULT);
  }
}

package com.consullo.snip.overlay;

import com.consullo.snip.window.WindowInfo;
import java.awt.image.BufferedImage;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Output of a committed session: the cropped composite and, when a window was clicked, that window.
 *
 * @since 1.0
 */
public final class CropResult {

  private final BufferedImage image;
  private final WindowInfo selectedWindow;

  public CropResult(final BufferedImage image, final WindowInfo selectedWindow) {
    Validate.notNull(image, "image must not be null");
    this.image = image;
    this.selectedWindow = selectedWindow;
  }

  public BufferedImage image() {
    return image;
  }

  public Optional<WindowInfo> selectedWindow() {
    return Optional.ofNullable(selectedWindow);
  }
}

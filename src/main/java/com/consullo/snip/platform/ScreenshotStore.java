package com.consullo.snip.platform;

import com.consullo.snip.window.WindowInfo;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists a finished capture.
 *
 * @since 1.0
 */
public interface ScreenshotStore {

  /**
   * Saves the image.
   *
   * @param image composited capture
   * @param selectedWindow window picked by a click, or null for a dragged region
   * @return path of the written file
   * @throws IOException if the file cannot be written
   */
  Path save(BufferedImage image, WindowInfo selectedWindow) throws IOException;
}

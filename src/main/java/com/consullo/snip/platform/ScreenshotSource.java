package com.consullo.snip.platform;

import java.awt.image.BufferedImage;

/**
 * Produces a bitmap of the whole virtual desktop in physical pixels.
 *
 * @since 1.0
 */
public interface ScreenshotSource {

  BufferedImage captureDesktop() throws CaptureFailedException;
}

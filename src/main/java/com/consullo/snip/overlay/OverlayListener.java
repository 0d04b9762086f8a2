package com.consullo.snip.overlay;

/**
 * Receives the outcome of an overlay session and repaint requests.
 *
 * @since 1.0
 */
public interface OverlayListener {

  /**
   * Called once when the session commits a crop.
   *
   * @param result cropped composite
   */
  void onCropComplete(CropResult result);

  /**
   * Called once when the session ends without output.
   */
  void onCancel();

  /**
   * Called after a state change that should be painted.
   */
  void repaintRequested();
}

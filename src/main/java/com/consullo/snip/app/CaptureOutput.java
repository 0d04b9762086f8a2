package com.consullo.snip.app;

import com.consullo.snip.overlay.CropResult;
import com.consullo.snip.platform.ClipboardSink;
import com.consullo.snip.platform.ScreenshotStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers a finished capture: saves it, then copies the saved PNG to the clipboard.
 *
 * @since 1.0
 */
public final class CaptureOutput {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptureOutput.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;

  private final ScreenshotStore store;
  private final ClipboardSink clipboard;

  public CaptureOutput(final ScreenshotStore store, final ClipboardSink clipboard) {
    Validate.notNull(store, "store must not be null");
    Validate.notNull(clipboard, "clipboard must not be null");
    this.store = store;
    this.clipboard = clipboard;
  }

  /**
   * Saves and copies a capture. Both steps are attempted once; a failed save is logged at ERROR and skips the
   * clipboard, a failed clipboard copy is logged at WARN.
   *
   * @param result committed capture
   * @return the saved file, or empty when saving failed
   */
  public Optional<Path> deliver(final CropResult result) {
    Validate.notNull(result, "result must not be null");
    final Path saved;
    try {
      saved = store.save(result.image(), result.selectedWindow().orElse(null));
    } catch (final IOException e) {
      LOGGER.error("Could not save screenshot: {}", e.getMessage(), e);
      return Optional.empty();
    }

    try {
      clipboard.copyPng(Files.readAllBytes(saved));
    } catch (final IOException e) {
      LOGGER.warn("Could not copy screenshot to the clipboard: {}", e.getMessage(), e);
    }
    return Optional.of(saved);
  }
}

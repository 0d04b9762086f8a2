package com.consullo.snip.platform;

import java.io.IOException;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Wayland clipboard through {@code wl-copy}, fed on standard input.
 *
 * @since 1.0
 */
public final class WlCopyClipboard implements ClipboardSink {

  static final List<String> COMMAND = List.of("wl-copy", "--type", "image/png");

  private final CommandRunner runner;

  public WlCopyClipboard(final CommandRunner runner) {
    Validate.notNull(runner, "runner must not be null");
    this.runner = runner;
  }

  @Override
  public void copyPng(final byte[] png) throws IOException {
    Validate.notNull(png, "png must not be null");
    final int exitCode = runner.feed(COMMAND, png);
    if (exitCode != 0) {
      throw new IOException("wl-copy failed with exit code " + exitCode);
    }
  }
}

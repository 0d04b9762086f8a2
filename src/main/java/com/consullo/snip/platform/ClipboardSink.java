package com.consullo.snip.platform;

import java.io.IOException;

/**
 * Places image bytes on the system clipboard.
 *
 * @since 1.0
 */
public interface ClipboardSink {

  void copyPng(byte[] png) throws IOException;
}

package com.consullo.snip.platform;

import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Tests for the wl-copy clipboard sink.
 *
 * @since 1.0
 */
public class WlCopyClipboardTest {

  @Test
  @DisplayName("PNG bytes are fed to wl-copy")
  void copyPng_Bytes_FedToWlCopy() throws Exception {
    final CommandRunner runner = mock(CommandRunner.class);
    final byte[] png = {1, 2, 3};
    when(runner.feed(WlCopyClipboard.COMMAND, png)).thenReturn(0);

    new WlCopyClipboard(runner).copyPng(png);

    verify(runner).feed(WlCopyClipboard.COMMAND, png);
  }

  @Test
  @DisplayName("Failing wl-copy is reported")
  void copyPng_NonZeroExit_Throws() throws Exception {
    final CommandRunner runner = mock(CommandRunner.class);
    when(runner.feed(WlCopyClipboard.COMMAND, new byte[0])).thenReturn(1);

    assertThatThrownBy(() -> new WlCopyClipboard(runner).copyPng(new byte[0])).isInstanceOf(IOException.class);
  }
}

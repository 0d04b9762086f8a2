package com.consullo.snip.app;

import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.overlay.CropResult;
import com.consullo.snip.platform.ClipboardSink;
import com.consullo.snip.platform.ScreenshotStore;
import com.consullo.snip.window.WindowInfo;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for saving and copying a finished capture.
 *
 * @since 1.0
 */
public class CaptureOutputTest {

  @TempDir
  Path dir;

  private ScreenshotStore store;
  private ClipboardSink clipboard;
  private CaptureOutput output;
  private BufferedImage image;

  @BeforeEach
  void setUp() {
    store = mock(ScreenshotStore.class);
    clipboard = mock(ClipboardSink.class);
    output = new CaptureOutput(store, clipboard);
    image = new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB);
  }

  @Test
  @DisplayName("Saved file bytes are copied to the clipboard")
  void deliver_Saved_CopiesFileBytes() throws Exception {
    final Path saved = dir.resolve("shot.png");
    Files.write(saved, new byte[] {9, 8, 7});
    final WindowInfo w = new WindowInfo("w", new DoubleRectangle(0, 0, 4, 4), "kate", 3);
    when(store.save(image, w)).thenReturn(saved);

    assertThat(output.deliver(new CropResult(image, w))).contains(saved);
    verify(clipboard).copyPng(new byte[] {9, 8, 7});
  }

  @Test
  @DisplayName("Clipboard failure does not fail the capture")
  void deliver_ClipboardFails_StillOk() throws Exception {
    final Path saved = dir.resolve("shot.png");
    Files.write(saved, new byte[] {1});
    when(store.save(any(), any())).thenReturn(saved);
    doThrow(new IOException("no wl-copy")).when(clipboard).copyPng(any());

    assertThat(output.deliver(new CropResult(image, null))).contains(saved);
  }

  @Test
  @DisplayName("Save failure yields no file and skips the clipboard")
  void deliver_SaveFails_Empty() throws Exception {
    when(store.save(any(), any())).thenThrow(new IOException("read-only"));

    assertThat(output.deliver(new CropResult(image, null))).isEmpty();
    verifyNoInteractions(clipboard);
  }
}

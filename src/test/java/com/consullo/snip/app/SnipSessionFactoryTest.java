package com.consullo.snip.app;

import com.consullo.snip.config.SnipConfig;
import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.overlay.OverlaySession;
import com.consullo.snip.platform.CaptureFailedException;
import com.consullo.snip.platform.DisplayQuery;
import com.consullo.snip.platform.MonitorInfo;
import com.consullo.snip.platform.ScreenshotSource;
import com.consullo.snip.platform.WindowEnumerator;
import com.consullo.snip.window.WindowInfo;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Tests for gathering desktop state before the overlay opens.
 *
 * @since 1.0
 */
public class SnipSessionFactoryTest {

  private static final MonitorInfo SECOND = new MonitorInfo("HDMI-A-1", new DoubleRectangle(100, 0, 100, 50),
      new Rectangle(100, 0, 100, 50), 1.0);

  private DisplayQuery display;
  private WindowEnumerator windows;
  private ScreenshotSource screenshots;
  private SnipSessionFactory factory;

  @BeforeEach
  void setUp() throws Exception {
    display = mock(DisplayQuery.class);
    windows = mock(WindowEnumerator.class);
    screenshots = mock(ScreenshotSource.class);
    factory = new SnipSessionFactory(display, windows, screenshots);
    when(screenshots.captureDesktop()).thenReturn(new BufferedImage(200, 50, BufferedImage.TYPE_INT_RGB));
  }

  @Test
  @DisplayName("Screenshot is cropped to the active monitor and windows are listed before capture")
  void prepare_SecondMonitor_CropsAndOrders() throws Exception {
    final WindowInfo w = new WindowInfo("w", new DoubleRectangle(120, 10, 30, 30), "kate", 1);
    when(display.activeMonitor()).thenReturn(Optional.of(SECOND));
    when(windows.visibleWindows()).thenReturn(List.of(w));

    final PreparedCapture capture = factory.prepare();

    assertThat(capture.screenshot().getWidth()).isEqualTo(100);
    assertThat(capture.windows()).containsExactly(w);
    final InOrder order = inOrder(display, windows, screenshots);
    order.verify(display).activeMonitor();
    order.verify(windows).visibleWindows();
    order.verify(screenshots).captureDesktop();
  }

  @Test
  @DisplayName("No active monitor is a startup failure")
  void prepare_NoMonitor_Throws() throws Exception {
    when(display.activeMonitor()).thenReturn(Optional.empty());

    assertThatThrownBy(() -> factory.prepare())
        .isInstanceOf(StartupException.class)
        .hasMessage("Could not detect monitor geometry");
    verifyNoInteractions(screenshots);
  }

  @Test
  @DisplayName("Window query failure degrades to no windows")
  void prepare_WindowQueryFails_EmptyWindows() throws Exception {
    when(display.activeMonitor()).thenReturn(Optional.of(SECOND));
    when(windows.visibleWindows()).thenThrow(new IOException("journal unavailable"));

    assertThat(factory.prepare().windows()).isEmpty();
  }

  @Test
  @DisplayName("Capture failure is a startup failure")
  void prepare_CaptureFails_Throws() throws Exception {
    when(display.activeMonitor()).thenReturn(Optional.of(SECOND));
    when(windows.visibleWindows()).thenReturn(List.of());
    when(screenshots.captureDesktop()).thenThrow(new CaptureFailedException("spectacle missing"));

    assertThatThrownBy(() -> factory.prepare())
        .isInstanceOf(StartupException.class)
        .hasCauseInstanceOf(CaptureFailedException.class);
  }

  @Test
  @DisplayName("New session holds monitor-relative windows")
  void newSession_PreparedCapture_RelativeWindows() throws Exception {
    final WindowInfo w = new WindowInfo("w", new DoubleRectangle(120, 10, 30, 30), "kate", 1);
    final PreparedCapture capture =
        new PreparedCapture(SECOND, new BufferedImage(100, 50, BufferedImage.TYPE_INT_RGB), List.of(w));

    final OverlaySession session = SnipSessionFactory.newSession(capture, SnipConfig.defaults());

    assertThat(session.isActive()).isTrue();
    assertThat(session.windows().windows().get(0).geometry()).isEqualTo(new DoubleRectangle(20, 10, 30, 30));
    assertThat(session.panelWidth()).isEqualTo(100);
  }
}

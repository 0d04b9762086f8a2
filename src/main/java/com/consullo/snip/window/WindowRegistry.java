package com.consullo.snip.window;

import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.geometry.MonitorPoint;
import com.consullo.snip.geometry.PanelPoint;
import com.consullo.snip.geometry.ScaleFactors;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Window rectangles of one overlay session, translated to the active monitor's local origin.
 *
 * <p>The list keeps the window manager's stacking order (index 0 = topmost) and never changes after
 * construction. Windows that do not overlap the monitor with a positive area are dropped.
 *
 * @since 1.0
 */
public final class WindowRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(WindowRegistry.class);

  private final List<WindowInfo> windows;

  /**
   * Builds the registry from the raw enumerator output.
   *
   * @param rawWindows windows in absolute desktop coordinates, topmost first
   * @param monitorGeometry active monitor geometry in absolute logical coordinates
   */
  public WindowRegistry(final List<WindowInfo> rawWindows, final DoubleRectangle monitorGeometry) {
    Validate.notNull(rawWindows, "rawWindows must not be null");
    Validate.notNull(monitorGeometry, "monitorGeometry must not be null");

    final DoubleRectangle monitorBounds = new DoubleRectangle(0, 0, monitorGeometry.width(), monitorGeometry.height());
    final List<WindowInfo> adjusted = new ArrayList<>(rawWindows.size());
    for (WindowInfo info : rawWindows) {
      final DoubleRectangle local = info.geometry().translate(-monitorGeometry.x(), -monitorGeometry.y());
      if (local.overlaps(monitorBounds)) {
        adjusted.add(info.withGeometry(local));
      }
    }
    this.windows = Collections.unmodifiableList(adjusted);

    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Window registry holds {} of {} windows (top -> bottom):", windows.size(), rawWindows.size());
      for (WindowInfo w : windows) {
        LOGGER.debug("- {}", w);
      }
    }
  }

  public static WindowRegistry empty() {
    return new WindowRegistry(List.of(), DoubleRectangle.ZERO);
  }

  /**
   * Returns the topmost window whose monitor-space rectangle contains the point.
   *
   * @param panelPoint point in panel space
   * @param scale scale factors of the current frame
   * @return the hit window, or empty
   */
  public Optional<WindowInfo> findWindowAt(final PanelPoint panelPoint, final ScaleFactors scale) {
    final MonitorPoint p = scale.toMonitorSpace(panelPoint);
    for (WindowInfo w : windows) {
      if (w.geometry().contains(p.x(), p.y())) {
        return Optional.of(w);
      }
    }
    return Optional.empty();
  }

  public List<WindowInfo> windows() {
    return windows;
  }

  public int size() {
    return windows.size();
  }
}

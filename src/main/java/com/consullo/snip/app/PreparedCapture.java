package com.consullo.snip.app;

import com.consullo.snip.platform.MonitorInfo;
import com.consullo.snip.window.WindowInfo;
import java.awt.image.BufferedImage;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Everything gathered from the desktop before the overlay opens.
 *
 * @param monitor active monitor
 * @param screenshot the monitor's bitmap in physical pixels
 * @param windows visible windows, topmost first, absolute desktop coordinates
 * @since 1.0
 */
public record PreparedCapture(MonitorInfo monitor, BufferedImage screenshot, List<WindowInfo> windows) {

  public PreparedCapture {
    Validate.notNull(monitor, "monitor must not be null");
    Validate.notNull(screenshot, "screenshot must not be null");
    Validate.notNull(windows, "windows must not be null");
    windows = List.copyOf(windows);
  }
}

package com.consullo.snip.window;

import com.consullo.snip.geometry.DoubleRectangle;
import org.apache.commons.lang3.Validate;

/**
 * An on-screen window as reported by the window manager.
 *
 * @param id window manager id
 * @param geometry frame geometry in logical units (absolute desktop coordinates when enumerated, monitor-relative
 *     once held by a {@link WindowRegistry})
 * @param processName resource/process name (may be null)
 * @param pid owning process id (may be null)
 * @since 1.0
 */
public record WindowInfo(String id, DoubleRectangle geometry, String processName, Integer pid) {

  public WindowInfo {
    Validate.notNull(id, "id must not be null");
    Validate.notNull(geometry, "geometry must not be null");
  }

  public WindowInfo withGeometry(final DoubleRectangle newGeometry) {
    return new WindowInfo(id, newGeometry, processName, pid);
  }

  /**
   * Label used for hover captions, e.g. {@code firefox (4242)}.
   *
   * @return display label
   */
  public String label() {
    return processName + " (" + pid + ")";
  }
}

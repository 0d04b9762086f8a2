package com.consullo.snip.platform;

import java.io.IOException;
import java.util.Optional;

/**
 * Finds the monitor that currently has focus.
 *
 * @since 1.0
 */
public interface DisplayQuery {

  /**
   * Resolves the active monitor.
   *
   * @return the active monitor, or empty when no enabled output matches
   * @throws IOException if the desktop could not be queried
   */
  Optional<MonitorInfo> activeMonitor() throws IOException;
}

package com.consullo.snip.app;

/**
 * Anything that prevents the overlay from opening: bad configuration, no active monitor, failed capture.
 *
 * @since 1.0
 */
public class StartupException extends Exception {

  private static final long serialVersionUID = 1L;

  public StartupException(final String message) {
    super(message);
  }

  public StartupException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

package com.consullo.snip.platform;

/**
 * The desktop screenshot could not be taken or decoded.
 *
 * @since 1.0
 */
public class CaptureFailedException extends Exception {

  private static final long serialVersionUID = 1L;

  public CaptureFailedException(final String message) {
    super(message);
  }

  public CaptureFailedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

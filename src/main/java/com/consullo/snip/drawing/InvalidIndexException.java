package com.consullo.snip.drawing;

/**
 * Thrown when a replace/remove targets an index outside the committed sequence. The sequence is left unchanged.
 *
 * @since 1.0
 */
public final class InvalidIndexException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final int index;

  public InvalidIndexException(final int index, final int size) {
    super("Invalid drawing operation index " + index + " (size " + size + ")");
    this.index = index;
  }

  public int index() {
    return index;
  }
}

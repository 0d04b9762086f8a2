package com.consullo.snip.drawing;

import com.consullo.snip.geometry.DoubleRectangle;

/**
 * Measures the rendered bounds of a text annotation. Kept behind an interface so hit-testing does not depend on a
 * live graphics context.
 *
 * @since 1.0
 */
public interface TextMeasurer {

  /**
   * Returns the panel-space box covered by the rendered label: from the baseline-left anchor, width of the text and
   * height from ascent to descent.
   *
   * @param annotation annotation to measure
   * @return bounds in panel space
   */
  DoubleRectangle bounds(TextAnnotation annotation);
}

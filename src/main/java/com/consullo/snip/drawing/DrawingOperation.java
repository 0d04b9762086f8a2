package com.consullo.snip.drawing;

/**
 * A committed annotation. The set of variants is closed; every consumer dispatches through
 * {@link DrawingOperationVisitor}, so a new variant cannot be added without handling it in the overlay renderer and
 * in the composite.
 *
 * <p>All coordinates are in panel space at the time of creation.
 *
 * @since 1.0
 */
public sealed interface DrawingOperation permits BrushStroke, FilledRectangle, TextAnnotation {

  <R> R accept(DrawingOperationVisitor<R> visitor);
}

package com.consullo.snip.drawing;

/**
 * Exhaustive dispatch over the {@link DrawingOperation} variants.
 *
 * @param <R> result type
 * @since 1.0
 */
public interface DrawingOperationVisitor<R> {

  R visitStroke(BrushStroke stroke);

  R visitRectangle(FilledRectangle rectangle);

  R visitText(TextAnnotation text);
}

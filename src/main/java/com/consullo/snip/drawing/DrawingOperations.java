package com.consullo.snip.drawing;

import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.geometry.Geometry;
import com.consullo.snip.geometry.PanelPoint;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import org.apache.commons.lang3.Validate;

/**
 * Ordered sequence of committed annotations plus the in-progress buffers of the brush and rectangle tools.
 *
 * <p>Later operations paint over earlier ones. The sequence only grows during drawing; text annotations are the
 * exception and may be replaced or removed by index. The in-progress buffers are never part of the sequence until
 * the state machine finalizes them with {@link #commit(DrawingOperation)}.
 *
 * @since 1.0
 */
public final class DrawingOperations {

  private final List<DrawingOperation> operations = new ArrayList<>();

  // In-progress brush stroke
  private final List<PanelPoint> strokePoints = new ArrayList<>();

  // In-progress rectangle corners
  private PanelPoint rectangleStart;
  private PanelPoint rectangleEnd;

  public void commit(final DrawingOperation operation) {
    Validate.notNull(operation, "operation must not be null");
    operations.add(operation);
  }

  /**
   * Replaces the operation at the index.
   *
   * @param index position in the sequence
   * @param operation replacement
   * @throws InvalidIndexException if the index is outside the sequence
   */
  public void replace(final int index, final DrawingOperation operation) {
    Validate.notNull(operation, "operation must not be null");
    checkIndex(index);
    operations.set(index, operation);
  }

  /**
   * Removes the operation at the index.
   *
   * @param index position in the sequence
   * @throws InvalidIndexException if the index is outside the sequence
   */
  public void remove(final int index) {
    checkIndex(index);
    operations.remove(index);
  }

  public DrawingOperation get(final int index) {
    checkIndex(index);
    return operations.get(index);
  }

  public int size() {
    return operations.size();
  }

  public List<DrawingOperation> operations() {
    return Collections.unmodifiableList(operations);
  }

  /**
   * Finds the most recently committed text annotation whose rendered bounds contain the point.
   *
   * @param point panel-space point
   * @param measurer font metrics source
   * @return index of the hit annotation, or empty
   */
  public OptionalInt hitTestText(final PanelPoint point, final TextMeasurer measurer) {
    for (int i = operations.size() - 1; i >= 0; i--) {
      final DrawingOperation op = operations.get(i);
      if (!(op instanceof TextAnnotation)) {
        continue;
      }
      if (measurer.bounds((TextAnnotation) op).contains(point.x(), point.y())) {
        return OptionalInt.of(i);
      }
    }
    return OptionalInt.empty();
  }

  // ------------------- In-progress buffers -------------------

  public void beginStroke(final PanelPoint point) {
    strokePoints.clear();
    strokePoints.add(point);
  }

  public void extendStroke(final PanelPoint point) {
    strokePoints.add(point);
  }

  public List<PanelPoint> strokePoints() {
    return Collections.unmodifiableList(strokePoints);
  }

  public void beginRectangle(final PanelPoint point) {
    rectangleStart = point;
    rectangleEnd = point;
  }

  public void extendRectangle(final PanelPoint point) {
    if (rectangleStart != null) {
      rectangleEnd = point;
    }
  }

  public boolean hasRectangleInProgress() {
    return rectangleStart != null && rectangleEnd != null;
  }

  /**
   * Normalized in-progress rectangle.
   *
   * @return rectangle, or {@link DoubleRectangle#ZERO} when no rectangle is being drawn
   */
  public DoubleRectangle rectangleInProgress() {
    return Geometry.selectionRectangle(rectangleStart, rectangleEnd);
  }

  public boolean hasInProgress() {
    return !strokePoints.isEmpty() || rectangleStart != null;
  }

  public void clearStroke() {
    strokePoints.clear();
  }

  public void clearRectangle() {
    rectangleStart = null;
    rectangleEnd = null;
  }

  public void clearInProgress() {
    clearStroke();
    clearRectangle();
  }

  private void checkIndex(final int index) {
    if (index < 0 || index >= operations.size()) {
      throw new InvalidIndexException(index, operations.size());
    }
  }
}

package com.consullo.snip.drawing;

import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.geometry.PanelPoint;
import java.awt.Color;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the ordered operation list and the in-progress buffers.
 *
 * @since 1.0
 */
public class DrawingOperationsTest {

  private final TextMeasurer measurer = new StubTextMeasurer();

  private static TextAnnotation text(final String value, final double x, final double y) {
    return new TextAnnotation(value, new PanelPoint(x, y), Color.RED, 18, "SansSerif");
  }

  @Test
  @DisplayName("Commit order is paint order")
  void commit_Sequence_PreservesOrder() {
    final DrawingOperations ops = new DrawingOperations();
    final FilledRectangle first = new FilledRectangle(new DoubleRectangle(0, 0, 5, 5), Color.BLUE);
    final TextAnnotation second = text("a", 1, 1);

    ops.commit(first);
    ops.commit(second);

    assertThat(ops.operations()).containsExactly(first, second);
    assertThat(ops.size()).isEqualTo(2);
  }

  @Test
  @DisplayName("Out-of-range replace, remove and get throw InvalidIndexException")
  void replace_InvalidIndex_Throws() {
    final DrawingOperations ops = new DrawingOperations();
    ops.commit(text("a", 1, 1));

    assertThatThrownBy(() -> ops.replace(1, text("b", 1, 1)))
        .isInstanceOf(InvalidIndexException.class)
        .satisfies(e -> assertThat(((InvalidIndexException) e).index()).isEqualTo(1));
    assertThatThrownBy(() -> ops.remove(-1)).isInstanceOf(InvalidIndexException.class);
    assertThatThrownBy(() -> ops.get(5)).isInstanceOf(InvalidIndexException.class);
    assertThat(ops.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("Exposed list is read-only")
  void operations_Mutation_Rejected() {
    final DrawingOperations ops = new DrawingOperations();

    assertThatThrownBy(() -> ops.operations().add(text("x", 0, 0)))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("Hit test prefers the most recently committed text")
  void hitTestText_Overlap_ReturnsLatest() {
    final DrawingOperations ops = new DrawingOperations();
    ops.commit(text("hello", 100, 100));
    ops.commit(new FilledRectangle(new DoubleRectangle(0, 0, 500, 500), Color.BLACK));
    ops.commit(text("world", 120, 100));

    assertThat(ops.hitTestText(new PanelPoint(130, 95), measurer)).hasValue(2);
    assertThat(ops.hitTestText(new PanelPoint(105, 95), measurer)).hasValue(0);
  }

  @Test
  @DisplayName("Rectangles and strokes are never text hits")
  void hitTestText_NoTextUnderPoint_Empty() {
    final DrawingOperations ops = new DrawingOperations();
    ops.commit(new FilledRectangle(new DoubleRectangle(0, 0, 500, 500), Color.BLACK));
    ops.commit(new BrushStroke(List.of(new PanelPoint(0, 0), new PanelPoint(10, 10)), Color.RED, 3f));

    assertThat(ops.hitTestText(new PanelPoint(5, 5), measurer)).isEmpty();
  }

  @Test
  @DisplayName("Rectangle buffer normalizes its corners")
  void rectangleInProgress_ReverseDrag_Normalized() {
    final DrawingOperations ops = new DrawingOperations();

    ops.beginRectangle(new PanelPoint(50, 60));
    ops.extendRectangle(new PanelPoint(20, 10));

    assertThat(ops.rectangleInProgress()).isEqualTo(new DoubleRectangle(20, 10, 30, 50));
    ops.clearInProgress();
    assertThat(ops.hasInProgress()).isFalse();
  }

  @Test
  @DisplayName("Single-point stroke is not renderable")
  void isRenderable_OnePoint_False() {
    assertThat(new BrushStroke(List.of(new PanelPoint(1, 1)), Color.RED, 3f).isRenderable()).isFalse();
  }
}

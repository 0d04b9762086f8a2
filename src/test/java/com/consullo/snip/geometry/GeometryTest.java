package com.consullo.snip.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for selection normalization and clamping.
 *
 * @since 1.0
 */
public class GeometryTest {

  @Test
  @DisplayName("Selection is the same whichever corner the drag starts from")
  void selectionRectangle_AnyDragDirection_IsSymmetric() {
    final PanelPoint a = new PanelPoint(40, 90);
    final PanelPoint b = new PanelPoint(10, 30);

    final DoubleRectangle forward = Geometry.selectionRectangle(a, b);
    final DoubleRectangle backward = Geometry.selectionRectangle(b, a);

    assertThat(forward).isEqualTo(backward);
    assertThat(forward).isEqualTo(new DoubleRectangle(10, 30, 30, 60));
  }

  @Test
  @DisplayName("Selection never has negative dimensions")
  void selectionRectangle_ReversedCorners_NonNegative() {
    final DoubleRectangle rect = Geometry.selectionRectangle(new PanelPoint(500, 0), new PanelPoint(0, 500));

    assertThat(rect.width()).isNotNegative();
    assertThat(rect.height()).isNotNegative();
    assertThat(rect.x()).isZero();
    assertThat(rect.y()).isZero();
  }

  @Test
  @DisplayName("Missing corner yields the zero rectangle")
  void selectionRectangle_NullCorner_Zero() {
    assertThat(Geometry.selectionRectangle(null, new PanelPoint(3, 3))).isEqualTo(DoubleRectangle.ZERO);
    assertThat(Geometry.selectionRectangle(new PanelPoint(3, 3), null)).isEqualTo(DoubleRectangle.ZERO);
  }

  @Test
  @DisplayName("Clamp pins values to the closed range")
  void clamp_OutOfRange_Pinned() {
    assertThat(Geometry.clamp(-4, 0, 10)).isZero();
    assertThat(Geometry.clamp(14, 0, 10)).isEqualTo(10);
    assertThat(Geometry.clamp(7, 0, 10)).isEqualTo(7);
    assertThat(Geometry.clamp(1.5, 2.0, 3.0)).isEqualTo(2.0);
  }
}

package com.consullo.snip.geometry;

import java.awt.Rectangle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for conversions between panel, monitor and source space.
 *
 * @since 1.0
 */
public class ScaleFactorsTest {

  @Test
  @DisplayName("HiDPI monitor: source is twice the panel, monitor equals the panel")
  void compute_HiDpi_SeparatesSourceAndMonitorFactors() {
    final ScaleFactors scale = ScaleFactors.compute(3840, 2160, 1920, 1080, 1920, 1080);

    assertThat(scale.sourceX()).isEqualTo(2.0);
    assertThat(scale.sourceY()).isEqualTo(2.0);
    assertThat(scale.monitorX()).isEqualTo(1.0);
    assertThat(scale.monitorY()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Panel to monitor and back stays within one unit")
  void toMonitorSpace_RoundTrip_WithinOneUnit() {
    final ScaleFactors scale = ScaleFactors.compute(2880, 1800, 1440, 900, 1437, 897);

    for (int x = 0; x < 1437; x += 97) {
      for (int y = 0; y < 897; y += 61) {
        final PanelPoint p = new PanelPoint(x, y);
        final PanelPoint back = scale.toPanelSpace(scale.toMonitorSpace(p));
        assertThat(back.x()).isCloseTo(p.x(), within(1.0));
        assertThat(back.y()).isCloseTo(p.y(), within(1.0));
      }
    }
  }

  @Test
  @DisplayName("Source rectangle scales every component")
  void toSourceRect_ScaledPanel_ScalesAllComponents() {
    final ScaleFactors scale = ScaleFactors.compute(400, 200, 200, 100, 200, 100);

    assertThat(scale.toSourceRect(new DoubleRectangle(10, 20, 30, 40)))
        .isEqualTo(new DoubleRectangle(20, 40, 60, 80));
    assertThat(scale.toSourceLength(3)).isEqualTo(6.0);
    assertThat(scale.toSourceSpace(new PanelPoint(5.7, 1)).pixelX()).isEqualTo(11);
  }

  @Test
  @DisplayName("Monitor rectangle maps into panel space")
  void toPanelRect_ShrunkPanel_Divides() {
    final ScaleFactors scale = ScaleFactors.compute(200, 200, 200, 200, 100, 100);

    assertThat(scale.toPanelRect(new DoubleRectangle(10, 10, 100, 100)))
        .isEqualTo(new DoubleRectangle(5, 5, 50, 50));
    assertThat(scale.toMonitorRect(new DoubleRectangle(5, 5, 50, 50)))
        .isEqualTo(new DoubleRectangle(10, 10, 100, 100));
  }

  @Test
  @DisplayName("Zero-sized panel is rejected")
  void compute_ZeroPanel_Throws() {
    assertThatThrownBy(() -> ScaleFactors.compute(10, 10, 10, 10, 0, 10))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Pixel rectangle truncates both corners")
  void toPixelRectangle_Fractional_TruncatesCorners() {
    final Rectangle r = new DoubleRectangle(1.6, 2.2, 3.6, 4.9).toPixelRectangle();

    assertThat(r).isEqualTo(new Rectangle(1, 2, 4, 5));
  }
}

package com.consullo.snip.overlay;

import com.consullo.snip.geometry.PanelPoint;
import java.awt.Rectangle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for toolbar placement and hit-testing.
 *
 * @since 1.0
 */
public class ToolbarLayoutTest {

  @Test
  @DisplayName("Toolbar is centered and the tool buttons are evenly spaced")
  void compute_CropMode_CenteredToolButtons() {
    final ToolbarLayout layout = ToolbarLayout.compute(800, ToolMode.CROP);

    assertThat(layout.bounds(ToolbarButton.CROP)).hasValue(new Rectangle(140, 50, 60, 28));
    assertThat(layout.bounds(ToolbarButton.BRUSH)).hasValue(new Rectangle(210, 50, 60, 28));
    assertThat(layout.bounds(ToolbarButton.RECTANGLE)).hasValue(new Rectangle(350, 50, 60, 28));
    assertThat(layout.background()).isEqualTo(new Rectangle(130, 45, 540, 38));
  }

  @Test
  @DisplayName("Crop and Rectangle have no size control; color keeps its slot")
  void compute_NoSizeTool_ColorOnly() {
    final ToolbarLayout layout = ToolbarLayout.compute(800, ToolMode.RECTANGLE);

    assertThat(layout.bounds(ToolbarButton.SIZE_DOWN)).isEmpty();
    assertThat(layout.bounds(ToolbarButton.FONT)).isEmpty();
    assertThat(layout.sizeValueSlot()).isEmpty();
    assertThat(layout.bounds(ToolbarButton.COLOR)).hasValue(new Rectangle(140 + 380, 50, 50, 28));
  }

  @Test
  @DisplayName("Text mode shows size, color and font controls")
  void compute_TextMode_AllControls() {
    final ToolbarLayout layout = ToolbarLayout.compute(800, ToolMode.TEXT);

    assertThat(layout.bounds(ToolbarButton.SIZE_DOWN)).hasValue(new Rectangle(140 + 290, 50, 24, 28));
    assertThat(layout.sizeValueSlot()).hasValue(new Rectangle(140 + 316, 50, 28, 28));
    assertThat(layout.bounds(ToolbarButton.SIZE_UP)).hasValue(new Rectangle(140 + 344, 50, 24, 28));
    assertThat(layout.bounds(ToolbarButton.COLOR)).hasValue(new Rectangle(140 + 388, 50, 50, 28));
    assertThat(layout.bounds(ToolbarButton.FONT)).hasValue(new Rectangle(140 + 448, 50, 80, 28));
  }

  @Test
  @DisplayName("Brush mode has a size control but no font button")
  void compute_BrushMode_NoFont() {
    final ToolbarLayout layout = ToolbarLayout.compute(800, ToolMode.BRUSH);

    assertThat(layout.bounds(ToolbarButton.SIZE_UP)).isPresent();
    assertThat(layout.bounds(ToolbarButton.FONT)).isEmpty();
  }

  @Test
  @DisplayName("Hit test finds the control under the point and nothing in the gaps")
  void hit_Points_ResolvesControls() {
    final ToolbarLayout layout = ToolbarLayout.compute(800, ToolMode.CROP);

    assertThat(layout.hit(new PanelPoint(170, 60))).hasValue(ToolbarButton.CROP);
    assertThat(layout.hit(new PanelPoint(205, 60))).isEmpty();
    assertThat(layout.hit(new PanelPoint(170, 100))).isEmpty();
  }

  @Test
  @DisplayName("Nothing is clickable before the first paint")
  void empty_AnyPoint_NoHit() {
    assertThat(ToolbarLayout.empty().hit(new PanelPoint(170, 60))).isEmpty();
  }
}

package com.consullo.snip.composite;

import com.consullo.snip.drawing.BrushStroke;
import com.consullo.snip.drawing.DrawingOperation;
import com.consullo.snip.drawing.FilledRectangle;
import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.geometry.PanelPoint;
import com.consullo.snip.geometry.ScaleFactors;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for full-resolution compositing and crop extraction.
 *
 * @since 1.0
 */
public class CompositeCropperTest {

  private final CompositeCropper cropper = new CompositeCropper();

  private static BufferedImage source(final int width, final int height) {
    final BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    final Graphics2D g = image.createGraphics();
    g.setColor(Color.WHITE);
    g.fillRect(0, 0, width, height);
    g.dispose();
    return image;
  }

  private static Color at(final BufferedImage image, final int x, final int y) {
    return new Color(image.getRGB(x, y));
  }

  @Test
  @DisplayName("Crop size equals the selection times the source scale")
  void crop_ScaleTwo_DoublesSize() {
    final ScaleFactors scale = ScaleFactors.compute(400, 200, 200, 100, 200, 100);

    final BufferedImage out = cropper.crop(source(400, 200), List.of(), new DoubleRectangle(10, 10, 50, 25), scale);

    assertThat(out.getWidth()).isEqualTo(100);
    assertThat(out.getHeight()).isEqualTo(50);
  }

  @Test
  @DisplayName("Operations composite in order and land at source coordinates")
  void crop_OverlappingRectangles_LaterWins() {
    final ScaleFactors scale = ScaleFactors.compute(200, 200, 100, 100, 100, 100);
    final List<DrawingOperation> ops = List.of(
        new FilledRectangle(new DoubleRectangle(10, 10, 20, 20), Color.RED),
        new FilledRectangle(new DoubleRectangle(20, 20, 20, 20), Color.BLUE));

    final BufferedImage out = cropper.crop(source(200, 200), ops, new DoubleRectangle(0, 0, 50, 50), scale);

    assertThat(at(out, 25, 25)).isEqualTo(Color.RED);
    assertThat(at(out, 50, 50)).isEqualTo(Color.BLUE);
    assertThat(at(out, 70, 70)).isEqualTo(Color.BLUE);
    assertThat(at(out, 90, 90)).isEqualTo(Color.WHITE);
  }

  @Test
  @DisplayName("Rectangle committed after a stroke covers the stroke in the composite")
  void crop_RectangleAfterStroke_RectangleOnTop() {
    final ScaleFactors scale = ScaleFactors.compute(200, 200, 100, 100, 100, 100);
    final List<DrawingOperation> ops = List.of(
        new BrushStroke(List.of(new PanelPoint(0, 25), new PanelPoint(50, 25)), Color.GREEN, 6f),
        new FilledRectangle(new DoubleRectangle(20, 15, 10, 20), Color.BLUE));

    final BufferedImage out = cropper.crop(source(200, 200), ops, new DoubleRectangle(0, 0, 50, 50), scale);

    assertThat(at(out, 50, 50)).isEqualTo(Color.BLUE);
    assertThat(at(out, 42, 50)).isEqualTo(Color.BLUE);
    assertThat(at(out, 20, 50).getGreen()).isGreaterThan(200);
    assertThat(at(out, 20, 50).getBlue()).isLessThan(50);
  }

  @Test
  @DisplayName("Result does not share pixels with the screenshot")
  void crop_ModifyResult_SourceUnchanged() {
    final BufferedImage src = source(50, 50);

    final BufferedImage out = cropper.crop(src, List.of(), new DoubleRectangle(0, 0, 50, 50), ScaleFactors.IDENTITY);
    out.setRGB(0, 0, Color.BLACK.getRGB());

    assertThat(at(src, 0, 0)).isEqualTo(Color.WHITE);
    assertThat(out.getType()).isEqualTo(BufferedImage.TYPE_INT_ARGB);
  }

  @Test
  @DisplayName("Selection past the image edge is clamped and never empty")
  void sourceRegion_OutOfBounds_Clamped() {
    assertThat(CompositeCropper.sourceRegion(new DoubleRectangle(90, 90, 50, 50), ScaleFactors.IDENTITY, 100, 100))
        .isEqualTo(new Rectangle(90, 90, 10, 10));
    assertThat(CompositeCropper.sourceRegion(new DoubleRectangle(-5, 150, 0, 0), ScaleFactors.IDENTITY, 100, 100))
        .isEqualTo(new Rectangle(0, 99, 1, 1));
  }

  @Test
  @DisplayName("Operations outside the crop do not leak into it")
  void crop_OperationOutsideRegion_NotVisible() {
    final List<DrawingOperation> ops =
        List.of(new FilledRectangle(new DoubleRectangle(60, 60, 20, 20), Color.RED));

    final BufferedImage out =
        cropper.crop(source(100, 100), ops, new DoubleRectangle(0, 0, 50, 50), ScaleFactors.IDENTITY);

    for (int x = 0; x < out.getWidth(); x += 7) {
      for (int y = 0; y < out.getHeight(); y += 7) {
        assertThat(at(out, x, y)).isEqualTo(Color.WHITE);
      }
    }
  }
}

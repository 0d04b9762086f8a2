package com.consullo.snip.drawing;

import com.consullo.snip.geometry.PanelPoint;
import java.awt.Color;
import java.awt.Font;
import org.apache.commons.lang3.Validate;

/**
 * Text label. The only operation that may change after commit (moved or edited while selected).
 *
 * @param text label text
 * @param position baseline-left anchor in panel space
 * @param color text color
 * @param fontSize font size in panel pixels
 * @param fontFamily font family name
 * @since 1.0
 */
public record TextAnnotation(String text, PanelPoint position, Color color, int fontSize, String fontFamily)
    implements DrawingOperation {

  public TextAnnotation {
    Validate.notNull(text, "text must not be null");
    Validate.notNull(position, "position must not be null");
    Validate.notNull(color, "color must not be null");
    Validate.notNull(fontFamily, "fontFamily must not be null");
  }

  public TextAnnotation withPosition(final PanelPoint newPosition) {
    return new TextAnnotation(text, newPosition, color, fontSize, fontFamily);
  }

  public TextAnnotation withText(final String newText) {
    return new TextAnnotation(newText, position, color, fontSize, fontFamily);
  }

  /**
   * Font used to paint this label at the given size.
   *
   * @param size point size
   * @return bold font of this label's family
   */
  public Font font(final int size) {
    return new Font(fontFamily, Font.BOLD, size);
  }

  @Override
  public <R> R accept(final DrawingOperationVisitor<R> visitor) {
    return visitor.visitText(this);
  }
}

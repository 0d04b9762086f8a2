package com.consullo.snip.platform;

import java.awt.Color;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@code #rrggbb} conversion.
 *
 * @since 1.0
 */
public class ColorHexTest {

  @Test
  @DisplayName("Formats lowercase, zero-padded, without alpha")
  void toHex_Colors_Formatted() {
    assertThat(ColorHex.toHex(Color.RED)).isEqualTo("#ff0000");
    assertThat(ColorHex.toHex(new Color(1, 2, 3, 4))).isEqualTo("#010203");
  }

  @Test
  @DisplayName("Parses kdialog output with surrounding whitespace")
  void parse_KDialogOutput_Color() {
    assertThat(ColorHex.parse("#00FF80\n")).hasValue(new Color(0, 255, 128));
    assertThat(ColorHex.parse("0a0b0c")).hasValue(new Color(10, 11, 12));
  }

  @Test
  @DisplayName("Rejects anything that is not six hex digits")
  void parse_Garbage_Empty() {
    assertThat(ColorHex.parse("")).isEmpty();
    assertThat(ColorHex.parse(null)).isEmpty();
    assertThat(ColorHex.parse("#fff")).isEmpty();
    assertThat(ColorHex.parse("#gg0000")).isEmpty();
  }
}

package com.consullo.snip.platform;

import com.consullo.snip.geometry.DoubleRectangle;
import java.awt.Rectangle;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Tests for active monitor resolution from kscreen-doctor output.
 *
 * @since 1.0
 */
public class KScreenDoctorDisplayQueryTest {

  private CommandRunner runner;
  private KScreenDoctorDisplayQuery query;

  @BeforeEach
  void setUp() throws Exception {
    runner = mock(CommandRunner.class);
    query = new KScreenDoctorDisplayQuery(runner);
    when(runner.run(KScreenDoctorDisplayQuery.OUTPUTS_COMMAND)).thenReturn(new CommandResult(0, fixture()));
  }

  private static byte[] fixture() throws IOException {
    try (InputStream in = KScreenDoctorDisplayQueryTest.class.getResourceAsStream("/fixtures/kscreen-doctor.json")) {
      return in.readAllBytes();
    }
  }

  private void activeOutput(final String name) throws IOException {
    when(runner.run(KScreenDoctorDisplayQuery.ACTIVE_OUTPUT_COMMAND))
        .thenReturn(new CommandResult(0, (name + "\n").getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  @DisplayName("Unscaled output keeps its size in both spaces")
  void activeMonitor_UnscaledOutput_SameGeometry() throws Exception {
    activeOutput("DP-1");

    final Optional<MonitorInfo> monitor = query.activeMonitor();

    assertThat(monitor).isPresent();
    assertThat(monitor.get().geometry()).isEqualTo(new DoubleRectangle(0, 0, 2560, 1440));
    assertThat(monitor.get().physicalBounds()).isEqualTo(new Rectangle(0, 0, 2560, 1440));
  }

  @Test
  @DisplayName("Scaled output divides its logical size and multiplies its physical origin")
  void activeMonitor_ScaledOutput_SplitsSpaces() throws Exception {
    activeOutput("HDMI-A-1");

    final MonitorInfo monitor = query.activeMonitor().orElseThrow();

    assertThat(monitor.scale()).isEqualTo(2.0);
    assertThat(monitor.geometry()).isEqualTo(new DoubleRectangle(2560, 0, 1920, 1080));
    assertThat(monitor.physicalBounds()).isEqualTo(new Rectangle(5120, 0, 3840, 2160));
  }

  @Test
  @DisplayName("Disabled or unknown outputs are not matched")
  void activeMonitor_DisabledOrUnknown_Empty() throws Exception {
    activeOutput("DP-2");
    assertThat(query.activeMonitor()).isEmpty();

    activeOutput("eDP-9");
    assertThat(query.activeMonitor()).isEmpty();
  }

  @Test
  @DisplayName("Failing D-Bus query is an error")
  void activeMonitor_DbusFails_Throws() throws Exception {
    when(runner.run(KScreenDoctorDisplayQuery.ACTIVE_OUTPUT_COMMAND)).thenReturn(new CommandResult(1, new byte[0]));

    assertThatThrownBy(() -> query.activeMonitor()).isInstanceOf(IOException.class);
  }
}

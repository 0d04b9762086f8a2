package com.consullo.snip.platform;

import com.consullo.snip.geometry.DoubleRectangle;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.awt.Rectangle;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Active monitor lookup on KDE Plasma: the focused output name comes from KWin over D-Bus, its geometry from
 * {@code kscreen-doctor --json}.
 *
 * @since 1.0
 */
public final class KScreenDoctorDisplayQuery implements DisplayQuery {

  private static final Logger LOGGER = LoggerFactory.getLogger(KScreenDoctorDisplayQuery.class);

  static final List<String> ACTIVE_OUTPUT_COMMAND =
      List.of("qdbus6", "org.kde.KWin", "/KWin", "org.kde.KWin.activeOutputName");
  static final List<String> OUTPUTS_COMMAND = List.of("kscreen-doctor", "--json");

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final CommandRunner runner;

  public KScreenDoctorDisplayQuery(final CommandRunner runner) {
    Validate.notNull(runner, "runner must not be null");
    this.runner = runner;
  }

  @Override
  public Optional<MonitorInfo> activeMonitor() throws IOException {
    final CommandResult nameResult = runner.run(ACTIVE_OUTPUT_COMMAND);
    if (!nameResult.isSuccess()) {
      throw new IOException("activeOutputName query failed with exit code " + nameResult.exitCode());
    }
    final String outputName = nameResult.text();
    LOGGER.info("Active output: {}", outputName);

    final CommandResult outputsResult = runner.run(OUTPUTS_COMMAND);
    if (!outputsResult.isSuccess()) {
      throw new IOException("kscreen-doctor failed with exit code " + outputsResult.exitCode());
    }
    final KScreenConfig config = MAPPER.readValue(outputsResult.stdout(), KScreenConfig.class);
    return findMonitor(config, outputName);
  }

  static Optional<MonitorInfo> findMonitor(final KScreenConfig config, final String outputName) {
    if (config.outputs() == null || StringUtils.isEmpty(outputName)) {
      return Optional.empty();
    }
    for (KScreenOutput output : config.outputs()) {
      if (output.enabled() && outputName.equals(output.name()) && output.pos() != null && output.size() != null) {
        final MonitorInfo monitor = toMonitorInfo(output);
        LOGGER.info("Monitor {} at {} (scale {})", monitor.name(), monitor.geometry(), monitor.scale());
        return Optional.of(monitor);
      }
    }
    LOGGER.warn("No enabled output named '{}'", outputName);
    return Optional.empty();
  }

  /**
   * kscreen-doctor reports the position in logical units and the size in physical pixels.
   *
   * @param output one output entry
   * @return monitor with logical geometry and physical bounds
   */
  static MonitorInfo toMonitorInfo(final KScreenOutput output) {
    final double scale = output.scale() > 0 ? output.scale() : 1.0;
    final DoubleRectangle geometry = new DoubleRectangle(
        output.pos().x(),
        output.pos().y(),
        Math.round(output.size().width() / scale),
        Math.round(output.size().height() / scale));
    final Rectangle physical = new Rectangle(
        (int) Math.round(output.pos().x() * scale),
        (int) Math.round(output.pos().y() * scale),
        output.size().width(),
        output.size().height());
    return new MonitorInfo(output.name(), geometry, physical, scale);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record KScreenConfig(List<KScreenOutput> outputs) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record KScreenOutput(String name, boolean enabled, KScreenPosition pos, KScreenSize size, double scale) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record KScreenPosition(int x, int y) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record KScreenSize(int width, int height) {
  }
}

package com.consullo.snip.platform;

import com.consullo.snip.geometry.DoubleRectangle;
import com.consullo.snip.window.WindowInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the KWin stacking order by running a one-shot KWin script.
 *
 * <p>KWin scripts cannot return values over D-Bus, so the script logs its JSON behind a random marker and the
 * result is read back from the user journal. The script is unloaded and its temp file deleted afterwards.
 *
 * @since 1.0
 */
public final class KWinScriptWindowEnumerator implements WindowEnumerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(KWinScriptWindowEnumerator.class);

  static final String SCRIPT_RESOURCE = "/kwin-stacking.js";
  static final String MARKER_PLACEHOLDER = "{marker}";
  static final String MARKER_PREFIX = "SNIPSNIP_OUTPUT_";
  static final List<String> JOURNAL_COMMAND =
      List.of("journalctl", "--user", "-t", "kwin_wayland", "-n", "50", "--no-pager", "-o", "cat");

  /** Desktop shell components that are never capture targets. */
  static final Set<String> DESKTOP_COMPONENTS = Set.of(
      "plasmashell",
      "krunner",
      "kded5",
      "kded6",
      "kwin_wayland",
      "kwin_x11",
      "xdg-desktop-portal",
      "xdg-desktop-portal-kde");

  private static final Duration DEFAULT_SETTLE_DELAY = Duration.ofMillis(100);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final CommandRunner runner;
  private final Duration settleDelay;

  public KWinScriptWindowEnumerator(final CommandRunner runner) {
    this(runner, DEFAULT_SETTLE_DELAY);
  }

  /**
   * Creates an enumerator.
   *
   * @param runner command runner
   * @param settleDelay wait between running the script and reading the journal
   */
  public KWinScriptWindowEnumerator(final CommandRunner runner, final Duration settleDelay) {
    Validate.notNull(runner, "runner must not be null");
    Validate.notNull(settleDelay, "settleDelay must not be null");
    Validate.isTrue(!settleDelay.isNegative(), "settleDelay must not be negative");
    this.runner = runner;
    this.settleDelay = settleDelay;
  }

  @Override
  public List<WindowInfo> visibleWindows() throws IOException {
    final String marker = MARKER_PREFIX + UUID.randomUUID();
    final Path scriptFile = Files.createTempFile("snipsnip-stacking-", ".js");
    try {
      Files.writeString(scriptFile, loadScript(marker), StandardCharsets.UTF_8);

      final CommandResult loaded = runner.run(List.of(
          "qdbus6", "org.kde.KWin", "/Scripting", "org.kde.kwin.Scripting.loadScript",
          scriptFile.toAbsolutePath().toString()));
      final String scriptId = loaded.text();
      if (!loaded.isSuccess() || StringUtils.isBlank(scriptId)) {
        throw new IOException("KWin refused to load the stacking script (exit code " + loaded.exitCode() + ")");
      }
      LOGGER.debug("Loaded KWin script {} from {}", scriptId, scriptFile);

      try {
        runner.run(scriptCommand(scriptId, "org.kde.kwin.Script.run"));
        sleep();
        final CommandResult journal = runner.run(JOURNAL_COMMAND);
        final String payload = findPayload(journal.text().lines().toList(), marker);
        if (payload == null) {
          LOGGER.warn("Stacking script output not found in the journal");
          return Collections.emptyList();
        }
        return parseStacking(payload);
      } finally {
        stopScript(scriptId);
      }
    } finally {
      Files.deleteIfExists(scriptFile);
    }
  }

  private String loadScript(final String marker) throws IOException {
    try (InputStream in = KWinScriptWindowEnumerator.class.getResourceAsStream(SCRIPT_RESOURCE)) {
      if (in == null) {
        throw new IOException("Missing resource " + SCRIPT_RESOURCE);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8).replace(MARKER_PLACEHOLDER, marker);
    }
  }

  private void stopScript(final String scriptId) {
    try {
      final CommandResult stopped = runner.run(scriptCommand(scriptId, "org.kde.kwin.Script.stop"));
      if (!stopped.isSuccess()) {
        LOGGER.warn("Stopping KWin script {} exited with {}", scriptId, stopped.exitCode());
      }
    } catch (final IOException e) {
      LOGGER.warn("Could not stop KWin script {}: {}", scriptId, e.getMessage(), e);
    }
  }

  private void sleep() throws IOException {
    if (settleDelay.isZero()) {
      return;
    }
    try {
      Thread.sleep(settleDelay.toMillis());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while waiting for the stacking script", e);
    }
  }

  private static List<String> scriptCommand(final String scriptId, final String method) {
    return List.of("qdbus6", "org.kde.KWin", "/Scripting/Script" + scriptId, method);
  }

  /**
   * Finds the newest journal line carrying the marker.
   *
   * @param lines journal lines, oldest first
   * @param marker marker of this run
   * @return JSON after the marker, or null when absent
   */
  static String findPayload(final List<String> lines, final String marker) {
    final String prefix = marker + ":";
    for (int i = lines.size() - 1; i >= 0; i--) {
      final String line = lines.get(i);
      if (line.startsWith(prefix)) {
        return line.substring(prefix.length());
      }
    }
    return null;
  }

  /**
   * Turns the script's bottom-to-top stacking JSON into visible windows, topmost first.
   *
   * @param json either an object with a {@code windows} array or the array itself
   * @return visible windows
   * @throws IOException if the JSON is malformed
   */
  static List<WindowInfo> parseStacking(final String json) throws IOException {
    final JsonNode root = MAPPER.readTree(json);
    final JsonNode windows = root.isArray() ? root : root.path("windows");
    if (!windows.isArray()) {
      throw new IOException("Stacking output has no window list");
    }

    final List<WindowInfo> result = new ArrayList<>(windows.size());
    for (int i = windows.size() - 1; i >= 0; i--) {
      final JsonNode node = windows.get(i);
      final String resourceName = node.path("resourceName").asText("");
      if (node.path("minimized").asBoolean(false) || DESKTOP_COMPONENTS.contains(resourceName)) {
        continue;
      }
      final JsonNode g = node.path("geometry");
      final JsonNode pid = node.path("pid");
      result.add(new WindowInfo(
          node.path("internalId").asText(),
          new DoubleRectangle(
              g.path("x").asDouble(),
              g.path("y").asDouble(),
              g.path("width").asDouble(),
              g.path("height").asDouble()),
          StringUtils.isEmpty(resourceName) ? null : resourceName,
          pid.isNumber() ? Integer.valueOf(pid.asInt()) : null));
    }

    LOGGER.debug("Visible windows (top to bottom): {}", result);
    return result;
  }
}

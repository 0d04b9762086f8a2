package com.consullo.snip.config;

import com.consullo.snip.overlay.InteractionThresholds;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link SnipConfig} from a JSON file. Missing keys fall back to {@link SnipConfig#defaults()}; unknown keys
 * are ignored.
 *
 * <pre>
 * {
 *   "screenshotsFolder": "/home/me/Pictures/SnipSnip",
 *   "useKDialogForColorPicking": true,
 *   "defaultFontFamily": "Noto Sans",
 *   "displayProcessInfoWhenHovering": false,
 *   "magnifier": { "zoom": 8, "offset": 20, "size": 160, "showInAllTools": false },
 *   "thresholds": { "cropDragMinPx": 5, "rectangleMinPx": 2, "textClickMaxPx": 5 }
 * }
 * </pre>
 *
 * @since 1.0
 */
public final class SnipConfigLoader {

  public static final String CONFIG_PROPERTY = "conf";
  public static final String DEFAULT_CONFIG_FILE = "./snipsnip.json";

  private static final Logger LOGGER = LoggerFactory.getLogger(SnipConfigLoader.class);

  private final ObjectMapper mapper;

  public SnipConfigLoader() {
    this(new ObjectMapper());
  }

  public SnipConfigLoader(final ObjectMapper mapper) {
    Validate.notNull(mapper, "mapper must not be null");
    this.mapper = mapper;
  }

  /**
   * Resolves the configuration file from the {@code conf} system property (or the default file name).
   *
   * @return configuration file path
   */
  public static Path resolveConfigFile() {
    return Path.of(System.getProperty(CONFIG_PROPERTY, DEFAULT_CONFIG_FILE));
  }

  /**
   * Loads the file, or returns defaults when it does not exist.
   *
   * @param file configuration file
   * @return configuration
   * @throws IOException if the file exists but cannot be read or parsed
   */
  public SnipConfig load(final Path file) throws IOException {
    Validate.notNull(file, "file must not be null");
    if (!Files.exists(file)) {
      LOGGER.info("No configuration at {}, using defaults", file.toAbsolutePath());
      return SnipConfig.defaults();
    }
    try (InputStream in = Files.newInputStream(file)) {
      final SnipConfig config = read(in);
      LOGGER.info("Loaded configuration from {}", file.toAbsolutePath());
      return config;
    }
  }

  /**
   * Parses a configuration document.
   *
   * @param in JSON input
   * @return configuration
   * @throws IOException if the JSON is malformed
   */
  public SnipConfig read(final InputStream in) throws IOException {
    final JsonNode root = mapper.readTree(in);
    final SnipConfig defaults = SnipConfig.defaults();
    if (root == null || root.isMissingNode() || root.isNull()) {
      return defaults;
    }

    final String folder = root.path("screenshotsFolder").asText("");
    final Path screenshotsFolder = folder.isBlank() ? defaults.screenshotsFolder() : Path.of(expandHome(folder));

    final JsonNode mag = root.path("magnifier");
    final MagnifierConfig magDefaults = defaults.magnifier();
    final MagnifierConfig magnifier = new MagnifierConfig(
        mag.path("zoom").asInt(magDefaults.zoom()),
        mag.path("offset").asInt(magDefaults.offset()),
        mag.path("size").asInt(magDefaults.size()),
        mag.path("showInAllTools").asBoolean(magDefaults.showInAllTools()));

    final JsonNode thr = root.path("thresholds");
    final InteractionThresholds thrDefaults = defaults.thresholds();
    final InteractionThresholds thresholds = new InteractionThresholds(
        thr.path("cropDragMinPx").asInt(thrDefaults.cropDragMinPx()),
        thr.path("rectangleMinPx").asInt(thrDefaults.rectangleMinPx()),
        thr.path("textClickMaxPx").asInt(thrDefaults.textClickMaxPx()));

    return new SnipConfig(
        screenshotsFolder,
        root.path("useKDialogForColorPicking").asBoolean(defaults.useKDialogForColorPicking()),
        root.path("defaultFontFamily").asText(defaults.defaultFontFamily()),
        root.path("displayProcessInfoWhenHovering").asBoolean(defaults.displayProcessInfoWhenHovering()),
        magnifier,
        thresholds);
  }

  private static String expandHome(final String path) {
    if (path.equals("~") || path.startsWith("~/")) {
      return System.getProperty("user.home") + path.substring(1);
    }
    return path;
  }
}

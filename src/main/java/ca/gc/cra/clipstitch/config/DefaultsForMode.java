package ca.gc.cra.clipstitch.config;

import ca.gc.cra.clipstitch.application.media.SegmentationEngine;
import ca.gc.cra.clipstitch.domain.media.OutOfRangePolicy;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each ClipStitch CLI mode.
 *
 * <p>The defaults are the lowest precedence layer; YAML and then CLI values override them.</p>
 */
public final class DefaultsForMode {
  /** Modes understood by {@link #asFlatMap(String)} and {@link YamlConfigLoader}. */
  public static final Set<String> MODES = Set.of("cut", "combine", "probe");

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode target CLI mode (cut, combine, probe)
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "cut" -> buildCutDefaults();
      case "combine" -> buildCombineDefaults();
      case "probe" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildCutDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("out", "");
    map.put("segmentSeconds", "");
    map.put("outOfRange", OutOfRangePolicy.DROP.name());
    map.put("maxSegments", Integer.toString(SegmentationEngine.DEFAULT_MAX_SEGMENTS));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildCombineDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("inDir", "");
    map.put("pattern", CombineConfig.DEFAULT_PATTERN);
    map.put("out", "");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}

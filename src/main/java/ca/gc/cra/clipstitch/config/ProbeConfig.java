package ca.gc.cra.clipstitch.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for one {@code probe} run.
 *
 * @param input container file to inspect
 * @since 0.1.0
 */
public record ProbeConfig(Path input) {

  public ProbeConfig {
    input = ConfigValues.normalizePath("in", input);
  }

  /**
   * Builds a configuration from merged key/value settings.
   *
   * @param options key {@code in}
   * @return configuration
   */
  public static ProbeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new ProbeConfig(ConfigValues.requirePath(options, "in"));
  }
}

package ca.gc.cra.clipstitch.config;

import ca.gc.cra.clipstitch.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsing helpers shared by the configuration records.
 */
final class ConfigValues {
  private ConfigValues() {
    // Utility
  }

  static String require(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return Strings.requireNonBlank(key, value);
  }

  static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  static Path requirePath(Map<String, String> options, String key) {
    return parsePath(key, require(options, key));
  }

  static Optional<Path> optionalPath(Map<String, String> options, String key) {
    return optionalString(options.get(key)).map(value -> parsePath(key, value));
  }

  static Path parsePath(String key, String raw) {
    String value = Strings.requireNonBlank(key, raw);
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }

  static Path normalizePath(String key, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(key + " is required");
    }
    return path.toAbsolutePath().normalize();
  }

  /**
   * Splits a comma-separated list of paths, skipping blank entries.
   */
  static List<Path> parsePathList(String key, String raw) {
    List<Path> paths = new ArrayList<>();
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        paths.add(parsePath(key, token));
      }
    }
    return paths;
  }

  static int parseInt(Map<String, String> options, String key, int defaultValue) {
    Optional<String> raw = optionalString(options.get(key));
    if (raw.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.get());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw.get() + ")", ex);
    }
  }
}

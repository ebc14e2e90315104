package ca.gc.cra.clipstitch.config;

import ca.gc.cra.clipstitch.validation.Strings;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Settings for one {@code combine} run.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept either an explicit ordered list ({@code in=A,B,...}) or a directory ({@code inDir=DIR}).</li>
 *   <li>Resolve the single output file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param inputs explicit sources in concatenation order; empty when {@code inputDirectory} is set
 * @param inputDirectory directory whose files matching {@code pattern} are combined in name order
 * @param pattern file-name glob applied inside {@code inputDirectory}
 * @param output combined output file
 * @since 0.1.0
 */
public record CombineConfig(List<Path> inputs, Optional<Path> inputDirectory, String pattern, Path output) {

  /** Glob used with {@code inDir} when none is configured. */
  public static final String DEFAULT_PATTERN = "*.mp4";

  public CombineConfig {
    inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
    inputDirectory = Objects.requireNonNullElse(inputDirectory, Optional.empty());
    pattern = pattern == null || pattern.isBlank() ? DEFAULT_PATTERN : Strings.requireNonBlank("pattern", pattern);
    output = ConfigValues.normalizePath("out", output);
    if (inputs.isEmpty() == inputDirectory.isEmpty()) {
      throw new IllegalArgumentException("exactly one of in=FILE[,FILE...] or inDir=DIR is required");
    }
    if (output.getFileName() == null
        || !output.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".mp4")) {
      throw new IllegalArgumentException("out must name an .mp4 file (was " + output + ")");
    }
  }

  /**
   * Builds a configuration from merged key/value settings.
   *
   * @param options keys {@code in}, {@code inDir}, {@code pattern}, {@code out}
   * @return configuration
   * @throws IllegalArgumentException if a value is missing or invalid
   */
  public static CombineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    List<Path> inputs = ConfigValues.optionalString(options.get("in"))
        .map(raw -> ConfigValues.parsePathList("in", raw))
        .orElse(List.of());
    Optional<Path> inputDirectory = ConfigValues.optionalPath(options, "inDir");
    return new CombineConfig(
        inputs, inputDirectory, options.get("pattern"), ConfigValues.requirePath(options, "out"));
  }
}

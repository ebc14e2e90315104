package ca.gc.cra.clipstitch.config;

import ca.gc.cra.clipstitch.application.media.SegmentationEngine;
import ca.gc.cra.clipstitch.domain.media.OutOfRangePolicy;
import ca.gc.cra.clipstitch.validation.Numbers;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for one {@code cut} run.
 * <p><strong>Role:</strong> Configuration aggregate built from merged defaults, YAML and CLI values.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param input source container file
 * @param outputDirectory directory receiving {@code clip_NN.mp4} files
 * @param segmentLength clip length; positive
 * @param outOfRangePolicy treatment of samples outside every segment window
 * @param maxSegments ceiling on the number of planned segments
 * @since 0.1.0
 * @see SegmentationEngine
 */
public record CutConfig(
    Path input,
    Path outputDirectory,
    Duration segmentLength,
    OutOfRangePolicy outOfRangePolicy,
    int maxSegments) {

  /** Longest accepted segment length in seconds (one week). */
  public static final double MAX_SEGMENT_SECONDS = 604_800d;

  public CutConfig {
    input = ConfigValues.normalizePath("in", input);
    outputDirectory = ConfigValues.normalizePath("out", outputDirectory);
    Objects.requireNonNull(segmentLength, "segmentLength");
    if (segmentLength.isNegative() || segmentLength.isZero()) {
      throw new IllegalArgumentException("segmentSeconds must be greater than 0");
    }
    outOfRangePolicy = Objects.requireNonNullElse(outOfRangePolicy, OutOfRangePolicy.DROP);
    Numbers.requireRange("maxSegments", maxSegments, 1, 1_000_000);
  }

  /**
   * Builds a configuration from merged key/value settings.
   *
   * @param options keys {@code in}, {@code out}, {@code segmentSeconds}, {@code outOfRange}, {@code maxSegments}
   * @return configuration
   * @throws IllegalArgumentException if a value is missing or invalid
   */
  public static CutConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path input = ConfigValues.requirePath(options, "in");
    Path output = ConfigValues.requirePath(options, "out");
    double seconds = Numbers.requirePositiveDecimal(
        "segmentSeconds", ConfigValues.require(options, "segmentSeconds"), MAX_SEGMENT_SECONDS);
    OutOfRangePolicy policy = OutOfRangePolicy.parse(options.get("outOfRange"), OutOfRangePolicy.DROP);
    int maxSegments = ConfigValues.parseInt(
        options, "maxSegments", SegmentationEngine.DEFAULT_MAX_SEGMENTS);
    return new CutConfig(input, output, toDuration(seconds), policy, maxSegments);
  }

  static Duration toDuration(double seconds) {
    long nanos = BigDecimal.valueOf(seconds)
        .movePointRight(9)
        .setScale(0, RoundingMode.HALF_UP)
        .longValueExact();
    if (nanos <= 0) {
      throw new IllegalArgumentException("segmentSeconds is below one nanosecond (was " + seconds + ")");
    }
    return Duration.ofNanos(nanos);
  }
}

package ca.gc.cra.clipstitch.domain.media;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Fixed-duration segmentation of a container's timeline.
 * <p><strong>Why:</strong> Keeps the bucket and offset arithmetic in one place, in integer ticks, so
 * long videos never lose precision.</p>
 * <p><strong>Role:</strong> Derived domain value; never stored, rebuilt for every cut.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Derive the segment count {@code ceil(totalDuration / segmentLength)}.</li>
 *   <li>Provide per-track windows mapping decoding timestamps onto segments and segment starts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param segmentNanos segment length in nanoseconds; positive
 * @param count number of segments covering the source; positive
 * @since 0.1.0
 */
public record SegmentPlan(long segmentNanos, int count) {

  public SegmentPlan {
    if (segmentNanos <= 0) {
      throw new IllegalArgumentException("segmentNanos must be positive (was " + segmentNanos + ")");
    }
    if (count <= 0) {
      throw new IllegalArgumentException("count must be positive (was " + count + ")");
    }
  }

  /**
   * Plans the segments for a source of the given duration.
   *
   * @param totalDuration source duration in {@code timescale} ticks
   * @param timescale source timescale
   * @param segmentLength requested segment length; must be positive
   * @param maxSegments upper bound on the segment count
   * @return the plan
   * @throws IllegalArgumentException if {@code segmentLength} is not positive
   * @throws InvalidDurationException if the source duration is not positive or the plan exceeds
   *     {@code maxSegments}
   */
  public static SegmentPlan of(long totalDuration, long timescale, Duration segmentLength, int maxSegments)
      throws InvalidDurationException {
    long segmentNanos = requirePositiveNanos(segmentLength);
    if (timescale <= 0 || totalDuration <= 0) {
      throw new InvalidDurationException(
          "Invalid video duration: " + totalDuration + " ticks at timescale " + timescale);
    }
    TrackWindow movieWindow = TrackWindow.of(segmentNanos, timescale);
    long segments = TickMath.mulDivCeil(
        totalDuration, movieWindow.ticksDenominator(), movieWindow.ticksNumerator());
    if (segments > maxSegments) {
      throw new InvalidDurationException(String.format(Locale.ROOT,
          "Segment length %s yields %d segments, above the limit of %d", segmentLength, segments, maxSegments));
    }
    return new SegmentPlan(segmentNanos, (int) segments);
  }

  /**
   * Returns the segment length in seconds for display purposes only.
   *
   * @return segment length in seconds
   */
  public double segmentSeconds() {
    return (double) segmentNanos / TickMath.NANOS_PER_SECOND;
  }

  /**
   * Returns the window arithmetic for a track timescale; callers cache one per track.
   *
   * @param trackTimescale ticks per second of the track
   * @return window helper
   */
  public TrackWindow window(long trackTimescale) {
    return TrackWindow.of(segmentNanos, trackTimescale);
  }

  /**
   * Indicates whether an index addresses a planned segment.
   *
   * @param index candidate index
   * @return {@code true} when {@code 0 <= index < count}
   */
  public boolean contains(long index) {
    return index >= 0 && index < count;
  }

  /**
   * Returns the deterministic name of segment {@code index}: 1-indexed, zero padded to two digits.
   *
   * @param index zero-based segment index
   * @return clip name such as {@code clip_01}
   */
  public static String clipName(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("index must not be negative (was " + index + ")");
    }
    return String.format(Locale.ROOT, "clip_%02d", index + 1);
  }

  private static long requirePositiveNanos(Duration segmentLength) {
    Objects.requireNonNull(segmentLength, "segmentLength");
    if (segmentLength.isNegative() || segmentLength.isZero()) {
      throw new IllegalArgumentException("segment length must be positive (was " + segmentLength + ")");
    }
    try {
      return segmentLength.toNanos();
    } catch (ArithmeticException ex) {
      // Longer than any representable timeline; one segment covers everything.
      return Long.MAX_VALUE;
    }
  }

  /**
   * Segment length expressed as an exact reduced fraction of track ticks.
   *
   * @param ticksNumerator numerator of the segment length in ticks
   * @param ticksDenominator denominator of the segment length in ticks
   */
  public record TrackWindow(long ticksNumerator, long ticksDenominator) {

    static TrackWindow of(long segmentNanos, long timescale) {
      if (timescale <= 0) {
        throw new IllegalArgumentException("timescale must be positive (was " + timescale + ")");
      }
      long g1 = TickMath.gcd(segmentNanos, TickMath.NANOS_PER_SECOND);
      long numerator = segmentNanos / g1;
      long denominator = TickMath.NANOS_PER_SECOND / g1;
      long g2 = TickMath.gcd(timescale, denominator);
      denominator /= g2;
      try {
        numerator = Math.multiplyExact(numerator, timescale / g2);
      } catch (ArithmeticException overflow) {
        return saturated(numerator, timescale / g2, denominator);
      }
      return new TrackWindow(numerator, denominator);
    }

    /**
     * Window whose exact numerator does not fit in a {@code long}: whole ticks, rounded down, capped at
     * {@link Long#MAX_VALUE}. Such windows span at least 2^63 / 10^9 ticks.
     */
    private static TrackWindow saturated(long numerator, long multiplier, long denominator) {
      BigInteger ticks = BigInteger.valueOf(numerator)
          .multiply(BigInteger.valueOf(multiplier))
          .divide(BigInteger.valueOf(denominator));
      long whole = ticks.bitLength() < Long.SIZE ? ticks.longValue() : Long.MAX_VALUE;
      return new TrackWindow(whole, 1);
    }

    /**
     * Maps a decoding timestamp onto its segment index.
     *
     * @param dts decoding timestamp in track ticks
     * @return floor of {@code dts / segmentTicks}
     */
    public long segmentIndex(long dts) {
      return TickMath.mulDivFloor(dts, ticksDenominator, ticksNumerator);
    }

    /**
     * Returns the first whole tick of a segment. Every timestamp mapped to {@code index} lies in
     * {@code [segmentStart(index), segmentStart(index) + segmentTicks)}.
     *
     * @param index segment index
     * @return ceiling of {@code index * segmentTicks}
     */
    public long segmentStart(long index) {
      return TickMath.mulDivCeil(index, ticksNumerator, ticksDenominator);
    }
  }
}

package ca.gc.cra.clipstitch.application.media;

import ca.gc.cra.clipstitch.application.port.ContainerFormat;
import ca.gc.cra.clipstitch.application.port.ContainerReader;
import ca.gc.cra.clipstitch.application.port.MetricsPort;
import ca.gc.cra.clipstitch.application.port.SampleReadException;
import ca.gc.cra.clipstitch.domain.media.Clip;
import ca.gc.cra.clipstitch.domain.media.ContainerInfo;
import ca.gc.cra.clipstitch.domain.media.ExtractionFailureException;
import ca.gc.cra.clipstitch.domain.media.InvalidContainerException;
import ca.gc.cra.clipstitch.domain.media.InvalidDurationException;
import ca.gc.cra.clipstitch.domain.media.MediaProcessingException;
import ca.gc.cra.clipstitch.domain.media.OutOfRangePolicy;
import ca.gc.cra.clipstitch.domain.media.SampleRecord;
import ca.gc.cra.clipstitch.domain.media.SampleView;
import ca.gc.cra.clipstitch.domain.media.SegmentPlan;
import ca.gc.cra.clipstitch.domain.media.TrackDescriptor;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Cuts one container into fixed-duration clips without re-encoding.
 * <p><strong>Why:</strong> Downstream tooling works on short clips; cutting at the sample level keeps every
 * payload and codec configuration untouched.</p>
 * <p><strong>Role:</strong> Application-layer use case driving the {@link ContainerFormat} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Plan {@code ceil(duration / segmentLength)} segments and mirror every source track into each.</li>
 *   <li>Bucket every sample of every track by decoding timestamp in a single pass.</li>
 *   <li>Rebase timestamps to the segment start and take an owned copy of each payload.</li>
 *   <li>Finish non-empty segments only, named {@code clip_01}, {@code clip_02}, ... in segment order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; every call owns its reader and builders, so one
 * engine may serve concurrent callers.</p>
 * <p><strong>Performance:</strong> O(total samples) time; O(segments x tracks) builder state. Payloads are held
 * until their segment is finished.</p>
 * <p><strong>Observability:</strong> Counters {@code cut.clips.produced}, {@code cut.samples.kept},
 * {@code cut.samples.dropped}; histogram {@code cut.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class SegmentationEngine {
  private static final Logger log = LoggerFactory.getLogger(SegmentationEngine.class);

  /** Default ceiling on the number of planned segments. */
  public static final int DEFAULT_MAX_SEGMENTS = 10_000;

  private final ContainerFormat format;
  private final MetricsPort metrics;
  private final OutOfRangePolicy outOfRangePolicy;
  private final int maxSegments;

  /**
   * Creates an engine with the default out-of-range policy ({@link OutOfRangePolicy#DROP}).
   *
   * @param format container adapter
   * @param metrics metrics sink
   */
  public SegmentationEngine(ContainerFormat format, MetricsPort metrics) {
    this(format, metrics, OutOfRangePolicy.DROP, DEFAULT_MAX_SEGMENTS);
  }

  /**
   * Creates an engine.
   *
   * @param format container adapter; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param outOfRangePolicy treatment of samples outside every segment window
   * @param maxSegments upper bound on planned segments; positive
   */
  public SegmentationEngine(
      ContainerFormat format, MetricsPort metrics, OutOfRangePolicy outOfRangePolicy, int maxSegments) {
    this.format = Objects.requireNonNull(format, "format");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.outOfRangePolicy = Objects.requireNonNull(outOfRangePolicy, "outOfRangePolicy");
    if (maxSegments <= 0) {
      throw new IllegalArgumentException("maxSegments must be positive (was " + maxSegments + ")");
    }
    this.maxSegments = maxSegments;
  }

  /**
   * Cuts {@code source} into clips of {@code segmentSeconds} seconds.
   *
   * @param source container bytes; not modified
   * @param segmentSeconds segment length in seconds; must be positive
   * @return clips in ascending segment order
   * @throws MediaProcessingException see {@link #cut(byte[], Duration)}
   */
  public List<Clip> cut(byte[] source, double segmentSeconds) throws MediaProcessingException {
    if (!(segmentSeconds > 0) || Double.isInfinite(segmentSeconds)) {
      throw new IllegalArgumentException("segment length must be positive (was " + segmentSeconds + ")");
    }
    return cut(source, toSegmentLength(segmentSeconds));
  }

  /** Converts seconds to a duration rounded to the nearest nanosecond, saturating at the longest duration. */
  static Duration toSegmentLength(double seconds) {
    BigDecimal exact = BigDecimal.valueOf(seconds);
    BigDecimal whole = exact.setScale(0, RoundingMode.FLOOR);
    if (whole.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) >= 0) {
      return Duration.ofSeconds(Long.MAX_VALUE);
    }
    long nanos = exact.subtract(whole)
        .movePointRight(9)
        .setScale(0, RoundingMode.HALF_UP)
        .longValueExact();
    return Duration.ofSeconds(whole.longValueExact(), nanos);
  }

  /**
   * Cuts {@code source} into clips of {@code segmentLength}.
   *
   * @param source container bytes; not modified
   * @param segmentLength segment length; must be positive
   * @return clips in ascending segment order; empty segments are skipped
   * @throws IllegalArgumentException if {@code segmentLength} is not positive
   * @throws InvalidContainerException if the source cannot be parsed, has no tracks, or a sample is out of
   *     range under {@link OutOfRangePolicy#FAIL}
   * @throws InvalidDurationException if the source duration is not positive or too many segments would result
   * @throws ExtractionFailureException if no segment received a sample or a clip could not be written
   */
  public List<Clip> cut(byte[] source, Duration segmentLength) throws MediaProcessingException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(segmentLength, "segmentLength");
    if (segmentLength.isNegative() || segmentLength.isZero()) {
      throw new IllegalArgumentException("segment length must be positive (was " + segmentLength + ")");
    }
    long started = System.nanoTime();
    try (ContainerReader reader = format.open(source.clone())) {
      ContainerInfo info = reader.info();
      if (info.tracks().isEmpty()) {
        throw new InvalidContainerException("Invalid video file: no tracks found");
      }
      SegmentPlan plan = SegmentPlan.of(info.duration(), info.timescale(), segmentLength, maxSegments);
      log.info("Cutting {} track(s) of {}s into {} segment(s) of {}s",
          info.tracks().size(), info.durationSeconds(), plan.count(), plan.segmentSeconds());

      List<OutputContainerBuilder> builders = new ArrayList<>(plan.count());
      for (int i = 0; i < plan.count(); i++) {
        builders.add(new OutputContainerBuilder(format.newContainer(), info.tracks()));
      }

      long kept = 0;
      long dropped = 0;
      for (TrackDescriptor track : info.tracks()) {
        TrackTally tally = distribute(reader, track, plan, builders);
        kept += tally.kept();
        dropped += tally.dropped();
      }
      metrics.add("cut.samples.kept", kept);
      if (dropped > 0) {
        metrics.add("cut.samples.dropped", dropped);
        log.warn("Dropped {} sample(s) outside the {} planned segment window(s)", dropped, plan.count());
      }

      List<Clip> clips = finishAll(builders);
      if (clips.isEmpty()) {
        throw new ExtractionFailureException(
            "Failed to extract any clips from the video. It may be corrupted.");
      }
      metrics.add("cut.clips.produced", clips.size());
      log.info("Cut produced {} clip(s) from {} sample(s)", clips.size(), kept);
      return clips;
    } finally {
      metrics.observe("cut.latencyNanos", System.nanoTime() - started);
    }
  }

  private TrackTally distribute(
      ContainerReader reader, TrackDescriptor track, SegmentPlan plan, List<OutputContainerBuilder> builders)
      throws InvalidContainerException {
    SegmentPlan.TrackWindow window = plan.window(track.timescale());
    long kept = 0;
    long dropped = 0;
    try {
      Iterator<SampleView> samples = reader.samples(track.trackId());
      while (samples.hasNext()) {
        SampleView view = samples.next();
        long index = window.segmentIndex(view.dts());
        if (!plan.contains(index)) {
          index = resolveOutOfRange(track, view, index, plan);
          if (index < 0) {
            dropped++;
            continue;
          }
        }
        long offset = window.segmentStart(index);
        SampleRecord rebased = SampleRecord.copyOf(view).shift(-offset);
        builders.get((int) index).append(track.trackId(), rebased);
        kept++;
      }
    } catch (SampleReadException ex) {
      throw new InvalidContainerException(
          "Unreadable sample data in track " + track.trackId() + ": " + ex.getMessage(), ex);
    }
    log.debug("Track {} ({}) distributed: kept={}, dropped={}", track.trackId(), track.mediaType(), kept, dropped);
    return new TrackTally(kept, dropped);
  }

  /**
   * Applies the out-of-range policy.
   *
   * @return index to use, or {@code -1} to drop the sample
   */
  private long resolveOutOfRange(TrackDescriptor track, SampleView view, long index, SegmentPlan plan)
      throws InvalidContainerException {
    switch (outOfRangePolicy) {
      case FAIL:
        throw new InvalidContainerException("Sample at dts " + view.dts() + " in track " + track.trackId()
            + " falls in segment " + index + ", outside [0, " + plan.count() + ")");
      case CLAMP:
        if (index >= plan.count()) {
          log.debug("Clamping sample at dts {} of track {} into the final segment", view.dts(), track.trackId());
          return plan.count() - 1L;
        }
        return -1;
      case DROP:
      default:
        log.debug("Dropping sample at dts {} of track {} (segment {})", view.dts(), track.trackId(), index);
        return -1;
    }
  }

  private List<Clip> finishAll(List<OutputContainerBuilder> builders) throws ExtractionFailureException {
    List<Clip> clips = new ArrayList<>();
    for (int i = 0; i < builders.size(); i++) {
      OutputContainerBuilder builder = builders.get(i);
      String name = SegmentPlan.clipName(i);
      if (builder.isEmpty()) {
        log.debug("Segment {} received no samples; discarding", name);
        continue;
      }
      String previousClip = MDC.get("clip");
      try {
        MDC.put("clip", name);
        byte[] data = builder.finish();
        clips.add(new Clip(name, data));
        log.debug("Finished {} with {} sample(s), {} byte(s)", name, builder.sampleCount(), data.length);
      } catch (IOException ex) {
        throw new ExtractionFailureException("Failed to write " + name, ex);
      } finally {
        if (previousClip == null) {
          MDC.remove("clip");
        } else {
          MDC.put("clip", previousClip);
        }
      }
      builders.set(i, null);
    }
    return clips;
  }

  private record TrackTally(long kept, long dropped) {}
}

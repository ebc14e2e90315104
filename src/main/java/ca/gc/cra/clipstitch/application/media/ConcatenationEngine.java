package ca.gc.cra.clipstitch.application.media;

import ca.gc.cra.clipstitch.application.port.ContainerFormat;
import ca.gc.cra.clipstitch.application.port.ContainerReader;
import ca.gc.cra.clipstitch.application.port.MediaSource;
import ca.gc.cra.clipstitch.application.port.MetricsPort;
import ca.gc.cra.clipstitch.application.port.SampleReadException;
import ca.gc.cra.clipstitch.domain.media.ContainerInfo;
import ca.gc.cra.clipstitch.domain.media.EmptyInputException;
import ca.gc.cra.clipstitch.domain.media.ExtractionFailureException;
import ca.gc.cra.clipstitch.domain.media.FormatMismatchException;
import ca.gc.cra.clipstitch.domain.media.InvalidContainerException;
import ca.gc.cra.clipstitch.domain.media.MediaProcessingException;
import ca.gc.cra.clipstitch.domain.media.SampleRecord;
import ca.gc.cra.clipstitch.domain.media.SampleView;
import ca.gc.cra.clipstitch.domain.media.TickMath;
import ca.gc.cra.clipstitch.domain.media.TrackDescriptor;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Concatenates an ordered list of containers into one continuous container.
 * <p><strong>Why:</strong> Clips cut (or generated) separately are stitched back together by offsetting
 * their timestamps; no sample is decoded or re-encoded.</p>
 * <p><strong>Role:</strong> Application-layer use case driving the {@link ContainerFormat} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject an empty list and pass a single source through untouched.</li>
 *   <li>Mirror the first source's tracks into exactly one destination container.</li>
 *   <li>Keep a per-track offset in that track's ticks, advanced by each source's movie duration.</li>
 *   <li>Reject sources whose track layout, timescales or codec configuration differ from the first source.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls.</p>
 * <p><strong>Performance:</strong> O(total samples). Sources are read lazily and one source's complete
 * sample set is materialized at a time, so peak memory is the destination plus the largest source. Very long
 * lists should be combined in batches.</p>
 * <p><strong>Observability:</strong> Counters {@code combine.sources}, {@code combine.samples}; histogram
 * {@code combine.latencyNanos}; MDC key {@code source} while a source is ingested.</p>
 *
 * @since 0.1.0
 */
public final class ConcatenationEngine {
  private static final Logger log = LoggerFactory.getLogger(ConcatenationEngine.class);

  private final ContainerFormat format;
  private final MetricsPort metrics;

  /**
   * Creates an engine.
   *
   * @param format container adapter; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public ConcatenationEngine(ContainerFormat format, MetricsPort metrics) {
    this.format = Objects.requireNonNull(format, "format");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Concatenates in-memory buffers.
   *
   * @param buffers ordered container buffers
   * @return combined container bytes
   * @throws MediaProcessingException see {@link #combine(List)}
   */
  public byte[] combineBuffers(List<byte[]> buffers) throws MediaProcessingException {
    Objects.requireNonNull(buffers, "buffers");
    List<MediaSource> sources = new ArrayList<>(buffers.size());
    for (byte[] buffer : buffers) {
      sources.add(MediaSource.ofBytes(buffer));
    }
    try {
      return combine(sources);
    } catch (IOException ex) {
      throw new IllegalStateException("in-memory source failed to read", ex);
    }
  }

  /**
   * Concatenates sources in list order.
   *
   * @param orderedSources sources to concatenate; read lazily, one at a time
   * @return combined container bytes; for a single source, exactly the bytes it returned
   * @throws EmptyInputException if {@code orderedSources} is empty
   * @throws InvalidContainerException if any source cannot be parsed or has no tracks
   * @throws FormatMismatchException if a source's tracks differ from the first source's
   * @throws ExtractionFailureException if no sample was collected or the result cannot be written
   * @throws IOException if a source cannot be read
   */
  public byte[] combine(List<MediaSource> orderedSources) throws MediaProcessingException, IOException {
    Objects.requireNonNull(orderedSources, "orderedSources");
    if (orderedSources.isEmpty()) {
      throw new EmptyInputException("No videos to combine");
    }
    long started = System.nanoTime();
    try {
      if (orderedSources.size() == 1) {
        MediaSource only = orderedSources.get(0);
        log.info("Single source {}; returning it unchanged", only.describe());
        metrics.increment("combine.sources");
        return only.read();
      }
      return concatenate(orderedSources);
    } finally {
      metrics.observe("combine.latencyNanos", System.nanoTime() - started);
    }
  }

  private byte[] concatenate(List<MediaSource> sources) throws MediaProcessingException, IOException {
    log.info("Combining {} sources", sources.size());
    List<TrackDescriptor> layout = null;
    OutputContainerBuilder builder = null;
    long[] offsets = null;
    long samples = 0;

    for (int position = 0; position < sources.size(); position++) {
      MediaSource source = sources.get(position);
      String previousSource = MDC.get("source");
      MDC.put("source", source.describe());
      try {
        byte[] bytes = source.read();
        try (ContainerReader reader = format.open(bytes)) {
          ContainerInfo info = reader.info();
          if (info.tracks().isEmpty()) {
            throw new InvalidContainerException(
                "Invalid video file: no tracks found in source " + (position + 1));
          }
          if (layout == null) {
            layout = info.tracks();
            builder = new OutputContainerBuilder(format.newContainer(), layout);
            offsets = new long[layout.size()];
          } else {
            requireSameLayout(layout, info.tracks(), position);
          }

          for (int t = 0; t < layout.size(); t++) {
            TrackDescriptor sourceTrack = info.tracks().get(t);
            List<SampleRecord> materialized = materialize(reader, sourceTrack);
            long offset = offsets[t];
            long destinationKey = layout.get(t).trackId();
            for (SampleRecord sample : materialized) {
              builder.append(destinationKey, sample.shift(offset));
            }
            samples += materialized.size();
            offsets[t] = Math.addExact(offset,
                TickMath.rescale(info.duration(), info.timescale(), sourceTrack.timescale()));
          }
          log.debug("Appended source {} ({}s, {} track(s))", position + 1, info.durationSeconds(),
              info.tracks().size());
        }
        metrics.increment("combine.sources");
      } finally {
        if (previousSource == null) {
          MDC.remove("source");
        } else {
          MDC.put("source", previousSource);
        }
      }
    }

    if (builder == null || builder.isEmpty()) {
      throw new ExtractionFailureException("Combined video contains no samples");
    }
    metrics.add("combine.samples", samples);
    try {
      byte[] combined = builder.finish();
      log.info("Combined {} sources into {} sample(s), {} byte(s)", sources.size(), samples, combined.length);
      return combined;
    } catch (IOException ex) {
      throw new ExtractionFailureException("Failed to write combined video", ex);
    }
  }

  private static List<SampleRecord> materialize(ContainerReader reader, TrackDescriptor track)
      throws InvalidContainerException {
    List<SampleRecord> records = new ArrayList<>();
    try {
      Iterator<SampleView> views = reader.samples(track.trackId());
      while (views.hasNext()) {
        records.add(SampleRecord.copyOf(views.next()));
      }
    } catch (SampleReadException ex) {
      throw new InvalidContainerException(
          "Unreadable sample data in track " + track.trackId() + ": " + ex.getMessage(), ex);
    }
    return records;
  }

  private static void requireSameLayout(List<TrackDescriptor> expected, List<TrackDescriptor> actual, int position)
      throws FormatMismatchException {
    int sourceNumber = position + 1;
    if (expected.size() != actual.size()) {
      throw new FormatMismatchException("Source " + sourceNumber + " has " + actual.size()
          + " track(s); expected " + expected.size());
    }
    for (int t = 0; t < expected.size(); t++) {
      TrackDescriptor first = expected.get(t);
      TrackDescriptor other = actual.get(t);
      if (first.mediaType() != other.mediaType()) {
        throw new FormatMismatchException("Source " + sourceNumber + " track " + (t + 1) + " is "
            + other.mediaType() + "; expected " + first.mediaType());
      }
      if (first.timescale() != other.timescale()) {
        throw new FormatMismatchException("Source " + sourceNumber + " track " + (t + 1) + " has timescale "
            + other.timescale() + "; expected " + first.timescale());
      }
      if (!Arrays.equals(first.codecConfig(), other.codecConfig())) {
        throw new FormatMismatchException("Source " + sourceNumber + " track " + (t + 1)
            + " has a different codec configuration than source 1");
      }
    }
  }
}

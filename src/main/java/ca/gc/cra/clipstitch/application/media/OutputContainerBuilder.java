package ca.gc.cra.clipstitch.application.media;

import ca.gc.cra.clipstitch.application.port.ContainerWriter;
import ca.gc.cra.clipstitch.domain.media.SampleRecord;
import ca.gc.cra.clipstitch.domain.media.TrackDescriptor;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One destination container under construction.
 * <p><strong>Role:</strong> Operation-scoped state owned by a single cut (one per segment) or combine (exactly
 * one) call; never exposed before {@link #finish()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Mirror every source track, in source order, with zeroed counters.</li>
 *   <li>Route appended samples from a source track id to its destination track.</li>
 *   <li>Finish exactly once, and only when at least one sample was appended.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
final class OutputContainerBuilder {
  private final ContainerWriter writer;
  private final Map<Long, Long> destinationTrackIds = new LinkedHashMap<>();
  private long sampleCount;
  private boolean finished;

  /**
   * Creates a builder and mirrors {@code sourceTracks} into {@code writer}.
   *
   * @param writer fresh destination writer
   * @param sourceTracks source tracks in file order
   */
  OutputContainerBuilder(ContainerWriter writer, List<TrackDescriptor> sourceTracks) {
    this.writer = Objects.requireNonNull(writer, "writer");
    for (TrackDescriptor track : Objects.requireNonNull(sourceTracks, "sourceTracks")) {
      long destination = writer.addTrack(track.withZeroCounters());
      destinationTrackIds.put(track.trackId(), destination);
    }
  }

  /**
   * Appends a sample to the destination track mirroring {@code sourceTrackId}.
   *
   * @param sourceTrackId source track identifier
   * @param sample owned, already rebased sample
   * @throws IllegalStateException if the builder was already finished
   * @throws IllegalArgumentException if the source track was never mirrored
   */
  void append(long sourceTrackId, SampleRecord sample) {
    if (finished) {
      throw new IllegalStateException("container already finished");
    }
    Long destination = destinationTrackIds.get(sourceTrackId);
    if (destination == null) {
      throw new IllegalArgumentException("unknown source track " + sourceTrackId);
    }
    writer.addSample(destination, sample);
    sampleCount++;
  }

  boolean isEmpty() {
    return sampleCount == 0;
  }

  long sampleCount() {
    return sampleCount;
  }

  /**
   * Serializes the container.
   *
   * @return finished container bytes
   * @throws IOException if the writer fails
   * @throws IllegalStateException if called twice or on an empty builder
   */
  byte[] finish() throws IOException {
    if (finished) {
      throw new IllegalStateException("container already finished");
    }
    if (isEmpty()) {
      throw new IllegalStateException("empty containers are discarded, not finished");
    }
    finished = true;
    return writer.finish();
  }
}

package ca.gc.cra.clipstitch.application.port;

import ca.gc.cra.clipstitch.domain.media.SampleRecord;
import ca.gc.cra.clipstitch.domain.media.TrackDescriptor;
import java.io.IOException;

/**
 * <strong>What:</strong> Builder for one destination container.
 * <p><strong>Role:</strong> Created by {@link ContainerFormat#newContainer()}; wrapped by the engines'
 * {@code OutputContainerBuilder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Add tracks that preserve the descriptor's codec configuration byte for byte.</li>
 *   <li>Accumulate samples per track in append order.</li>
 *   <li>Serialize the container exactly once.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ContainerWriter {
  /**
   * Adds a track mirroring {@code descriptor}.
   *
   * @param descriptor source descriptor, typically with zeroed counters
   * @return identifier of the new destination track
   */
  long addTrack(TrackDescriptor descriptor);

  /**
   * Appends one sample to a destination track.
   *
   * @param trackId identifier returned by {@link #addTrack(TrackDescriptor)}
   * @param sample owned sample record
   * @throws IllegalArgumentException if the track is unknown
   */
  void addSample(long trackId, SampleRecord sample);

  /**
   * Serializes the container.
   *
   * @return finished container bytes
   * @throws IOException if serialization fails
   */
  byte[] finish() throws IOException;
}

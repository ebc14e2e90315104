package ca.gc.cra.clipstitch.application.port;

import ca.gc.cra.clipstitch.domain.media.ContainerInfo;
import ca.gc.cra.clipstitch.domain.media.SampleView;
import java.util.Iterator;

/**
 * <strong>What:</strong> Parsed view over one source container.
 * <p><strong>Role:</strong> Created by {@link ContainerFormat#open(byte[])}; owned by a single cut or combine
 * call.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report movie duration, timescale and tracks in file order.</li>
 *   <li>Stream each track's samples in on-disk order; exhaustion of the iterator is the completion
 *   signal for that track.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 * <p><strong>Performance:</strong> Iterators are lazy; the {@link SampleView} handed out may reuse one
 * buffer, so callers copy before the next {@code next()} call.</p>
 *
 * @since 0.1.0
 */
public interface ContainerReader extends AutoCloseable {
  /**
   * Returns container-level metadata.
   *
   * @return container metadata
   */
  ContainerInfo info();

  /**
   * Streams the samples of one track. Malformed sample data surfaces from the iterator as
   * {@link SampleReadException}.
   *
   * @param trackId identifier reported by {@link #info()}
   * @return lazy, finite iterator of transient sample views
   * @throws IllegalArgumentException if the track is unknown
   */
  Iterator<SampleView> samples(long trackId);

  /**
   * Releases parser resources. Never throws a checked exception.
   */
  @Override
  void close();
}

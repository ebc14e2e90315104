package ca.gc.cra.clipstitch.domain.media;

import java.util.List;
import java.util.Objects;

/**
 * Container-level metadata reported by a reader: movie duration, movie timescale and tracks in file order.
 *
 * @param duration movie duration in {@code timescale} ticks
 * @param timescale movie timescale in ticks per second
 * @param tracks tracks in on-disk order; copied into an immutable list
 * @since 0.1.0
 */
public record ContainerInfo(long duration, long timescale, List<TrackDescriptor> tracks) {

  public ContainerInfo {
    tracks = List.copyOf(Objects.requireNonNull(tracks, "tracks"));
  }

  /**
   * Returns the duration in seconds for display purposes only.
   *
   * @return duration in seconds, {@code 0} when the timescale is not positive
   */
  public double durationSeconds() {
    return timescale <= 0 ? 0d : (double) duration / timescale;
  }

}

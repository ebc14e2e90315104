package ca.gc.cra.clipstitch.domain.media;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable description of one elementary stream inside a container.
 * <p><strong>Why:</strong> Destination tracks are mirrored from source tracks, so everything needed to
 * rebuild a track (timescale, handler, codec configuration) travels in one value.</p>
 * <p><strong>Role:</strong> Domain value produced by {@code ContainerReader} and consumed by
 * {@code ContainerWriter}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the codec configuration is cloned on the way in and out.</p>
 *
 * @param trackId identifier of the track within its container; positive
 * @param mediaType elementary stream category
 * @param handler raw four-character handler type ({@code vide}, {@code soun}, ...)
 * @param timescale ticks per second for every timestamp of this track; positive
 * @param codecConfig opaque sample description payload, copied verbatim between containers
 * @param sampleCount number of samples carried by the track
 * @param duration track duration in {@code timescale} ticks
 * @param language ISO-639-2/T language code, {@code "und"} when unknown
 * @param width presentation width in pixels, {@code 0} for non-visual tracks
 * @param height presentation height in pixels, {@code 0} for non-visual tracks
 * @since 0.1.0
 */
public record TrackDescriptor(
    long trackId,
    MediaType mediaType,
    String handler,
    long timescale,
    byte[] codecConfig,
    long sampleCount,
    long duration,
    String language,
    double width,
    double height) {

  /**
   * Validates identifiers and clones the codec payload.
   *
   * @throws IllegalArgumentException if the track id or timescale is not positive
   */
  public TrackDescriptor {
    if (trackId <= 0) {
      throw new IllegalArgumentException("trackId must be positive (was " + trackId + ")");
    }
    if (timescale <= 0) {
      throw new IllegalArgumentException("timescale must be positive (was " + timescale + ")");
    }
    mediaType = Objects.requireNonNullElse(mediaType, MediaType.OTHER);
    handler = handler == null ? mediaType.handler() : handler;
    codecConfig = codecConfig != null ? codecConfig.clone() : new byte[0];
    language = language == null || language.isBlank() ? "und" : language;
  }

  /**
   * Returns a copy of the codec configuration payload.
   *
   * @return codec configuration bytes; caller owns the array
   */
  @Override
  public byte[] codecConfig() {
    return codecConfig.clone();
  }

  /**
   * Returns the mirrored descriptor used for a destination track: same identity and codec
   * configuration, sample count and duration reset to zero.
   *
   * @return descriptor with zeroed counters
   */
  public TrackDescriptor withZeroCounters() {
    return new TrackDescriptor(
        trackId, mediaType, handler, timescale, codecConfig, 0, 0, language, width, height);
  }

  /**
   * Returns a copy of this descriptor carrying a different track identifier.
   *
   * @param newTrackId identifier assigned by the destination container
   * @return re-identified descriptor
   */
  public TrackDescriptor withTrackId(long newTrackId) {
    return new TrackDescriptor(
        newTrackId, mediaType, handler, timescale, codecConfig, sampleCount, duration, language, width, height);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TrackDescriptor that)) {
      return false;
    }
    return trackId == that.trackId
        && timescale == that.timescale
        && sampleCount == that.sampleCount
        && duration == that.duration
        && Double.compare(width, that.width) == 0
        && Double.compare(height, that.height) == 0
        && mediaType == that.mediaType
        && Objects.equals(handler, that.handler)
        && Objects.equals(language, that.language)
        && Arrays.equals(codecConfig, that.codecConfig);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(trackId, mediaType, handler, timescale, sampleCount, duration, language, width, height);
    result = 31 * result + Arrays.hashCode(codecConfig);
    return result;
  }

  @Override
  public String toString() {
    return "TrackDescriptor{"
        + "trackId=" + trackId
        + ", mediaType=" + mediaType
        + ", handler='" + handler + '\''
        + ", timescale=" + timescale
        + ", codecConfigBytes=" + codecConfig.length
        + ", sampleCount=" + sampleCount
        + ", duration=" + duration
        + ", language='" + language + '\''
        + ", width=" + width
        + ", height=" + height
        + '}';
  }
}

package ca.gc.cra.clipstitch.domain.media;

import java.nio.ByteBuffer;

/**
 * Transient, read-only view of one access unit as handed out by a container reader.
 *
 * <p>The payload buffer belongs to the reader and is only valid until the owning iterator advances.
 * Anything that must outlive that window goes through {@link SampleRecord#copyOf(SampleView)}.</p>
 *
 * @since 0.1.0
 */
public interface SampleView {
  /**
   * Returns the decoding timestamp in track ticks.
   *
   * @return decoding timestamp
   */
  long dts();

  /**
   * Returns the composition timestamp in track ticks.
   *
   * @return composition timestamp
   */
  long cts();

  /**
   * Returns the sample duration in track ticks.
   *
   * @return duration
   */
  long duration();

  /**
   * Indicates whether the sample is a sync sample (keyframe).
   *
   * @return {@code true} for sync samples
   */
  boolean sync();

  /**
   * Returns the payload positioned at its first byte; may alias reader-owned memory.
   *
   * @return read-only payload buffer
   */
  ByteBuffer payload();
}

package ca.gc.cra.clipstitch.domain.media;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> One access unit with its timing metadata and an exclusively owned payload.
 * <p><strong>Why:</strong> Readers may reuse their decode buffers between samples; a record never
 * references reader memory, so it can be queued until its destination container is finished.</p>
 * <p><strong>Role:</strong> Domain value flowing from the segmentation and concatenation engines into
 * {@code ContainerWriter}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; payload cloned on construction and access.</p>
 * <p><strong>Performance:</strong> One payload copy per record; use {@link #payloadView()} to read
 * without copying again.</p>
 *
 * @param dts decoding timestamp in track ticks
 * @param cts composition timestamp in track ticks
 * @param duration sample duration in track ticks; never negative
 * @param sync whether this is a sync sample (keyframe)
 * @param payload encoded sample bytes; defensively copied
 * @since 0.1.0
 */
public record SampleRecord(long dts, long cts, long duration, boolean sync, byte[] payload) {

  /**
   * Validates the duration and clones the payload.
   *
   * @throws IllegalArgumentException if {@code duration} is negative
   */
  public SampleRecord {
    if (duration < 0) {
      throw new IllegalArgumentException("duration must not be negative (was " + duration + ")");
    }
    payload = payload != null ? payload.clone() : new byte[0];
  }

  /**
   * Takes an independent copy of a reader-owned sample.
   *
   * @param view transient sample view; must not be {@code null}
   * @return record owning a fresh copy of the payload
   */
  public static SampleRecord copyOf(SampleView view) {
    Objects.requireNonNull(view, "view");
    ByteBuffer source = view.payload().duplicate();
    byte[] copy = new byte[source.remaining()];
    source.get(copy);
    return new SampleRecord(view.dts(), view.cts(), view.duration(), view.sync(), copy);
  }

  /**
   * Returns a copy of this record with both timestamps shifted by {@code delta} ticks.
   *
   * @param delta signed offset in track ticks
   * @return shifted record
   * @throws ArithmeticException if a timestamp overflows
   */
  public SampleRecord shift(long delta) {
    return new SampleRecord(
        Math.addExact(dts, delta), Math.addExact(cts, delta), duration, sync, payload);
  }

  /**
   * Returns the payload size in bytes.
   *
   * @return payload length
   */
  public int size() {
    return payload.length;
  }

  /**
   * Returns a copy of the payload.
   *
   * @return payload bytes; caller owns the array
   */
  @Override
  public byte[] payload() {
    return payload.clone();
  }

  /**
   * Returns a read-only view over the owned payload without copying.
   *
   * @return read-only buffer positioned at the first byte
   */
  public ByteBuffer payloadView() {
    return ByteBuffer.wrap(payload).asReadOnlyBuffer();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SampleRecord that)) {
      return false;
    }
    return dts == that.dts
        && cts == that.cts
        && duration == that.duration
        && sync == that.sync
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(dts);
    result = 31 * result + Long.hashCode(cts);
    result = 31 * result + Long.hashCode(duration);
    result = 31 * result + Boolean.hashCode(sync);
    result = 31 * result + Arrays.hashCode(payload);
    return result;
  }

  @Override
  public String toString() {
    return "SampleRecord{"
        + "dts=" + dts
        + ", cts=" + cts
        + ", duration=" + duration
        + ", sync=" + sync
        + ", size=" + payload.length
        + '}';
  }
}

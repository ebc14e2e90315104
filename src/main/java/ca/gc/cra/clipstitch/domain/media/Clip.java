package ca.gc.cra.clipstitch.domain.media;

import java.util.Arrays;
import java.util.Objects;

/**
 * One finished output container produced by a cut, with its deterministic name.
 *
 * @param name clip name such as {@code clip_01}; the caller picks any file extension
 * @param data finished container bytes; defensively copied
 * @since 0.1.0
 */
public record Clip(String name, byte[] data) {

  public Clip {
    Objects.requireNonNull(name, "name");
    data = data != null ? data.clone() : new byte[0];
  }

  /**
   * Returns a copy of the container bytes.
   *
   * @return container bytes; caller owns the array
   */
  @Override
  public byte[] data() {
    return data.clone();
  }

  /**
   * Returns the container size in bytes.
   *
   * @return byte count
   */
  public int size() {
    return data.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Clip that)) {
      return false;
    }
    return name.equals(that.name) && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "Clip{name='" + name + "', size=" + data.length + '}';
  }
}

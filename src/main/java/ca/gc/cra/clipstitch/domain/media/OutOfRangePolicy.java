package ca.gc.cra.clipstitch.domain.media;

import java.util.Locale;

/**
 * Treatment of samples whose decoding timestamp falls outside every planned segment window.
 *
 * <p>This happens for samples stamped before zero or past the reported movie duration, typically
 * audio priming or a movie header that rounds the duration down.</p>
 *
 * @since 0.1.0
 */
public enum OutOfRangePolicy {
  /** Discard the sample, count it and report the total once extraction completes. */
  DROP,
  /** Place trailing samples in the final segment; samples before zero are still dropped. */
  CLAMP,
  /** Abort the cut with {@link InvalidContainerException}. */
  FAIL;

  /**
   * Parses a policy name case-insensitively.
   *
   * @param raw policy name; blank values return {@code defaultValue}
   * @param defaultValue fallback policy
   * @return parsed policy
   * @throws IllegalArgumentException if the name is not a known policy
   */
  public static OutOfRangePolicy parse(String raw, OutOfRangePolicy defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return OutOfRangePolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("outOfRange must be DROP, CLAMP or FAIL (was " + raw + ")", ex);
    }
  }
}

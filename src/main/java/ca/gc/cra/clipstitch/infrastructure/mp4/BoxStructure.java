package ca.gc.cra.clipstitch.infrastructure.mp4;

import ca.gc.cra.clipstitch.domain.media.InvalidContainerException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;

/**
 * Bounds check of ISO box headers, run before a buffer is handed to mp4parser.
 *
 * <p>mp4parser allocates whatever size a box header declares, so arbitrary bytes read as a header can
 * demand gigabytes. Top-level boxes and the {@code moov} container chain must each fit inside their
 * parent; box contents are not inspected.</p>
 */
final class BoxStructure {
  private static final Set<String> CONTAINERS =
      Set.of("moov", "trak", "mdia", "minf", "stbl", "edts", "dinf", "mvex");
  private static final int MAX_DEPTH = 8;
  private static final int HEADER = 8;
  private static final int LARGE_HEADER = 16;

  private BoxStructure() {
    // Utility
  }

  /**
   * Verifies that every checked box fits its parent and that a movie box is present.
   *
   * @param bytes complete container bytes
   * @throws InvalidContainerException if a header is truncated, declares an impossible size, or no
   *     {@code moov} box exists at the top level
   */
  static void requireWellFormed(byte[] bytes) throws InvalidContainerException {
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    Set<String> topLevel = walk(buffer, 0, bytes.length, 0);
    if (!topLevel.contains("moov")) {
      throw new InvalidContainerException("Invalid video file: no movie box (moov) found");
    }
  }

  private static Set<String> walk(ByteBuffer buffer, long start, long end, int depth)
      throws InvalidContainerException {
    Set<String> types = new HashSet<>();
    long offset = start;
    while (offset < end) {
      long remaining = end - offset;
      if (remaining < HEADER) {
        if (isZeroPadding(buffer, offset, end)) {
          break;
        }
        throw new InvalidContainerException("Invalid video file: truncated box header at offset " + offset);
      }
      int at = (int) offset;
      long size = Integer.toUnsignedLong(buffer.getInt(at));
      String type = fourCc(buffer, at + 4);
      long header = HEADER;
      if (size == 1) {
        if (remaining < LARGE_HEADER) {
          throw new InvalidContainerException("Invalid video file: truncated box header at offset " + offset);
        }
        size = buffer.getLong(at + HEADER);
        header = LARGE_HEADER;
      } else if (size == 0) {
        size = remaining;
      }
      if (size < header || size > remaining) {
        throw new InvalidContainerException("Invalid video file: box '" + type + "' at offset " + offset
            + " declares " + size + " byte(s), " + remaining + " available");
      }
      if (CONTAINERS.contains(type) && depth < MAX_DEPTH) {
        walk(buffer, offset + header, offset + size, depth + 1);
      }
      types.add(type);
      offset += size;
    }
    return types;
  }

  private static boolean isZeroPadding(ByteBuffer buffer, long from, long to) {
    for (long i = from; i < to; i++) {
      if (buffer.get((int) i) != 0) {
        return false;
      }
    }
    return true;
  }

  private static String fourCc(ByteBuffer buffer, int at) {
    byte[] raw = new byte[4];
    for (int i = 0; i < raw.length; i++) {
      byte b = buffer.get(at + i);
      raw[i] = b >= 0x20 && b < 0x7F ? b : (byte) '?';
    }
    return new String(raw, StandardCharsets.US_ASCII);
  }
}

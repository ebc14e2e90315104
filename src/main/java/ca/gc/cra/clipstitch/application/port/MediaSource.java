package ca.gc.cra.clipstitch.application.port;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Lazily read source container for concatenation.
 *
 * <p>Reading is where fetching happens (local disk here, anything else for other implementations);
 * failures propagate as {@link IOException} and retry policy belongs to the caller.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface MediaSource {
  /**
   * Reads the full container.
   *
   * @return container bytes
   * @throws IOException if the bytes cannot be obtained
   */
  byte[] read() throws IOException;

  /**
   * Returns a human-readable label for logs.
   *
   * @return description of the source
   */
  default String describe() {
    return "in-memory";
  }

  /**
   * Wraps an in-memory buffer. The buffer is copied so later caller mutations are not observed.
   *
   * @param bytes container bytes
   * @return source returning a copy of {@code bytes}
   */
  static MediaSource ofBytes(byte[] bytes) {
    byte[] copy = Objects.requireNonNull(bytes, "bytes").clone();
    return () -> copy.clone();
  }

  /**
   * Reads a container from the filesystem on demand.
   *
   * @param path container file
   * @return source reading {@code path}
   */
  static MediaSource ofPath(Path path) {
    Objects.requireNonNull(path, "path");
    return new MediaSource() {
      @Override
      public byte[] read() throws IOException {
        return Files.readAllBytes(path);
      }

      @Override
      public String describe() {
        return path.toString();
      }
    };
  }
}

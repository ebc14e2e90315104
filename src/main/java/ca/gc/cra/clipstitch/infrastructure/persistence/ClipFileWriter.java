package ca.gc.cra.clipstitch.infrastructure.persistence;

import ca.gc.cra.clipstitch.domain.media.Clip;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists finished containers to disk.
 *
 * <p>Each file is written to a sibling temporary file and moved into place, so a failed run never leaves a
 * truncated {@code .mp4} behind. Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ClipFileWriter {
  private static final Logger log = LoggerFactory.getLogger(ClipFileWriter.class);

  /** File extension appended to clip names. */
  public static final String EXTENSION = ".mp4";

  private final boolean allowOverwrite;

  /**
   * Creates a writer.
   *
   * @param allowOverwrite whether existing files may be replaced
   */
  public ClipFileWriter(boolean allowOverwrite) {
    this.allowOverwrite = allowOverwrite;
  }

  /**
   * Writes each clip as {@code <name>.mp4} inside {@code directory}.
   *
   * @param directory existing output directory
   * @param clips clips in output order
   * @return written paths in the same order
   * @throws IOException if any file cannot be written
   */
  public List<Path> writeClips(Path directory, List<Clip> clips) throws IOException {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(clips, "clips");
    List<Path> written = new ArrayList<>(clips.size());
    for (Clip clip : clips) {
      Path target = directory.resolve(clip.name() + EXTENSION);
      write(target, clip.data());
      written.add(target);
    }
    return written;
  }

  /**
   * Writes one container.
   *
   * @param target destination file
   * @param data container bytes
   * @throws IOException if the file exists and overwriting is disabled, or the write fails
   */
  public void write(Path target, byte[] data) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(data, "data");
    Path parent = target.toAbsolutePath().getParent();
    if (!allowOverwrite && Files.exists(target)) {
      throw new IOException("refusing to overwrite existing file " + target);
    }
    Path temp = Files.createTempFile(parent, "." + target.getFileName(), ".part");
    try {
      Files.write(temp, data, StandardOpenOption.TRUNCATE_EXISTING);
      if (allowOverwrite) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } else {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
    log.debug("Wrote {} ({} bytes)", target, data.length);
  }
}

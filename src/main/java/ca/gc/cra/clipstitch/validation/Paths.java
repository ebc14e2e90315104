package ca.gc.cra.clipstitch.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for CLI inputs and outputs.
 * <p><strong>Why:</strong> Clips and combined files are written next to user data; existing files are never
 * replaced unless the operator passes {@code --allow-overwrite}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve readable source files.</li>
 *   <li>Create or reuse output directories for clips.</li>
 *   <li>Check the parent of a single output file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked output is treated as a
 * file to protect, not followed.
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a readable regular file.
   *
   * @param path candidate file
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the file is missing, unreadable or not a regular file
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("input file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input file is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an existing readable directory.
   *
   * @param path candidate directory
   * @return absolute, normalized path
   */
  public static Path validateReadableDir(Path path) {
    Path normalized = normalize(path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("input directory does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input directory is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates a writable directory, optionally creating it.
   *
   * @param path candidate directory
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @param allowReuse when {@code false}, existing non-empty directories are rejected
   * @return real path when the directory exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the directory cannot be used
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    Path normalized = normalize(path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException("directory does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      if (!Files.isDirectory(real, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      if (!allowReuse) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(real)) {
          if (entries.iterator().hasNext()) {
            throw new IllegalArgumentException(
                "directory " + real + " is not empty; re-run with --allow-overwrite to reuse");
          }
        }
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates the target of a single output file.
   *
   * @param path candidate file
   * @param allowOverwrite whether an existing regular file may be replaced
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the parent is not a writable directory or the file exists
   */
  public static Path validateWritableFile(Path path, boolean allowOverwrite) {
    Path normalized = normalize(path);
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException("output directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("output directory is not writable: " + parent);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            "output file " + normalized + " exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isRegularFile(normalized, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("output path is not a regular file: " + normalized);
      }
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.isEmpty()) {
      throw new IllegalArgumentException("path must not be empty");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}

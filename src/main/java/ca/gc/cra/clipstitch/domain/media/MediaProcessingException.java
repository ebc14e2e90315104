package ca.gc.cra.clipstitch.domain.media;

import java.util.Objects;

/**
 * Base class for typed failures of a cut or combine operation.
 *
 * <p>Every subclass aborts the whole operation; no partial output accompanies it.</p>
 *
 * @since 0.1.0
 */
public abstract class MediaProcessingException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  protected MediaProcessingException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected MediaProcessingException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return error kind
   */
  public ErrorKind kind() {
    return kind;
  }
}

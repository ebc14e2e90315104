package ca.gc.cra.clipstitch.domain.media;

/**
 * Raised when input bytes cannot be parsed as a container, or the container carries no tracks.
 *
 * @since 0.1.0
 */
public final class InvalidContainerException extends MediaProcessingException {
  private static final long serialVersionUID = 1L;

  public InvalidContainerException(String message) {
    super(ErrorKind.INVALID_CONTAINER, message);
  }

  public InvalidContainerException(String message, Throwable cause) {
    super(ErrorKind.INVALID_CONTAINER, message, cause);
  }
}

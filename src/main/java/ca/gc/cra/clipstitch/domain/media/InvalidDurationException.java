package ca.gc.cra.clipstitch.domain.media;

/**
 * Raised when a source reports a non-positive duration or the requested segmentation cannot be planned.
 *
 * @since 0.1.0
 */
public final class InvalidDurationException extends MediaProcessingException {
  private static final long serialVersionUID = 1L;

  public InvalidDurationException(String message) {
    super(ErrorKind.INVALID_DURATION, message);
  }

  public InvalidDurationException(String message, Throwable cause) {
    super(ErrorKind.INVALID_DURATION, message, cause);
  }
}

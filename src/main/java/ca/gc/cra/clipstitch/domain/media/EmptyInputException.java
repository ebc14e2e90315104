package ca.gc.cra.clipstitch.domain.media;

/**
 * Raised when concatenation is invoked without any source.
 *
 * @since 0.1.0
 */
public final class EmptyInputException extends MediaProcessingException {
  private static final long serialVersionUID = 1L;

  public EmptyInputException(String message) {
    super(ErrorKind.EMPTY_INPUT, message);
  }

  public EmptyInputException(String message, Throwable cause) {
    super(ErrorKind.EMPTY_INPUT, message, cause);
  }
}

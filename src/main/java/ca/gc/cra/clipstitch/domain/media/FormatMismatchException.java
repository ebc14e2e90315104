package ca.gc.cra.clipstitch.domain.media;

/**
 * Raised when a concatenation source disagrees with the first source on track layout or timescale.
 *
 * @since 0.1.0
 */
public final class FormatMismatchException extends MediaProcessingException {
  private static final long serialVersionUID = 1L;

  public FormatMismatchException(String message) {
    super(ErrorKind.FORMAT_MISMATCH, message);
  }

  public FormatMismatchException(String message, Throwable cause) {
    super(ErrorKind.FORMAT_MISMATCH, message, cause);
  }
}

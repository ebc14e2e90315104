package ca.gc.cra.clipstitch.domain.media;

/**
 * Raised when processing completed but every destination container stayed empty.
 *
 * @since 0.1.0
 */
public final class ExtractionFailureException extends MediaProcessingException {
  private static final long serialVersionUID = 1L;

  public ExtractionFailureException(String message) {
    super(ErrorKind.EXTRACTION_FAILURE, message);
  }

  public ExtractionFailureException(String message, Throwable cause) {
    super(ErrorKind.EXTRACTION_FAILURE, message, cause);
  }
}

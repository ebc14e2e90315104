package ca.gc.cra.clipstitch.application.port;

/**
 * Unchecked failure raised by a {@link ContainerReader} sample iterator when sample data or sample tables
 * turn out to be malformed after the container header parsed cleanly.
 *
 * <p>Engines translate it into {@link ca.gc.cra.clipstitch.domain.media.InvalidContainerException}.</p>
 *
 * @since 0.1.0
 */
public final class SampleReadException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public SampleReadException(String message, Throwable cause) {
    super(message, cause);
  }
}

package ca.gc.cra.clipstitch.domain.media;

/**
 * Failure categories reported by the segmentation and concatenation engines.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** Input could not be parsed or carries no tracks. */
  INVALID_CONTAINER,
  /** Source duration is not positive, or the requested segmentation is unusable. */
  INVALID_DURATION,
  /** Processing finished without producing any usable output. */
  EXTRACTION_FAILURE,
  /** Concatenation was asked to combine nothing. */
  EMPTY_INPUT,
  /** Sources disagree on track layout or timescale. */
  FORMAT_MISMATCH
}

package ca.gc.cra.clipstitch.application.port;

import ca.gc.cra.clipstitch.domain.media.InvalidContainerException;

/**
 * <strong>What:</strong> Domain port for the container parser/writer consumed by the engines.
 * <p><strong>Why:</strong> Box-level ISOBMFF decoding is independently testable and swappable; the engines
 * only need metadata, a sample stream and a way to build a fresh container.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as
 * {@link ca.gc.cra.clipstitch.infrastructure.mp4.IsoContainerFormat}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hand out a fresh {@link ContainerReader} per parsed buffer.</li>
 *   <li>Hand out a fresh {@link ContainerWriter} per destination container.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe to share; the readers and writers they
 * create are confined to one operation and never shared.</p>
 *
 * @since 0.1.0
 */
public interface ContainerFormat {
  /**
   * Parses a container buffer.
   *
   * @param source container bytes; the adapter works on its own copy and never mutates the argument
   * @return reader positioned before the first sample of every track
   * @throws InvalidContainerException if the bytes are not a parseable container
   */
  ContainerReader open(byte[] source) throws InvalidContainerException;

  /**
   * Creates an empty destination container.
   *
   * @return writer with no tracks
   */
  ContainerWriter newContainer();
}

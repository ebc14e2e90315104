package ca.gc.cra.clipstitch.infrastructure.mp4;

import ca.gc.cra.clipstitch.application.port.ContainerFormat;
import ca.gc.cra.clipstitch.application.port.ContainerReader;
import ca.gc.cra.clipstitch.application.port.ContainerWriter;
import ca.gc.cra.clipstitch.domain.media.InvalidContainerException;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link ContainerFormat} for ISO base media files (MP4, M4A, MOV-compatible) backed
 * by the mp4parser library.
 * <p><strong>Role:</strong> Infrastructure adapter selected by the composition root.</p>
 * <p><strong>Thread-safety:</strong> Stateless; readers and writers it creates are not shared.</p>
 *
 * @since 0.1.0
 */
public final class IsoContainerFormat implements ContainerFormat {

  @Override
  public ContainerReader open(byte[] source) throws InvalidContainerException {
    Objects.requireNonNull(source, "source");
    return IsoContainerReader.parse(source.clone());
  }

  @Override
  public ContainerWriter newContainer() {
    return new IsoContainerWriter();
  }
}

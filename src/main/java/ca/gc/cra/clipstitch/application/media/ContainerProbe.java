package ca.gc.cra.clipstitch.application.media;

import ca.gc.cra.clipstitch.application.port.ContainerFormat;
import ca.gc.cra.clipstitch.application.port.ContainerReader;
import ca.gc.cra.clipstitch.domain.media.ContainerInfo;
import ca.gc.cra.clipstitch.domain.media.InvalidContainerException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports container metadata without touching any sample.
 *
 * @since 0.1.0
 */
public final class ContainerProbe {
  private static final Logger log = LoggerFactory.getLogger(ContainerProbe.class);

  private final ContainerFormat format;

  public ContainerProbe(ContainerFormat format) {
    this.format = Objects.requireNonNull(format, "format");
  }

  /**
   * Parses {@code source} and returns its movie header and track list.
   *
   * @param source container bytes; not modified
   * @return container metadata
   * @throws InvalidContainerException if the bytes cannot be parsed or contain no tracks
   */
  public ContainerInfo probe(byte[] source) throws InvalidContainerException {
    Objects.requireNonNull(source, "source");
    try (ContainerReader reader = format.open(source.clone())) {
      ContainerInfo info = reader.info();
      if (info.tracks().isEmpty()) {
        throw new InvalidContainerException("Invalid video file: no tracks found");
      }
      log.debug("Probed {} track(s), {}s", info.tracks().size(), info.durationSeconds());
      return info;
    }
  }
}

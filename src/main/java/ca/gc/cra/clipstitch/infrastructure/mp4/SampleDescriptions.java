package ca.gc.cra.clipstitch.infrastructure.mp4;

import com.coremedia.iso.IsoFile;
import com.coremedia.iso.boxes.SampleDescriptionBox;
import com.googlecode.mp4parser.MemoryDataSourceImpl;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.util.List;

/**
 * Converts between a track's {@code stsd} box and the opaque codec configuration carried by
 * {@link ca.gc.cra.clipstitch.domain.media.TrackDescriptor}.
 *
 * <p>The configuration is the serialized box itself, so sample entries (avcC, esds, ...) travel byte for
 * byte from source to destination.</p>
 */
final class SampleDescriptions {
  private SampleDescriptions() {
    // Utility
  }

  static byte[] serialize(SampleDescriptionBox box) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(Integer.MAX_VALUE, box.getSize()));
    box.getBox(Channels.newChannel(out));
    return out.toByteArray();
  }

  /**
   * Parses a serialized {@code stsd} box into a fresh, parent-less instance.
   *
   * @param codecConfig bytes produced by {@link #serialize(SampleDescriptionBox)}
   * @return new box instance
   * @throws IOException if the bytes do not hold exactly one {@code stsd} box
   */
  static SampleDescriptionBox parse(byte[] codecConfig) throws IOException {
    if (codecConfig == null || codecConfig.length == 0) {
      throw new IOException("Track has no sample description");
    }
    // Memory backed; the parsed box keeps reading from the buffer lazily, so the IsoFile stays open.
    IsoFile holder = new IsoFile(new MemoryDataSourceImpl(codecConfig.clone()));
    List<SampleDescriptionBox> boxes = holder.getBoxes(SampleDescriptionBox.class);
    if (boxes.size() != 1) {
      throw new IOException("Expected one stsd box in codec configuration, found " + boxes.size());
    }
    return boxes.get(0);
  }
}

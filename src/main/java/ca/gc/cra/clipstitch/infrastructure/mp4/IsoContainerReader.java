package ca.gc.cra.clipstitch.infrastructure.mp4;

import ca.gc.cra.clipstitch.application.port.ContainerReader;
import ca.gc.cra.clipstitch.application.port.SampleReadException;
import ca.gc.cra.clipstitch.domain.media.ContainerInfo;
import ca.gc.cra.clipstitch.domain.media.InvalidContainerException;
import ca.gc.cra.clipstitch.domain.media.MediaType;
import ca.gc.cra.clipstitch.domain.media.SampleView;
import ca.gc.cra.clipstitch.domain.media.TrackDescriptor;
import com.coremedia.iso.IsoFile;
import com.coremedia.iso.boxes.CompositionTimeToSample;
import com.coremedia.iso.boxes.MovieBox;
import com.coremedia.iso.boxes.MovieHeaderBox;
import com.coremedia.iso.boxes.TrackBox;
import com.googlecode.mp4parser.MemoryDataSourceImpl;
import com.googlecode.mp4parser.authoring.Mp4TrackImpl;
import com.googlecode.mp4parser.authoring.Sample;
import com.googlecode.mp4parser.authoring.Track;
import com.googlecode.mp4parser.authoring.TrackMetaData;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ContainerReader} over a progressive (non-fragmented) ISO base media file.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read duration and timescale from {@code mvhd}, one {@link TrackDescriptor} per {@code trak}.</li>
 *   <li>Derive DTS from cumulative {@code stts} durations, CTS from {@code ctts} offsets and sync flags
 *   from {@code stss} (every sample is sync when the box is absent).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Iterators reuse one view object per track.</p>
 * <p><strong>Performance:</strong> Sample payloads are sliced from the in-memory source on demand.</p>
 *
 * @since 0.1.0
 */
final class IsoContainerReader implements ContainerReader {
  private static final Logger log = LoggerFactory.getLogger(IsoContainerReader.class);

  private final IsoFile isoFile;
  private final ContainerInfo info;
  private final Map<Long, Track> tracks;

  private IsoContainerReader(IsoFile isoFile, ContainerInfo info, Map<Long, Track> tracks) {
    this.isoFile = isoFile;
    this.info = info;
    this.tracks = tracks;
  }

  /**
   * Parses an owned buffer.
   *
   * @param bytes container bytes owned by the reader from now on
   * @return reader
   * @throws InvalidContainerException if the buffer is not a readable ISO base media file
   */
  static IsoContainerReader parse(byte[] bytes) throws InvalidContainerException {
    BoxStructure.requireWellFormed(bytes);
    IsoFile isoFile;
    try {
      isoFile = new IsoFile(new MemoryDataSourceImpl(bytes));
    } catch (IOException | RuntimeException ex) {
      throw new InvalidContainerException("Invalid video file: " + describe(ex), ex);
    }
    try {
      MovieBox moov = isoFile.getMovieBox();
      if (moov == null || moov.getMovieHeaderBox() == null) {
        throw new InvalidContainerException("Invalid video file: no movie header (moov/mvhd) found");
      }
      MovieHeaderBox mvhd = moov.getMovieHeaderBox();
      Map<Long, Track> tracks = new LinkedHashMap<>();
      List<TrackDescriptor> descriptors = new ArrayList<>();
      for (TrackBox trackBox : moov.getBoxes(TrackBox.class)) {
        long trackId = trackBox.getTrackHeaderBox().getTrackId();
        Track track = new Mp4TrackImpl("track-" + trackId, trackBox);
        if (tracks.putIfAbsent(trackId, track) != null) {
          throw new InvalidContainerException("Invalid video file: duplicate track id " + trackId);
        }
        descriptors.add(describe(trackId, track));
      }
      ContainerInfo info = new ContainerInfo(mvhd.getDuration(), mvhd.getTimescale(), descriptors);
      log.debug("Parsed container: {} track(s), duration {} at timescale {}",
          descriptors.size(), info.duration(), info.timescale());
      return new IsoContainerReader(isoFile, info, tracks);
    } catch (InvalidContainerException ex) {
      closeAfterFailure(isoFile);
      throw ex;
    } catch (IOException | RuntimeException ex) {
      closeAfterFailure(isoFile);
      throw new InvalidContainerException("Invalid video file: " + describe(ex), ex);
    }
  }

  private static TrackDescriptor describe(long trackId, Track track) throws IOException {
    TrackMetaData meta = track.getTrackMetaData();
    long[] durations = track.getSampleDurations();
    long total = 0;
    for (long d : durations) {
      total = Math.addExact(total, d);
    }
    String handler = track.getHandler();
    return new TrackDescriptor(
        trackId,
        MediaType.fromHandler(handler),
        handler,
        meta.getTimescale(),
        SampleDescriptions.serialize(track.getSampleDescriptionBox()),
        durations.length,
        total,
        meta.getLanguage(),
        meta.getWidth(),
        meta.getHeight());
  }

  @Override
  public ContainerInfo info() {
    return info;
  }

  @Override
  public Iterator<SampleView> samples(long trackId) {
    Track track = tracks.get(trackId);
    if (track == null) {
      throw new IllegalArgumentException("unknown track " + trackId);
    }
    return new TrackSampleIterator(trackId, track);
  }

  @Override
  public void close() {
    try {
      isoFile.close();
    } catch (IOException ex) {
      log.warn("Failed to release parsed container", ex);
    }
  }

  private static void closeAfterFailure(IsoFile isoFile) {
    try {
      isoFile.close();
    } catch (IOException suppressed) {
      log.debug("Ignoring close failure after parse error", suppressed);
    }
  }

  private static String describe(Exception ex) {
    return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
  }

  /** Walks one track's sample tables in lockstep with its sample list. */
  private static final class TrackSampleIterator implements Iterator<SampleView> {
    private final long trackId;
    private final List<Sample> samples;
    private final long[] durations;
    private final List<CompositionTimeToSample.Entry> cttsEntries;
    private final long[] syncSamples;
    private final MutableSampleView view = new MutableSampleView();

    private int index;
    private long nextDts;
    private int cttsEntry;
    private int cttsUsed;
    private int syncCursor;

    TrackSampleIterator(long trackId, Track track) {
      this.trackId = trackId;
      this.samples = track.getSamples();
      this.durations = track.getSampleDurations();
      List<CompositionTimeToSample.Entry> ctts = track.getCompositionTimeEntries();
      this.cttsEntries = ctts != null ? ctts : List.of();
      this.syncSamples = track.getSyncSamples();
    }

    @Override
    public boolean hasNext() {
      return index < samples.size();
    }

    @Override
    public SampleView next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      try {
        if (index >= durations.length) {
          throw new IllegalStateException("stts covers " + durations.length + " samples, track has "
              + samples.size());
        }
        long duration = durations[index];
        long dts = nextDts;
        ByteBuffer payload = samples.get(index).asByteBuffer().asReadOnlyBuffer();
        view.set(dts, Math.addExact(dts, nextCompositionOffset()), duration, isSync(index + 1L), payload);
        nextDts = Math.addExact(dts, duration);
        index++;
        return view;
      } catch (RuntimeException ex) {
        throw new SampleReadException("track " + trackId + " sample " + (index + 1) + ": " + describe(ex), ex);
      }
    }

    private long nextCompositionOffset() {
      while (cttsEntry < cttsEntries.size() && cttsUsed >= cttsEntries.get(cttsEntry).getCount()) {
        cttsEntry++;
        cttsUsed = 0;
      }
      if (cttsEntry >= cttsEntries.size()) {
        return 0;
      }
      cttsUsed++;
      return cttsEntries.get(cttsEntry).getOffset();
    }

    private boolean isSync(long sampleNumber) {
      if (syncSamples == null) {
        return true;
      }
      while (syncCursor < syncSamples.length && syncSamples[syncCursor] < sampleNumber) {
        syncCursor++;
      }
      return syncCursor < syncSamples.length && syncSamples[syncCursor] == sampleNumber;
    }
  }

  private static final class MutableSampleView implements SampleView {
    private long dts;
    private long cts;
    private long duration;
    private boolean sync;
    private ByteBuffer payload;

    void set(long dts, long cts, long duration, boolean sync, ByteBuffer payload) {
      this.dts = dts;
      this.cts = cts;
      this.duration = duration;
      this.sync = sync;
      this.payload = payload;
    }

    @Override
    public long dts() {
      return dts;
    }

    @Override
    public long cts() {
      return cts;
    }

    @Override
    public long duration() {
      return duration;
    }

    @Override
    public boolean sync() {
      return sync;
    }

    @Override
    public ByteBuffer payload() {
      return payload.duplicate();
    }
  }
}

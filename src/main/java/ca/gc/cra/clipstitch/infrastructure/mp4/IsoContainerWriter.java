package ca.gc.cra.clipstitch.infrastructure.mp4;

import ca.gc.cra.clipstitch.application.port.ContainerWriter;
import ca.gc.cra.clipstitch.domain.media.SampleRecord;
import ca.gc.cra.clipstitch.domain.media.TrackDescriptor;
import com.coremedia.iso.boxes.CompositionTimeToSample;
import com.coremedia.iso.boxes.Container;
import com.coremedia.iso.boxes.SampleDescriptionBox;
import com.googlecode.mp4parser.authoring.AbstractTrack;
import com.googlecode.mp4parser.authoring.Movie;
import com.googlecode.mp4parser.authoring.Sample;
import com.googlecode.mp4parser.authoring.SampleImpl;
import com.googlecode.mp4parser.authoring.TrackMetaData;
import com.googlecode.mp4parser.authoring.builder.DefaultMp4Builder;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ContainerWriter} that assembles a progressive MP4 with
 * {@link DefaultMp4Builder}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep each track's {@code stsd} box exactly as received in the descriptor.</li>
 *   <li>Rebuild {@code stts} from DTS deltas, {@code ctts} from {@code cts - dts} and {@code stss} from sync
 *   flags.</li>
 *   <li>Omit tracks that never received a sample.</li>
 * </ul>
 * <p>No edit list is written, so a track whose first DTS is above zero starts playing at zero.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
final class IsoContainerWriter implements ContainerWriter {
  private static final Logger log = LoggerFactory.getLogger(IsoContainerWriter.class);

  private final Map<Long, PendingTrack> tracks = new LinkedHashMap<>();
  private long nextTrackId = 1;
  private boolean finished;

  @Override
  public long addTrack(TrackDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    ensureOpen();
    SampleDescriptionBox stsd;
    try {
      stsd = SampleDescriptions.parse(descriptor.codecConfig());
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "track " + descriptor.trackId() + " carries an unreadable sample description", ex);
    }
    long trackId = nextTrackId++;
    tracks.put(trackId, new PendingTrack(trackId, descriptor, stsd));
    return trackId;
  }

  @Override
  public void addSample(long trackId, SampleRecord sample) {
    Objects.requireNonNull(sample, "sample");
    ensureOpen();
    PendingTrack track = tracks.get(trackId);
    if (track == null) {
      throw new IllegalArgumentException("unknown track " + trackId);
    }
    track.append(sample);
  }

  @Override
  public byte[] finish() throws IOException {
    ensureOpen();
    finished = true;
    Movie movie = new Movie();
    for (PendingTrack track : tracks.values()) {
      if (track.records.isEmpty()) {
        log.debug("Omitting track {} ({}): no samples", track.trackId, track.handler);
        continue;
      }
      movie.addTrack(track);
    }
    if (movie.getTracks().isEmpty()) {
      throw new IOException("Container has no samples to write");
    }
    try {
      Container container = new DefaultMp4Builder().build(movie);
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      container.writeContainer(Channels.newChannel(out));
      return out.toByteArray();
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    } catch (RuntimeException ex) {
      throw new IOException("Failed to build MP4 container: " + ex.getMessage(), ex);
    }
  }

  private void ensureOpen() {
    if (finished) {
      throw new IllegalStateException("container already finished");
    }
  }

  /** Track fed with rebased samples; exposes them to mp4parser as a finished track. */
  private static final class PendingTrack extends AbstractTrack {
    private final long trackId;
    private final String handler;
    private final SampleDescriptionBox sampleDescription;
    private final TrackMetaData metaData = new TrackMetaData();
    private final List<SampleRecord> records = new ArrayList<>();
    private List<Sample> samples;

    PendingTrack(long trackId, TrackDescriptor descriptor, SampleDescriptionBox sampleDescription) {
      super("track-" + trackId);
      this.trackId = trackId;
      this.handler = descriptor.handler();
      this.sampleDescription = sampleDescription;
      metaData.setTrackId(trackId);
      metaData.setTimescale(descriptor.timescale());
      metaData.setLanguage(descriptor.language());
      metaData.setWidth(descriptor.width());
      metaData.setHeight(descriptor.height());
    }

    void append(SampleRecord sample) {
      if (sample.dts() < 0) {
        throw new IllegalArgumentException("negative dts " + sample.dts() + " on track " + trackId);
      }
      if (samples != null) {
        throw new IllegalStateException("track " + trackId + " already handed to the builder");
      }
      if (!records.isEmpty() && sample.dts() < records.get(records.size() - 1).dts()) {
        throw new IllegalArgumentException("dts " + sample.dts() + " goes backwards on track " + trackId);
      }
      records.add(sample);
    }

    @Override
    public SampleDescriptionBox getSampleDescriptionBox() {
      return sampleDescription;
    }

    @Override
    public long[] getSampleDurations() {
      long[] durations = new long[records.size()];
      for (int i = 0; i < durations.length; i++) {
        SampleRecord current = records.get(i);
        durations[i] = i + 1 < durations.length
            ? records.get(i + 1).dts() - current.dts()
            : current.duration();
      }
      return durations;
    }

    @Override
    public List<CompositionTimeToSample.Entry> getCompositionTimeEntries() {
      List<CompositionTimeToSample.Entry> entries = new ArrayList<>();
      boolean anyOffset = false;
      int runOffset = 0;
      int runCount = 0;
      for (SampleRecord record : records) {
        int offset = Math.toIntExact(record.cts() - record.dts());
        anyOffset |= offset != 0;
        if (runCount > 0 && offset == runOffset) {
          runCount++;
          continue;
        }
        if (runCount > 0) {
          entries.add(new CompositionTimeToSample.Entry(runCount, runOffset));
        }
        runOffset = offset;
        runCount = 1;
      }
      if (runCount > 0) {
        entries.add(new CompositionTimeToSample.Entry(runCount, runOffset));
      }
      return anyOffset ? entries : null;
    }

    @Override
    public long[] getSyncSamples() {
      int syncCount = 0;
      for (SampleRecord record : records) {
        if (record.sync()) {
          syncCount++;
        }
      }
      if (syncCount == records.size()) {
        return null;
      }
      long[] sync = new long[syncCount];
      int cursor = 0;
      for (int i = 0; i < records.size(); i++) {
        if (records.get(i).sync()) {
          sync[cursor++] = i + 1L;
        }
      }
      return sync;
    }

    @Override
    public TrackMetaData getTrackMetaData() {
      return metaData;
    }

    @Override
    public String getHandler() {
      return handler;
    }

    @Override
    public List<Sample> getSamples() {
      if (samples == null) {
        List<Sample> built = new ArrayList<>(records.size());
        for (SampleRecord record : records) {
          built.add(new SampleImpl(record.payloadView()));
        }
        samples = built;
      }
      return samples;
    }

    @Override
    public void close() {
      // Heap only.
    }
  }
}

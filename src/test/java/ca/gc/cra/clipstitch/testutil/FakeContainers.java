package ca.gc.cra.clipstitch.testutil;

import ca.gc.cra.clipstitch.domain.media.MediaType;
import ca.gc.cra.clipstitch.domain.media.SampleRecord;
import ca.gc.cra.clipstitch.domain.media.TrackDescriptor;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compact binary container used by engine tests in place of MP4.
 *
 * <p>Layout: magic {@code FAKE}, movie duration and timescale, then each track with its samples.</p>
 */
public final class FakeContainers {
  static final int MAGIC = 0x46414B45;

  private FakeContainers() {}

  public static Builder builder(long duration, long timescale) {
    return new Builder(duration, timescale);
  }

  /**
   * Builds a movie with one video track (90 kHz, 30 fps, keyframe every 30 samples) and one audio track
   * (48 kHz, 1024-tick frames), both {@code seconds} long.
   */
  public static byte[] audioVideo(int seconds) {
    Builder builder = builder(seconds * 1000L, 1000);
    builder.track(1, MediaType.VIDEO, 90_000);
    builder.uniformSamples(1, seconds * 30, 3_000, 30);
    builder.track(2, MediaType.AUDIO, 48_000);
    long audioTicks = seconds * 48_000L;
    builder.uniformSamples(2, (int) ((audioTicks + 1023) / 1024), 1_024, 1);
    return builder.build();
  }

  /** Builds a movie with one video track (timescale 1000, 100 ms per sample, keyframe every 10). */
  public static byte[] videoOnly(int seconds) {
    Builder builder = builder(seconds * 1000L, 1000);
    builder.track(1, MediaType.VIDEO, 1000);
    builder.uniformSamples(1, seconds * 10, 100, 10);
    return builder.build();
  }

  public static Parsed decode(byte[] data) {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
      if (in.readInt() != MAGIC) {
        throw new IOException("bad magic");
      }
      long duration = in.readLong();
      long timescale = in.readLong();
      int trackCount = in.readInt();
      List<ParsedTrack> tracks = new ArrayList<>(trackCount);
      for (int t = 0; t < trackCount; t++) {
        long trackId = in.readLong();
        MediaType type = MediaType.valueOf(in.readUTF());
        long trackTimescale = in.readLong();
        byte[] codec = new byte[in.readInt()];
        in.readFully(codec);
        int sampleCount = in.readInt();
        List<SampleRecord> samples = new ArrayList<>(sampleCount);
        long end = 0;
        for (int s = 0; s < sampleCount; s++) {
          long dts = in.readLong();
          long cts = in.readLong();
          long sampleDuration = in.readLong();
          boolean sync = in.readBoolean();
          byte[] payload = new byte[in.readInt()];
          in.readFully(payload);
          samples.add(new SampleRecord(dts, cts, sampleDuration, sync, payload));
          end = Math.max(end, dts + sampleDuration);
        }
        TrackDescriptor descriptor = new TrackDescriptor(
            trackId, type, type.handler(), trackTimescale, codec, sampleCount, end, "und", 0, 0);
        tracks.add(new ParsedTrack(descriptor, samples));
      }
      return new Parsed(duration, timescale, tracks);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  static byte[] encode(long duration, long timescale, List<ParsedTrack> tracks) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      out.writeInt(MAGIC);
      out.writeLong(duration);
      out.writeLong(timescale);
      out.writeInt(tracks.size());
      for (ParsedTrack track : tracks) {
        TrackDescriptor descriptor = track.descriptor();
        out.writeLong(descriptor.trackId());
        out.writeUTF(descriptor.mediaType().name());
        out.writeLong(descriptor.timescale());
        byte[] codec = descriptor.codecConfig();
        out.writeInt(codec.length);
        out.write(codec);
        out.writeInt(track.samples().size());
        for (SampleRecord sample : track.samples()) {
          out.writeLong(sample.dts());
          out.writeLong(sample.cts());
          out.writeLong(sample.duration());
          out.writeBoolean(sample.sync());
          out.writeInt(sample.size());
          out.write(sample.payload());
        }
      }
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return bytes.toByteArray();
  }

  /** Decoded container. */
  public record Parsed(long duration, long timescale, List<ParsedTrack> tracks) {
    public ParsedTrack track(int index) {
      return tracks.get(index);
    }

    public long totalSamples() {
      return tracks.stream().mapToLong(track -> track.samples().size()).sum();
    }
  }

  /** Decoded track. */
  public record ParsedTrack(TrackDescriptor descriptor, List<SampleRecord> samples) {}

  /** Incremental builder for test movies. */
  public static final class Builder {
    private final long duration;
    private final long timescale;
    private final Map<Long, TrackDescriptor> tracks = new LinkedHashMap<>();
    private final Map<Long, List<SampleRecord>> samples = new LinkedHashMap<>();

    private Builder(long duration, long timescale) {
      this.duration = duration;
      this.timescale = timescale;
    }

    public Builder track(long trackId, MediaType type, long trackTimescale) {
      String codecName = "codec-" + type.name().toLowerCase(Locale.ROOT) + "-" + trackId;
      byte[] codec = codecName.getBytes(StandardCharsets.UTF_8);
      tracks.put(trackId, new TrackDescriptor(
          trackId, type, type.handler(), trackTimescale, codec, 0, 0, "und", 0, 0));
      samples.put(trackId, new ArrayList<>());
      return this;
    }

    public Builder sample(long trackId, long dts, long cts, long sampleDuration, boolean sync, byte[] payload) {
      List<SampleRecord> list = samples.get(trackId);
      if (list == null) {
        throw new IllegalArgumentException("unknown track " + trackId);
      }
      list.add(new SampleRecord(dts, cts, sampleDuration, sync, payload));
      return this;
    }

    public Builder sample(long trackId, long dts, long sampleDuration) {
      return sample(trackId, dts, dts, sampleDuration, true, payloadFor(trackId, dts));
    }

    /** Adds {@code count} back-to-back samples starting at zero. */
    public Builder uniformSamples(long trackId, int count, long sampleDuration, int syncInterval) {
      for (int i = 0; i < count; i++) {
        long dts = i * sampleDuration;
        sample(trackId, dts, dts, sampleDuration, i % syncInterval == 0, payloadFor(trackId, dts));
      }
      return this;
    }

    public byte[] build() {
      List<ParsedTrack> parsed = new ArrayList<>();
      for (TrackDescriptor descriptor : tracks.values()) {
        parsed.add(new ParsedTrack(descriptor, samples.get(descriptor.trackId())));
      }
      return encode(duration, timescale, parsed);
    }
  }

  /** Deterministic payload that encodes its track and timestamp. */
  public static byte[] payloadFor(long trackId, long dts) {
    return ("t" + trackId + "@" + dts).getBytes(StandardCharsets.UTF_8);
  }
}

package ca.gc.cra.clipstitch.infrastructure.mp4;

import ca.gc.cra.clipstitch.domain.media.MediaType;
import ca.gc.cra.clipstitch.domain.media.SampleRecord;
import ca.gc.cra.clipstitch.domain.media.TrackDescriptor;
import com.coremedia.iso.boxes.SampleDescriptionBox;
import com.coremedia.iso.boxes.sampleentry.AudioSampleEntry;
import com.coremedia.iso.boxes.sampleentry.VisualSampleEntry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Small but real MP4 files built through {@link IsoContainerWriter}.
 */
public final class Mp4Fixtures {
  static final long VIDEO_TIMESCALE = 90_000;
  static final long VIDEO_FRAME = 3_000;
  static final long AUDIO_TIMESCALE = 48_000;
  static final long AUDIO_FRAME = 1_024;

  private Mp4Fixtures() {}

  static TrackDescriptor videoTrack(long trackId) {
    VisualSampleEntry entry = new VisualSampleEntry("avc1");
    entry.setDataReferenceIndex(1);
    entry.setWidth(320);
    entry.setHeight(240);
    entry.setHorizresolution(72);
    entry.setVertresolution(72);
    entry.setFrameCount(1);
    entry.setDepth(24);
    entry.setCompressorname("clipstitch");
    SampleDescriptionBox stsd = new SampleDescriptionBox();
    stsd.addBox(entry);
    return new TrackDescriptor(trackId, MediaType.VIDEO, "vide", VIDEO_TIMESCALE, serialize(stsd), 0, 0,
        "und", 320, 240);
  }

  static TrackDescriptor audioTrack(long trackId) {
    AudioSampleEntry entry = new AudioSampleEntry("mp4a");
    entry.setDataReferenceIndex(1);
    entry.setChannelCount(2);
    entry.setSampleSize(16);
    entry.setSampleRate(AUDIO_TIMESCALE);
    SampleDescriptionBox stsd = new SampleDescriptionBox();
    stsd.addBox(entry);
    return new TrackDescriptor(trackId, MediaType.AUDIO, "soun", AUDIO_TIMESCALE, serialize(stsd), 0, 0,
        "und", 0, 0);
  }

  /**
   * Video at 30 fps with a keyframe every 30 frames and a composition offset on every other frame, plus
   * 48 kHz audio, both {@code seconds} long.
   */
  public static byte[] audioVideo(int seconds) throws IOException {
    IsoContainerWriter writer = new IsoContainerWriter();
    long video = writer.addTrack(videoTrack(1));
    long audio = writer.addTrack(audioTrack(2));
    int frames = seconds * 30;
    for (int i = 0; i < frames; i++) {
      long dts = i * VIDEO_FRAME;
      long cts = i % 2 == 0 ? dts + 2 * VIDEO_FRAME : dts;
      writer.addSample(video, new SampleRecord(dts, cts, VIDEO_FRAME, i % 30 == 0, payload("v", i)));
    }
    long audioFrames = (seconds * AUDIO_TIMESCALE + AUDIO_FRAME - 1) / AUDIO_FRAME;
    for (int i = 0; i < audioFrames; i++) {
      long dts = i * AUDIO_FRAME;
      writer.addSample(audio, new SampleRecord(dts, dts, AUDIO_FRAME, true, payload("a", i)));
    }
    return writer.finish();
  }

  /** Single 30 fps video track, every frame a keyframe. */
  public static byte[] videoOnly(int seconds) throws IOException {
    IsoContainerWriter writer = new IsoContainerWriter();
    long video = writer.addTrack(videoTrack(1));
    for (int i = 0; i < seconds * 30; i++) {
      long dts = i * VIDEO_FRAME;
      writer.addSample(video, new SampleRecord(dts, dts, VIDEO_FRAME, true, payload("v", i)));
    }
    return writer.finish();
  }

  static byte[] payload(String prefix, int index) {
    return (prefix + index + ":" + "x".repeat(index % 7)).getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] serialize(SampleDescriptionBox stsd) {
    try {
      return SampleDescriptions.serialize(stsd);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}

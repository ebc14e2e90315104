package ca.gc.cra.clipstitch.infrastructure.mp4;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.clipstitch.application.port.ContainerReader;
import ca.gc.cra.clipstitch.domain.media.ContainerInfo;
import ca.gc.cra.clipstitch.domain.media.InvalidContainerException;
import ca.gc.cra.clipstitch.domain.media.MediaType;
import ca.gc.cra.clipstitch.domain.media.SampleRecord;
import ca.gc.cra.clipstitch.domain.media.SampleView;
import ca.gc.cra.clipstitch.domain.media.TrackDescriptor;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;

class IsoContainerRoundTripTest {

  @Test
  void writtenTracksReadBackWithTimingSyncAndPayloads() throws Exception {
    byte[] mp4 = Mp4Fixtures.audioVideo(2);

    try (IsoContainerReader reader = IsoContainerReader.parse(mp4)) {
      ContainerInfo info = reader.info();
      assertEquals(2, info.tracks().size());
      assertEquals(2.0, info.durationSeconds(), 0.05);

      TrackDescriptor video = info.tracks().get(0);
      assertEquals(MediaType.VIDEO, video.mediaType());
      assertEquals(Mp4Fixtures.VIDEO_TIMESCALE, video.timescale());
      assertEquals(60, video.sampleCount());

      List<SampleRecord> samples = drain(reader.samples(video.trackId()));
      assertEquals(60, samples.size());
      for (int i = 0; i < samples.size(); i++) {
        SampleRecord sample = samples.get(i);
        long dts = i * Mp4Fixtures.VIDEO_FRAME;
        assertEquals(dts, sample.dts());
        assertEquals(i % 2 == 0 ? dts + 2 * Mp4Fixtures.VIDEO_FRAME : dts, sample.cts());
        assertEquals(i % 30 == 0, sample.sync(), "sync flag of sample " + i);
        assertArrayEquals(Mp4Fixtures.payload("v", i), sample.payload());
      }

      TrackDescriptor audio = info.tracks().get(1);
      assertEquals(MediaType.AUDIO, audio.mediaType());
      List<SampleRecord> audioSamples = drain(reader.samples(audio.trackId()));
      assertEquals(94, audioSamples.size());
      assertTrue(audioSamples.stream().allMatch(SampleRecord::sync));
      assertEquals(93 * Mp4Fixtures.AUDIO_FRAME, audioSamples.get(93).dts());
    }
  }

  @Test
  void sampleDescriptionSurvivesByteForByte() throws Exception {
    TrackDescriptor original = Mp4Fixtures.audioTrack(1);
    IsoContainerWriter writer = new IsoContainerWriter();
    long track = writer.addTrack(original);
    writer.addSample(track, new SampleRecord(0, 0, 1_024, true, new byte[] {1, 2, 3}));

    try (IsoContainerReader reader = IsoContainerReader.parse(writer.finish())) {
      TrackDescriptor parsed = reader.info().tracks().get(0);
      assertArrayEquals(original.codecConfig(), parsed.codecConfig());
      assertEquals("soun", parsed.handler());
    }
  }

  @Test
  void tracksWithoutSamplesAreOmitted() throws Exception {
    IsoContainerWriter writer = new IsoContainerWriter();
    writer.addTrack(Mp4Fixtures.videoTrack(1));
    long audio = writer.addTrack(Mp4Fixtures.audioTrack(2));
    writer.addSample(audio, new SampleRecord(0, 0, 1_024, true, new byte[] {9}));

    try (IsoContainerReader reader = IsoContainerReader.parse(writer.finish())) {
      assertEquals(1, reader.info().tracks().size());
      assertEquals(MediaType.AUDIO, reader.info().tracks().get(0).mediaType());
    }
  }

  @Test
  void writerRejectsInvalidInput() throws Exception {
    IsoContainerWriter writer = new IsoContainerWriter();
    long track = writer.addTrack(Mp4Fixtures.videoTrack(1));
    writer.addSample(track, new SampleRecord(3_000, 3_000, 3_000, true, new byte[] {1}));

    assertThrows(IllegalArgumentException.class,
        () -> writer.addSample(track, new SampleRecord(0, 0, 3_000, true, new byte[] {2})));
    assertThrows(IllegalArgumentException.class,
        () -> writer.addSample(track, new SampleRecord(-1, 0, 3_000, true, new byte[] {2})));
    assertThrows(IllegalArgumentException.class,
        () -> writer.addSample(99, new SampleRecord(6_000, 6_000, 3_000, true, new byte[] {2})));
    assertThrows(IllegalArgumentException.class, () -> writer.addTrack(
        new TrackDescriptor(5, MediaType.VIDEO, "vide", 90_000, new byte[0], 0, 0, "und", 0, 0)));
  }

  @Test
  void finishingWithoutSamplesFails() {
    IsoContainerWriter writer = new IsoContainerWriter();
    writer.addTrack(Mp4Fixtures.videoTrack(1));

    assertThrows(IOException.class, writer::finish);
  }

  @Test
  void finishIsSingleUse() throws Exception {
    IsoContainerWriter writer = new IsoContainerWriter();
    long track = writer.addTrack(Mp4Fixtures.audioTrack(1));
    writer.addSample(track, new SampleRecord(0, 0, 1_024, true, new byte[] {1}));
    writer.finish();

    assertThrows(IllegalStateException.class, writer::finish);
  }

  @Test
  void garbageIsAnInvalidContainer() {
    IsoContainerFormat format = new IsoContainerFormat();

    assertThrows(InvalidContainerException.class,
        () -> format.open("definitely not an mp4 file".getBytes(StandardCharsets.UTF_8)));
    assertThrows(InvalidContainerException.class, () -> format.open(new byte[0]));
    assertThrows(InvalidContainerException.class,
        () -> format.open("plain text".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void formatDoesNotRetainTheCallersBuffer() throws Exception {
    byte[] mp4 = Mp4Fixtures.audioVideo(1);
    IsoContainerFormat format = new IsoContainerFormat();

    try (ContainerReader reader = format.open(mp4)) {
      Arrays.fill(mp4, (byte) 0);
      Iterator<SampleView> samples = reader.samples(reader.info().tracks().get(0).trackId());
      SampleRecord first = SampleRecord.copyOf(samples.next());
      assertArrayEquals(Mp4Fixtures.payload("v", 0), first.payload());
      assertFalse(first.payloadView().remaining() == 0);
    }
  }

  @Test
  void unknownTrackIsRejected() throws Exception {
    try (IsoContainerReader reader = IsoContainerReader.parse(Mp4Fixtures.audioVideo(1))) {
      assertThrows(IllegalArgumentException.class, () -> reader.samples(42));
    }
  }

  private static List<SampleRecord> drain(Iterator<SampleView> views) {
    List<SampleRecord> records = new ArrayList<>();
    while (views.hasNext()) {
      records.add(SampleRecord.copyOf(views.next()));
    }
    return records;
  }
}

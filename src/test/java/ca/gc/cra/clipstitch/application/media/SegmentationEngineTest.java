package ca.gc.cra.clipstitch.application.media;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.clipstitch.domain.media.Clip;
import ca.gc.cra.clipstitch.domain.media.ErrorKind;
import ca.gc.cra.clipstitch.domain.media.ExtractionFailureException;
import ca.gc.cra.clipstitch.domain.media.InvalidContainerException;
import ca.gc.cra.clipstitch.domain.media.InvalidDurationException;
import ca.gc.cra.clipstitch.domain.media.MediaType;
import ca.gc.cra.clipstitch.domain.media.OutOfRangePolicy;
import ca.gc.cra.clipstitch.domain.media.SampleRecord;
import ca.gc.cra.clipstitch.testutil.FakeContainerFormat;
import ca.gc.cra.clipstitch.testutil.FakeContainers;
import ca.gc.cra.clipstitch.testutil.RecordingMetricsPort;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SegmentationEngineTest {
  private FakeContainerFormat format;
  private RecordingMetricsPort metrics;
  private SegmentationEngine engine;

  @BeforeEach
  void setUp() {
    format = new FakeContainerFormat();
    metrics = new RecordingMetricsPort();
    engine = new SegmentationEngine(format, metrics);
  }

  @Test
  void twentySecondsAtEightSecondsYieldsThreeClips() throws Exception {
    List<Clip> clips = engine.cut(FakeContainers.audioVideo(20), 8.0);

    assertEquals(3, clips.size());
    assertEquals(List.of("clip_01", "clip_02", "clip_03"), clips.stream().map(Clip::name).toList());

    FakeContainers.Parsed first = FakeContainers.decode(clips.get(0).data());
    FakeContainers.Parsed last = FakeContainers.decode(clips.get(2).data());
    assertEquals(8_000, first.duration());
    assertEquals(240, first.track(0).samples().size());
    assertEquals(375, first.track(1).samples().size());
    assertEquals(120, last.track(0).samples().size());
    assertEquals(188, last.track(1).samples().size());
    assertTrue(last.duration() <= first.duration());
  }

  @Test
  void everySampleLandsInExactlyOneClip() throws Exception {
    List<Clip> clips = engine.cut(FakeContainers.audioVideo(20), 8.0);

    long total = clips.stream()
        .mapToLong(clip -> FakeContainers.decode(clip.data()).totalSamples())
        .sum();
    assertEquals(600 + 938, total);
  }

  @Test
  void timestampsAreRebasedToClipStart() throws Exception {
    List<Clip> clips = engine.cut(FakeContainers.audioVideo(20), 8.0);

    for (Clip clip : clips) {
      FakeContainers.Parsed parsed = FakeContainers.decode(clip.data());
      for (FakeContainers.ParsedTrack track : parsed.tracks()) {
        assertEquals(0, track.samples().get(0).dts(), clip.name() + " track " + track.descriptor().trackId());
        assertTrue(track.samples().stream().allMatch(sample -> sample.dts() >= 0));
      }
    }
  }

  @Test
  void segmentLongerThanSourceYieldsSingleClipWithAllSamples() throws Exception {
    byte[] source = FakeContainers.videoOnly(5);

    List<Clip> clips = engine.cut(source, 10.0);

    assertEquals(1, clips.size());
    assertEquals("clip_01", clips.get(0).name());
    FakeContainers.Parsed original = FakeContainers.decode(source);
    FakeContainers.Parsed clip = FakeContainers.decode(clips.get(0).data());
    assertEquals(original.track(0).samples(), clip.track(0).samples());
  }

  @Test
  void segmentLongerThanAnyTimelineYieldsSingleClip() throws Exception {
    byte[] source = FakeContainers.videoOnly(5);
    List<SampleRecord> original = FakeContainers.decode(source).track(0).samples();

    List<Clip> bySeconds = engine.cut(source, 1e10);
    List<Clip> byDuration = engine.cut(source, Duration.ofDays(200_000));

    assertEquals(List.of("clip_01"), bySeconds.stream().map(Clip::name).toList());
    assertEquals(List.of("clip_01"), byDuration.stream().map(Clip::name).toList());
    assertEquals(original, FakeContainers.decode(bySeconds.get(0).data()).track(0).samples());
    assertEquals(original, FakeContainers.decode(byDuration.get(0).data()).track(0).samples());
  }

  @Test
  void secondsConvertToNearestNanosecondAndSaturate() {
    assertEquals(Duration.ofMillis(8_001), SegmentationEngine.toSegmentLength(8.001));
    assertEquals(Duration.ofSeconds(10_000_000_000L), SegmentationEngine.toSegmentLength(1e10));
    assertEquals(Duration.ofSeconds(Long.MAX_VALUE), SegmentationEngine.toSegmentLength(1e300));
  }

  @Test
  void rebasedTimestampsStayBelowAFractionalSegmentLength() throws Exception {
    byte[] source = FakeContainers.builder(30_000, 1000)
        .track(1, MediaType.VIDEO, 1000)
        .uniformSamples(1, 30_000, 1, 1_000)
        .build();

    List<Clip> clips = engine.cut(source, 8.0007);

    assertEquals(4, clips.size());
    long total = 0;
    for (Clip clip : clips) {
      List<SampleRecord> samples = FakeContainers.decode(clip.data()).track(0).samples();
      total += samples.size();
      for (SampleRecord sample : samples) {
        assertTrue(sample.dts() >= 0, clip.name() + " dts " + sample.dts());
        // Segment length is 8000.7 ticks.
        assertTrue(sample.dts() * 10 < 80_007, clip.name() + " dts " + sample.dts());
      }
    }
    assertEquals(30_000, total);
  }

  @Test
  void codecConfigurationAndMediaTypeCarryOver() throws Exception {
    byte[] source = FakeContainers.audioVideo(4);
    FakeContainers.Parsed original = FakeContainers.decode(source);

    List<Clip> clips = engine.cut(source, 2.0);

    for (Clip clip : clips) {
      FakeContainers.Parsed parsed = FakeContainers.decode(clip.data());
      assertEquals(2, parsed.tracks().size());
      for (int t = 0; t < 2; t++) {
        assertEquals(original.track(t).descriptor().mediaType(), parsed.track(t).descriptor().mediaType());
        assertEquals(original.track(t).descriptor().timescale(), parsed.track(t).descriptor().timescale());
        assertArrayEquals(
            original.track(t).descriptor().codecConfig(), parsed.track(t).descriptor().codecConfig());
      }
    }
  }

  @Test
  void compositionOffsetsSurviveRebasing() throws Exception {
    byte[] source = FakeContainers.builder(2_000, 1000)
        .track(1, MediaType.VIDEO, 1000)
        .sample(1, 0, 200, 500, true, new byte[] {1})
        .sample(1, 500, 1_300, 500, false, new byte[] {2})
        .sample(1, 1_000, 1_200, 500, true, new byte[] {3})
        .sample(1, 1_500, 1_500, 500, false, new byte[] {4})
        .build();

    List<Clip> clips = engine.cut(source, 1.0);

    List<SampleRecord> second = FakeContainers.decode(clips.get(1).data()).track(0).samples();
    assertEquals(0, second.get(0).dts());
    assertEquals(200, second.get(0).cts());
    assertEquals(500, second.get(1).dts());
    assertEquals(500, second.get(1).cts());
    assertTrue(second.get(0).sync());
    assertFalse(second.get(1).sync());
  }

  @Test
  void fractionalSegmentLengthsUseExactTickBoundaries() throws Exception {
    List<Clip> clips = engine.cut(FakeContainers.videoOnly(10), 2.5);

    assertEquals(4, clips.size());
    for (Clip clip : clips) {
      assertEquals(25, FakeContainers.decode(clip.data()).track(0).samples().size());
    }
  }

  @Test
  void emptySegmentsAreSkippedButKeepTheirIndexInNames() throws Exception {
    FakeContainers.Builder builder = FakeContainers.builder(30_000, 1000).track(1, MediaType.VIDEO, 1000);
    for (long dts = 0; dts < 10_000; dts += 1_000) {
      builder.sample(1, dts, 1_000);
    }
    for (long dts = 20_000; dts < 30_000; dts += 1_000) {
      builder.sample(1, dts, 1_000);
    }

    List<Clip> clips = engine.cut(builder.build(), 10.0);

    assertEquals(List.of("clip_01", "clip_03"), clips.stream().map(Clip::name).toList());
  }

  @Test
  void payloadsAreCopiedBeforeReaderReusesItsBuffer() throws Exception {
    engine = new SegmentationEngine(format.reuseSampleBuffer(), metrics);

    List<Clip> clips = engine.cut(FakeContainers.videoOnly(3), 1.0);

    for (int i = 0; i < clips.size(); i++) {
      for (SampleRecord sample : FakeContainers.decode(clips.get(i).data()).track(0).samples()) {
        long originalDts = sample.dts() + i * 1_000L;
        assertEquals(
            new String(FakeContainers.payloadFor(1, originalDts), StandardCharsets.UTF_8),
            new String(sample.payload(), StandardCharsets.UTF_8));
      }
    }
  }

  @Test
  void sourceBufferIsNotModified() throws Exception {
    byte[] source = FakeContainers.audioVideo(6);
    byte[] before = source.clone();

    engine.cut(source, 2.0);

    assertArrayEquals(before, source);
  }

  @Test
  void containerWithoutTracksIsRejectedBeforeAnyOutputIsCreated() {
    byte[] source = FakeContainers.builder(10_000, 1000).build();

    InvalidContainerException ex = assertThrows(InvalidContainerException.class, () -> engine.cut(source, 5.0));

    assertEquals("Invalid video file: no tracks found", ex.getMessage());
    assertEquals(ErrorKind.INVALID_CONTAINER, ex.kind());
    assertEquals(0, format.writersCreated());
  }

  @Test
  void unparseableSourceIsInvalidContainer() {
    byte[] garbage = "not a video".getBytes(StandardCharsets.UTF_8);

    assertThrows(InvalidContainerException.class, () -> engine.cut(garbage, 5.0));
    assertThrows(InvalidContainerException.class, () -> engine.cut(new byte[0], 5.0));
  }

  @Test
  void zeroDurationIsInvalidDuration() {
    byte[] source = FakeContainers.builder(0, 1000)
        .track(1, MediaType.VIDEO, 1000)
        .sample(1, 0, 100)
        .build();

    InvalidDurationException ex = assertThrows(InvalidDurationException.class, () -> engine.cut(source, 5.0));

    assertEquals(ErrorKind.INVALID_DURATION, ex.kind());
    assertEquals(0, format.writersCreated());
  }

  @Test
  void nonPositiveSegmentLengthIsRejected() {
    byte[] source = FakeContainers.videoOnly(2);

    assertThrows(IllegalArgumentException.class, () -> engine.cut(source, 0.0));
    assertThrows(IllegalArgumentException.class, () -> engine.cut(source, -1.0));
    assertThrows(IllegalArgumentException.class, () -> engine.cut(source, Double.NaN));
  }

  @Test
  void planAboveSegmentCeilingIsInvalidDuration() {
    engine = new SegmentationEngine(format, metrics, OutOfRangePolicy.DROP, 2);

    assertThrows(InvalidDurationException.class, () -> engine.cut(FakeContainers.videoOnly(20), 5.0));
    assertEquals(0, format.writersCreated());
  }

  @Test
  void outOfRangeSamplesAreDroppedAndCountedByDefault() throws Exception {
    List<Clip> clips = engine.cut(sourceWithStraySamples(), 5.0);

    assertEquals(2, clips.size());
    long kept = clips.stream().mapToLong(clip -> FakeContainers.decode(clip.data()).totalSamples()).sum();
    assertEquals(100, kept);
    assertEquals(2, metrics.count("cut.samples.dropped"));
    assertEquals(100, metrics.count("cut.samples.kept"));
  }

  @Test
  void clampPolicyMovesTrailingSamplesIntoFinalClip() throws Exception {
    engine = new SegmentationEngine(format, metrics, OutOfRangePolicy.CLAMP, SegmentationEngine.DEFAULT_MAX_SEGMENTS);

    List<Clip> clips = engine.cut(sourceWithStraySamples(), 5.0);

    List<SampleRecord> last = FakeContainers.decode(clips.get(1).data()).track(0).samples();
    assertEquals(51, last.size());
    assertEquals(5_000, last.get(last.size() - 1).dts());
    assertEquals(1, metrics.count("cut.samples.dropped"));
  }

  @Test
  void failPolicyRejectsOutOfRangeSamples() {
    engine = new SegmentationEngine(format, metrics, OutOfRangePolicy.FAIL, SegmentationEngine.DEFAULT_MAX_SEGMENTS);

    assertThrows(InvalidContainerException.class, () -> engine.cut(sourceWithStraySamples(), 5.0));
  }

  @Test
  void unreadableSampleDataIsInvalidContainer() {
    engine = new SegmentationEngine(format.corruptSamplesOf(2), metrics);

    InvalidContainerException ex = assertThrows(
        InvalidContainerException.class, () -> engine.cut(FakeContainers.audioVideo(4), 2.0));

    assertTrue(ex.getMessage().contains("track 2"));
    assertEquals(format.readersOpened(), format.readersClosed());
  }

  @Test
  void writerFailureIsExtractionFailure() {
    engine = new SegmentationEngine(format.failOnFinish(), metrics);

    ExtractionFailureException ex = assertThrows(
        ExtractionFailureException.class, () -> engine.cut(FakeContainers.videoOnly(4), 2.0));

    assertTrue(ex.getMessage().contains("clip_01"));
  }

  @Test
  void metricsDescribeTheCut() throws Exception {
    engine.cut(FakeContainers.audioVideo(20), 8.0);

    assertEquals(3, metrics.count("cut.clips.produced"));
    assertEquals(1_538, metrics.count("cut.samples.kept"));
    assertFalse(metrics.hasCounter("cut.samples.dropped"));
    assertEquals(1, metrics.observed("cut.latencyNanos").size());
    assertEquals(1, format.readersOpened());
    assertEquals(1, format.readersClosed());
  }

  @Test
  void latencyIsObservedEvenWhenTheCutFails() {
    assertThrows(InvalidContainerException.class, () -> engine.cut(new byte[0], 1.0));

    assertEquals(1, metrics.observed("cut.latencyNanos").size());
  }

  /** Ten seconds of 100 ms samples plus one sample before zero and one at the reported end. */
  private static byte[] sourceWithStraySamples() {
    FakeContainers.Builder builder = FakeContainers.builder(10_000, 1000)
        .track(1, MediaType.VIDEO, 1000)
        .sample(1, -100, 100);
    for (long dts = 0; dts < 10_000; dts += 100) {
      builder.sample(1, dts, 100);
    }
    return builder.sample(1, 10_000, 100).build();
  }
}

package ca.gc.cra.clipstitch.domain.media;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SegmentPlanTest {

  @Test
  void countIsCeilingOfDurationOverSegmentLength() throws Exception {
    assertEquals(3, SegmentPlan.of(20_000, 1000, Duration.ofSeconds(8), 100).count());
    assertEquals(2, SegmentPlan.of(20_000, 1000, Duration.ofSeconds(10), 100).count());
    assertEquals(1, SegmentPlan.of(20_000, 1000, Duration.ofSeconds(60), 100).count());
    assertEquals(21, SegmentPlan.of(20_001, 1000, Duration.ofSeconds(1), 100).count());
  }

  @Test
  void nonPositiveDurationIsInvalid() {
    assertThrows(InvalidDurationException.class, () -> SegmentPlan.of(0, 1000, Duration.ofSeconds(1), 10));
    assertThrows(InvalidDurationException.class, () -> SegmentPlan.of(-5, 1000, Duration.ofSeconds(1), 10));
    assertThrows(InvalidDurationException.class, () -> SegmentPlan.of(100, 0, Duration.ofSeconds(1), 10));
  }

  @Test
  void nonPositiveSegmentLengthIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SegmentPlan.of(1_000, 1000, Duration.ZERO, 10));
    assertThrows(IllegalArgumentException.class, () -> SegmentPlan.of(1_000, 1000, Duration.ofSeconds(-1), 10));
  }

  @Test
  void tooManySegmentsIsInvalidDuration() {
    InvalidDurationException ex = assertThrows(InvalidDurationException.class,
        () -> SegmentPlan.of(3_600_000, 1000, Duration.ofMillis(1), 10_000));

    assertTrue(ex.getMessage().contains("10000"));
  }

  @Test
  void windowsUseExactTrackTicks() throws Exception {
    SegmentPlan plan = SegmentPlan.of(10_000, 1000, Duration.ofMillis(2_500), 100);

    SegmentPlan.TrackWindow window = plan.window(90_000);

    assertEquals(0, window.segmentIndex(224_999));
    assertEquals(1, window.segmentIndex(225_000));
    assertEquals(225_000, window.segmentStart(1));
    assertEquals(-1, window.segmentIndex(-1));
  }

  @Test
  void windowHandlesTimescalesThatDoNotDivideTheSegment() throws Exception {
    SegmentPlan plan = SegmentPlan.of(3_000, 1000, Duration.ofMillis(1_001), 100);

    SegmentPlan.TrackWindow window = plan.window(44_100);

    // 1.001 s at 44.1 kHz is 44144.1 ticks; segments start on the first whole tick inside them.
    assertEquals(44_145, window.segmentStart(1));
    assertEquals(0, window.segmentIndex(44_144));
    assertEquals(1, window.segmentIndex(44_145));
    assertEquals(1, window.segmentIndex(88_288));
    assertEquals(88_289, window.segmentStart(2));
  }

  @Test
  void rebasedTimestampsStayInsideAFractionalWindow() throws Exception {
    SegmentPlan plan = SegmentPlan.of(30_000, 1000, Duration.ofNanos(8_000_700_000L), 100);
    SegmentPlan.TrackWindow window = plan.window(1000);

    // 8000.7 ticks per segment.
    for (long dts = 0; dts < 30_000; dts++) {
      long index = window.segmentIndex(dts);
      long rebased = dts - window.segmentStart(index);
      assertTrue(rebased >= 0, "dts " + dts + " rebased below zero");
      assertTrue(rebased * 10 < 80_007, "dts " + dts + " rebased to " + rebased);
    }
  }

  @Test
  void segmentLongerThanAnyTimelineYieldsOneSegment() throws Exception {
    SegmentPlan plan = SegmentPlan.of(20_000, 1000, Duration.ofDays(200_000), 100);

    assertEquals(1, plan.count());
    SegmentPlan.TrackWindow window = plan.window(90_000);
    assertEquals(0, window.segmentIndex(1_800_000));
    assertEquals(0, window.segmentStart(0));
    assertEquals(1, SegmentPlan.of(20_000, 1000, Duration.ofSeconds(Long.MAX_VALUE), 1).count());
  }

  @Test
  void containsCoversPlannedIndicesOnly() throws Exception {
    SegmentPlan plan = SegmentPlan.of(20_000, 1000, Duration.ofSeconds(8), 100);

    assertTrue(plan.contains(0));
    assertTrue(plan.contains(2));
    assertFalse(plan.contains(3));
    assertFalse(plan.contains(-1));
  }

  @Test
  void clipNamesAreOneIndexedAndPadded() {
    assertEquals("clip_01", SegmentPlan.clipName(0));
    assertEquals("clip_10", SegmentPlan.clipName(9));
    assertEquals("clip_100", SegmentPlan.clipName(99));
    assertThrows(IllegalArgumentException.class, () -> SegmentPlan.clipName(-1));
  }
}

package ca.gc.cra.clipstitch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("cut");
    Map<String, String> yaml = Map.of("segmentSeconds", "10", "outOfRange", "CLAMP");
    Map<String, String> cli = Map.of("segmentSeconds", "8", "in", "a.mp4");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "cut",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("8", merged.get("segmentSeconds"));
    assertEquals("CLAMP", merged.get("outOfRange"));
    assertEquals("a.mp4", merged.get("in"));
    assertEquals("none", merged.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: segmentSeconds"), warnings);
  }

  @Test
  void cliListReplacesYamlDirectory() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "combine",
        Optional.of(Map.of("inDir", "clips")),
        Map.of("in", "a.mp4,b.mp4"),
        DefaultsForMode.asFlatMap("combine"),
        msg -> {});

    assertEquals("a.mp4,b.mp4", merged.get("in"));
    assertFalse(merged.containsKey("inDir"));
  }

  @Test
  void cliDirectoryReplacesYamlList() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "combine",
        Optional.of(Map.of("in", "a.mp4")),
        Map.of("inDir", "clips"),
        DefaultsForMode.asFlatMap("combine"),
        msg -> {});

    assertEquals("clips", merged.get("inDir"));
    assertFalse(merged.containsKey("in"));
  }

  @Test
  void combineRejectsListAndDirectoryTogether() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "combine",
            Optional.empty(),
            Map.of("in", "a.mp4", "inDir", "clips"),
            DefaultsForMode.asFlatMap("combine"),
            msg -> {}));
  }

  @Test
  void yamlAloneIsNotWarnedAbout() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "probe", Optional.of(Map.of("in", "x.mp4")), Map.of(), DefaultsForMode.asFlatMap("probe"), warnings::add);

    assertEquals("x.mp4", merged.get("in"));
    assertTrue(warnings.isEmpty());
  }
}

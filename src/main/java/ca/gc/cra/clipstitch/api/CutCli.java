package ca.gc.cra.clipstitch.api;

import ca.gc.cra.clipstitch.application.media.SegmentationEngine;
import ca.gc.cra.clipstitch.config.CompositionRoot;
import ca.gc.cra.clipstitch.config.CutConfig;
import ca.gc.cra.clipstitch.domain.media.Clip;
import ca.gc.cra.clipstitch.domain.media.ContainerInfo;
import ca.gc.cra.clipstitch.domain.media.MediaProcessingException;
import ca.gc.cra.clipstitch.domain.media.SegmentPlan;
import ca.gc.cra.clipstitch.logging.LoggingConfigurator;
import ca.gc.cra.clipstitch.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for cutting one video into fixed-length clips.
 *
 * @since 0.1.0
 */
public final class CutCli {
  private static final Logger log = LoggerFactory.getLogger(CutCli.class);
  private static final Set<String> FLAGS = Set.of("--dry-run", "--allow-overwrite");
  private static final String SUMMARY_USAGE =
      "usage: cut in=FILE out=DIR segmentSeconds=N [outOfRange=DROP|CLAMP|FAIL] [maxSegments=N] "
          + "[config=FILE.yaml] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      ClipStitch cut

      Usage:
        cut in=./talk.mp4 out=./clips segmentSeconds=8 [options]

      Required:
        in=FILE                   Source MP4 file
        out=DIR                   Directory receiving clip_01.mp4, clip_02.mp4, ...
        segmentSeconds=N          Clip length in seconds (decimals allowed)

      Optional:
        outOfRange=DROP|CLAMP|FAIL  Samples outside every clip window (default DROP)
        maxSegments=N             Refuse plans with more clips than this (default 10000)
        config=FILE.yaml          Read defaults from the common and cut sections
        --dry-run                 Probe the input and print the plan without writing clips
        --allow-overwrite         Permit writing into a non-empty output directory
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Notes:
        Samples are copied, never re-encoded; clips start at the sample that falls in their window,
        which need not be a keyframe.
      """;

  private CutCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for cut CLI");
    }
    List<String> unsupported = input.unsupportedFlags(FLAGS);
    if (!unsupported.isEmpty()) {
      log.error("Unknown flag(s): {}", unsupported);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CommandSettings settings = CommandSettings.resolve("cut", input, SUMMARY_USAGE, log);
    if (settings.failed()) {
      return settings.failure();
    }
    boolean dryRun = settings.flagOrSetting(input, "--dry-run", "dryRun");
    boolean allowOverwrite = settings.flagOrSetting(input, "--allow-overwrite", "allowOverwrite");

    String metricsExporter;
    CutConfig config;
    Path source;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(settings.values());
      config = CutConfig.fromMap(settings.values());
      source = Paths.validateReadableFile(config.input());
      if (!dryRun || Files.exists(config.outputDirectory())) {
        Paths.validateWritableDir(config.outputDirectory(), !dryRun, allowOverwrite);
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid cut arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(metricsExporter)) {
      byte[] bytes = Files.readAllBytes(source);
      if (dryRun) {
        ContainerInfo info = root.containerProbe().probe(bytes);
        SegmentPlan plan = SegmentPlan.of(
            info.duration(), info.timescale(), config.segmentLength(), config.maxSegments());
        printDryRunPlan(config, info, plan, allowOverwrite);
        return ExitCode.SUCCESS;
      }
      log.info("Cutting {} into {}s clips under {} (outOfRange={})",
          source, format(config.segmentLength().toNanos() / 1e9), config.outputDirectory(),
          config.outOfRangePolicy());
      SegmentationEngine engine = root.segmentationEngine(config);
      List<Clip> clips = engine.cut(bytes, config.segmentLength());
      List<Path> written = root.clipFileWriter(allowOverwrite).writeClips(config.outputDirectory(), clips);
      for (Path path : written) {
        CliPrinter.println(path.toString());
      }
      log.info("Wrote {} clip(s) to {}", written.size(), config.outputDirectory());
      return ExitCode.SUCCESS;
    } catch (MediaProcessingException ex) {
      log.error("Cut failed ({}): {}", ex.kind(), ex.getMessage());
      return ExitCode.MEDIA_ERROR;
    } catch (IOException ex) {
      log.error("Cut I/O failure for {}", source, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while cutting {}", source, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(
      CutConfig config, ContainerInfo info, SegmentPlan plan, boolean allowOverwrite) {
    CliPrinter.printLines(
        "Cut dry-run: no clips will be written.",
        " Input             : " + config.input(),
        " Duration          : " + format(info.durationSeconds()) + "s (" + info.tracks().size() + " track(s))",
        " Segment length    : " + format(plan.segmentSeconds()) + "s",
        " Planned clips     : " + plan.count() + " (" + SegmentPlan.clipName(0) + " .. "
            + SegmentPlan.clipName(plan.count() - 1) + ")",
        " Output directory  : " + config.outputDirectory(),
        " Out-of-range      : " + config.outOfRangePolicy(),
        " Allow overwrite   : " + allowOverwrite,
        " Re-run without --dry-run to write clips.");
  }

  private static String format(double seconds) {
    return String.format(Locale.ROOT, "%.3f", seconds);
  }
}

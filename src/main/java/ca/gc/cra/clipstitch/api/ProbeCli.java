package ca.gc.cra.clipstitch.api;

import ca.gc.cra.clipstitch.config.CompositionRoot;
import ca.gc.cra.clipstitch.config.ProbeConfig;
import ca.gc.cra.clipstitch.domain.media.ContainerInfo;
import ca.gc.cra.clipstitch.domain.media.MediaProcessingException;
import ca.gc.cra.clipstitch.domain.media.TrackDescriptor;
import ca.gc.cra.clipstitch.logging.LoggingConfigurator;
import ca.gc.cra.clipstitch.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the movie duration and track layout of one container.
 *
 * @since 0.1.0
 */
public final class ProbeCli {
  private static final Logger log = LoggerFactory.getLogger(ProbeCli.class);
  private static final String SUMMARY_USAGE = "usage: probe in=FILE [config=FILE.yaml]";
  private static final String HELP_TEXT = """
      ClipStitch probe

      Usage:
        probe in=./talk.mp4

      Prints duration, timescale and one line per track. Useful to check that clips
      share a layout before combining them.
      """;

  private ProbeCli() {}

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
    }
    List<String> unsupported = input.unsupportedFlags(Set.of());
    if (!unsupported.isEmpty()) {
      log.error("Unknown flag(s): {}", unsupported);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CommandSettings settings = CommandSettings.resolve("probe", input, SUMMARY_USAGE, log);
    if (settings.failed()) {
      return settings.failure();
    }

    String metricsExporter;
    Path source;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(settings.values());
      source = Paths.validateReadableFile(ProbeConfig.fromMap(settings.values()).input());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid probe arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(metricsExporter)) {
      ContainerInfo info = root.containerProbe().probe(Files.readAllBytes(source));
      CliPrinter.printLines(describe(source, info).toArray(new String[0]));
      return ExitCode.SUCCESS;
    } catch (MediaProcessingException ex) {
      log.error("Probe failed ({}): {}", ex.kind(), ex.getMessage());
      return ExitCode.MEDIA_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read {}", source, ex);
      return ExitCode.IO_ERROR;
    }
  }

  static List<String> describe(Path source, ContainerInfo info) {
    List<String> lines = new ArrayList<>();
    lines.add(source.toString());
    lines.add(String.format(Locale.ROOT, " Duration : %.3fs (%d ticks @ %d/s)",
        info.durationSeconds(), info.duration(), info.timescale()));
    lines.add(" Tracks   : " + info.tracks().size());
    for (TrackDescriptor track : info.tracks()) {
      StringBuilder line = new StringBuilder(String.format(Locale.ROOT,
          "  #%d %-5s %s timescale=%d samples=%d duration=%.3fs lang=%s",
          track.trackId(), track.mediaType(), track.handler(), track.timescale(), track.sampleCount(),
          (double) track.duration() / track.timescale(), track.language()));
      if (track.width() > 0 && track.height() > 0) {
        line.append(String.format(Locale.ROOT, " %.0fx%.0f", track.width(), track.height()));
      }
      lines.add(line.toString());
    }
    return lines;
  }
}

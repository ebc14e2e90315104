package ca.gc.cra.clipstitch.api;

import ca.gc.cra.clipstitch.application.media.ConcatenationEngine;
import ca.gc.cra.clipstitch.application.port.MediaSource;
import ca.gc.cra.clipstitch.config.CombineConfig;
import ca.gc.cra.clipstitch.config.CompositionRoot;
import ca.gc.cra.clipstitch.domain.media.MediaProcessingException;
import ca.gc.cra.clipstitch.logging.LoggingConfigurator;
import ca.gc.cra.clipstitch.validation.Paths;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for joining clips end to end into one video.
 *
 * <p>Sources are either listed explicitly ({@code in=a.mp4,b.mp4}) or discovered in a directory
 * ({@code inDir=DIR pattern=*.mp4}) and sorted by file name.</p>
 *
 * @since 0.1.0
 */
public final class CombineCli {
  private static final Logger log = LoggerFactory.getLogger(CombineCli.class);
  private static final Set<String> FLAGS = Set.of("--dry-run", "--allow-overwrite");
  private static final String SUMMARY_USAGE =
      "usage: combine (in=FILE[,FILE...] | inDir=DIR [pattern=GLOB]) out=FILE.mp4 "
          + "[config=FILE.yaml] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      ClipStitch combine

      Usage:
        combine in=./clips/clip_01.mp4,./clips/clip_02.mp4 out=./joined.mp4 [options]
        combine inDir=./clips out=./joined.mp4 [pattern=clip_*.mp4] [options]

      Sources (exactly one):
        in=FILE[,FILE...]         Clips in playback order
        inDir=DIR                 Directory of clips, combined in file-name order

      Required:
        out=FILE.mp4              Combined output file

      Optional:
        pattern=GLOB              File-name filter for inDir (default *.mp4)
        config=FILE.yaml          Read defaults from the common and combine sections
        --dry-run                 List the resolved sources without combining
        --allow-overwrite         Replace an existing output file
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Notes:
        All clips must share track layout, media types and timescales.
      """;

  private CombineCli() {}

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
      log.debug("Verbose logging enabled for combine CLI");
    }
    List<String> unsupported = input.unsupportedFlags(FLAGS);
    if (!unsupported.isEmpty()) {
      log.error("Unknown flag(s): {}", unsupported);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CommandSettings settings = CommandSettings.resolve("combine", input, SUMMARY_USAGE, log);
    if (settings.failed()) {
      return settings.failure();
    }
    boolean dryRun = settings.flagOrSetting(input, "--dry-run", "dryRun");
    boolean allowOverwrite = settings.flagOrSetting(input, "--allow-overwrite", "allowOverwrite");

    String metricsExporter;
    CombineConfig config;
    Path output;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(settings.values());
      config = CombineConfig.fromMap(settings.values());
      for (Path source : config.inputs()) {
        Paths.validateReadableFile(source);
      }
      config.inputDirectory().ifPresent(Paths::validateReadableDir);
      output = Paths.validateWritableFile(config.output(), allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid combine arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<Path> sources;
    try {
      sources = resolveSources(config);
    } catch (IOException ex) {
      log.error("Unable to list clips in {}", config.inputDirectory().orElse(null), ex);
      return ExitCode.IO_ERROR;
    }

    if (dryRun) {
      printDryRunPlan(config, sources, output, allowOverwrite);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(metricsExporter)) {
      log.info("Combining {} clip(s) into {}", sources.size(), output);
      List<MediaSource> ordered = new ArrayList<>(sources.size());
      for (Path source : sources) {
        ordered.add(MediaSource.ofPath(source));
      }
      ConcatenationEngine engine = root.concatenationEngine();
      byte[] combined = engine.combine(ordered);
      root.clipFileWriter(allowOverwrite).write(output, combined);
      CliPrinter.println(output.toString());
      log.info("Wrote {} ({} bytes)", output, combined.length);
      return ExitCode.SUCCESS;
    } catch (MediaProcessingException ex) {
      log.error("Combine failed ({}): {}", ex.kind(), ex.getMessage());
      return ExitCode.MEDIA_ERROR;
    } catch (IOException ex) {
      log.error("Combine I/O failure writing {}", output, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while combining into {}", output, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<Path> resolveSources(CombineConfig config) throws IOException {
    if (config.inputDirectory().isEmpty()) {
      return config.inputs();
    }
    List<Path> matches = new ArrayList<>();
    try (DirectoryStream<Path> stream =
        Files.newDirectoryStream(config.inputDirectory().get(), config.pattern())) {
      for (Path entry : stream) {
        if (Files.isRegularFile(entry)) {
          matches.add(entry);
        }
      }
    }
    matches.sort(Comparator.comparing(path -> path.getFileName().toString()));
    log.debug("Resolved {} clip(s) in {} matching {}",
        matches.size(), config.inputDirectory().get(), config.pattern());
    return matches;
  }

  private static void printDryRunPlan(
      CombineConfig config, List<Path> sources, Path output, boolean allowOverwrite) {
    List<String> lines = new ArrayList<>();
    lines.add("Combine dry-run: no output will be written.");
    config.inputDirectory().ifPresent(dir ->
        lines.add(" Input directory   : " + dir + " (pattern " + config.pattern() + ")"));
    lines.add(" Sources           : " + sources.size());
    for (int i = 0; i < sources.size(); i++) {
      lines.add(String.format("   %2d. %s", i + 1, sources.get(i)));
    }
    lines.add(" Output            : " + output);
    lines.add(" Allow overwrite   : " + allowOverwrite);
    lines.add(" Re-run without --dry-run to combine.");
    CliPrinter.printLines(lines.toArray(new String[0]));
  }
}

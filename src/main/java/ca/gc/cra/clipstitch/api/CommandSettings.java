package ca.gc.cra.clipstitch.api;

import ca.gc.cra.clipstitch.config.ConfigMerger;
import ca.gc.cra.clipstitch.config.DefaultsForMode;
import ca.gc.cra.clipstitch.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Resolves the effective settings of one command: embedded defaults, then the YAML file named by
 * {@code config=}, then CLI {@code key=value} pairs.
 *
 * <p>Failures are logged against the calling command's logger and reported as an {@link ExitCode}.</p>
 */
final class CommandSettings {
  private final Map<String, String> values;
  private final ExitCode failure;

  private CommandSettings(Map<String, String> values, ExitCode failure) {
    this.values = values;
    this.failure = failure;
  }

  static CommandSettings resolve(String mode, CliInput input, String usage, Logger log) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return failed(ExitCode.INVALID_ARGS);
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return failed(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      return new CommandSettings(new LinkedHashMap<>(effective), null);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return failed(ExitCode.INVALID_ARGS);
    }
  }

  private static CommandSettings failed(ExitCode code) {
    return new CommandSettings(Map.of(), code);
  }

  boolean failed() {
    return failure != null;
  }

  ExitCode failure() {
    return failure;
  }

  /**
   * Returns the mutable effective settings; telemetry keys are consumed from it by
   * {@link TelemetryConfigurator}.
   */
  Map<String, String> values() {
    return values;
  }

  boolean flagOrSetting(CliInput input, String flag, String key) {
    return input.hasFlag(flag) || ConfigCliUtils.parseBoolean(values, key);
  }
}

package io.netguard.api;

import io.netguard.application.error.InsufficientDataException;
import io.netguard.application.error.PermissionDeniedException;
import io.netguard.config.ConfigMerger;
import io.netguard.config.DefaultsForCommand;
import io.netguard.config.NetGuardConfig;
import io.netguard.config.YamlConfigLoader;
import io.netguard.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Steps every command shares: verbose switch, argument parsing, YAML + CLI + defaults merge, and the mapping of
 * failures to {@link ExitCode}s.
 */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

  private CommandSupport() {}

  /**
   * Effective configuration of one command invocation.
   *
   * @param config validated NetGuard configuration
   * @param values merged key/value pairs, including command-specific keys such as {@code domain}
   */
  record Resolved(NetGuardConfig config, Map<String, String> values) {
    String value(String key) {
      String raw = values.get(key);
      return raw == null ? "" : raw.trim();
    }

    int intValue(String key, int fallback, int min, int max) {
      String raw = value(key);
      if (raw.isEmpty()) {
        return fallback;
      }
      try {
        int parsed = Integer.parseInt(raw);
        if (parsed < min || parsed > max) {
          throw new IllegalArgumentException(key + " must be between " + min + " and " + max + " (was " + parsed + ")");
        }
        return parsed;
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
      }
    }
  }

  static void enableVerboseIfRequested(CliInput input, String command) {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", command);
    }
  }

  /**
   * Parses {@code key=value} arguments, loads the optional {@code config=PATH} YAML file and merges everything
   * over the command defaults.
   *
   * @param command command name, also the YAML section read
   * @param input parsed CLI input
   * @param usage one-line usage printed on argument errors
   * @return resolved configuration
   * @throws CliAbort with the exit code to return when arguments or configuration are invalid
   */
  static Resolved resolve(String command, CliInput input, String usage) throws CliAbort {
    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      throw abort(ExitCode.INVALID_ARGS, "Invalid argument: " + ex.getMessage(), usage);
    }

    String configPath = cliKv.remove("config");
    Optional<Map<String, String>> yaml = loadYaml(command, configPath, usage);

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          command, yaml, cliKv, DefaultsForCommand.asFlatMap(command), log::warn);
    } catch (IllegalArgumentException ex) {
      throw abort(ExitCode.INVALID_ARGS, "Invalid " + command + " configuration: " + ex.getMessage(), usage);
    }

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      return new Resolved(NetGuardConfig.fromMap(configInputs), configInputs);
    } catch (IllegalArgumentException ex) {
      throw abort(ExitCode.INVALID_ARGS, "Invalid " + command + " configuration: " + ex.getMessage(), usage);
    }
  }

  private static Optional<Map<String, String>> loadYaml(String command, String configPath, String usage)
      throws CliAbort {
    if (configPath == null || configPath.isBlank()) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath.trim());
    if (!Files.exists(yamlPath)) {
      throw abort(ExitCode.INVALID_ARGS, "Configuration file does not exist: " + yamlPath, usage);
    }
    try {
      return YamlConfigLoader.load(yamlPath, command);
    } catch (IllegalArgumentException ex) {
      throw abort(ExitCode.INVALID_ARGS, "Invalid YAML configuration: " + ex.getMessage(), usage);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  /**
   * Logs {@code failure} and maps it to an exit code.
   *
   * @param command command that failed
   * @param failure exception thrown by the service
   * @return exit code for the failure class
   */
  static ExitCode failure(String command, Exception failure) {
    if (failure instanceof PermissionDeniedException denied) {
      log.error("{}: {} (run with administrator rights)", command, denied.getMessage());
      return ExitCode.PERMISSION_DENIED;
    }
    if (failure instanceof InsufficientDataException insufficient) {
      log.error("{}: {}", command, insufficient.getMessage());
      return ExitCode.INSUFFICIENT_DATA;
    }
    if (failure instanceof IOException) {
      log.error("{} I/O failure", command, failure);
      return ExitCode.IO_ERROR;
    }
    if (failure instanceof IllegalArgumentException) {
      log.error("{} configuration error: {}", command, failure.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    log.error("Unexpected failure in {}", command, failure);
    return ExitCode.RUNTIME_FAILURE;
  }

  static CliAbort abort(ExitCode code, String message, String usage) {
    log.error(message);
    if (usage != null) {
      CliPrinter.println(usage);
    }
    return new CliAbort(code);
  }

  /** Carries the exit code out of a failed preparation step. */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;
    private final transient ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}

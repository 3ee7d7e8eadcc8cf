package io.netguard.api;

import io.netguard.api.CommandSupport.CliAbort;
import io.netguard.api.CommandSupport.Resolved;
import io.netguard.application.pipeline.CleanupResult;
import io.netguard.config.CompositionRoot;
import io.netguard.config.NetGuardConfig;
import java.time.Duration;
import java.util.function.Function;

/**
 * Applies audit retention. Detections for domains that are still actively blocked are kept regardless of age.
 *
 * @since 0.1.0
 */
public final class CleanupCli {
  static final String COMMAND = "cleanup";
  private static final String SUMMARY_USAGE = "usage: netguard cleanup [retentionDays=N] [config=PATH] [dataDir=PATH]";
  private static final String HELP_TEXT = """
      NetGuard cleanup

      Usage:
        netguard cleanup [retentionDays=N]

      Options:
        retentionDays=N  Remove audit entries older than N days (0-3650, default 30)
        config=PATH      YAML file; reads the common and cleanup sections
        dataDir=PATH     Directory holding the audit log (default ~/.netguard)
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private CleanupCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new);
  }

  static ExitCode run(String[] args, Function<NetGuardConfig, CompositionRoot> roots) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CommandSupport.enableVerboseIfRequested(input, COMMAND);

    Resolved resolved;
    int retentionDays;
    try {
      if (input.action() != null) {
        throw CommandSupport.abort(ExitCode.INVALID_ARGS, "Unexpected argument: " + input.action(), SUMMARY_USAGE);
      }
      resolved = CommandSupport.resolve(COMMAND, input, SUMMARY_USAGE);
      retentionDays = resolved.intValue("retentionDays", 30, 0, 3650);
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      return CommandSupport.abort(ExitCode.INVALID_ARGS, ex.getMessage(), SUMMARY_USAGE).exitCode();
    }

    try (CompositionRoot root = roots.apply(resolved.config())) {
      CleanupResult result = root.monitoringService().cleanup(Duration.ofDays(retentionDays));
      CliPrinter.printf("Removed %d audit entries and %d captured transactions older than %d day(s)",
          result.auditEntriesRemoved(), result.transactionsRemoved(), retentionDays);
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CommandSupport.failure(COMMAND, ex);
    }
  }
}

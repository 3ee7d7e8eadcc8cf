package io.netguard.api;

import io.netguard.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * NetGuard CLI dispatcher that routes to subcommands.
 *
 * <p>The first argument that is neither a flag nor a {@code key=value} pair names the command. Every other
 * argument, flags included, is passed to the command so {@code netguard sites --help} shows the sites help.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: netguard <monitor|classify|sites|detections|cleanup> [action] [key=value ...] [--flags]";
  private static final String HELP_TEXT = """
      NetGuard gambling traffic monitor

      Usage:
        netguard <command> [action] [options]

      Commands:
        monitor     Sample connections, classify hosts and enforce blocks (monitor --help for details)
        classify    Dry-run URLs, record feedback, retrain and inspect the model
        sites       List, block, unblock, export and import blocked sites
        detections  Query the audit log
        cleanup     Apply audit log retention

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String command = null;
    List<String> delegate = new ArrayList<>();
    if (args != null) {
      for (String arg : args) {
        if (arg == null) {
          continue;
        }
        String trimmed = arg.trim();
        if (command == null && !trimmed.isEmpty() && !trimmed.startsWith("-") && !trimmed.contains("=")) {
          command = trimmed.toLowerCase(Locale.ROOT);
        } else {
          delegate.add(arg);
        }
      }
    }

    CliInput input = CliInput.parse(delegate.toArray(String[]::new));
    if (command == null || command.equals("help")) {
      if (input.help() || "help".equals(command)) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String[] delegateArgs = delegate.toArray(String[]::new);
    return switch (command) {
      case MonitorCli.COMMAND -> MonitorCli.run(delegateArgs);
      case ClassifyCli.COMMAND -> ClassifyCli.run(delegateArgs);
      case SitesCli.COMMAND -> SitesCli.run(delegateArgs);
      case DetectionsCli.COMMAND -> DetectionsCli.run(delegateArgs);
      case CleanupCli.COMMAND -> CleanupCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}

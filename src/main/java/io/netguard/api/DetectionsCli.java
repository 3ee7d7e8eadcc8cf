package io.netguard.api;

import io.netguard.api.CommandSupport.CliAbort;
import io.netguard.api.CommandSupport.Resolved;
import io.netguard.application.pipeline.MonitoringService;
import io.netguard.config.CompositionRoot;
import io.netguard.config.NetGuardConfig;
import io.netguard.domain.audit.AuditStatistics;
import io.netguard.domain.audit.DetectionLogEntry;
import io.netguard.domain.audit.DetectionQuery;
import io.netguard.domain.audit.EnforcementAction;
import io.netguard.domain.audit.PipelineError;
import io.netguard.domain.decision.Verdict;
import io.netguard.logging.Logs;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Read-only audit queries: detections with filters and paging, enforcement actions, pipeline errors and
 * summary statistics.
 *
 * @since 0.1.0
 */
public final class DetectionsCli {
  static final String COMMAND = "detections";
  private static final int SUBJECT_BYTES = 96;
  private static final int RECENT_LIMIT = 50;
  private static final String SUMMARY_USAGE =
      "usage: netguard detections [domain=TEXT] [verdict=block|allow|observe] [hours=N | since=ISO-8601] "
          + "[limit=N] [offset=N] [--stats] [--errors] [--enforcement] [config=PATH]";
  private static final String HELP_TEXT = """
      NetGuard detections

      Usage:
        netguard detections [filters] [--stats | --errors | --enforcement]

      Filters:
        domain=TEXT          Domains containing TEXT
        verdict=VERDICT      block, allow or observe
        hours=N              Entries from the last N hours
        since=INSTANT        Entries at or after an ISO-8601 instant (e.g. 2024-05-01T00:00:00Z)
        limit=N              Page size (1-10000, default 100)
        offset=N             Entries to skip, newest first (default 0)

      Views:
        --stats              Totals for detections, blocks, enforcement actions and errors
        --errors             Most recent pipeline errors
        --enforcement        Most recent hosts file changes

      Options:
        config=PATH          YAML file; reads the common and detections sections
        dataDir=PATH         Directory holding the audit log (default ~/.netguard)
        --verbose            Enable DEBUG logging
        --help               Show this message
      """;

  private DetectionsCli() {}

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
    try {
      if (input.action() != null) {
        throw CommandSupport.abort(ExitCode.INVALID_ARGS, "Unexpected argument: " + input.action(), SUMMARY_USAGE);
      }
      resolved = CommandSupport.resolve(COMMAND, input, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    try (CompositionRoot root = roots.apply(resolved.config())) {
      MonitoringService service = root.monitoringService();
      if (input.hasFlag("--stats")) {
        printStats(service.auditStatistics());
      } else if (input.hasFlag("--errors")) {
        printErrors(service.listErrors(resolved.intValue("limit", RECENT_LIMIT, 1, DetectionQuery.MAX_LIMIT)));
      } else if (input.hasFlag("--enforcement")) {
        printEnforcement(
            service.listEnforcementActions(resolved.intValue("limit", RECENT_LIMIT, 1, DetectionQuery.MAX_LIMIT)));
      } else {
        DetectionQuery query = query(resolved, () -> root.clock().now());
        printDetections(service.listDetections(query), query);
      }
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      return CommandSupport.abort(ExitCode.INVALID_ARGS, "Invalid detections filter: " + ex.getMessage(), SUMMARY_USAGE)
          .exitCode();
    } catch (Exception ex) {
      return CommandSupport.failure(COMMAND, ex);
    }
  }

  static DetectionQuery query(Resolved resolved, Supplier<Instant> now) {
    DetectionQuery query = DetectionQuery.all();
    String domain = resolved.value("domain");
    if (!domain.isEmpty()) {
      query = query.withDomain(domain.toLowerCase(Locale.ROOT));
    }
    String verdict = resolved.value("verdict");
    if (!verdict.isEmpty()) {
      try {
        query = query.withVerdict(Verdict.valueOf(verdict.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("verdict must be block, allow or observe (was " + verdict + ")", ex);
      }
    }
    String since = resolved.value("since");
    int hours = resolved.intValue("hours", 0, 0, 24 * 365 * 10);
    if (!since.isEmpty() && hours > 0) {
      throw new IllegalArgumentException("use either hours= or since=, not both");
    }
    if (hours > 0) {
      query = query.withRange(now.get().minus(Duration.ofHours(hours)), null);
    } else if (!since.isEmpty()) {
      try {
        query = query.withRange(Instant.parse(since), null);
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException("since must be an ISO-8601 instant (was " + since + ")", ex);
      }
    }
    int limit = resolved.intValue("limit", DetectionQuery.DEFAULT_LIMIT, 1, DetectionQuery.MAX_LIMIT);
    int offset = resolved.intValue("offset", 0, 0, Integer.MAX_VALUE);
    return query.withPage(limit, offset);
  }

  private static void printDetections(List<DetectionLogEntry> entries, DetectionQuery query) {
    for (DetectionLogEntry entry : entries) {
      CliPrinter.printf("%s %-7s %-12s %.3f %-40s %s",
          entry.timestamp(), entry.decision().verdict(), entry.source(), entry.result().score(),
          entry.domain(), Logs.truncate(entry.result().subject(), SUBJECT_BYTES));
    }
    CliPrinter.printf("%d detection(s) shown (limit %d, offset %d)", entries.size(), query.limit(), query.offset());
  }

  private static void printEnforcement(List<EnforcementAction> actions) {
    for (EnforcementAction action : actions) {
      CliPrinter.printf("%s %-7s %-8s %-40s %s",
          action.timestamp(), action.action(), action.outcome(), action.domain(), Logs.truncate(action.detail(), 160));
    }
    CliPrinter.printf("%d enforcement action(s) shown", actions.size());
  }

  private static void printErrors(List<PipelineError> errors) {
    for (PipelineError error : errors) {
      CliPrinter.printf("%s %-9s %-30s %s: %s",
          error.timestamp(), error.stage(), error.domain().isEmpty() ? "-" : error.domain(), error.errorType(),
          Logs.truncate(error.message(), 200));
    }
    CliPrinter.printf("%d error(s) shown", errors.size());
  }

  private static void printStats(AuditStatistics stats) {
    CliPrinter.printLines(
        "Detections (total)    : " + stats.totalDetections(),
        "Detections (24h)      : " + stats.recentDetections(),
        "Gambling detections   : " + stats.gamblingDetections(),
        "Blocking decisions    : " + stats.blockedDetections(),
        "Enforcement actions   : " + stats.enforcementActions(),
        "Pipeline errors       : " + stats.pipelineErrors());
  }
}

package io.netguard.api;

import io.netguard.api.CommandSupport.CliAbort;
import io.netguard.api.CommandSupport.Resolved;
import io.netguard.application.enforcement.ReconcileResult;
import io.netguard.application.pipeline.MonitoringService;
import io.netguard.config.CompositionRoot;
import io.netguard.config.NetGuardConfig;
import io.netguard.domain.site.BlockedSite;
import io.netguard.infrastructure.persistence.BlockedSiteJson;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Block list management: list, block, unblock, export, import and an immediate hosts file reconciliation.
 *
 * <p>Every change is written to the block list first and then reconciled into the hosts file; a reconciliation
 * refused by the operating system leaves the block list committed and exits with
 * {@link ExitCode#PERMISSION_DENIED}.</p>
 *
 * @since 0.1.0
 */
public final class SitesCli {
  static final String COMMAND = "sites";
  private static final String SUMMARY_USAGE =
      "usage: netguard sites [list|block|unblock|export|import|reconcile] [domain=DOMAIN] [reason=TEXT] "
          + "[file=PATH] [--all] [config=PATH]";
  private static final String HELP_TEXT = """
      NetGuard sites

      Usage:
        netguard sites list [--all]
        netguard sites block domain=DOMAIN [reason=TEXT]
        netguard sites unblock domain=DOMAIN
        netguard sites export file=PATH
        netguard sites import file=PATH
        netguard sites reconcile

      Actions:
        list       Show active blocks (--all adds deactivated entries and the allow list)
        block      Block a domain and its subdomains; removes it from the allow list
        unblock    Remove a block and allow-list the domain so the classifier cannot re-block it
        export     Write the block list and allow list as JSON
        import     Merge a JSON export into the block list
        reconcile  Rewrite the managed hosts file region from the block list now

      Options:
        config=PATH      YAML file; reads the common and sites sections
        dataDir=PATH     Directory holding blocked-sites.json (default ~/.netguard)
        hostsFile=PATH   Hosts file to manage (default is the system hosts file)
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private SitesCli() {}

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
      resolved = CommandSupport.resolve(COMMAND, input, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }
    String action = input.action() == null ? "list" : input.action();

    try (CompositionRoot root = roots.apply(resolved.config())) {
      MonitoringService service = root.monitoringService();
      switch (action) {
        case "list":
          list(service, input.hasFlag("--all"));
          return ExitCode.SUCCESS;
        case "block":
          return block(service, resolved);
        case "unblock":
          return unblock(service, resolved);
        case "export":
          return export(service, resolved);
        case "import":
          return importFile(service, resolved);
        case "reconcile":
          printReconcile(service.reconcileNow());
          return ExitCode.SUCCESS;
        default:
          throw CommandSupport.abort(ExitCode.INVALID_ARGS, "Unknown sites action: " + action, SUMMARY_USAGE);
      }
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (Exception ex) {
      return CommandSupport.failure(COMMAND, ex);
    }
  }

  private static void list(MonitoringService service, boolean all) {
    List<BlockedSite> sites = new ArrayList<>(service.exportBlockedSites());
    sites.sort(Comparator.comparing(BlockedSite::domain));
    int shown = 0;
    for (BlockedSite site : sites) {
      if (!site.active() && !all) {
        continue;
      }
      CliPrinter.printf("%-40s %-6s %-8s %s  %s",
          site.domain(), site.source(), site.active() ? "active" : "inactive", site.addedAt(), site.reason());
      shown++;
    }
    CliPrinter.printf("%d blocked site(s) listed", shown);
    if (all) {
      List<String> allowed = new ArrayList<>(service.allowList());
      allowed.sort(Comparator.naturalOrder());
      for (String domain : allowed) {
        CliPrinter.printf("%-40s allowed", domain);
      }
    }
  }

  private static ExitCode block(MonitoringService service, Resolved resolved) throws CliAbort, IOException {
    String domain = requireDomain(resolved, "block");
    BlockedSite site = service.blockDomain(domain, resolved.value("reason"));
    CliPrinter.printf("Blocked %s (%s)", site.domain(), site.reason());
    printReconcile(service.reconcileNow());
    return ExitCode.SUCCESS;
  }

  private static ExitCode unblock(MonitoringService service, Resolved resolved) throws CliAbort, IOException {
    String domain = requireDomain(resolved, "unblock");
    boolean removed = service.unblockDomain(domain);
    CliPrinter.println(removed
        ? "Unblocked " + domain + " and added it to the allow list"
        : domain + " was not blocked; added it to the allow list");
    printReconcile(service.reconcileNow());
    return ExitCode.SUCCESS;
  }

  private static ExitCode export(MonitoringService service, Resolved resolved) throws CliAbort, IOException {
    Path file = requireFile(resolved, "export");
    List<BlockedSite> sites = service.exportBlockedSites();
    BlockedSiteJson.write(file, sites, service.allowList());
    CliPrinter.printf("Exported %d block list entries to %s", sites.size(), file);
    return ExitCode.SUCCESS;
  }

  private static ExitCode importFile(MonitoringService service, Resolved resolved) throws CliAbort, IOException {
    Path file = requireFile(resolved, "import");
    BlockedSiteJson.Document document = BlockedSiteJson.read(file);
    int written = service.importBlockedSites(document.sites());
    int allowed = service.importAllowList(document.allowList());
    CliPrinter.printf("Imported %d block list entries and %d allow list entries from %s", written, allowed, file);
    if (written > 0) {
      printReconcile(service.reconcileNow());
    }
    return ExitCode.SUCCESS;
  }

  private static String requireDomain(Resolved resolved, String action) throws CliAbort {
    String domain = resolved.value("domain");
    if (domain.isEmpty()) {
      throw CommandSupport.abort(ExitCode.INVALID_ARGS, "sites " + action + " requires domain=DOMAIN", SUMMARY_USAGE);
    }
    return domain;
  }

  private static Path requireFile(Resolved resolved, String action) throws CliAbort {
    String file = resolved.value("file");
    if (file.isEmpty()) {
      throw CommandSupport.abort(ExitCode.INVALID_ARGS, "sites " + action + " requires file=PATH", SUMMARY_USAGE);
    }
    return Path.of(file);
  }

  private static void printReconcile(ReconcileResult result) {
    if (!result.written()) {
      CliPrinter.println("Hosts file already up to date");
      return;
    }
    CliPrinter.printf("Hosts file updated: %d added, %d removed", result.added().size(), result.removed().size());
  }
}

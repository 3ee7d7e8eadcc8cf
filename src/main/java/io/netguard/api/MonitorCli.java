package io.netguard.api;

import io.netguard.api.CommandSupport.CliAbort;
import io.netguard.api.CommandSupport.Resolved;
import io.netguard.application.pipeline.MonitoringService;
import io.netguard.config.CompositionRoot;
import io.netguard.config.NetGuardConfig;
import io.netguard.domain.stats.MonitoringStats;
import io.netguard.infrastructure.intercept.CertificateAuthority;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the monitor in the foreground until interrupted or until {@code durationSec} elapses.
 *
 * @since 0.1.0
 */
public final class MonitorCli {
  private static final Logger log = LoggerFactory.getLogger(MonitorCli.class);
  static final String COMMAND = "monitor";
  private static final String SUMMARY_USAGE =
      "usage: netguard monitor [config=PATH] [dataDir=PATH] [hostsFile=PATH] [sensitivity=0-100] "
          + "[devMode=true|false] [durationSec=N] [pollIntervalMs=N] [proxyPort=N] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      NetGuard monitor

      Usage:
        netguard monitor [options]

      Operator settings (persisted in dataDir/settings.properties):
        sensitivity=0-100         Detection sensitivity; higher blocks more (default 50)
        devMode=true|false        Run the intercepting proxy for full-page classification

      Runtime options:
        config=PATH               YAML file; reads the common and monitor sections
        dataDir=PATH              Block list, audit log, model and root CA (default ~/.netguard)
        hostsFile=PATH            Hosts file to manage (default is the system hosts file)
        redirectAddress=IP        Address blocked domains resolve to (default 127.0.0.1)
        pollIntervalMs=N          Connection sampling period (default 2000)
        idleTimeoutMs=N           Connection idle eviction (default 30000)
        reanalysisWindowSec=N     Minimum seconds between classifications of one host (default 300)
        reconcileIntervalMs=N     Hosts file reconciliation period (default 30000)
        laneCount=N laneCapacity=N  Detection lane layout
        proxyHost=HOST proxyPort=N  Proxy listen address (default 127.0.0.1:8080)
        allowRemoteProxy=true     Acknowledge a non-loopback proxyHost
        durationSec=N             Stop after N seconds (default 0 = until Ctrl+C)
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint
        --dry-run                 Print the effective configuration and exit
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Notes:
        Writing the system hosts file needs administrator rights.
        In dev mode, install dataDir/ca/netguard-ca.pem in the browser and point its proxy at proxyHost:proxyPort.
      """;

  private MonitorCli() {}

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
    Integer sensitivity;
    Boolean devMode;
    int durationSec;
    try {
      if (input.action() != null) {
        throw CommandSupport.abort(ExitCode.INVALID_ARGS, "Unexpected argument: " + input.action(), SUMMARY_USAGE);
      }
      resolved = CommandSupport.resolve(COMMAND, input, SUMMARY_USAGE);
      sensitivity = resolved.value("sensitivity").isEmpty()
          ? null
          : resolved.intValue("sensitivity", 50, 0, 100);
      devMode = resolved.value("devMode").isEmpty() ? null : parseStrictBoolean("devMode", resolved.value("devMode"));
      durationSec = resolved.intValue("durationSec", 0, 0, 31_536_000);
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid monitor arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    NetGuardConfig config = resolved.config();
    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config, sensitivity, devMode, durationSec);
      return ExitCode.SUCCESS;
    }

    CompositionRoot root = roots.apply(config);
    CountDownLatch stopSignal = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      stopSignal.countDown();
      root.close();
    }, "netguard-shutdown");
    try {
      MonitoringService service = root.monitoringService();
      if (sensitivity != null) {
        service.setSensitivity(sensitivity);
      }
      if (devMode != null) {
        service.setDevMode(devMode);
      }
      Runtime.getRuntime().addShutdownHook(hook);
      service.start();
      printBanner(config, service);
      if (durationSec > 0) {
        stopSignal.await(durationSec, TimeUnit.SECONDS);
      } else {
        stopSignal.await();
      }
      MonitoringStats stats = service.currentStats();
      root.close();
      CliPrinter.printf("Stopped. %d connections observed, %d active blocks, %d detections logged.",
          stats.connectionsObserved(), stats.blockCount(), stats.detectionsLogged());
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Monitor interrupted; shutting down");
      root.close();
      return ExitCode.INTERRUPTED;
    } catch (Exception ex) {
      root.close();
      return CommandSupport.failure(COMMAND, ex);
    } finally {
      removeHook(hook);
    }
  }

  private static boolean parseStrictBoolean(String key, String value) {
    if (value.equalsIgnoreCase("true")) {
      return true;
    }
    if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; shutdown hook stays registered");
    }
  }

  private static void printBanner(NetGuardConfig config, MonitoringService service) {
    MonitoringStats stats = service.currentStats();
    CliPrinter.printLines(
        "NetGuard monitoring started.",
        " Data directory   : " + config.dataDir(),
        " Hosts file       : " + config.hostsFile(),
        " Sensitivity      : " + stats.sensitivity(),
        " Model version    : " + stats.modelVersion(),
        " Dev mode         : " + stats.devMode());
    if (stats.devMode()) {
      CliPrinter.printLines(
          " Proxy            : " + config.proxyAddress().getHostString() + ":" + config.proxyAddress().getPort(),
          " Root CA (install): " + config.caDir().resolve(CertificateAuthority.PEM_FILE));
    }
    CliPrinter.println(" Press Ctrl+C to stop.");
  }

  private static void printDryRunPlan(
      NetGuardConfig config, Integer sensitivity, Boolean devMode, int durationSec) {
    CliPrinter.printLines(
        "Monitor dry-run: nothing will be started.",
        " Data directory   : " + config.dataDir(),
        " Hosts file       : " + config.hostsFile(),
        " Redirect address : " + config.redirectAddress(),
        " Poll interval    : " + config.sampler().pollInterval().toMillis() + " ms",
        " Idle timeout     : " + config.sampler().idleTimeout().toMillis() + " ms",
        " Re-analysis      : " + config.sampler().reanalysisWindow().toSeconds() + " s",
        " Lanes            : " + config.pipeline().laneCount() + " x " + config.pipeline().laneCapacity(),
        " Reconcile every  : " + config.reconcileInterval().toMillis() + " ms",
        " Proxy            : " + config.proxyAddress().getHostString() + ":" + config.proxyAddress().getPort(),
        " Sensitivity      : " + (sensitivity == null ? "<stored>" : sensitivity),
        " Dev mode         : " + (devMode == null ? "<stored>" : devMode),
        " Duration         : " + (durationSec == 0 ? "until interrupted" : durationSec + " s"),
        " Re-run without --dry-run to start monitoring.");
  }
}

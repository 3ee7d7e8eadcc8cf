package io.netguard.config;

import io.netguard.application.decision.DecisionEngine;
import io.netguard.application.enforcement.EnforcementManager;
import io.netguard.application.pipeline.MonitorOptions;
import io.netguard.application.pipeline.PipelineSettings;
import io.netguard.application.sampling.SamplerSettings;
import io.netguard.infrastructure.enforcement.HostsFileOverrideTable;
import io.netguard.infrastructure.intercept.InterceptingProxy;
import io.netguard.infrastructure.persistence.InMemoryTransactionStore;
import io.netguard.validation.Net;
import io.netguard.validation.Numbers;
import io.netguard.validation.Strings;
import java.net.InetSocketAddress;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable runtime configuration for the NetGuard monitor and its CLI commands.
 * <p><strong>Why:</strong> Collects every tunable in one validated value so the composition root never sees raw
 * strings.</p>
 * <p><strong>Role:</strong> Built by {@link #fromMap(Map)} from the merged CLI, YAML and default key/value map
 * (see {@link ConfigMerger}); consumed by {@link CompositionRoot}.</p>
 * <p><strong>Keys:</strong> {@code dataDir}, {@code hostsFile}, {@code redirectAddress}, {@code pollIntervalMs},
 * {@code idleTimeoutMs}, {@code enumerationTimeoutMs}, {@code reanalysisWindowSec}, {@code laneCount},
 * {@code laneCapacity}, {@code reconcileIntervalMs}, {@code observeBand}, {@code proxyHost}, {@code proxyPort},
 * {@code socketTimeoutMs}, {@code drainTimeoutMs}, {@code transactionCapacity}, {@code transactionMaxAgeMin},
 * {@code lexicon}, {@code seedCorpus}, {@code caPassword}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable.</p>
 *
 * @param dataDir directory holding the block list, audit log, model, settings and root CA
 * @param hostsFile hosts file managed by the enforcement manager
 * @param redirectAddress address blocked domains resolve to
 * @param sampler sampler timing
 * @param pipeline detection lane layout
 * @param reconcileInterval period of the reconciliation tick
 * @param observeBand width of the observe band below the block threshold
 * @param proxyAddress listen address of the dev-mode proxy
 * @param socketTimeout proxy read timeout per exchange
 * @param drainTimeout how long stopping the proxy waits for in-flight exchanges
 * @param transactionCapacity maximum captured transactions kept in memory
 * @param transactionMaxAge maximum age of a kept captured transaction
 * @param lexiconFile lexicon YAML, or empty for the bundled lexicon
 * @param seedCorpusFile seed corpus YAML, or empty for the bundled corpus
 * @param caPassword password of the root CA keystore
 * @since 0.1.0
 */
public record NetGuardConfig(
    Path dataDir,
    Path hostsFile,
    String redirectAddress,
    SamplerSettings sampler,
    PipelineSettings pipeline,
    Duration reconcileInterval,
    double observeBand,
    InetSocketAddress proxyAddress,
    Duration socketTimeout,
    Duration drainTimeout,
    int transactionCapacity,
    Duration transactionMaxAge,
    Optional<Path> lexiconFile,
    Optional<Path> seedCorpusFile,
    String caPassword) {

  static final String DEFAULT_CA_PASSWORD = "netguard";

  private static final int MIN_POLL_MILLIS = 100;
  private static final int MAX_POLL_MILLIS = 3_600_000;
  private static final int MAX_IDLE_MILLIS = 86_400_000;
  private static final int MIN_ENUMERATION_MILLIS = 10;
  private static final int MAX_REANALYSIS_SECONDS = 86_400;
  private static final int MAX_LANES = 64;
  private static final int MAX_LANE_CAPACITY = 100_000;
  private static final int MIN_RECONCILE_MILLIS = 100;
  private static final int MAX_RECONCILE_MILLIS = 86_400_000;
  private static final int MIN_SOCKET_TIMEOUT_MILLIS = 100;
  private static final int MAX_SOCKET_TIMEOUT_MILLIS = 600_000;
  private static final int MAX_DRAIN_MILLIS = 600_000;
  private static final int MAX_TRANSACTIONS = 1_000_000;
  private static final int MAX_TRANSACTION_AGE_MINUTES = 10_080;

  public NetGuardConfig {
    Objects.requireNonNull(dataDir, "dataDir");
    Objects.requireNonNull(hostsFile, "hostsFile");
    redirectAddress = Strings.requireNonBlank("redirectAddress", redirectAddress);
    if (Net.isPublicAddress(redirectAddress)) {
      throw new IllegalArgumentException("redirectAddress must be a loopback or unroutable address: " + redirectAddress);
    }
    Objects.requireNonNull(sampler, "sampler");
    Objects.requireNonNull(pipeline, "pipeline");
    Objects.requireNonNull(reconcileInterval, "reconcileInterval");
    Numbers.requireRange("observeBand", observeBand, 0.0, 1.0);
    Objects.requireNonNull(proxyAddress, "proxyAddress");
    Objects.requireNonNull(socketTimeout, "socketTimeout");
    Objects.requireNonNull(drainTimeout, "drainTimeout");
    Numbers.requireRange("transactionCapacity", transactionCapacity, 1, MAX_TRANSACTIONS);
    Objects.requireNonNull(transactionMaxAge, "transactionMaxAge");
    lexiconFile = lexiconFile == null ? Optional.empty() : lexiconFile;
    seedCorpusFile = seedCorpusFile == null ? Optional.empty() : seedCorpusFile;
    caPassword = Strings.requireNonBlank("caPassword", caPassword);
  }

  /**
   * Returns the configuration used when no YAML or CLI overrides are supplied.
   *
   * @return default configuration rooted at {@code ~/.netguard}
   */
  public static NetGuardConfig defaults() {
    return new NetGuardConfig(
        defaultDataDir(),
        HostsFileOverrideTable.systemDefault(),
        EnforcementManager.DEFAULT_REDIRECT_ADDRESS,
        SamplerSettings.defaults(),
        PipelineSettings.defaults(),
        MonitorOptions.defaults().reconcileInterval(),
        DecisionEngine.DEFAULT_OBSERVE_BAND,
        InetSocketAddress.createUnresolved(InterceptingProxy.DEFAULT_HOST, InterceptingProxy.DEFAULT_PORT),
        InterceptingProxy.DEFAULT_SOCKET_TIMEOUT,
        InterceptingProxy.DEFAULT_DRAIN_TIMEOUT,
        InMemoryTransactionStore.DEFAULT_CAPACITY,
        InMemoryTransactionStore.DEFAULT_MAX_AGE,
        Optional.empty(),
        Optional.empty(),
        DEFAULT_CA_PASSWORD);
  }

  /**
   * Builds a configuration from flattened key/value pairs, falling back to {@link #defaults()} per key.
   *
   * @param args merged configuration; unknown keys are ignored
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static NetGuardConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : args;
    NetGuardConfig defaults = defaults();

    Path dataDir = hasText(kv.get("dataDir")) ? parsePath("dataDir", kv.get("dataDir")) : defaults.dataDir();
    Path hostsFile = hasText(kv.get("hostsFile"))
        ? parsePath("hostsFile", kv.get("hostsFile"))
        : defaults.hostsFile();
    String redirect = hasText(kv.get("redirectAddress"))
        ? kv.get("redirectAddress").trim()
        : defaults.redirectAddress();

    SamplerSettings samplerDefaults = defaults.sampler();
    int pollMillis = parseBoundedInt(kv, "pollIntervalMs",
        (int) samplerDefaults.pollInterval().toMillis(), MIN_POLL_MILLIS, MAX_POLL_MILLIS);
    int idleMillis = parseBoundedInt(kv, "idleTimeoutMs",
        (int) samplerDefaults.idleTimeout().toMillis(), 0, MAX_IDLE_MILLIS);
    int enumerationMillis = parseBoundedInt(kv, "enumerationTimeoutMs",
        (int) samplerDefaults.enumerationTimeout().toMillis(), MIN_ENUMERATION_MILLIS, MAX_POLL_MILLIS);
    int reanalysisSeconds = parseBoundedInt(kv, "reanalysisWindowSec",
        (int) samplerDefaults.reanalysisWindow().toSeconds(), 0, MAX_REANALYSIS_SECONDS);
    SamplerSettings sampler = new SamplerSettings(
        Duration.ofMillis(pollMillis),
        Duration.ofMillis(idleMillis),
        Duration.ofMillis(enumerationMillis),
        Duration.ofSeconds(reanalysisSeconds));

    int laneCount = parseBoundedInt(kv, "laneCount", defaults.pipeline().laneCount(), 1, MAX_LANES);
    int laneCapacity = parseBoundedInt(
        kv, "laneCapacity", defaults.pipeline().laneCapacity(), 1, MAX_LANE_CAPACITY);

    int reconcileMillis = parseBoundedInt(kv, "reconcileIntervalMs",
        (int) defaults.reconcileInterval().toMillis(), MIN_RECONCILE_MILLIS, MAX_RECONCILE_MILLIS);
    double observeBand = parseBoundedDouble(kv, "observeBand", defaults.observeBand(), 0.0, 1.0);

    String proxyHost = hasText(kv.get("proxyHost"))
        ? kv.get("proxyHost").trim()
        : defaults.proxyAddress().getHostString();
    int proxyPort = parseBoundedInt(kv, "proxyPort", defaults.proxyAddress().getPort(), 0, 65_535);

    int socketMillis = parseBoundedInt(kv, "socketTimeoutMs",
        (int) defaults.socketTimeout().toMillis(), MIN_SOCKET_TIMEOUT_MILLIS, MAX_SOCKET_TIMEOUT_MILLIS);
    int drainMillis = parseBoundedInt(kv, "drainTimeoutMs",
        (int) defaults.drainTimeout().toMillis(), 0, MAX_DRAIN_MILLIS);

    int transactionCapacity = parseBoundedInt(
        kv, "transactionCapacity", defaults.transactionCapacity(), 1, MAX_TRANSACTIONS);
    int transactionMaxAgeMinutes = parseBoundedInt(kv, "transactionMaxAgeMin",
        (int) defaults.transactionMaxAge().toMinutes(), 1, MAX_TRANSACTION_AGE_MINUTES);

    Optional<Path> lexicon = parseOptionalPath("lexicon", kv.get("lexicon"));
    Optional<Path> seedCorpus = parseOptionalPath("seedCorpus", kv.get("seedCorpus"));
    String caPassword = hasText(kv.get("caPassword")) ? kv.get("caPassword") : defaults.caPassword();

    return new NetGuardConfig(
        dataDir,
        hostsFile,
        redirect,
        sampler,
        new PipelineSettings(laneCount, laneCapacity),
        Duration.ofMillis(reconcileMillis),
        observeBand,
        InetSocketAddress.createUnresolved(proxyHost, proxyPort),
        Duration.ofMillis(socketMillis),
        Duration.ofMillis(drainMillis),
        transactionCapacity,
        Duration.ofMinutes(transactionMaxAgeMinutes),
        lexicon,
        seedCorpus,
        caPassword);
  }

  /** @return monitoring tunables derived from this configuration */
  public MonitorOptions monitorOptions() {
    return new MonitorOptions(sampler, pipeline, reconcileInterval, observeBand, redirectAddress);
  }

  /** @return directory holding the root CA keystore and its PEM export */
  public Path caDir() {
    return dataDir.resolve("ca");
  }

  /** @return directory holding the JSON-lines audit files */
  public Path auditDir() {
    return dataDir.resolve("audit");
  }

  @Override
  public String toString() {
    return "NetGuardConfig[dataDir=" + dataDir
        + ", hostsFile=" + hostsFile
        + ", redirectAddress=" + redirectAddress
        + ", sampler=" + sampler
        + ", pipeline=" + pipeline
        + ", reconcileInterval=" + reconcileInterval
        + ", observeBand=" + observeBand
        + ", proxyAddress=" + proxyAddress.getHostString() + ":" + proxyAddress.getPort()
        + ", socketTimeout=" + socketTimeout
        + ", drainTimeout=" + drainTimeout
        + ", transactionCapacity=" + transactionCapacity
        + ", transactionMaxAge=" + transactionMaxAge
        + ", lexiconFile=" + lexiconFile
        + ", seedCorpusFile=" + seedCorpusFile
        + ", caPassword=[REDACTED]]";
  }

  private static Path defaultDataDir() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".netguard").toAbsolutePath().normalize();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private static int parseBoundedInt(
      Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      Numbers.requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static double parseBoundedDouble(
      Map<String, String> kv, String key, double defaultValue, double min, double max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Numbers.requireRange(key, defaultValue, min, max);
    }
    try {
      return Numbers.requireRange(key, Double.parseDouble(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number between " + min + " and " + max, ex);
    }
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Optional<Path> parseOptionalPath(String name, String value) {
    if (!hasText(value)) {
      return Optional.empty();
    }
    return Optional.of(parsePath(name, value));
  }
}

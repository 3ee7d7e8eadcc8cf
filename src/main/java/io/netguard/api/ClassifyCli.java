package io.netguard.api;

import io.netguard.api.CommandSupport.CliAbort;
import io.netguard.api.CommandSupport.Resolved;
import io.netguard.application.classify.ValidationReport;
import io.netguard.application.pipeline.DryRunResult;
import io.netguard.application.pipeline.MonitoringService;
import io.netguard.config.CompositionRoot;
import io.netguard.config.NetGuardConfig;
import io.netguard.config.SeedCorpusLoader;
import io.netguard.domain.capture.HttpHeaders;
import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.classify.Label;
import io.netguard.domain.classify.LabeledExample;
import io.netguard.domain.classify.ModelInfo;
import io.netguard.domain.classify.TermContribution;
import io.netguard.logging.Logs;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifier maintenance: dry-run a URL, record operator feedback, retrain, show model details and score a
 * labelled corpus.
 *
 * @since 0.1.0
 */
public final class ClassifyCli {
  private static final Logger log = LoggerFactory.getLogger(ClassifyCli.class);
  static final String COMMAND = "classify";
  private static final int BODY_LOG_BYTES = 120;
  private static final String SUMMARY_USAGE =
      "usage: netguard classify [url|feedback|retrain|info|validate] [url=URL] [body=TEXT] "
          + "[domain=DOMAIN label=gambling|benign] [corpus=PATH] [--explain] [config=PATH]";
  private static final String HELP_TEXT = """
      NetGuard classify

      Usage:
        netguard classify [url] url=URL [body=TEXT] [--explain]
        netguard classify feedback domain=DOMAIN label=gambling|benign
        netguard classify retrain
        netguard classify info
        netguard classify validate corpus=PATH

      Actions:
        url        Score a URL (and optional page text) without blocking or auditing it
        feedback   Label a domain and retrain the model with it
        retrain    Retrain with the seed corpus and all recorded feedback
        info       Print the model version, vocabulary and training counts
        validate   Score a labelled YAML corpus (gambling: [...], benign: [...]) at the current sensitivity

      Options:
        config=PATH      YAML file; reads the common and classify sections
        dataDir=PATH     Directory holding model.json (default ~/.netguard)
        lexicon=PATH     Keyword lexicon overriding the built-in one
        seedCorpus=PATH  Seed corpus overriding the built-in one
        --explain        Print the terms that contributed most to the score
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private ClassifyCli() {}

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
    String action = input.action();
    if (action == null) {
      action = resolved.value("url").isEmpty() ? "info" : "url";
    }

    try (CompositionRoot root = roots.apply(resolved.config())) {
      MonitoringService service = root.monitoringService();
      switch (action) {
        case "url":
          return dryRun(service, resolved, input.hasFlag("--explain"));
        case "feedback":
          return feedback(service, resolved);
        case "retrain":
          long version = service.retrain();
          CliPrinter.printf("Retrained; model version %d", version);
          return ExitCode.SUCCESS;
        case "info":
          printInfo(service.modelInfo(), service.sensitivity());
          return ExitCode.SUCCESS;
        case "validate":
          return validate(service, resolved);
        default:
          throw CommandSupport.abort(ExitCode.INVALID_ARGS, "Unknown classify action: " + action, SUMMARY_USAGE);
      }
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (Exception ex) {
      return CommandSupport.failure(COMMAND, ex);
    }
  }

  private static ExitCode dryRun(MonitoringService service, Resolved resolved, boolean explain) throws CliAbort {
    String url = resolved.value("url");
    if (url.isEmpty()) {
      throw CommandSupport.abort(ExitCode.INVALID_ARGS, "classify url requires url=URL", SUMMARY_USAGE);
    }
    String body = resolved.value("body");
    log.debug("Dry-run classification of {} (body {})", Logs.truncate(url, 256), Logs.truncate(body, BODY_LOG_BYTES));
    DryRunResult dryRun = service.classify(url, HttpHeaders.empty(), body.isEmpty() ? null : body);
    ClassificationResult result = dryRun.result();
    CliPrinter.printf("%s score=%.4f threshold=%.4f verdict=%s reason=%s model=v%d",
        result.domain(), result.score(), dryRun.threshold(), dryRun.decision().verdict(),
        dryRun.decision().reason(), result.modelVersion());
    if (explain) {
      if (result.topTerms().isEmpty()) {
        CliPrinter.println("  (no known terms)");
      }
      for (TermContribution term : result.topTerms()) {
        CliPrinter.printf("  %-24s %+.4f", term.term(), term.contribution());
      }
    }
    return ExitCode.SUCCESS;
  }

  private static ExitCode feedback(MonitoringService service, Resolved resolved) throws Exception {
    String domain = resolved.value("domain");
    String rawLabel = resolved.value("label");
    if (domain.isEmpty() || rawLabel.isEmpty()) {
      throw CommandSupport.abort(
          ExitCode.INVALID_ARGS, "classify feedback requires domain=DOMAIN and label=gambling|benign", SUMMARY_USAGE);
    }
    Label label;
    try {
      label = Label.parse(rawLabel);
    } catch (IllegalArgumentException ex) {
      throw CommandSupport.abort(ExitCode.INVALID_ARGS, ex.getMessage(), SUMMARY_USAGE);
    }
    service.submitFeedback(domain, label);
    long version = service.retrain();
    CliPrinter.printf("Recorded %s as %s; model version %d", domain, label.name().toLowerCase(Locale.ROOT),
        version);
    return ExitCode.SUCCESS;
  }

  private static ExitCode validate(MonitoringService service, Resolved resolved) throws Exception {
    String corpus = resolved.value("corpus");
    if (corpus.isEmpty()) {
      throw CommandSupport.abort(ExitCode.INVALID_ARGS, "classify validate requires corpus=PATH", SUMMARY_USAGE);
    }
    List<LabeledExample> examples = SeedCorpusLoader.load(Path.of(corpus));
    ValidationReport report = service.validate(examples);
    CliPrinter.printLines(
        "Validation of " + report.total() + " documents against model v" + report.modelVersion(),
        String.format(Locale.ROOT, " Accuracy        : %.3f", report.accuracy()),
        " True positives  : " + report.truePositives(),
        " False positives : " + report.falsePositives(),
        " True negatives  : " + report.trueNegatives(),
        " False negatives : " + report.falseNegatives());
    return ExitCode.SUCCESS;
  }

  private static void printInfo(ModelInfo info, int sensitivity) {
    CliPrinter.printLines(
        "Model version     : " + info.version(),
        "Trained at        : " + info.trainedAt(),
        "Vocabulary size   : " + info.vocabularySize(),
        "Gambling examples : " + info.gamblingExamples(),
        "Benign examples   : " + info.benignExamples(),
        "Pending feedback  : " + info.pendingFeedback(),
        "Sensitivity       : " + sensitivity);
  }
}

package io.netguard.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import io.netguard.domain.audit.DetectionLogEntry;
import io.netguard.domain.audit.DetectionSource;
import io.netguard.domain.audit.EnforcementAction;
import io.netguard.domain.audit.PipelineError;
import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.classify.TermContribution;
import io.netguard.domain.decision.BlockDecision;
import io.netguard.domain.decision.DecisionReason;
import io.netguard.domain.decision.Verdict;
import io.netguard.domain.site.BlockSource;
import io.netguard.domain.site.BlockedSite;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON line encodings of audit and block list records. Field names are stable; unknown fields are ignored on read.
 *
 * @since 0.1.0
 */
final class AuditRecordCodec {
  private AuditRecordCodec() {}

  static String encodeDetection(DetectionLogEntry entry) {
    return JsonSupport.render(gen -> {
      gen.writeStartObject();
      gen.writeStringField("id", entry.id());
      gen.writeNumberField("sequence", entry.sequence());
      JsonSupport.writeInstant(gen, "timestamp", entry.timestamp());
      gen.writeStringField("source", entry.source().name());
      if (entry.transactionId() != null) {
        gen.writeStringField("transactionId", entry.transactionId());
      }
      gen.writeStringField("method", entry.method());
      gen.writeNumberField("statusCode", entry.statusCode());
      writeResult(gen, entry.result());
      writeDecision(gen, entry.decision());
      gen.writeEndObject();
    });
  }

  static DetectionLogEntry decodeDetection(String line) {
    Map<String, Object> map = JsonSupport.parseObject(line);
    Map<String, Object> result = JsonSupport.object(map, "result");
    Map<String, Object> decision = JsonSupport.object(map, "decision");
    List<TermContribution> terms = new ArrayList<>();
    for (Object raw : JsonSupport.array(result, "topTerms")) {
      if (raw instanceof Map<?, ?> m) {
        @SuppressWarnings("unchecked")
        Map<String, Object> term = (Map<String, Object>) m;
        terms.add(new TermContribution(
            JsonSupport.string(term, "term"), JsonSupport.doubleValue(term, "contribution", 0.0)));
      }
    }
    ClassificationResult classification = new ClassificationResult(
        JsonSupport.string(result, "subject"),
        JsonSupport.string(result, "domain"),
        JsonSupport.doubleValue(result, "score", 0.0),
        terms,
        JsonSupport.longValue(result, "modelVersion", 0L),
        JsonSupport.instant(result, "timestamp"));
    BlockDecision blockDecision = new BlockDecision(
        JsonSupport.string(decision, "domain"),
        Verdict.valueOf(JsonSupport.string(decision, "verdict")),
        DecisionReason.valueOf(JsonSupport.string(decision, "reason")),
        JsonSupport.doubleValue(decision, "score", 0.0),
        JsonSupport.bool(decision, "conflict", false),
        JsonSupport.instant(decision, "timestamp"));
    return new DetectionLogEntry(
        JsonSupport.string(map, "id"),
        JsonSupport.longValue(map, "sequence", 0L),
        classification,
        blockDecision,
        DetectionSource.valueOf(JsonSupport.string(map, "source")),
        JsonSupport.optString(map, "transactionId", null),
        JsonSupport.optString(map, "method", ""),
        (int) JsonSupport.longValue(map, "statusCode", 0L),
        JsonSupport.instant(map, "timestamp"));
  }

  static String encodeEnforcement(EnforcementAction action) {
    return JsonSupport.render(gen -> {
      gen.writeStartObject();
      gen.writeStringField("id", action.id());
      JsonSupport.writeInstant(gen, "timestamp", action.timestamp());
      gen.writeStringField("domain", action.domain());
      gen.writeStringField("action", action.action().name());
      gen.writeStringField("outcome", action.outcome().name());
      gen.writeStringField("detail", action.detail());
      gen.writeEndObject();
    });
  }

  static EnforcementAction decodeEnforcement(String line) {
    Map<String, Object> map = JsonSupport.parseObject(line);
    return new EnforcementAction(
        JsonSupport.string(map, "id"),
        JsonSupport.string(map, "domain"),
        EnforcementAction.Action.valueOf(JsonSupport.string(map, "action")),
        EnforcementAction.Outcome.valueOf(JsonSupport.string(map, "outcome")),
        JsonSupport.optString(map, "detail", ""),
        JsonSupport.instant(map, "timestamp"));
  }

  static String encodeError(PipelineError error) {
    return JsonSupport.render(gen -> {
      gen.writeStartObject();
      gen.writeStringField("id", error.id());
      JsonSupport.writeInstant(gen, "timestamp", error.timestamp());
      gen.writeStringField("stage", error.stage());
      gen.writeStringField("domain", error.domain());
      gen.writeStringField("errorType", error.errorType());
      gen.writeStringField("message", error.message());
      gen.writeEndObject();
    });
  }

  static PipelineError decodeError(String line) {
    Map<String, Object> map = JsonSupport.parseObject(line);
    return new PipelineError(
        JsonSupport.string(map, "id"),
        JsonSupport.string(map, "stage"),
        JsonSupport.optString(map, "domain", ""),
        JsonSupport.string(map, "errorType"),
        JsonSupport.optString(map, "message", ""),
        JsonSupport.instant(map, "timestamp"));
  }

  static void writeSite(JsonGenerator gen, BlockedSite site) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("domain", site.domain());
    gen.writeStringField("source", site.source().name());
    gen.writeStringField("reason", site.reason());
    JsonSupport.writeInstant(gen, "addedAt", site.addedAt());
    gen.writeBooleanField("active", site.active());
    JsonSupport.writeInstant(gen, "deactivatedAt", site.deactivatedAt());
    gen.writeEndObject();
  }

  static BlockedSite readSite(Map<String, Object> map) {
    return new BlockedSite(
        JsonSupport.string(map, "domain"),
        BlockSource.valueOf(JsonSupport.optString(map, "source", BlockSource.MANUAL.name())),
        JsonSupport.optString(map, "reason", ""),
        JsonSupport.instant(map, "addedAt"),
        JsonSupport.bool(map, "active", true),
        JsonSupport.instant(map, "deactivatedAt"));
  }

  private static void writeResult(JsonGenerator gen, ClassificationResult result) throws IOException {
    gen.writeObjectFieldStart("result");
    gen.writeStringField("subject", result.subject());
    gen.writeStringField("domain", result.domain());
    gen.writeNumberField("score", result.score());
    gen.writeNumberField("modelVersion", result.modelVersion());
    JsonSupport.writeInstant(gen, "timestamp", result.timestamp());
    gen.writeArrayFieldStart("topTerms");
    for (TermContribution term : result.topTerms()) {
      gen.writeStartObject();
      gen.writeStringField("term", term.term());
      gen.writeNumberField("contribution", term.contribution());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeDecision(JsonGenerator gen, BlockDecision decision) throws IOException {
    gen.writeObjectFieldStart("decision");
    gen.writeStringField("domain", decision.domain());
    gen.writeStringField("verdict", decision.verdict().name());
    gen.writeStringField("reason", decision.reason().name());
    gen.writeNumberField("score", decision.score());
    gen.writeBooleanField("conflict", decision.conflict());
    JsonSupport.writeInstant(gen, "timestamp", decision.timestamp());
    gen.writeEndObject();
  }
}

package io.netguard.infrastructure.persistence;

import io.netguard.domain.site.BlockedSite;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads and writes block list documents: {@code {"sites": [...], "allow": [...]}}.
 *
 * <p>Used both by {@link JsonBlockedSiteStore} and by the {@code sites export}/{@code sites import} commands, so an
 * exported file can be fed straight back into another installation.</p>
 *
 * @since 0.1.0
 */
public final class BlockedSiteJson {
  private BlockedSiteJson() {}

  /**
   * Parsed block list document.
   *
   * @param sites block list entries in document order
   * @param allowList domains explicitly allowed by an operator
   */
  public record Document(List<BlockedSite> sites, Set<String> allowList) {
    public Document {
      sites = List.copyOf(Objects.requireNonNull(sites, "sites"));
      allowList = Set.copyOf(Objects.requireNonNull(allowList, "allowList"));
    }
  }

  public static String encode(Collection<BlockedSite> sites, Collection<String> allowList) {
    Objects.requireNonNull(sites, "sites");
    Set<String> allow = new TreeSet<>(allowList == null ? List.of() : allowList);
    return JsonSupport.render(gen -> {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeArrayFieldStart("sites");
      for (BlockedSite site : sites) {
        AuditRecordCodec.writeSite(gen, site);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("allow");
      for (String domain : allow) {
        gen.writeString(domain);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    });
  }

  /**
   * Parses a block list document.
   *
   * @param json document text
   * @return parsed document
   * @throws IllegalArgumentException if the payload is not a valid block list document
   */
  @SuppressWarnings("unchecked")
  public static Document decode(String json) {
    Map<String, Object> root = JsonSupport.parseObject(json);
    List<BlockedSite> sites = new ArrayList<>();
    for (Object raw : JsonSupport.array(root, "sites")) {
      if (!(raw instanceof Map<?, ?> map)) {
        throw new IllegalArgumentException("sites entries must be objects");
      }
      try {
        sites.add(AuditRecordCodec.readSite((Map<String, Object>) map));
      } catch (NullPointerException ex) {
        throw new IllegalArgumentException("incomplete site entry: " + map, ex);
      }
    }
    Set<String> allow = new TreeSet<>();
    for (Object raw : JsonSupport.array(root, "allow")) {
      if (raw != null) {
        allow.add(raw.toString());
      }
    }
    return new Document(sites, allow);
  }

  /**
   * Writes a document atomically: the content goes to a sibling temp file which then replaces {@code file}.
   */
  public static void write(Path file, Collection<BlockedSite> sites, Collection<String> allowList)
      throws IOException {
    Path target = Objects.requireNonNull(file, "file").toAbsolutePath();
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      Files.writeString(temp, encode(sites, allowList), StandardCharsets.UTF_8);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  public static Document read(Path file) throws IOException {
    return decode(Files.readString(Objects.requireNonNull(file, "file"), StandardCharsets.UTF_8));
  }
}

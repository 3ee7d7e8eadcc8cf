package io.netguard.application.enforcement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parsed view of a hosts file split around the NetGuard managed region.
 *
 * <p>Text before and after the region is kept verbatim. Inside the region each blocked domain is rendered as two
 * lines, {@code <redirect> domain} and {@code <redirect> www.domain}.</p>
 *
 * @since 0.1.0
 */
public final class ManagedRegion {
  public static final String BEGIN_MARKER = "# BEGIN NetGuard managed block";
  public static final String END_MARKER = "# END NetGuard managed block";

  private final String before;
  private final List<String> entries;
  private final String after;
  private final String lineSeparator;
  private final boolean present;

  private ManagedRegion(String before, List<String> entries, String after, String lineSeparator, boolean present) {
    this.before = before;
    this.entries = entries;
    this.after = after;
    this.lineSeparator = lineSeparator;
    this.present = present;
  }

  /**
   * Splits hosts file content. A begin marker without an end marker claims the rest of the file.
   *
   * @param content full hosts file content
   * @return parsed region
   */
  public static ManagedRegion parse(String content) {
    String text = content == null ? "" : content;
    String separator = text.contains("\r\n") ? "\r\n" : "\n";
    int begin = findMarkerLine(text, BEGIN_MARKER, 0);
    if (begin < 0) {
      return new ManagedRegion(text, List.of(), "", separator, false);
    }
    int bodyStart = nextLineStart(text, begin);
    int end = findMarkerLine(text, END_MARKER, bodyStart);
    String body;
    String after;
    if (end < 0) {
      body = text.substring(bodyStart);
      after = "";
    } else {
      body = text.substring(bodyStart, end);
      after = text.substring(nextLineStart(text, end));
    }
    List<String> lines = new ArrayList<>();
    for (String line : body.split("\r?\n")) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
        lines.add(trimmed.replaceAll("\\s+", " "));
      }
    }
    return new ManagedRegion(text.substring(0, begin), Collections.unmodifiableList(lines), after, separator, true);
  }

  /** @return whether the file already contains a managed region */
  public boolean present() {
    return present;
  }

  /** @return normalized entry lines inside the region, in file order */
  public List<String> entries() {
    return entries;
  }

  /**
   * Returns the domains the region currently enforces. {@code www.} aliases of listed domains are folded into
   * their base domain.
   *
   * @return enforced domains, sorted
   */
  public Set<String> domains() {
    Set<String> hosts = new LinkedHashSet<>();
    for (String line : entries) {
      String[] parts = line.split(" ");
      for (int i = 1; i < parts.length; i++) {
        hosts.add(parts[i].toLowerCase(Locale.ROOT));
      }
    }
    Set<String> domains = new TreeSet<>();
    for (String host : hosts) {
      if (host.startsWith("www.") && hosts.contains(host.substring(4))) {
        continue;
      }
      domains.add(host);
    }
    return domains;
  }

  /**
   * Drops {@code www.x} when {@code x} is also present, since the entry for {@code x} already renders its
   * {@code www.} alias.
   *
   * @param domains normalized domains
   * @return sorted domain set as {@link #domains()} would report it after rendering
   */
  public static Set<String> canonical(Collection<String> domains) {
    Set<String> all = new TreeSet<>(domains);
    Set<String> out = new TreeSet<>();
    for (String domain : all) {
      if (domain.startsWith("www.") && all.contains(domain.substring(4))) {
        continue;
      }
      out.add(domain);
    }
    return out;
  }

  /**
   * Renders the entry lines for a desired domain set.
   *
   * @param domains normalized domains
   * @param redirectAddress address the domains resolve to
   * @return entry lines, sorted by domain
   */
  public static List<String> renderEntries(Collection<String> domains, String redirectAddress) {
    Set<String> canonical = canonical(domains);
    List<String> lines = new ArrayList<>(canonical.size() * 2);
    for (String domain : canonical) {
      lines.add(redirectAddress + " " + domain);
      if (!domain.startsWith("www.")) {
        lines.add(redirectAddress + " www." + domain);
      }
    }
    return lines;
  }

  /**
   * Tests whether the region already holds exactly {@code desiredEntries}. An absent region matches an empty set.
   *
   * @param desiredEntries output of {@link #renderEntries}
   * @return {@code true} when no write is needed
   */
  public boolean matches(List<String> desiredEntries) {
    return entries.equals(desiredEntries);
  }

  /**
   * Produces the full file content with the region replaced, or appended when absent.
   *
   * @param desiredEntries output of {@link #renderEntries}
   * @return new hosts file content
   */
  public String replaceWith(List<String> desiredEntries) {
    StringBuilder out = new StringBuilder(before.length() + after.length() + 64 * (desiredEntries.size() + 2));
    out.append(before);
    if (out.length() > 0 && !endsWithNewline(out)) {
      out.append(lineSeparator);
    }
    out.append(BEGIN_MARKER).append(lineSeparator);
    for (String entry : desiredEntries) {
      out.append(entry).append(lineSeparator);
    }
    out.append(END_MARKER).append(lineSeparator);
    out.append(after);
    return out.toString();
  }

  private static boolean endsWithNewline(CharSequence text) {
    return text.charAt(text.length() - 1) == '\n';
  }

  private static int findMarkerLine(String text, String marker, int from) {
    int idx = text.indexOf(marker, from);
    while (idx >= 0) {
      if (idx == 0 || text.charAt(idx - 1) == '\n') {
        return idx;
      }
      idx = text.indexOf(marker, idx + 1);
    }
    return -1;
  }

  private static int nextLineStart(String text, int from) {
    int nl = text.indexOf('\n', from);
    return nl < 0 ? text.length() : nl + 1;
  }
}

package io.ariasnap.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the item list inside decorated snapshot text.
 *
 * <p>Snapshots arrive in several shapes: a bare list, a fenced {@code yaml}/{@code yml} (or
 * unlabelled) code block, a list preceded by narrative lines such as {@code Page URL: ...}, or a
 * combination of those. The extractor returns just the list so the grammar sees nothing else. Text
 * in which no list can be found is returned unchanged.
 */
public final class SnapshotExtractor {

  // Fence of three or more backticks or tildes; anything after the language word is ignored
  private static final Pattern FENCE_OPEN =
      Pattern.compile("^\\s*(`{3,}|~{3,})\\s*([\\w-]*)(?:\\s.*)?$");

  private SnapshotExtractor() {}

  public static String extract(String text) {
    if (text == null || text.isEmpty()) {
      return text == null ? "" : text;
    }
    if (text.stripLeading().startsWith("- ")) {
      return text;
    }
    String[] lines = text.split("\n", -1);

    String fenced = fencedBlock(lines);
    if (fenced != null) {
      return fenced;
    }
    String run = listRun(lines);
    return run != null ? run : text;
  }

  // First fenced block labelled yaml/yml or unlabelled; empty blocks are skipped
  private static String fencedBlock(String[] lines) {
    for (int i = 0; i < lines.length; i++) {
      Matcher m = FENCE_OPEN.matcher(lines[i]);
      if (!m.matches()) {
        continue;
      }
      String fence = m.group(1);
      String info = m.group(2).toLowerCase(Locale.ROOT);
      List<String> body = new ArrayList<>();
      int j = i + 1;
      while (j < lines.length && !closes(lines[j], fence)) {
        body.add(lines[j]);
        j++;
      }
      if (info.equals("yaml") || info.equals("yml") || info.isEmpty()) {
        String raw = String.join("\n", body).replaceAll("\\n+$", "");
        if (!raw.isBlank()) {
          return raw;
        }
      }
      i = j;
    }
    return null;
  }

  private static String listRun(String[] lines) {
    for (int i = 0; i < lines.length; i++) {
      if (!lines[i].stripLeading().startsWith("- ")) {
        continue;
      }
      List<String> run = new ArrayList<>();
      for (int j = i; j < lines.length; j++) {
        String line = lines[j];
        String trimmed = line.strip();
        if (isFence(trimmed)) {
          break;
        }
        boolean continues =
            trimmed.isEmpty()
                || trimmed.startsWith("- ")
                || line.startsWith(" ")
                || line.startsWith("\t");
        if (!continues && j > i) {
          break;
        }
        run.add(line);
      }
      return String.join("\n", run);
    }
    return null;
  }

  /** A closing fence uses the opening character at least as many times, and nothing else. */
  static boolean closes(String line, String fence) {
    String trimmed = line.strip();
    return trimmed.length() >= fence.length() && isRunOf(trimmed, fence.charAt(0));
  }

  private static boolean isFence(String trimmed) {
    return trimmed.length() >= 3 && (isRunOf(trimmed, '`') || isRunOf(trimmed, '~'));
  }

  private static boolean isRunOf(String s, char c) {
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) != c) {
        return false;
      }
    }
    return true;
  }
}

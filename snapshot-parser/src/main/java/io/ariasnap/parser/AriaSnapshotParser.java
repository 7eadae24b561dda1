package io.ariasnap.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for accessibility snapshots such as:
 *
 * <pre>
 * - generic [ref=e2]:
 *   - heading "Example Domain" [level=1] [ref=e3]
 *   - link "More information" [ref=e5] [cursor=pointer]:
 *     - /url: https://iana.org/domains/example
 *   - text: Search for Images
 * </pre>
 *
 * <p>A node line is {@code - role ["name" | /regex/] [attr ...]... [:[ inline text]]}. The block of
 * lines indented deeper than a node line holds its children. A line that does not match the
 * grammar is reported as a {@link ParseError}; that line and its deeper-indented block are skipped,
 * and parsing resumes at the next line indented no deeper than it. The parser never throws for
 * malformed input.
 */
public final class AriaSnapshotParser {

  private static final Logger LOG = LoggerFactory.getLogger(AriaSnapshotParser.class);

  private static final Pattern TEXT_ENTRY = Pattern.compile("^text(?::\\s?(.*))?$");
  private static final Pattern PROPERTY_ENTRY = Pattern.compile("^/([^:\\s]+):(?:\\s(.*))?$");

  private final List<Line> lines;
  private final List<ParseError> errors = new ArrayList<>();

  private AriaSnapshotParser(List<Line> lines) {
    this.lines = lines;
  }

  /**
   * Parses snapshot text, extracting the list region first (see {@link SnapshotExtractor}).
   *
   * @param text raw snapshot text, possibly preceded by narrative or wrapped in a code fence
   * @return the root entries plus any structural errors; the tree is {@code null} only when the
   *     input holds no content at all
   */
  public static ParseResult parse(String text) {
    if (text == null) {
      return ParseResult.empty();
    }
    long start = System.nanoTime();
    try {
      String extracted = SnapshotExtractor.extract(text);
      List<Line> lines = Line.split(extracted);
      if (lines.isEmpty()) {
        return ParseResult.empty();
      }
      if (SnapshotDataReader.looksSerialized(extracted)) {
        try {
          List<AriaChild> tree = SnapshotDataReader.readYaml(extracted);
          LOG.debug("Read {} serialized root entries", tree.size());
          return new ParseResult(tree, List.of());
        } catch (IllegalArgumentException e) {
          LOG.debug("Serialized read failed, using line grammar: {}", e.getMessage());
        }
      }
      AriaSnapshotParser parser = new AriaSnapshotParser(lines);
      List<AriaChild> roots = parser.parseBlock(0, lines.size(), null);
      LOG.debug(
          "Parsed {} lines into {} roots with {} errors in {} us",
          lines.size(),
          roots.size(),
          parser.errors.size(),
          (System.nanoTime() - start) / 1000);
      return new ParseResult(roots, parser.errors);
    } catch (RuntimeException e) {
      LOG.warn("Unexpected failure while parsing snapshot: {}", e.getMessage(), e);
      return new ParseResult(
          null, List.of(new ParseError(null, "Failed to parse ARIA snapshot: " + e.getMessage())));
    }
  }

  // Parses the sibling entries in lines[from, to); parent is null at the root
  private List<AriaChild> parseBlock(int from, int to, AriaNode.Builder parent) {
    List<AriaChild> out = new ArrayList<>();
    int i = from;
    while (i < to) {
      Line line = lines.get(i);
      int end = i + 1;
      while (end < to && lines.get(end).indent() > line.indent()) {
        end++;
      }
      try {
        parseEntry(line, i + 1, end, parent, out);
      } catch (IllegalArgumentException e) {
        errors.add(new ParseError(line.number(), e.getMessage()));
      }
      i = end;
    }
    return out;
  }

  private void parseEntry(
      Line line, int childFrom, int childTo, AriaNode.Builder parent, List<AriaChild> out) {
    String content = line.content();
    boolean listItem = content.startsWith("- ") || content.equals("-");
    String body = listItem ? content.substring(1).strip() : content;
    if (body.isEmpty()) {
      throw error("Empty list item");
    }
    body = unwrapSingleQuoted(body);

    Matcher text = TEXT_ENTRY.matcher(body);
    if (text.matches()) {
      if (childFrom < childTo) {
        throw error("Text entry cannot have nested entries");
      }
      String value = text.group(1) == null ? "" : text.group(1).strip();
      out.add(new AriaText(unquote(value)));
      return;
    }
    if (!listItem) {
      throw error("Expected a list item starting with '- ' but found '" + content + "'");
    }
    if (body.startsWith("/")) {
      Matcher prop = PROPERTY_ENTRY.matcher(body);
      if (!prop.matches()) {
        throw error("Malformed property entry '" + body + "'");
      }
      if (parent == null) {
        throw error("Property '" + prop.group(1) + "' outside of a node");
      }
      if (childFrom < childTo) {
        throw error("Property entry cannot have nested entries");
      }
      parent.prop(prop.group(1), prop.group(2) == null ? "" : prop.group(2).strip());
      return;
    }

    NodeLine node = new NodeLine(body).parse();
    AriaNode.Builder builder = node.builder;
    if (node.inlineText != null && !node.inlineText.isEmpty()) {
      if (builder.hasName()) {
        builder.child(new AriaText(unquote(node.inlineText)));
      } else {
        builder.name(nameFromText(node.inlineText));
      }
    }
    builder.children(parseBlock(childFrom, childTo, builder));
    out.add(builder.build());
  }

  private static AriaName nameFromText(String text) {
    if (text.length() >= 2 && text.startsWith("/") && text.endsWith("/")) {
      return AriaName.pattern(text.substring(1, text.length() - 1));
    }
    return AriaName.literal(unquote(text));
  }

  private static String unquote(String value) {
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }

  // 'link "a: b"' -> link "a: b"; a trailing ':' or ': text' after the closing quote is kept
  private static String unwrapSingleQuoted(String body) {
    if (!body.startsWith("'")) {
      return body;
    }
    StringBuilder sb = new StringBuilder();
    int i = 1;
    while (i < body.length()) {
      char c = body.charAt(i);
      if (c == '\'') {
        if (i + 1 < body.length() && body.charAt(i + 1) == '\'') {
          sb.append('\'');
          i += 2;
          continue;
        }
        return sb.append(body.substring(i + 1)).toString();
      }
      sb.append(c);
      i++;
    }
    throw error("Unterminated single-quoted entry");
  }

  private static IllegalArgumentException error(String message) {
    return new IllegalArgumentException(message);
  }

  /** One non-blank input line. */
  record Line(int number, int indent, String content) {

    static List<Line> split(String text) {
      List<Line> out = new ArrayList<>();
      String[] raw = text.split("\r?\n", -1);
      for (int i = 0; i < raw.length; i++) {
        String line = raw[i].stripTrailing();
        if (line.isBlank()) {
          continue;
        }
        String stripped = line.stripLeading();
        out.add(new Line(i + 1, line.length() - stripped.length(), stripped));
      }
      return out;
    }
  }

  /** Scanner over the body of a single node line (everything after the {@code - } marker). */
  private static final class NodeLine {
    private final String input;
    private int pos = 0;
    private AriaNode.Builder builder;
    private String inlineText;

    NodeLine(String input) {
      this.input = input;
    }

    NodeLine parse() {
      String role = readRole();
      if (role.isEmpty()) {
        throw error("Expected a role at the start of '" + input + "'");
      }
      builder = AriaNode.builder(role);
      skipWs();
      if (peek() == '"') {
        builder.name(AriaName.literal(readDelimited('"', "name")));
      } else if (peek() == '/') {
        builder.name(AriaName.pattern(readDelimited('/', "regex name")));
      }
      skipWs();
      while (peek() == '[') {
        readAttributes();
        skipWs();
      }
      if (peek() == ':') {
        pos++;
        inlineText = input.substring(pos).strip();
        pos = input.length();
      }
      if (!eof()) {
        throw error("Unexpected content '" + input.substring(pos) + "' after role '" + role + "'");
      }
      return this;
    }

    private String readRole() {
      int start = pos;
      while (!eof()) {
        char c = input.charAt(pos);
        if (Character.isLetterOrDigit(c) || c == '_' || c == '-') {
          pos++;
        } else {
          break;
        }
      }
      if (!eof() && pos > start) {
        char next = input.charAt(pos);
        if (!Character.isWhitespace(next) && next != ':' && next != '[') {
          throw error("Unexpected character '" + next + "' in role");
        }
      }
      return input.substring(start, pos);
    }

    // Content between matching delimiters, verbatim; a backslash keeps the next char in the value
    private String readDelimited(char delimiter, String what) {
      int start = ++pos;
      while (!eof()) {
        char c = input.charAt(pos);
        if (c == '\\' && pos + 1 < input.length()) {
          pos += 2;
          continue;
        }
        if (c == delimiter) {
          String value = input.substring(start, pos);
          pos++;
          return value;
        }
        pos++;
      }
      throw error("Unterminated " + what + " in '" + input + "'");
    }

    private void readAttributes() {
      int close = input.indexOf(']', pos);
      if (close < 0) {
        throw error("Unterminated attribute list in '" + input + "'");
      }
      String body = input.substring(pos + 1, close);
      pos = close + 1;
      for (String token : body.split("[,\\s]+")) {
        if (!token.isEmpty()) {
          applyAttribute(token);
        }
      }
    }

    private void applyAttribute(String token) {
      int eq = token.indexOf('=');
      String key = (eq < 0 ? token : token.substring(0, eq)).toLowerCase(Locale.ROOT);
      String value = eq < 0 ? null : token.substring(eq + 1);
      if (key.isEmpty()) {
        throw error("Attribute without a name: '" + token + "'");
      }
      switch (key) {
        case "ref" -> builder.ref(required(key, value));
        case "checked" -> builder.checked(state(key, value));
        case "pressed" -> builder.pressed(state(key, value));
        case "disabled" -> builder.disabled(flag(key, value));
        case "expanded" -> builder.expanded(flag(key, value));
        case "active" -> builder.active(flag(key, value));
        case "selected" -> builder.selected(flag(key, value));
        case "level" -> builder.level(level(required(key, value)));
        default -> builder.prop(
            eq < 0 ? token : token.substring(0, eq), value == null ? "true" : value);
      }
    }

    private static String required(String key, String value) {
      if (value == null || value.isEmpty()) {
        throw error("Attribute '" + key + "' requires a value");
      }
      return value;
    }

    private static CheckedState state(String key, String value) {
      if (value == null) {
        return CheckedState.TRUE;
      }
      return CheckedState.parse(value)
          .orElseThrow(
              () ->
                  error(
                      "Invalid value for '"
                          + key
                          + "': "
                          + value
                          + " (expected true, false or mixed)"));
    }

    private static Boolean flag(String key, String value) {
      if (value == null || value.equalsIgnoreCase("true")) {
        return Boolean.TRUE;
      }
      if (value.equalsIgnoreCase("false")) {
        return Boolean.FALSE;
      }
      throw error("Invalid value for '" + key + "': " + value + " (expected true or false)");
    }

    private static Integer level(String value) {
      try {
        return Integer.valueOf(value);
      } catch (NumberFormatException e) {
        throw error("Invalid level: " + value);
      }
    }

    private void skipWs() {
      while (!eof() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
    }

    private int peek() {
      return eof() ? -1 : input.charAt(pos);
    }

    private boolean eof() {
      return pos >= input.length();
    }
  }
}

package io.ariasnap.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;
import java.util.Locale;
import java.util.Set;

/**
 * Renders plain data as pretty JSON or block-style YAML.
 *
 * <p>Map key order is kept and non-ASCII text is written as-is. YAML output has no {@code ---}
 * marker and writes every string value double-quoted, so hex, exponent or keyword-shaped text
 * (such as {@code 0x1F}, {@code .inf} or {@code yes}) reads back as the same string and a list of
 * bare text entries cannot be mistaken for grammar lines.
 */
public final class OutputFormatter {

  private static final ObjectWriter JSON_WRITER =
      new ObjectMapper().writerWithDefaultPrettyPrinter();

  private static final ObjectWriter YAML_WRITER =
      new YAMLMapper(
              YAMLFactory.builder()
                  .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                  .disable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                  .stringQuotingChecker(new KeyQuoting())
                  .build())
          .writer();

  private OutputFormatter() {}

  /**
   * @throws IllegalArgumentException if the data holds values that cannot be serialized
   */
  public static String format(Object data, OutputFormat format) {
    ObjectWriter writer = format == OutputFormat.JSON ? JSON_WRITER : YAML_WRITER;
    try {
      return writer.writeValueAsString(data);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot format data as " + format.id(), e);
    }
  }

  /** {@code "json"} selects JSON; any other value selects YAML. */
  public static String format(Object data, String format) {
    return format(data, OutputFormat.parse(format));
  }

  /**
   * Leaves a mapping key plain only when it is a simple identifier-like word, since prop keys come
   * straight from snapshot attributes and may hold {@code :}, {@code #} or a leading indicator.
   */
  static final class KeyQuoting extends StringQuotingChecker.Default {

    private static final long serialVersionUID = 1L;

    private static final Set<String> KEYWORDS =
        Set.of("true", "false", "yes", "no", "y", "n", "on", "off", "null");

    private static final String SAFE_PUNCTUATION = "_-.";

    @Override
    public boolean needToQuoteName(String name) {
      return super.needToQuoteName(name) || !isPlainKey(name);
    }

    static boolean isPlainKey(String name) {
      if (name.isEmpty()) {
        return false;
      }
      char first = name.charAt(0);
      if (!Character.isLetter(first) && first != '_') {
        return false;
      }
      if (KEYWORDS.contains(name.toLowerCase(Locale.ROOT))) {
        return false;
      }
      for (int i = 0; i < name.length(); i++) {
        char c = name.charAt(i);
        if (!Character.isLetterOrDigit(c) && SAFE_PUNCTUATION.indexOf(c) < 0) {
          return false;
        }
      }
      return true;
    }
  }
}

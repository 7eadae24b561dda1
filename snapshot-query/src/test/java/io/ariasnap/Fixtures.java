package io.ariasnap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.ariasnap.parser.AriaSnapshotParser;
import io.ariasnap.parser.AriaSnapshotSerializer;
import io.ariasnap.parser.ParseResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Loads snapshot fixtures from {@code src/test/resources/fixtures}. */
public final class Fixtures {

  private static final YAMLMapper YAML = new YAMLMapper();

  private Fixtures() {}

  public static String read(String name) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IllegalStateException("Missing fixture: " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Parses a fixture that is known to be well formed and returns its serialized data. */
  public static List<Object> data(String name) {
    ParseResult result = AriaSnapshotParser.parse(read(name));
    if (result.hasErrors()) {
      throw new IllegalStateException("Fixture " + name + " has errors: " + result.errorMessages());
    }
    return AriaSnapshotSerializer.toData(result.tree());
  }

  /** Reads YAML text back into plain maps, lists and scalars. */
  public static Object readYaml(String yaml) {
    try {
      return YAML.readValue(yaml, Object.class);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unreadable YAML: " + e.getOriginalMessage(), e);
    }
  }
}

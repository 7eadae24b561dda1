package io.ariasnap.parser;

import static io.ariasnap.parser.SnapshotFields.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a typed tree from the plain-data form written by {@link AriaSnapshotSerializer}.
 *
 * <p>The reader is strict: any key outside {@link SnapshotFields#NODE_KEYS} or any value of the
 * wrong shape is rejected with an {@link IllegalArgumentException}, so that grammar-form text is
 * never mistaken for serialized data.
 */
public final class SnapshotDataReader {

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
  private static final String SERIALIZED_ITEM = "- " + ROLE + ": ";
  private static final String QUOTED_TEXT_ITEM = "- \"";

  private SnapshotDataReader() {}

  /**
   * Tells whether the text looks like serialized data: every line at the base indentation starts
   * with {@code - role: } (a node) or {@code - "} (a quoted text entry). Neither shape is a valid
   * grammar line, so grammar snapshots never match.
   */
  public static boolean looksSerialized(String text) {
    int base = Integer.MAX_VALUE;
    boolean found = false;
    boolean mismatch = false;
    for (String line : text.split("\n")) {
      if (line.isBlank()) {
        continue;
      }
      int indent = line.length() - line.stripLeading().length();
      if (indent < base) {
        base = indent;
        found = false;
        mismatch = false;
      }
      if (indent == base) {
        String item = line.stripLeading();
        if (item.startsWith(SERIALIZED_ITEM) || item.startsWith(QUOTED_TEXT_ITEM)) {
          found = true;
        } else {
          mismatch = true;
        }
      }
    }
    return found && !mismatch;
  }

  /**
   * Reads serialized data rendered as YAML (or JSON, which is a YAML subset).
   *
   * @throws IllegalArgumentException if the text is not valid YAML or not in serialized form
   */
  public static List<AriaChild> readYaml(String text) {
    Object data;
    try {
      data = YAML_MAPPER.readValue(text, Object.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Not a serialized snapshot: " + e.getOriginalMessage(), e);
    }
    return fromData(data);
  }

  /**
   * Converts plain data (a list of node maps and strings) back into a tree.
   *
   * @throws IllegalArgumentException if the data is not in serialized form
   */
  public static List<AriaChild> fromData(Object data) {
    if (!(data instanceof List<?> items)) {
      throw new IllegalArgumentException("Expected a list of entries, got " + typeName(data));
    }
    List<AriaChild> out = new ArrayList<>(items.size());
    for (Object item : items) {
      out.add(child(item));
    }
    return out;
  }

  private static AriaChild child(Object item) {
    if (item instanceof String s) {
      return new AriaText(s);
    }
    if (item instanceof Map<?, ?> map) {
      return node(map);
    }
    throw new IllegalArgumentException("Unexpected entry of type " + typeName(item));
  }

  private static AriaNode node(Map<?, ?> map) {
    for (Object key : map.keySet()) {
      if (!NODE_KEYS.contains(String.valueOf(key))) {
        throw new IllegalArgumentException("Unknown field '" + key + "'");
      }
    }
    if (!(map.get(ROLE) instanceof String role) || role.isBlank()) {
      throw new IllegalArgumentException("Node without a role: " + map);
    }
    AriaNode.Builder b = AriaNode.builder(role);
    Object name = map.get(NAME);
    if (name != null) {
      b.name(name(name));
    }
    Object ref = map.get(REF);
    if (ref != null) {
      b.ref(scalar(REF, ref));
    }
    b.checked(state(CHECKED, map.get(CHECKED)));
    b.pressed(state(PRESSED, map.get(PRESSED)));
    b.disabled(flag(DISABLED, map.get(DISABLED)));
    b.expanded(flag(EXPANDED, map.get(EXPANDED)));
    b.active(flag(ACTIVE, map.get(ACTIVE)));
    b.selected(flag(SELECTED, map.get(SELECTED)));
    Object level = map.get(LEVEL);
    if (level != null) {
      if (!(level instanceof Number n)) {
        throw new IllegalArgumentException("Field 'level' must be an integer: " + level);
      }
      b.level(n.intValue());
    }
    Object props = map.get(PROPS);
    if (props != null) {
      if (!(props instanceof Map<?, ?> pm)) {
        throw new IllegalArgumentException("Field 'props' must be a mapping");
      }
      pm.forEach((k, v) -> b.prop(String.valueOf(k), v == null ? "" : String.valueOf(v)));
    }
    Object children = map.get(CHILDREN);
    if (children != null) {
      b.children(fromData(children));
    }
    return b.build();
  }

  private static AriaName name(Object value) {
    if (value instanceof String s) {
      return AriaName.literal(s);
    }
    if (value instanceof Map<?, ?> m && m.get(NAME_VALUE) != null) {
      Object regex = m.get(NAME_IS_REGEX);
      if (regex != null && !(regex instanceof Boolean)) {
        throw new IllegalArgumentException("Field 'is_regex' must be a boolean: " + regex);
      }
      return new AriaName(scalar(NAME_VALUE, m.get(NAME_VALUE)), Boolean.TRUE.equals(regex));
    }
    throw new IllegalArgumentException("Field 'name' must be a string or {value, is_regex}");
  }

  private static CheckedState state(String field, Object value) {
    if (value == null) {
      return null;
    }
    return CheckedState.fromData(value)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Field '" + field + "' must be true, false or \"mixed\": " + value));
  }

  private static Boolean flag(String field, Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    throw new IllegalArgumentException("Field '" + field + "' must be a boolean: " + value);
  }

  private static String scalar(String field, Object value) {
    if (value instanceof Map || value instanceof List) {
      throw new IllegalArgumentException("Field '" + field + "' must be a scalar");
    }
    return String.valueOf(value);
  }

  private static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}

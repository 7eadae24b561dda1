package io.ariasnap.parser;

import static io.ariasnap.parser.SnapshotFields.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a parsed tree into plain nested data: ordered maps, lists, strings, booleans and
 * integers.
 *
 * <p>A node becomes a map holding only the attributes that were set, always followed by a {@code
 * children} list. A text leaf becomes a bare string inside its parent's {@code children}. This
 * plain form is what querying, flattening, caching and output formatting operate on.
 */
public final class AriaSnapshotSerializer {

  private AriaSnapshotSerializer() {}

  public static List<Object> toData(List<? extends AriaChild> tree) {
    List<Object> out = new ArrayList<>(tree.size());
    for (AriaChild child : tree) {
      out.add(toData(child));
    }
    return out;
  }

  public static Object toData(AriaChild child) {
    if (child instanceof AriaText text) {
      return text.text();
    }
    return toData((AriaNode) child);
  }

  public static Map<String, Object> toData(AriaNode node) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(ROLE, node.role());
    node.name()
        .ifPresent(
            n -> {
              Map<String, Object> name = new LinkedHashMap<>();
              name.put(NAME_VALUE, n.value());
              name.put(NAME_IS_REGEX, n.regex());
              map.put(NAME, name);
            });
    node.ref().ifPresent(v -> map.put(REF, v));
    node.checked().ifPresent(v -> map.put(CHECKED, v.toData()));
    node.disabled().ifPresent(v -> map.put(DISABLED, v));
    node.expanded().ifPresent(v -> map.put(EXPANDED, v));
    node.active().ifPresent(v -> map.put(ACTIVE, v));
    node.level().ifPresent(v -> map.put(LEVEL, v));
    node.pressed().ifPresent(v -> map.put(PRESSED, v.toData()));
    node.selected().ifPresent(v -> map.put(SELECTED, v));
    if (!node.props().isEmpty()) {
      map.put(PROPS, new LinkedHashMap<>(node.props()));
    }
    map.put(CHILDREN, toData(node.children()));
    return map;
  }
}

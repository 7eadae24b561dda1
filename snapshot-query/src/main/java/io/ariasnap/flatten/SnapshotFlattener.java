package io.ariasnap.flatten;

import io.ariasnap.parser.AriaChild;
import io.ariasnap.parser.AriaSnapshotSerializer;
import io.ariasnap.parser.SnapshotFields;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens serialized snapshot data into one depth-first, pre-order list.
 *
 * <p>Each entry is a copy of the node without {@code children}, annotated with {@code _depth} (0
 * at the root), {@code _parent_role} ({@code null} at the root) and {@code _index} (its position in
 * the output). Text leaves become {@code {"text": ...}} entries with the same annotations. With the
 * tree flattened, a filter such as {@code [?role == 'button']} matches at every depth.
 */
public final class SnapshotFlattener {

  public static final String DEPTH = "_depth";
  public static final String PARENT_ROLE = "_parent_role";
  public static final String INDEX = "_index";
  public static final String TEXT = "text";

  private SnapshotFlattener() {}

  /** Flattens a typed tree; equivalent to flattening its serialized form. */
  public static List<Map<String, Object>> flatten(List<? extends AriaChild> tree) {
    return flatten(AriaSnapshotSerializer.toData(tree));
  }

  /**
   * Flattens plain data: a list of entries, or a single node map. Entries that are neither maps nor
   * strings are ignored.
   */
  public static List<Map<String, Object>> flatten(Object data) {
    List<Map<String, Object>> out = new ArrayList<>();
    walk(data, 0, null, out);
    return out;
  }

  private static void walk(
      Object data, int depth, String parentRole, List<Map<String, Object>> out) {
    if (data instanceof List<?> items) {
      for (Object item : items) {
        walk(item, depth, parentRole, out);
      }
    } else if (data instanceof Map<?, ?> node) {
      Map<String, Object> entry = new LinkedHashMap<>();
      node.forEach(
          (k, v) -> {
            if (!SnapshotFields.CHILDREN.equals(k)) {
              entry.put(String.valueOf(k), v);
            }
          });
      annotate(entry, depth, parentRole, out);
      Object children = node.get(SnapshotFields.CHILDREN);
      if (children != null) {
        Object role = node.get(SnapshotFields.ROLE);
        walk(children, depth + 1, role == null ? null : String.valueOf(role), out);
      }
    } else if (data instanceof String text) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put(TEXT, text);
      annotate(entry, depth, parentRole, out);
    }
  }

  private static void annotate(
      Map<String, Object> entry, int depth, String parentRole, List<Map<String, Object>> out) {
    entry.put(DEPTH, depth);
    entry.put(PARENT_ROLE, parentRole);
    entry.put(INDEX, out.size());
    out.add(entry);
  }
}

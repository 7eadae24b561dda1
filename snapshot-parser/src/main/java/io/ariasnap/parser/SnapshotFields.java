package io.ariasnap.parser;

import java.util.Set;

/** Key names of the plain-data form shared by the serializer and {@link SnapshotDataReader}. */
public final class SnapshotFields {
  public static final String ROLE = "role";
  public static final String NAME = "name";
  public static final String NAME_VALUE = "value";
  public static final String NAME_IS_REGEX = "is_regex";
  public static final String REF = "ref";
  public static final String CHECKED = "checked";
  public static final String DISABLED = "disabled";
  public static final String EXPANDED = "expanded";
  public static final String ACTIVE = "active";
  public static final String LEVEL = "level";
  public static final String PRESSED = "pressed";
  public static final String SELECTED = "selected";
  public static final String PROPS = "props";
  public static final String CHILDREN = "children";

  /** Every key a serialized node may carry. */
  public static final Set<String> NODE_KEYS =
      Set.of(
          ROLE, NAME, REF, CHECKED, DISABLED, EXPANDED, ACTIVE, LEVEL, PRESSED, SELECTED, PROPS,
          CHILDREN);

  private SnapshotFields() {}
}

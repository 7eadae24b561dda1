package io.ariasnap.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An element of a snapshot tree, e.g. {@code - button "Submit" [ref=e1] [disabled]}.
 *
 * <p>Only {@code role} is mandatory. Every other attribute is optional and is reported as empty
 * when the snapshot did not set it, so that serialization can omit it instead of writing a null.
 * Instances are immutable; use {@link #builder(String)} to create them.
 */
public final class AriaNode implements AriaChild {

  private final String role;
  private final AriaName name;
  private final String ref;
  private final CheckedState checked;
  private final CheckedState pressed;
  private final Boolean disabled;
  private final Boolean expanded;
  private final Boolean active;
  private final Boolean selected;
  private final Integer level;
  private final Map<String, String> props;
  private final List<AriaChild> children;

  private AriaNode(Builder b) {
    this.role = b.role;
    this.name = b.name;
    this.ref = b.ref;
    this.checked = b.checked;
    this.pressed = b.pressed;
    this.disabled = b.disabled;
    this.expanded = b.expanded;
    this.active = b.active;
    this.selected = b.selected;
    this.level = b.level;
    this.props = Collections.unmodifiableMap(new LinkedHashMap<>(b.props));
    this.children = List.copyOf(b.children);
  }

  public static Builder builder(String role) {
    return new Builder(role);
  }

  public String role() {
    return role;
  }

  public Optional<AriaName> name() {
    return Optional.ofNullable(name);
  }

  public Optional<String> ref() {
    return Optional.ofNullable(ref);
  }

  public Optional<CheckedState> checked() {
    return Optional.ofNullable(checked);
  }

  public Optional<CheckedState> pressed() {
    return Optional.ofNullable(pressed);
  }

  public Optional<Boolean> disabled() {
    return Optional.ofNullable(disabled);
  }

  public Optional<Boolean> expanded() {
    return Optional.ofNullable(expanded);
  }

  public Optional<Boolean> active() {
    return Optional.ofNullable(active);
  }

  public Optional<Boolean> selected() {
    return Optional.ofNullable(selected);
  }

  public Optional<Integer> level() {
    return Optional.ofNullable(level);
  }

  /** Role-specific extra attributes in insertion order, e.g. {@code url} or {@code cursor}. */
  public Map<String, String> props() {
    return props;
  }

  public List<AriaChild> children() {
    return children;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AriaNode other)) {
      return false;
    }
    return role.equals(other.role)
        && Objects.equals(name, other.name)
        && Objects.equals(ref, other.ref)
        && checked == other.checked
        && pressed == other.pressed
        && Objects.equals(disabled, other.disabled)
        && Objects.equals(expanded, other.expanded)
        && Objects.equals(active, other.active)
        && Objects.equals(selected, other.selected)
        && Objects.equals(level, other.level)
        && props.equals(other.props)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        role, name, ref, checked, pressed, disabled, expanded, active, selected, level, props,
        children);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("AriaNode{role=").append(role);
    if (name != null) {
      sb.append(", name=").append(name.regex() ? "/" + name.value() + "/" : name.value());
    }
    if (ref != null) {
      sb.append(", ref=").append(ref);
    }
    if (!props.isEmpty()) {
      sb.append(", props=").append(props);
    }
    if (!children.isEmpty()) {
      sb.append(", children=").append(children.size());
    }
    return sb.append('}').toString();
  }

  /** Mutable builder; the parser fills it while it walks a node line and its child block. */
  public static final class Builder {
    private final String role;
    private AriaName name;
    private String ref;
    private CheckedState checked;
    private CheckedState pressed;
    private Boolean disabled;
    private Boolean expanded;
    private Boolean active;
    private Boolean selected;
    private Integer level;
    private final Map<String, String> props = new LinkedHashMap<>();
    private final List<AriaChild> children = new ArrayList<>();

    private Builder(String role) {
      if (role == null || role.isBlank()) {
        throw new IllegalArgumentException("Role is required");
      }
      this.role = role;
    }

    public Builder name(AriaName name) {
      this.name = name;
      return this;
    }

    public Builder ref(String ref) {
      this.ref = ref;
      return this;
    }

    public Builder checked(CheckedState checked) {
      this.checked = checked;
      return this;
    }

    public Builder pressed(CheckedState pressed) {
      this.pressed = pressed;
      return this;
    }

    public Builder disabled(Boolean disabled) {
      this.disabled = disabled;
      return this;
    }

    public Builder expanded(Boolean expanded) {
      this.expanded = expanded;
      return this;
    }

    public Builder active(Boolean active) {
      this.active = active;
      return this;
    }

    public Builder selected(Boolean selected) {
      this.selected = selected;
      return this;
    }

    public Builder level(Integer level) {
      this.level = level;
      return this;
    }

    public Builder prop(String key, String value) {
      props.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder child(AriaChild child) {
      children.add(Objects.requireNonNull(child, "child"));
      return this;
    }

    public Builder children(List<? extends AriaChild> more) {
      more.forEach(this::child);
      return this;
    }

    boolean hasName() {
      return name != null;
    }

    public AriaNode build() {
      return new AriaNode(this);
    }
  }
}

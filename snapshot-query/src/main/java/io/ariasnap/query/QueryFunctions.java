package io.ariasnap.query;

import io.ariasnap.query.function.IntFunction;
import io.ariasnap.query.function.NvlFunction;
import io.ariasnap.query.function.RegexReplaceFunction;
import io.ariasnap.query.function.StrFunction;
import io.burt.jmespath.Adapter;
import io.burt.jmespath.function.ArgumentConstraint;
import io.burt.jmespath.function.ArgumentConstraints;
import io.burt.jmespath.function.BaseFunction;
import io.burt.jmespath.function.Function;
import io.burt.jmespath.function.FunctionArgument;
import io.burt.jmespath.function.FunctionRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of custom query functions: name to arity and implementation.
 *
 * <p>The table is handed to {@link JmesPathQueryEngine} at construction. The built-in JMESPath
 * functions stay available next to the ones registered here.
 */
public final class QueryFunctions {

  /** One registered function. */
  public record Entry(String name, int arity, QueryFunction implementation) {
    public Entry {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Function name is required");
      }
      if (arity < 0) {
        throw new IllegalArgumentException("Arity must not be negative: " + arity);
      }
      Objects.requireNonNull(implementation, "implementation");
    }
  }

  private static final QueryFunctions EMPTY = new QueryFunctions(Map.of());

  private static final QueryFunctions STANDARD =
      EMPTY
          .with("nvl", 2, new NvlFunction())
          .with("int", 1, new IntFunction())
          .with("str", 1, new StrFunction())
          .with("regex_replace", 3, new RegexReplaceFunction());

  private final Map<String, Entry> entries;

  private QueryFunctions(Map<String, Entry> entries) {
    this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  public static QueryFunctions empty() {
    return EMPTY;
  }

  /** {@code nvl/2}, {@code int/1}, {@code str/1} and {@code regex_replace/3}. */
  public static QueryFunctions standard() {
    return STANDARD;
  }

  /**
   * Returns a copy of this table with one more function.
   *
   * @throws IllegalArgumentException if the name is already registered
   */
  public QueryFunctions with(String name, int arity, QueryFunction implementation) {
    Entry entry = new Entry(name, arity, implementation);
    if (entries.containsKey(name)) {
      throw new IllegalArgumentException("Function already registered: " + name);
    }
    Map<String, Entry> copy = new LinkedHashMap<>(entries);
    copy.put(name, entry);
    return new QueryFunctions(copy);
  }

  public Optional<Entry> lookup(String name) {
    return Optional.ofNullable(entries.get(name));
  }

  public Set<String> names() {
    return entries.keySet();
  }

  FunctionRegistry toRegistry() {
    List<Function> bound = new ArrayList<>(entries.size());
    for (Entry entry : entries.values()) {
      bound.add(new BoundFunction(entry));
    }
    return FunctionRegistry.defaultRegistry().extend(bound.toArray(new Function[0]));
  }

  private static ArgumentConstraint[] anyValues(int arity) {
    ArgumentConstraint[] constraints = new ArgumentConstraint[arity];
    for (int i = 0; i < arity; i++) {
      constraints[i] = ArgumentConstraints.anyValue();
    }
    return constraints;
  }

  // Adapts a table entry to the runtime's function interface; arity is checked by BaseFunction
  private static final class BoundFunction extends BaseFunction {
    private final QueryFunction implementation;

    BoundFunction(Entry entry) {
      super(entry.name(), anyValues(entry.arity()));
      this.implementation = entry.implementation();
    }

    @Override
    protected <T> T callFunction(Adapter<T> runtime, List<FunctionArgument<T>> arguments) {
      List<T> values = new ArrayList<>(arguments.size());
      for (FunctionArgument<T> argument : arguments) {
        values.add(argument.value());
      }
      return implementation.apply(runtime, values);
    }
  }
}

package io.ariasnap.query.function;

import io.ariasnap.query.QueryFunction;
import io.burt.jmespath.Adapter;
import java.util.List;

/**
 * {@code str(value)}: the text form of a value. Null stays null, strings are returned as they are
 * and anything else prints as compact JSON.
 */
public final class StrFunction implements QueryFunction {

  @Override
  public <T> T apply(Adapter<T> runtime, List<T> args) {
    T value = args.get(0);
    switch (runtime.typeOf(value)) {
      case NULL:
      case STRING:
        return value;
      default:
        return runtime.createString(runtime.toString(value));
    }
  }
}

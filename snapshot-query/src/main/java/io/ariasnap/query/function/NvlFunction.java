package io.ariasnap.query.function;

import io.ariasnap.query.QueryFunction;
import io.burt.jmespath.Adapter;
import io.burt.jmespath.JmesPathType;
import java.util.List;

/** {@code nvl(value, default)}: {@code default} when {@code value} is null, else {@code value}. */
public final class NvlFunction implements QueryFunction {

  @Override
  public <T> T apply(Adapter<T> runtime, List<T> args) {
    T value = args.get(0);
    return runtime.typeOf(value) == JmesPathType.NULL ? args.get(1) : value;
  }
}

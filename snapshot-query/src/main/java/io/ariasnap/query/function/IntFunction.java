package io.ariasnap.query.function;

import io.ariasnap.query.QueryFunction;
import io.burt.jmespath.Adapter;
import java.util.List;

/**
 * {@code int(value)}: best-effort integer coercion.
 *
 * <p>Numbers are truncated toward zero, booleans give 1 or 0 and strings are trimmed and read as
 * base-10 integers. Everything else, including an unreadable string, gives null.
 */
public final class IntFunction implements QueryFunction {

  @Override
  public <T> T apply(Adapter<T> runtime, List<T> args) {
    T value = args.get(0);
    switch (runtime.typeOf(value)) {
      case NUMBER:
        return runtime.createNumber(runtime.toNumber(value).longValue());
      case BOOLEAN:
        return runtime.createNumber(runtime.isTruthy(value) ? 1L : 0L);
      case STRING:
        try {
          return runtime.createNumber(Long.parseLong(runtime.toString(value).strip()));
        } catch (NumberFormatException e) {
          return runtime.createNull();
        }
      default:
        return runtime.createNull();
    }
  }
}

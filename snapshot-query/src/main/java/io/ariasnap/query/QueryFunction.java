package io.ariasnap.query;

import io.burt.jmespath.Adapter;
import java.util.List;

/**
 * Implementation of a custom query function.
 *
 * <p>Arguments arrive already evaluated and already checked against the arity registered in {@link
 * QueryFunctions}. Implementations work through the {@link Adapter} only, so they are independent
 * of the JSON tree library underneath.
 */
public interface QueryFunction {

  <T> T apply(Adapter<T> runtime, List<T> args);
}

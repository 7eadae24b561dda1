package io.ariasnap.query.function;

import io.ariasnap.query.QueryFunction;
import io.burt.jmespath.Adapter;
import io.burt.jmespath.JmesPathType;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code regex_replace(pattern, replacement, value)}: replaces every match of {@code pattern} in
 * {@code value}.
 *
 * <p>Pattern and replacement use {@link Pattern} syntax ({@code $1}, {@code ${name}}). The value is
 * returned unchanged when it is not a string, when either of the other arguments is not a string,
 * or when the pattern or a group reference is invalid.
 */
public final class RegexReplaceFunction implements QueryFunction {

  private static final Logger LOG = LoggerFactory.getLogger(RegexReplaceFunction.class);

  @Override
  public <T> T apply(Adapter<T> runtime, List<T> args) {
    T pattern = args.get(0);
    T replacement = args.get(1);
    T value = args.get(2);
    if (runtime.typeOf(value) != JmesPathType.STRING
        || runtime.typeOf(pattern) != JmesPathType.STRING
        || runtime.typeOf(replacement) != JmesPathType.STRING) {
      return value;
    }
    try {
      String replaced =
          Pattern.compile(runtime.toString(pattern))
              .matcher(runtime.toString(value))
              .replaceAll(runtime.toString(replacement));
      return runtime.createString(replaced);
    } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
      // PatternSyntaxException is an IllegalArgumentException
      LOG.debug("regex_replace left value unchanged: {}", e.getMessage());
      return value;
    }
  }
}

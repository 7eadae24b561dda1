package io.ariasnap.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.burt.jmespath.Expression;
import io.burt.jmespath.RuntimeConfiguration;
import io.burt.jmespath.jackson.JacksonRuntime;
import io.burt.jmespath.parser.ParseException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueryEngine} backed by jmespath-java over Jackson trees.
 *
 * <p>Plain data is converted to a {@link JsonNode} for evaluation and the result converted back to
 * maps, lists and scalars. The runtime is immutable once built, so one engine can serve concurrent
 * callers.
 */
public final class JmesPathQueryEngine implements QueryEngine {

  private static final Logger LOG = LoggerFactory.getLogger(JmesPathQueryEngine.class);

  static final String ERROR_PREFIX = "Invalid JMESPath query: ";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final QueryFunctions functions;
  private final JacksonRuntime runtime;

  public JmesPathQueryEngine() {
    this(QueryFunctions.standard());
  }

  public JmesPathQueryEngine(QueryFunctions functions) {
    this.functions = Objects.requireNonNull(functions, "functions");
    RuntimeConfiguration configuration =
        new RuntimeConfiguration.Builder().withFunctionRegistry(functions.toRegistry()).build();
    this.runtime = new JacksonRuntime(configuration);
  }

  public QueryFunctions functions() {
    return functions;
  }

  @Override
  public QueryResult evaluate(Object data, String expression) {
    if (expression == null || expression.isBlank()) {
      return QueryResult.failure(ERROR_PREFIX + "expression is empty");
    }
    long start = System.nanoTime();
    try {
      Expression<JsonNode> compiled = runtime.compile(expression);
      JsonNode input = data == null ? NullNode.getInstance() : MAPPER.valueToTree(data);
      JsonNode output = compiled.search(input);
      Object value =
          output == null || output.isNull() ? null : MAPPER.convertValue(output, Object.class);
      LOG.debug("Evaluated '{}' in {} us", expression, (System.nanoTime() - start) / 1000);
      return QueryResult.success(value);
    } catch (ParseException e) {
      LOG.warn("Query '{}' does not compile: {}", expression, e.getMessage());
      return QueryResult.failure(ERROR_PREFIX + e.getMessage());
    } catch (RuntimeException e) {
      LOG.warn("Query '{}' failed: {}", expression, e.getMessage());
      return QueryResult.failure(ERROR_PREFIX + describe(e));
    }
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}

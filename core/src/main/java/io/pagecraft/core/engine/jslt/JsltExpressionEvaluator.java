package io.pagecraft.core.engine.jslt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.pagecraft.core.error.ExpressionEvalException;
import io.pagecraft.core.spi.Environment;
import io.pagecraft.core.spi.ExpressionEvaluator;
import io.pagecraft.core.spi.LazySequence;
import io.pagecraft.core.spi.Truthiness;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expression evaluator backed by Schibsted JSLT.
 *
 * <p>Every binding that Jackson can convert is exposed both as an external JSLT variable
 * ({@code $name}) and as a field of the input object ({@code .name}). Results are converted back
 * to plain Java values (maps, lists, strings, numbers, booleans, {@code null}).
 *
 * <p>JSLT has no side effects: a statement block is evaluated as one JSLT program and its value is
 * the block's output (strings verbatim, other values as JSON). Iterable values are arrays (their
 * elements) and objects (their keys); {@code null} iterates as empty.
 */
public final class JsltExpressionEvaluator implements ExpressionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(JsltExpressionEvaluator.class);

    /** Evaluator identifier used by {@code --evaluator} and {@code engine.evaluator}. */
    public static final String EVALUATOR_ID = "jslt";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final int MAX_CACHED_EXPRESSIONS = 1024;

    private final Map<String, Expression> compiled = new ConcurrentHashMap<>();

    @Override
    public String id() {
        return EVALUATOR_ID;
    }

    @Override
    public Object evaluate(String expression, Environment env) {
        return toJava(apply(expression, env), expression);
    }

    @Override
    public boolean test(String expression, Environment env) {
        return Truthiness.isTruthy(apply(expression, env));
    }

    @Override
    public String execute(String code, Environment env) {
        JsonNode result = apply(code, env);
        if (result == null || result.isNull() || result.isMissingNode()) {
            return "";
        }
        return result.isTextual() ? result.textValue() : result.toString();
    }

    @Override
    public LazySequence sequence(String expression, Environment env) {
        JsonNode result = apply(expression, env);
        if (result == null || result.isNull() || result.isMissingNode()) {
            return LazySequence.empty();
        }
        if (result.isArray()) {
            Iterator<JsonNode> elements = result.elements();
            return new LazySequence() {
                @Override
                public boolean hasNext() {
                    return elements.hasNext();
                }

                @Override
                public Object next() {
                    return toJava(elements.next(), expression);
                }
            };
        }
        if (result.isObject()) {
            return LazySequence.of(result.fieldNames());
        }
        throw new ExpressionEvalException(
                "Cannot iterate over JSON " + result.getNodeType().name().toLowerCase() + ": '" + expression + "'",
                expression);
    }

    private JsonNode apply(String expression, Environment env) {
        Expression jslt = compile(expression);
        Map<String, JsonNode> variables = buildVariables(env);
        ObjectNode input = MAPPER.createObjectNode();
        input.setAll(variables);
        try {
            return jslt.apply(variables, input);
        } catch (JsltException e) {
            throw new ExpressionEvalException(
                    "JSLT evaluation failed for '" + expression + "': " + e.getMessage(), e, expression);
        }
    }

    private Expression compile(String expression) {
        Expression cached = compiled.get(expression);
        if (cached != null) {
            return cached;
        }
        Expression jslt;
        try {
            jslt = Parser.compileString(expression);
        } catch (JsltException e) {
            throw new ExpressionEvalException(
                    "Failed to compile JSLT expression '" + expression + "': " + e.getMessage(), e, expression);
        }
        if (compiled.size() >= MAX_CACHED_EXPRESSIONS) {
            compiled.clear();
        }
        compiled.put(expression, jslt);
        return jslt;
    }

    /** Converts every binding Jackson can handle; the rest are invisible to JSLT. */
    private static Map<String, JsonNode> buildVariables(Environment env) {
        Map<String, JsonNode> variables = new HashMap<>();
        env.asMap().forEach((name, value) -> {
            if (value == null) {
                variables.put(name, NullNode.getInstance());
                return;
            }
            try {
                variables.put(name, MAPPER.valueToTree(value));
            } catch (IllegalArgumentException e) {
                LOG.debug(
                        "Binding '{}' of type {} is not visible to JSLT: {}",
                        name,
                        value.getClass().getName(),
                        e.getMessage());
            }
        });
        return variables;
    }

    private static Object toJava(JsonNode node, String expression) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return MAPPER.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new ExpressionEvalException(
                    "Cannot convert JSLT result of '" + expression + "': " + e.getOriginalMessage(), e, expression);
        }
    }
}

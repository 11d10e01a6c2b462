package io.pagecraft.core.engine.spel;

import io.pagecraft.core.error.ExpressionEvalException;
import io.pagecraft.core.error.TemplateException;
import io.pagecraft.core.spi.Environment;
import io.pagecraft.core.spi.ExpressionEvaluator;
import io.pagecraft.core.spi.LazySequence;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.BaseStream;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;

/**
 * Expression evaluator backed by the Spring Expression Language.
 *
 * <p>Bare identifiers are environment bindings ({@code user.name}, {@code items.size()}),
 * assignments write back to the environment ({@code total = total + 1}), and the root object
 * exposes {@code write(...)} and {@code escape(...)}. Statement blocks hold one statement per line
 * or {@code ;}-separated statements.
 *
 * <p>Iterable values: {@link Iterable}, arrays, {@link Iterator}, streams, maps (their keys) and
 * strings (their characters as one-character strings).
 */
public final class SpelExpressionEvaluator implements ExpressionEvaluator {

    /** Evaluator identifier used by {@code --evaluator} and {@code engine.evaluator}. */
    public static final String EVALUATOR_ID = "spel";

    private static final ExpressionParser PARSER = new SpelExpressionParser();

    @Override
    public String id() {
        return EVALUATOR_ID;
    }

    @Override
    public Object evaluate(String expression, Environment env) {
        EvaluationContext context = context(env);
        try {
            Expression parsed = PARSER.parseExpression(expression);
            return parsed.getValue(context);
        } catch (RuntimeException e) {
            throw translate(e, expression);
        }
    }

    @Override
    public String execute(String code, Environment env) {
        EvaluationContext context = context(env);
        try (Environment.WriteScope scope = env.openWriteScope()) {
            for (String statement : statements(code)) {
                try {
                    PARSER.parseExpression(statement).getValue(context);
                } catch (RuntimeException e) {
                    throw translate(e, statement);
                }
            }
            return scope.text();
        }
    }

    @Override
    public LazySequence sequence(String expression, Environment env) {
        Object value = evaluate(expression, env);
        if (value == null) {
            throw new ExpressionEvalException("Cannot iterate over null: '" + expression + "'", expression);
        }
        if (value instanceof Iterator<?> iterator) {
            return LazySequence.of(iterator);
        }
        if (value instanceof Iterable<?> iterable) {
            return LazySequence.of(iterable.iterator());
        }
        if (value instanceof Map<?, ?> map) {
            return LazySequence.of(map.keySet().iterator());
        }
        if (value instanceof BaseStream<?, ?> stream) {
            return LazySequence.of(stream.iterator());
        }
        if (value instanceof Object[] array) {
            return LazySequence.of(Arrays.asList(array).iterator());
        }
        if (value.getClass().isArray()) {
            return LazySequence.of(new PrimitiveArrayIterator(value));
        }
        if (value instanceof CharSequence chars) {
            return LazySequence.of(chars.codePoints().mapToObj(Character::toString).iterator());
        }
        throw new ExpressionEvalException(
                "Cannot iterate over a value of type " + value.getClass().getName() + ": '" + expression + "'",
                expression);
    }

    private static EvaluationContext context(Environment env) {
        StandardEvaluationContext context = new StandardEvaluationContext(new TemplateScope(env));
        context.addPropertyAccessor(new ScopePropertyAccessor());
        return context;
    }

    /** Splits a statement block on newlines and on {@code ;} outside string literals. */
    static List<String> statements(String code) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == ';' || c == '\n') {
                addStatement(statements, current);
            } else {
                current.append(c);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String statement = current.toString().strip();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }

    /** Template errors raised inside evaluated code (e.g. by a template function) pass through unchanged. */
    private static RuntimeException translate(RuntimeException e, String expression) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TemplateException templateError) {
                return templateError;
            }
        }
        if (e instanceof ExpressionException spel) {
            return new ExpressionEvalException(
                    "SpEL evaluation failed for '" + expression + "': " + spel.getMessage(), e, expression);
        }
        return new ExpressionEvalException(
                "SpEL evaluation failed for '" + expression + "': " + e, e, expression);
    }

    private static final class PrimitiveArrayIterator implements Iterator<Object> {

        private final Object array;
        private final int length;
        private int index;

        PrimitiveArrayIterator(Object array) {
            this.array = array;
            this.length = Array.getLength(array);
        }

        @Override
        public boolean hasNext() {
            return index < length;
        }

        @Override
        public Object next() {
            if (index >= length) {
                throw new NoSuchElementException();
            }
            return Array.get(array, index++);
        }
    }
}

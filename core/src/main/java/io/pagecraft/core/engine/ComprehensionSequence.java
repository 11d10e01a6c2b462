package io.pagecraft.core.engine;

import io.pagecraft.core.error.LoopTargetMismatchException;
import io.pagecraft.core.model.BlockKind;
import io.pagecraft.core.model.ForClause;
import io.pagecraft.core.model.Location;
import io.pagecraft.core.spi.Environment;
import io.pagecraft.core.spi.ExpressionEvaluator;
import io.pagecraft.core.spi.LazySequence;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Lazy source of value tuples for a {@code for} loop.
 *
 * <p>Walks the loop's clauses left to right like nested loops: each iteration clause pulls values
 * from {@link ExpressionEvaluator#sequence(String, Environment)} and binds them to its targets,
 * each filter clause drops the current combination when its condition is falsy. Inner sources are
 * re-evaluated for every value of an outer one, so they may refer to outer targets. Every
 * surviving combination yields one tuple holding the values of {@link BlockKind.ForLoop#targets()}
 * in order.
 *
 * <p>Targets stay bound in the environment while the sequence is consumed; the caller is
 * responsible for restoring them.
 */
final class ComprehensionSequence implements LazySequence {

    private final BlockKind.ForLoop loop;
    private final ExpressionEvaluator evaluator;
    private final Environment env;
    private final Location location;
    private final LazySequence[] sources;

    private boolean started;
    private boolean fetched;
    private boolean available;

    ComprehensionSequence(BlockKind.ForLoop loop, ExpressionEvaluator evaluator, Environment env, Location location) {
        this.loop = loop;
        this.evaluator = evaluator;
        this.env = env;
        this.location = location;
        this.sources = new LazySequence[loop.clauses().size()];
    }

    @Override
    public boolean hasNext() {
        if (!fetched) {
            available = advance();
            fetched = true;
        }
        return available;
    }

    @Override
    public List<Object> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("loop source exhausted: " + loop.generatorExpression());
        }
        fetched = false;
        List<Object> tuple = new ArrayList<>(loop.targets().size());
        for (String target : loop.targets()) {
            tuple.add(env.lookup(target));
        }
        return tuple;
    }

    /** Moves to the next combination that passes every filter. Returns false when exhausted. */
    private boolean advance() {
        List<ForClause> clauses = loop.clauses();
        int i;
        boolean forward;
        if (!started) {
            started = true;
            i = 0;
            forward = true;
        } else {
            i = clauses.size() - 1;
            forward = false;
        }

        while (i >= 0 && i < clauses.size()) {
            ForClause clause = clauses.get(i);
            if (clause instanceof ForClause.Iteration iteration) {
                if (forward) {
                    sources[i] = evaluator.sequence(iteration.source(), env);
                }
                if (sources[i].hasNext()) {
                    bind(iteration.targets(), sources[i].next());
                    i++;
                    forward = true;
                } else {
                    sources[i] = null;
                    i--;
                    forward = false;
                }
            } else if (clause instanceof ForClause.Filter filter) {
                if (forward && evaluator.test(filter.condition(), env)) {
                    i++;
                } else {
                    i--;
                    forward = false;
                }
            }
        }
        return i == clauses.size();
    }

    private void bind(List<String> targets, Object value) {
        if (targets.size() == 1) {
            env.bind(targets.get(0), value);
            return;
        }
        List<Object> values = unpack(targets, value);
        if (values.size() > targets.size()) {
            throw new LoopTargetMismatchException(targets, "more than " + targets.size() + " values", location);
        }
        if (values.size() < targets.size()) {
            throw new LoopTargetMismatchException(targets, values.size() + " value(s)", location);
        }
        for (int t = 0; t < targets.size(); t++) {
            env.bind(targets.get(t), values.get(t));
        }
    }

    private List<Object> unpack(List<String> targets, Object value) {
        List<Object> values = new ArrayList<>();
        if (value instanceof Iterable<?> iterable) {
            Iterator<?> it = iterable.iterator();
            // stop one past the target count, enough to report a mismatch
            while (it.hasNext() && values.size() <= targets.size()) {
                values.add(it.next());
            }
        } else if (value instanceof Object[] array) {
            values.addAll(Arrays.asList(array).subList(0, Math.min(array.length, targets.size() + 1)));
        } else if (value instanceof Map.Entry<?, ?> entry) {
            values.add(entry.getKey());
            values.add(entry.getValue());
        } else {
            String actual = value == null ? "null" : "a value of type " + value.getClass().getSimpleName();
            throw new LoopTargetMismatchException(targets, actual, location);
        }
        return values;
    }
}

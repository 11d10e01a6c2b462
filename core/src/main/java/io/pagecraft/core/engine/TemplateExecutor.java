package io.pagecraft.core.engine;

import io.pagecraft.core.error.ExpressionEvalException;
import io.pagecraft.core.error.TemplateException;
import io.pagecraft.core.model.BlockKind;
import io.pagecraft.core.model.BlockTag;
import io.pagecraft.core.model.CodeFragment;
import io.pagecraft.core.model.CommentTag;
import io.pagecraft.core.model.ExprTag;
import io.pagecraft.core.model.Location;
import io.pagecraft.core.model.Node;
import io.pagecraft.core.model.Template;
import io.pagecraft.core.model.TextNode;
import io.pagecraft.core.spi.Environment;
import io.pagecraft.core.spi.ExpressionEvaluator;
import io.pagecraft.core.spi.RenderListener;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a parsed template and produces its output. One instance per render: the executor holds
 * the environment and the output buffer of the render in progress and is not thread-safe.
 *
 * <p>Evaluator failures abort the walk. The executor attaches the location of the tag being
 * executed to {@link ExpressionEvalException}s that do not carry one yet.
 */
public final class TemplateExecutor implements Node.Visitor<Void>, BlockKind.Visitor<Void> {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateExecutor.class);

    private final ExpressionEvaluator evaluator;
    private final LoopBudget budget;
    private final RenderListener listener;

    private String templateName = Template.DEFAULT_NAME;
    private Environment env;
    private StringBuilder out;

    /**
     * @param evaluator expression evaluator for every tag of the render
     * @param budget    time limit for {@code while} loops
     * @param listener  optional listener notified of terminated loops, may be {@code null}
     */
    public TemplateExecutor(ExpressionEvaluator evaluator, LoopBudget budget, RenderListener listener) {
        this.evaluator = evaluator;
        this.budget = budget;
        this.listener = listener;
    }

    /** Renders {@code template} against {@code environment}, which is modified by the render. */
    public String execute(Template template, Environment environment) {
        if (env != null) {
            throw new IllegalStateException("executor already used for template '" + templateName + "'");
        }
        this.templateName = template.name();
        this.env = environment;
        this.out = new StringBuilder();
        renderAll(template.children());
        return out.toString();
    }

    /** Renders {@code nodes} into a fresh buffer and returns its content; the current output is untouched. */
    String renderIsolated(List<Node> nodes) {
        StringBuilder saved = out;
        out = new StringBuilder();
        try {
            renderAll(nodes);
            return out.toString();
        } finally {
            out = saved;
        }
    }

    private void renderAll(List<Node> nodes) {
        for (Node node : nodes) {
            node.accept(this);
        }
    }

    // --- Nodes ---

    @Override
    public Void visitText(TextNode text) {
        out.append(text.content());
        return null;
    }

    @Override
    public Void visitExpr(ExprTag expr) {
        CodeFragment code = expr.code();
        try {
            if (code.statements()) {
                out.append(code.reindent(evaluator.execute(code.code(), env)));
                return null;
            }
            Object value;
            String written;
            try (Environment.WriteScope scope = env.openWriteScope()) {
                value = evaluator.evaluate(code.code(), env);
                written = scope.text();
            }
            if (!written.isEmpty()) {
                out.append(written);
            } else if (value != null) {
                out.append(value);
            }
            return null;
        } catch (ExpressionEvalException e) {
            throw e.at(expr.location());
        }
    }

    @Override
    public Void visitComment(CommentTag comment) {
        return null;
    }

    @Override
    public Void visitBlock(BlockTag block) {
        return block.kind().accept(this, block);
    }

    // --- Block kinds ---

    @Override
    public Void visitConditional(BlockKind.Conditional kind, BlockTag block) {
        BlockTag branch = block;
        while (branch != null) {
            BlockKind.Conditional condition = (BlockKind.Conditional) branch.kind();
            if (condition.isElse() || test(condition.expression(), branch.location())) {
                renderAll(branch.children());
                return null;
            }
            branch = branch.continuation();
        }
        return null;
    }

    @Override
    public Void visitFor(BlockKind.ForLoop kind, BlockTag block) {
        List<String> targets = kind.targets();
        Environment.Backup backup = env.backup(targets);
        try {
            ComprehensionSequence values = new ComprehensionSequence(kind, evaluator, env, block.location());
            while (hasNext(values, kind, block.location())) {
                List<Object> tuple = values.next();
                for (int i = 0; i < targets.size(); i++) {
                    env.bind(targets.get(i), tuple.get(i));
                }
                renderAll(block.children());
            }
        } finally {
            env.restore(backup);
        }
        return null;
    }

    @Override
    public Void visitWhile(BlockKind.WhileLoop kind, BlockTag block) {
        long startNanos = System.nanoTime();
        long limitNanos = budget.whileTimeLimit().toNanos();
        int iterations = 0;

        if (kind.doFirst()) {
            renderAll(block.children());
            iterations++;
        }
        while (test(kind.expression(), block.location())) {
            renderAll(block.children());
            iterations++;
            if (!kind.slow() && System.nanoTime() - startNanos > limitNanos) {
                LOG.warn(
                        "Loop '{}' at {} terminated after {} iterations: exceeded time limit of {} ms",
                        kind.expression(),
                        block.location(),
                        iterations,
                        budget.whileTimeLimit().toMillis());
                notifyLoopTerminated(kind, block, iterations);
                break;
            }
        }
        return null;
    }

    @Override
    public Void visitCapture(BlockKind.Capture kind, BlockTag block) {
        env.bind(kind.variable(), renderIsolated(block.children()));
        return null;
    }

    @Override
    public Void visitComment(BlockKind.CommentBlock kind, BlockTag block) {
        return null;
    }

    @Override
    public Void visitFunctionDef(BlockKind.FunctionDef kind, BlockTag block) {
        env.bind(kind.name(), new TemplateFunction(kind, block, this, env));
        return null;
    }

    @Override
    public Void visitEnd(BlockKind.End kind, BlockTag block) {
        throw new IllegalStateException("end tag '" + block.body() + "' at " + block.location() + " was not consumed");
    }

    // --- Helpers ---

    private boolean test(String expression, Location location) {
        try {
            return evaluator.test(expression, env);
        } catch (ExpressionEvalException e) {
            throw e.at(location);
        }
    }

    /** Pulls the next tuple. Failures of caller-supplied iterators become located render errors. */
    private static boolean hasNext(ComprehensionSequence values, BlockKind.ForLoop kind, Location location) {
        try {
            return values.hasNext();
        } catch (ExpressionEvalException e) {
            throw e.at(location);
        } catch (TemplateException e) {
            throw e;
        } catch (RuntimeException e) {
            String source = kind.generatorExpression();
            throw new ExpressionEvalException("Iteration over '" + source + "' failed: " + e, e, source).at(location);
        }
    }

    private void notifyLoopTerminated(BlockKind.WhileLoop kind, BlockTag block, int iterations) {
        if (listener == null) return;
        try {
            listener.onLoopTerminated(new RenderListener.LoopTerminatedEvent(
                    templateName, kind.expression(), block.location(), iterations));
        } catch (Exception e) {
            LOG.warn("RenderListener.onLoopTerminated failed", e);
        }
    }
}

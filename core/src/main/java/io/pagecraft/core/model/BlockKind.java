package io.pagecraft.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The classified directive of a block tag. The set is closed; the executor handles every kind
 * through {@link Visitor}.
 */
public sealed interface BlockKind {

    /**
     * The block-start keyword an end tag must name to close this block ({@code endif},
     * {@code endfor}, ...). Empty for {@link End}.
     */
    String keyword();

    <R> R accept(Visitor<R> visitor, BlockTag block);

    /** Double-dispatch over the block kinds; receives the block tag that carries the kind. */
    interface Visitor<R> {

        R visitConditional(Conditional kind, BlockTag block);

        R visitFor(ForLoop kind, BlockTag block);

        R visitWhile(WhileLoop kind, BlockTag block);

        R visitCapture(Capture kind, BlockTag block);

        R visitComment(CommentBlock kind, BlockTag block);

        R visitFunctionDef(FunctionDef kind, BlockTag block);

        R visitEnd(End kind, BlockTag block);
    }

    /**
     * One branch of an {@code if}/{@code elif}/{@code else} chain.
     *
     * @param branch     {@value #IF}, {@value #ELIF} or {@value #ELSE}
     * @param expression the condition; {@value #ALWAYS} for {@code else}
     */
    record Conditional(String branch, String expression) implements BlockKind {

        public static final String IF = "if";
        public static final String ELIF = "elif";
        public static final String ELSE = "else";
        public static final String ALWAYS = "true";

        public Conditional {
            if (!IF.equals(branch) && !ELIF.equals(branch) && !ELSE.equals(branch)) {
                throw new IllegalArgumentException("unknown conditional branch: " + branch);
            }
            Objects.requireNonNull(expression, "expression must not be null");
        }

        public static Conditional otherwise() {
            return new Conditional(ELSE, ALWAYS);
        }

        public boolean isElse() {
            return ELSE.equals(branch);
        }

        /** {@code elif} and {@code else} continue a chain instead of opening one. */
        public boolean isContinuation() {
            return !IF.equals(branch);
        }

        /** {@code if} and {@code elif} may be followed by another branch; {@code else} ends the chain. */
        public boolean acceptsContinuation() {
            return !isElse();
        }

        @Override
        public String keyword() {
            return IF;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, BlockTag block) {
            return visitor.visitConditional(this, block);
        }
    }

    /**
     * A {@code for} loop.
     *
     * @param targets sorted union of the identifiers bound by every iteration clause
     * @param clauses iteration and filter clauses, left to right; the first is always an iteration
     */
    record ForLoop(List<String> targets, List<ForClause> clauses) implements BlockKind {

        public ForLoop {
            targets = List.copyOf(targets);
            clauses = List.copyOf(clauses);
            if (clauses.isEmpty() || !(clauses.get(0) instanceof ForClause.Iteration)) {
                throw new IllegalArgumentException("a for loop must start with an iteration clause");
            }
        }

        /** Generator-style rendering of the loop header, e.g. {@code ((k, v) for k, v in items)}. */
        public String generatorExpression() {
            StringBuilder sb = new StringBuilder("((").append(String.join(", ", targets)).append(")");
            for (ForClause clause : clauses) {
                if (clause instanceof ForClause.Iteration iteration) {
                    sb.append(" for ")
                            .append(String.join(", ", iteration.targets()))
                            .append(" in ")
                            .append(iteration.source());
                } else if (clause instanceof ForClause.Filter filter) {
                    sb.append(" if ").append(filter.condition());
                }
            }
            return sb.append(")").toString();
        }

        @Override
        public String keyword() {
            return "for";
        }

        @Override
        public <R> R accept(Visitor<R> visitor, BlockTag block) {
            return visitor.visitFor(this, block);
        }
    }

    /**
     * A {@code while} loop.
     *
     * @param expression loop condition
     * @param doFirst    run the body once before the first condition check
     * @param slow       exempt the loop from the wall-clock time limit
     */
    record WhileLoop(String expression, boolean doFirst, boolean slow) implements BlockKind {

        public WhileLoop {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public String keyword() {
            return "while";
        }

        @Override
        public <R> R accept(Visitor<R> visitor, BlockTag block) {
            return visitor.visitWhile(this, block);
        }
    }

    /** Renders the children into a variable instead of the output. */
    record Capture(String variable) implements BlockKind {

        public Capture {
            Objects.requireNonNull(variable, "variable must not be null");
        }

        @Override
        public String keyword() {
            return "capture";
        }

        @Override
        public <R> R accept(Visitor<R> visitor, BlockTag block) {
            return visitor.visitCapture(this, block);
        }
    }

    /** Discards its children. */
    record CommentBlock() implements BlockKind {

        @Override
        public String keyword() {
            return "comment";
        }

        @Override
        public <R> R accept(Visitor<R> visitor, BlockTag block) {
            return visitor.visitComment(this, block);
        }
    }

    /**
     * Binds a callable that renders the children with the parameters bound.
     *
     * @param name       function name
     * @param parameters parameter names in call order
     */
    record FunctionDef(String name, List<String> parameters) implements BlockKind {

        public FunctionDef {
            Objects.requireNonNull(name, "name must not be null");
            parameters = List.copyOf(parameters);
        }

        /** Signature as written in diagnostics, e.g. {@code greet(name, greeting)}. */
        public String signature() {
            return parameters.stream().collect(Collectors.joining(", ", name + "(", ")"));
        }

        @Override
        public String keyword() {
            return "def";
        }

        @Override
        public <R> R accept(Visitor<R> visitor, BlockTag block) {
            return visitor.visitFunctionDef(this, block);
        }
    }

    /**
     * Closes the innermost open block.
     *
     * @param target keyword named after {@code end} ({@code "if"} for {@code endif}); empty closes any block
     */
    record End(String target) implements BlockKind {

        public End {
            Objects.requireNonNull(target, "target must not be null");
        }

        /** Returns {@code true} if this end tag may close a block of the given kind. */
        public boolean closes(BlockKind kind) {
            return target.isEmpty() || target.equals(kind.keyword());
        }

        @Override
        public String keyword() {
            return "";
        }

        @Override
        public <R> R accept(Visitor<R> visitor, BlockTag block) {
            return visitor.visitEnd(this, block);
        }
    }
}

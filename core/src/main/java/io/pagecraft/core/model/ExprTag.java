package io.pagecraft.core.model;

import java.util.Objects;

/**
 * A {@code {{ ... }}} tag holding one expression or a block of statements.
 *
 * @param body     raw text between the delimiters, escapes already applied
 * @param location position of the opening delimiter
 * @param code     the body prepared for evaluation (indentation stripped, mode decided)
 */
public record ExprTag(String body, Location location, CodeFragment code) implements Node {

    public ExprTag {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(code, "code must not be null");
    }

    /** Returns {@code true} if the raw body spans more than one line. */
    public boolean isMultiLine() {
        return body.indexOf('\n') >= 0;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitExpr(this);
    }
}

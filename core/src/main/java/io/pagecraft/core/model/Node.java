package io.pagecraft.core.model;

/**
 * A node of the template tree. The set of node types is closed: text, expression tags, comment tags
 * and block tags. Consumers dispatch through {@link Visitor} so that a new node type is a
 * compile-time change for every walker.
 */
public sealed interface Node permits TextNode, ExprTag, CommentTag, BlockTag {

    <R> R accept(Visitor<R> visitor);

    /** Double-dispatch over the node types. */
    interface Visitor<R> {

        R visitText(TextNode node);

        R visitExpr(ExprTag node);

        R visitComment(CommentTag node);

        R visitBlock(BlockTag node);
    }
}

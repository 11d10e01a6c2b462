package io.pagecraft.core.parse;

import io.pagecraft.core.error.ElifOrElseWithoutIfException;
import io.pagecraft.core.error.MismatchingEndTagException;
import io.pagecraft.core.error.UnboundEndTagException;
import io.pagecraft.core.error.UnclosedTagException;
import io.pagecraft.core.model.BlockKind;
import io.pagecraft.core.model.BlockTag;
import io.pagecraft.core.model.Node;
import io.pagecraft.core.model.Template;
import java.util.ArrayList;
import java.util.List;

/**
 * Nests the flat token list produced by the lexer into a {@link Template}.
 *
 * <p>Recursive descent over a cursor. An {@code elif}/{@code else} token becomes the continuation
 * of the block being collected and takes over the rest of the chain, so a single end tag closes a
 * whole {@code if}/{@code elif}/{@code else} chain.
 */
public final class TreeBuilder {

    private final List<Node> tokens;
    private int cursor;

    private TreeBuilder(List<Node> tokens) {
        this.tokens = tokens;
    }

    /**
     * Builds the tree.
     *
     * @throws io.pagecraft.core.error.TemplateSyntaxException on unbalanced or mismatched tags
     */
    public static Template build(String name, List<Node> tokens) {
        TreeBuilder builder = new TreeBuilder(tokens);
        List<Node> children = new ArrayList<>();
        builder.collect(null, children);
        return new Template(name, children);
    }

    private BlockTag readBlock(BlockTag opener) {
        List<Node> children = new ArrayList<>();
        BlockTag continuation = collect(opener, children);
        return opener.withChildren(children, continuation);
    }

    /**
     * Appends tokens to {@code children} until {@code opener} is closed. Returns the continuation
     * that took over the chain, or {@code null} if an end tag closed the block.
     */
    private BlockTag collect(BlockTag opener, List<Node> children) {
        while (cursor < tokens.size()) {
            Node token = tokens.get(cursor++);
            if (!(token instanceof BlockTag block)) {
                children.add(token);
                continue;
            }

            if (block.kind() instanceof BlockKind.Conditional branch && branch.isContinuation()) {
                if (opener != null
                        && opener.kind() instanceof BlockKind.Conditional current
                        && current.acceptsContinuation()) {
                    return readBlock(block);
                }
                throw new ElifOrElseWithoutIfException(branch.branch(), block.location());
            }

            if (block.kind() instanceof BlockKind.End end) {
                if (opener == null) {
                    throw new UnboundEndTagException(block.body(), block.location());
                }
                if (!end.closes(opener.kind())) {
                    throw new MismatchingEndTagException(
                            block.body(),
                            block.location(),
                            opener.kind().keyword(),
                            opener.body(),
                            opener.location());
                }
                return null;
            }

            children.add(readBlock(block));
        }

        if (opener != null) {
            throw new UnclosedTagException(opener.kind().keyword(), opener.body(), opener.location());
        }
        return null;
    }
}

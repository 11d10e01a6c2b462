package io.pagecraft.core.parse;

import io.pagecraft.core.model.ExprTag;
import io.pagecraft.core.model.Node;
import io.pagecraft.core.model.TextNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Removes the whitespace around tags that sit alone on their line, so that block structure does
 * not leave blank lines in the output.
 *
 * <p>For each tag other than a single-line expression tag: if the text since the last newline of
 * the preceding text node is whitespace only, and the text up to the first newline of the
 * following text node is whitespace only, both fragments are deleted (the following one including
 * its newline). A neighbour that is not a text node counts as whitespace only and is left alone.
 * When two stripped tags are separated only by a newline-free whitespace run, that run is removed
 * as well. Empty text nodes are dropped afterwards.
 */
public final class WhitespaceNormalizer {

    private WhitespaceNormalizer() {}

    public static List<Node> normalize(List<Node> tokens) {
        List<Node> nodes = new ArrayList<>(tokens);
        boolean strippedPrevious = false;

        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node instanceof TextNode) {
                continue;
            }

            String leading = "";
            int previousNewline = -1;
            TextNode previous = textAt(nodes, i - 1);
            if (previous != null) {
                previousNewline = previous.content().lastIndexOf('\n');
                leading = previous.content().substring(previousNewline + 1);
            }

            String trailing = "";
            int nextNewline = -1;
            TextNode next = textAt(nodes, i + 1);
            if (next != null) {
                nextNewline = next.content().indexOf('\n');
                trailing = nextNewline >= 0 ? next.content().substring(0, nextNewline + 1) : next.content();
            }

            boolean inlineExpr = node instanceof ExprTag expr && !expr.isMultiLine();
            boolean strip = leading.isBlank() && trailing.isBlank() && !inlineExpr;

            if (strip) {
                if (previous != null && previousNewline >= 0) {
                    nodes.set(i - 1, new TextNode(previous.content().substring(0, previousNewline + 1)));
                }
                if (next != null && nextNewline >= 0) {
                    nodes.set(i + 1, new TextNode(next.content().substring(nextNewline + 1)));
                }
                if (strippedPrevious && i >= 2 && !(nodes.get(i - 2) instanceof TextNode)) {
                    TextNode between = textAt(nodes, i - 1);
                    if (between != null
                            && between.content().indexOf('\n') < 0
                            && between.content().isBlank()) {
                        nodes.set(i - 1, new TextNode(""));
                    }
                }
            }
            strippedPrevious = strip;
        }

        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (!(node instanceof TextNode text && text.isEmpty())) {
                result.add(node);
            }
        }
        return result;
    }

    private static TextNode textAt(List<Node> nodes, int index) {
        if (index >= 0 && index < nodes.size() && nodes.get(index) instanceof TextNode text) {
            return text;
        }
        return null;
    }
}

package io.pagecraft.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a parsed template as an indented outline, one heading per node. Used by the CLI's
 * {@code --tree} option.
 *
 * <pre>
 * Root:
 *     {% if x %}:
 *         Text:
 *             'yes'
 *         {% else %}:
 *             Text:
 *                 'no'
 * </pre>
 */
public final class TreePrinter implements Node.Visitor<String> {

    private static final String INDENT = "    ";

    private TreePrinter() {}

    /** Returns the outline of the given template. */
    public static String print(Template template) {
        return "Root:\n" + indent(printAll(template.children(), new TreePrinter()));
    }

    @Override
    public String visitText(TextNode text) {
        String content = text.content();
        int lines = 1 + (int) content.chars().filter(c -> c == '\n').count();
        if (content.endsWith("\n")) {
            lines--;
        }
        if (content.startsWith("\n")) {
            lines--;
        }
        if (lines <= 1) {
            return "Text:\n" + indent(quote(content));
        }
        return "Text-multiline:\n" + indent(content);
    }

    @Override
    public String visitExpr(ExprTag expr) {
        return (expr.isMultiLine() ? "Expr-block:\n" : "Expr-inline:\n") + indent(expr.body());
    }

    @Override
    public String visitComment(CommentTag comment) {
        return "Comment:\n" + indent(comment.body());
    }

    @Override
    public String visitBlock(BlockTag block) {
        StringBuilder sb = new StringBuilder("{% ").append(block.body()).append(" %}:");
        String children = printAll(block.children(), this);
        if (!children.isEmpty()) {
            sb.append('\n').append(indent(children));
        }
        if (block.hasContinuation()) {
            sb.append('\n').append(indent(visitBlock(block.continuation())));
        }
        return sb.toString();
    }

    private static String printAll(List<Node> nodes, TreePrinter printer) {
        return nodes.stream().map(node -> node.accept(printer)).collect(Collectors.joining("\n"));
    }

    private static String indent(String text) {
        return text.lines().map(line -> INDENT + line).collect(Collectors.joining("\n"));
    }

    private static String quote(String text) {
        String escaped = text.replace("\\", "\\\\")
                .replace("'", "\\'")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
        return "'" + escaped + "'";
    }
}

package io.pagecraft.core.parse;

import io.pagecraft.core.model.Node;
import io.pagecraft.core.model.Template;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses template source into an immutable {@link Template}: lex, normalize whitespace, build the
 * tree. All syntax errors surface here, before anything is rendered.
 */
public final class TemplateParser {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateParser.class);

    private TemplateParser() {}

    /**
     * @param name   template name used in diagnostics
     * @param source template text
     * @throws io.pagecraft.core.error.TemplateSyntaxException if the template is malformed
     */
    public static Template parse(String name, String source) {
        List<Node> tokens = Lexer.lex(source);
        List<Node> normalized = WhitespaceNormalizer.normalize(tokens);
        Template template = TreeBuilder.build(name, normalized);
        LOG.debug(
                "Parsed template '{}': {} tokens, {} top-level nodes",
                name,
                normalized.size(),
                template.children().size());
        return template;
    }
}

package io.pagecraft.core.engine;

import io.pagecraft.core.error.FunctionArgumentCountException;
import io.pagecraft.core.model.BlockKind;
import io.pagecraft.core.model.BlockTag;
import io.pagecraft.core.spi.Environment;
import java.util.List;

/**
 * A callable bound by a {@code {% def name params... %}} block. Calling it renders the block's
 * children with the parameters bound and returns the rendered text; it writes nothing to the
 * enclosing output.
 *
 * <p>From SpEL: {@code {{ greet.call('World') }}}.
 */
public final class TemplateFunction {

    private final BlockKind.FunctionDef definition;
    private final BlockTag block;
    private final TemplateExecutor executor;
    private final Environment env;

    TemplateFunction(BlockKind.FunctionDef definition, BlockTag block, TemplateExecutor executor, Environment env) {
        this.definition = definition;
        this.block = block;
        this.executor = executor;
        this.env = env;
    }

    public String name() {
        return definition.name();
    }

    public List<String> parameters() {
        return definition.parameters();
    }

    /**
     * Renders the function body with {@code args} bound to the parameters, in order. Bindings
     * shadowed by the parameters are restored afterwards.
     *
     * @throws FunctionArgumentCountException if the number of arguments does not match
     */
    public String call(Object... args) {
        List<String> parameters = definition.parameters();
        int given = args == null ? 0 : args.length;
        if (given != parameters.size()) {
            throw new FunctionArgumentCountException(definition.signature(), parameters.size(), given, block.location());
        }
        Environment.Backup backup = env.backup(parameters);
        try {
            for (int i = 0; i < given; i++) {
                env.bind(parameters.get(i), args[i]);
            }
            return executor.renderIsolated(block.children());
        } finally {
            env.restore(backup);
        }
    }

    @Override
    public String toString() {
        return "<function " + definition.signature() + ">";
    }
}

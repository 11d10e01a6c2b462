package io.pagecraft.core.engine.spel;

import java.util.Map;
import org.springframework.expression.AccessException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.PropertyAccessor;
import org.springframework.expression.TypedValue;

/**
 * Resolves identifiers against template bindings.
 *
 * <p>On the {@link TemplateScope} root, reads and writes go to the environment, so {@code name}
 * reads a binding and {@code name = 1} creates or replaces one. On {@link Map} values (seed data
 * parsed from JSON), {@code person.name} reads the {@code name} entry.
 */
final class ScopePropertyAccessor implements PropertyAccessor {

    @Override
    public Class<?>[] getSpecificTargetClasses() {
        return new Class<?>[] {TemplateScope.class, Map.class};
    }

    @Override
    public boolean canRead(EvaluationContext context, Object target, String name) {
        if (target instanceof TemplateScope scope) {
            return scope.environment().isBound(name);
        }
        return target instanceof Map<?, ?> map && map.containsKey(name);
    }

    @Override
    public TypedValue read(EvaluationContext context, Object target, String name) throws AccessException {
        if (target instanceof TemplateScope scope) {
            return new TypedValue(scope.environment().lookup(name));
        }
        if (target instanceof Map<?, ?> map) {
            return new TypedValue(map.get(name));
        }
        throw new AccessException("Cannot read '" + name + "' from " + target);
    }

    @Override
    public boolean canWrite(EvaluationContext context, Object target, String name) {
        return target instanceof TemplateScope;
    }

    @Override
    public void write(EvaluationContext context, Object target, String name, Object newValue)
            throws AccessException {
        if (!(target instanceof TemplateScope scope)) {
            throw new AccessException("Cannot assign '" + name + "' on " + target);
        }
        scope.environment().bind(name, newValue);
    }
}

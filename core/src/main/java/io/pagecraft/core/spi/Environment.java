package io.pagecraft.core.spi;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Variable bindings visible to evaluated code during one render, plus the stack of buffers that
 * collect text written through the {@code write} channel.
 *
 * <p>Values may be {@code null}; use {@link #isBound(String)} to tell an unbound name from a name
 * bound to {@code null}. Scoped changes (loop targets, function parameters) follow a strict stack
 * discipline through {@link #backup(Collection)} and {@link #restore(Backup)}.
 *
 * <p>Not thread-safe. Use one instance per render.
 */
public final class Environment {

    /** Reserved binding giving evaluated code a module-like identity. */
    public static final String NAME_BINDING = "__name__";

    public static final String PAGE_NAME = "pagecraft_page";

    private final Map<String, Object> bindings = new LinkedHashMap<>();
    private final Deque<StringBuilder> writeScopes = new ArrayDeque<>();

    /** Creates an environment with no bindings at all. */
    public Environment() {}

    /**
     * Creates an environment holding the reserved {@value #NAME_BINDING} binding followed by the
     * given seed data. Seed entries may override the reserved binding.
     */
    public static Environment seeded(Map<String, ?> seed) {
        Environment env = new Environment();
        env.bind(NAME_BINDING, PAGE_NAME);
        if (seed != null) {
            seed.forEach(env::bind);
        }
        return env;
    }

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    /** Returns the bound value, or {@code null} if the name is unbound or bound to {@code null}. */
    public Object lookup(String name) {
        return bindings.get(name);
    }

    public void bind(String name, Object value) {
        bindings.put(name, value);
    }

    public void unbind(String name) {
        bindings.remove(name);
    }

    /** Read-only live view of all bindings, in binding order. */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(bindings);
    }

    /** Saves the current state of the given names. */
    public Backup backup(Collection<String> names) {
        Map<String, Object> saved = new HashMap<>();
        for (String name : names) {
            if (bindings.containsKey(name)) {
                saved.put(name, bindings.get(name));
            }
        }
        return new Backup(new LinkedHashSet<>(names), saved);
    }

    /**
     * Returns the names covered by {@code backup} to their saved state: names that were bound get
     * their old value back, names that were unbound are removed.
     */
    public void restore(Backup backup) {
        for (String name : backup.names()) {
            if (backup.saved().containsKey(name)) {
                bindings.put(name, backup.saved().get(name));
            } else {
                bindings.remove(name);
            }
        }
    }

    /**
     * Starts collecting written text. Scopes nest; text goes to the innermost open scope.
     *
     * <pre>{@code
     * try (Environment.WriteScope scope = env.openWriteScope()) {
     *     evaluator.evaluate(code, env);
     *     output = scope.text();
     * }
     * }</pre>
     */
    public WriteScope openWriteScope() {
        StringBuilder buffer = new StringBuilder();
        writeScopes.push(buffer);
        return new WriteScope(buffer);
    }

    /**
     * Appends text to the innermost write scope.
     *
     * @throws IllegalStateException if no write scope is open
     */
    public void write(String text) {
        StringBuilder buffer = writeScopes.peek();
        if (buffer == null) {
            throw new IllegalStateException("write() called outside of a code tag");
        }
        buffer.append(text);
    }

    /**
     * Saved bindings for a set of names.
     *
     * @param names the names covered by this backup
     * @param saved values of the names that were bound; may contain {@code null} values
     */
    public record Backup(Set<String> names, Map<String, Object> saved) {}

    /** An open write scope. Closing it discards the scope from the stack. */
    public final class WriteScope implements AutoCloseable {

        private final StringBuilder buffer;

        private WriteScope(StringBuilder buffer) {
            this.buffer = buffer;
        }

        /** Text written into this scope so far. */
        public String text() {
            return buffer.toString();
        }

        @Override
        public void close() {
            writeScopes.removeFirstOccurrence(buffer);
        }
    }
}

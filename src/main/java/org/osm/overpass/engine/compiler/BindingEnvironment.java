package org.osm.overpass.engine.compiler;

import org.osm.overpass.dsl.Statement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The named sets and the default set visible to the statement being compiled.
 * Assignments replace earlier ones; nothing is visible before it is assigned.
 *
 * A union branch compiles against a {@link #copy()}: it sees the enclosing
 * sets, while its own assignments stay in the copy until the compiler merges
 * them back once the union closes.
 */
public final class BindingEnvironment {

    private final Map<String, Binding> named;
    private final Map<String, Binding> assigned = new LinkedHashMap<>();
    private final Binding empty;
    private Binding current;

    /**
     * @param empty The set the default set holds before any statement ran
     */
    public BindingEnvironment(Binding empty) {
        this(new LinkedHashMap<>(), Objects.requireNonNull(empty, "Empty binding cannot be null"), empty);
    }

    private BindingEnvironment(Map<String, Binding> named, Binding empty, Binding current) {
        this.named = named;
        this.empty = empty;
        this.current = current;
    }

    /**
     * Assigns a set. {@code _} names the default set.
     */
    public void define(String name, Binding binding) {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(binding, "Binding cannot be null");
        if (Statement.DEFAULT_SET.equals(name)) {
            current = binding;
            return;
        }
        named.put(name, binding);
        assigned.remove(name);
        assigned.put(name, binding);
    }

    /**
     * @throws UnboundBindingException if no statement assigned the name yet
     */
    public Binding resolve(String name) {
        if (Statement.DEFAULT_SET.equals(name)) {
            return current;
        }
        Binding binding = named.get(name);
        if (binding == null) {
            throw new UnboundBindingException(name);
        }
        return binding;
    }

    public Binding defaultBinding() {
        return current;
    }

    public boolean isEmptySentinel(Binding binding) {
        return binding == empty;
    }

    /**
     * @return An environment with the same sets and no assignments of its own
     */
    public BindingEnvironment copy() {
        return new BindingEnvironment(new LinkedHashMap<>(named), empty, current);
    }

    /**
     * @return The named sets assigned in this environment since it was
     *         created, in order of last assignment
     */
    public Map<String, Binding> assignments() {
        return Collections.unmodifiableMap(assigned);
    }
}

package io.github.eutro.varrec.analysis;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * What a statement or expression node was bound to.
 * <p>
 * The variables of a binding always share one storage location.
 */
public final class Binding {
    public enum Kind {
        /**
         * The node defines a variable.
         */
        DEFINITION,
        /**
         * The node reads a location, which may hold any of a set of variables.
         */
        USE,
        /**
         * The node is of a kind the evaluator does not model.
         */
        UNRESOLVED,
    }

    private static final Binding UNRESOLVED = new Binding(Kind.UNRESOLVED, Collections.emptySet());

    @NotNull
    public final Kind kind;
    private final Set<SSAVariable> vars;

    private Binding(@NotNull Kind kind, Set<SSAVariable> vars) {
        this.kind = kind;
        this.vars = vars;
    }

    public static Binding definition(SSAVariable var) {
        return new Binding(Kind.DEFINITION, Collections.singleton(Objects.requireNonNull(var)));
    }

    public static Binding use(Collection<SSAVariable> vars) {
        if (vars.isEmpty()) {
            throw new IllegalArgumentException("a use must read at least one variable");
        }
        return new Binding(Kind.USE, Collections.unmodifiableSet(new TreeSet<>(vars)));
    }

    public static Binding unresolved() {
        return UNRESOLVED;
    }

    @Nullable
    public SSAVariable getDefined() {
        return kind == Kind.DEFINITION ? vars.iterator().next() : null;
    }

    /**
     * Get the variables of this binding: the defined variable, the variables read, or nothing.
     *
     * @return The variables, ordered by id.
     */
    public Set<SSAVariable> getVariables() {
        return vars;
    }

    public boolean isResolved() {
        return kind != Kind.UNRESOLVED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Binding)) return false;
        Binding binding = (Binding) o;
        return kind == binding.kind && vars.equals(binding.vars);
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + vars.hashCode();
    }

    @Override
    public String toString() {
        switch (kind) {
            case DEFINITION:
                return "def " + getDefined();
            case USE:
                return "use " + vars;
            default:
                return "unresolved";
        }
    }
}

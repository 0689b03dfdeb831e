package org.pragmatica.symex.match;

import org.pragmatica.symex.directive.Directive;
import org.pragmatica.symex.expr.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bindings of pattern variables to concrete expressions, produced by matching.
 * Immutable; {@link #bind(String, Expression)} returns a new table.
 */
public final class SymbolTable {
    private static final SymbolTable EMPTY = new SymbolTable(Map.of());

    private final Map<String, Expression> bindings;

    private SymbolTable(Map<String, Expression> bindings) {
        this.bindings = bindings;
    }

    public static SymbolTable empty() {
        return EMPTY;
    }

    public static SymbolTable of(Map<String, Expression> bindings) {
        return new SymbolTable(Collections.unmodifiableMap(new LinkedHashMap<>(bindings)));
    }

    /**
     * Expression bound to the variable id.
     */
    public Optional<Expression> resolve(String id) {
        return Optional.ofNullable(bindings.get(id));
    }

    /**
     * Expression bound to the variable leaf.
     */
    public Optional<Expression> translate(Directive.Variable variable) {
        return resolve(variable.id());
    }

    /**
     * Table extended with {@code id -> expression}. Rebinding to an equal expression keeps the
     * table; rebinding to a different one is a conflict and yields empty.
     */
    public Optional<SymbolTable> bind(String id, Expression expression) {
        var existing = bindings.get(id);
        if (existing != null) {
            return existing.equals(expression)
                   ? Optional.of(this)
                   : Optional.empty();
        }
        var extended = new LinkedHashMap<>(bindings);
        extended.put(id, expression);
        return Optional.of(new SymbolTable(Collections.unmodifiableMap(extended)));
    }

    public Set<String> variables() {
        return bindings.keySet();
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SymbolTable other && bindings.equals(other.bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}

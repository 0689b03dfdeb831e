package org.pragmatica.symex.match;

import org.pragmatica.symex.directive.Directive;
import org.pragmatica.symex.expr.Expression;

import java.util.List;

/**
 * Structural matcher - proposes the variable bindings under which a pattern matches an expression.
 */
@FunctionalInterface
public interface Matcher {

    /**
     * Every distinct binding under which {@code pattern} matches {@code expression}, in
     * preference order. Empty if there is no match.
     */
    List<SymbolTable> match(Directive pattern, Expression expression);

    static Matcher structural() {
        return StructuralMatcher.INSTANCE;
    }
}

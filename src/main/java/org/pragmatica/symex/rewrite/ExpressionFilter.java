package org.pragmatica.symex.rewrite;

import org.pragmatica.symex.expr.Expression;

/**
 * Acceptance test applied to a rewrite result before it is returned.
 */
@FunctionalInterface
public interface ExpressionFilter {
    boolean accept(Expression expression);

    /**
     * Accept results no more complex than {@code original}.
     */
    static ExpressionFilter notMoreComplexThan(Expression original) {
        var limit = original.complexity();
        return expression -> expression.complexity() <= limit;
    }

    /**
     * Accept results strictly less complex than {@code original}.
     */
    static ExpressionFilter lessComplexThan(Expression original) {
        var limit = original.complexity();
        return expression -> expression.complexity() < limit;
    }
}

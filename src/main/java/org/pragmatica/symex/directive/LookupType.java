package org.pragmatica.symex.directive;

import org.pragmatica.symex.expr.Expression;

/**
 * Restriction on what a pattern variable may bind to during matching.
 */
public enum LookupType {
    /**
     * Any expression.
     */
    ANY,

    /**
     * Only a fully-known constant.
     */
    CONSTANT,

    /**
     * Only a non-constant leaf.
     */
    VARIABLE,

    /**
     * Only an operation.
     */
    EXPRESSION;

    public boolean accepts(Expression expression) {
        return switch (this) {
            case ANY -> true;
            case CONSTANT -> expression instanceof Expression.Constant;
            case VARIABLE -> expression instanceof Expression.Symbol;
            case EXPRESSION -> expression instanceof Expression.Operation;
        };
    }
}

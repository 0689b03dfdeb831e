package org.pragmatica.symex.expr;

import org.pragmatica.symex.math.OperatorId;

import java.util.Optional;

/**
 * Node construction and numeric simplification used by the directive interpreter.
 */
public interface ExpressionAlgebra {

    /**
     * Constant of the given width; the value is truncated to fit.
     */
    Expression constant(long value, int bits);

    /**
     * Apply a unary operator, or empty if the operator does not take one operand.
     */
    Optional<Expression> unary(OperatorId op, Expression rhs);

    /**
     * Apply a binary operator, or empty if the combination is not applicable.
     */
    Optional<Expression> binary(Expression lhs, OperatorId op, Expression rhs);

    /**
     * Value resized to {@code bits}, sign- or zero-extended. Never alters {@code expression}.
     */
    Expression resize(Expression expression, int bits, boolean signExtend);

    /**
     * Reduced form of the expression, or empty if nothing could be simplified.
     */
    Optional<Expression> simplify(Expression expression);

    static ExpressionAlgebra standard() {
        return StandardAlgebra.INSTANCE;
    }
}

package org.pragmatica.symex.expr;

import org.pragmatica.symex.math.BitMath;
import org.pragmatica.symex.math.OperatorId;

import java.util.Optional;

/**
 * Default algebra: builds plain nodes without folding and delegates reduction to {@link Simplifier}.
 */
public final class StandardAlgebra implements ExpressionAlgebra {
    static final StandardAlgebra INSTANCE = new StandardAlgebra();

    private static final int WIDTH_OPERAND_BITS = 8;

    private StandardAlgebra() {}

    @Override
    public Expression constant(long value, int bits) {
        return new Expression.Constant(value, bits);
    }

    @Override
    public Optional<Expression> unary(OperatorId op, Expression rhs) {
        if (!op.isUnary()) {
            return Optional.empty();
        }
        return Optional.of(new Expression.Operation(op, Optional.empty(), rhs, op.resultBits(rhs.bits(), rhs.bits()), false));
    }

    @Override
    public Optional<Expression> binary(Expression lhs, OperatorId op, Expression rhs) {
        // Casts are built through resize()
        if (op.isUnary() || op.isCast()) {
            return Optional.empty();
        }
        var bits = op.resultBits(lhs.bits(), rhs.bits());
        return Optional.of(new Expression.Operation(op, Optional.of(lhs), rhs, bits, false));
    }

    @Override
    public Expression resize(Expression expression, int bits, boolean signExtend) {
        if (!BitMath.isValidWidth(bits)) {
            throw new IllegalArgumentException("Unsupported width: " + bits);
        }
        if (expression.bits() == bits) {
            return expression;
        }
        if (expression instanceof Expression.Constant constant) {
            return constant(BitMath.resize(constant.value(), constant.bits(), bits, signExtend), bits);
        }
        var op = signExtend
                 ? OperatorId.CAST
                 : OperatorId.UCAST;
        return new Expression.Operation(op,
                                        Optional.of(expression),
                                        new Expression.Constant(bits, WIDTH_OPERAND_BITS),
                                        bits,
                                        false);
    }

    @Override
    public Optional<Expression> simplify(Expression expression) {
        return Simplifier.simplify(expression);
    }
}

package org.pragmatica.symex.expr;

import org.pragmatica.symex.math.BitMath;
import org.pragmatica.symex.math.OperatorId;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bottom-up numeric simplification: folds operations whose bits are all known and applies
 * algebraic identities. Reduced operation nodes carry the simplify hint.
 */
public final class Simplifier {
    private Simplifier() {}

    /**
     * Reduced form of the expression, or empty if no rule applied.
     */
    public static Optional<Expression> simplify(Expression expression) {
        var reduced = reduce(expression, new IdentityHashMap<>());
        return reduced == expression
               ? Optional.empty()
               : Optional.of(reduced);
    }

    // Returns the same instance when nothing changed; shared subtrees are reduced once
    private static Expression reduce(Expression expression, Map<Expression, Expression> reduced) {
        if (!(expression instanceof Expression.Operation operation)) {
            return expression;
        }
        var cached = reduced.get(operation);
        if (cached != null) {
            return cached;
        }
        var result = reduceOperation(operation, reduced);
        reduced.put(operation, result);
        return result;
    }

    private static Expression reduceOperation(Expression.Operation operation, Map<Expression, Expression> reduced) {
        var lhs = operation.lhs()
                           .map(operand -> reduce(operand, reduced));
        var rhs = reduce(operation.rhs(), reduced);
        var changed = rhs != operation.rhs()
                      || (lhs.isPresent() && lhs.get() != operation.lhs()
                                                                .get());
        var current = changed
                      ? operation.withOperands(lhs, rhs)
                      : operation;

        var known = KnownBits.of(current);
        if (known.isFullyKnown()) {
            return new Expression.Constant(known.one(), current.bits());
        }
        var identity = identity(current);
        if (identity.isPresent()) {
            return hinted(identity.get());
        }
        return changed
               ? current.withHint()
               : operation;
    }

    private static Optional<Expression> identity(Expression.Operation operation) {
        var bits = operation.bits();
        var b = operation.rhs();
        if (operation.lhs()
                     .isEmpty()) {
            return unaryIdentity(operation.op(), b, bits);
        }
        var a = operation.lhs()
                         .get();
        return switch (operation.op()) {
            case ADD, BITWISE_OR -> isZero(b)
                                    ? fit(a, bits)
                                    : isZero(a)
                                      ? fit(b, bits)
                                      : sameOperand(operation.op(), a, b, bits);
            case SUBTRACT, SHIFT_LEFT, SHIFT_RIGHT -> isZero(b)
                                                      ? fit(a, bits)
                                                      : sameOperand(operation.op(), a, b, bits);
            case BITWISE_XOR -> isZero(b)
                                ? fit(a, bits)
                                : isZero(a)
                                  ? fit(b, bits)
                                  : sameOperand(operation.op(), a, b, bits);
            case MULTIPLY -> isZero(a) || isZero(b)
                             ? Optional.of(new Expression.Constant(0, bits))
                             : isValue(b, 1)
                               ? fit(a, bits)
                               : isValue(a, 1)
                                 ? fit(b, bits)
                                 : Optional.empty();
            case BITWISE_AND -> isAllOnes(b, bits)
                                ? fit(a, bits)
                                : isAllOnes(a, bits)
                                  ? fit(b, bits)
                                  : sameOperand(operation.op(), a, b, bits);
            case EQUAL, NOT_EQUAL -> sameOperand(operation.op(), a, b, bits);
            case UCAST, CAST -> a.bits() == bits
                                ? Optional.of(a)
                                : Optional.empty();
            default -> Optional.empty();
        };
    }

    private static Optional<Expression> unaryIdentity(OperatorId op, Expression rhs, int bits) {
        if ((op == OperatorId.BITWISE_NOT || op == OperatorId.NEGATE)
            && rhs instanceof Expression.Operation inner
            && inner.op() == op
            && inner.bits() == bits) {
            return Optional.of(inner.rhs());
        }
        return Optional.empty();
    }

    // x op x
    private static Optional<Expression> sameOperand(OperatorId op, Expression a, Expression b, int bits) {
        if (!a.equals(b)) {
            return Optional.empty();
        }
        return switch (op) {
            case SUBTRACT, BITWISE_XOR, NOT_EQUAL -> Optional.of(new Expression.Constant(0, bits));
            case EQUAL -> Optional.of(new Expression.Constant(1, bits));
            case BITWISE_AND, BITWISE_OR -> fit(a, bits);
            default -> Optional.empty();
        };
    }

    private static Optional<Expression> fit(Expression expression, int bits) {
        return Optional.of(StandardAlgebra.INSTANCE.resize(expression, bits, false));
    }

    private static Expression hinted(Expression expression) {
        return expression instanceof Expression.Operation operation
               ? operation.withHint()
               : expression;
    }

    private static boolean isZero(Expression expression) {
        return isValue(expression, 0);
    }

    private static boolean isValue(Expression expression, long value) {
        return expression instanceof Expression.Constant constant
               && constant.value() == BitMath.zeroExtend(value, constant.bits());
    }

    private static boolean isAllOnes(Expression expression, int bits) {
        return expression instanceof Expression.Constant constant
               && constant.bits() >= bits
               && BitMath.zeroExtend(constant.value(), bits) == BitMath.mask(bits);
    }
}

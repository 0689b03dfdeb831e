package org.pragmatica.symex.expr;

import org.pragmatica.symex.math.BitMath;
import org.pragmatica.symex.math.OperatorId;

/**
 * Bits of an expression that are known regardless of the values of its symbols.
 *
 * @param one  bits known to be set
 * @param zero bits known to be clear
 * @param bits width of the expression
 */
public record KnownBits(long one, long zero, int bits) {

    public static KnownBits constant(long value, int bits) {
        var mask = BitMath.mask(bits);
        return new KnownBits(value & mask, ~value & mask, bits);
    }

    public static KnownBits unknown(int bits) {
        return new KnownBits(0, 0, bits);
    }

    public long unknown() {
        return BitMath.mask(bits) & ~(one | zero);
    }

    public boolean isFullyKnown() {
        return unknown() == 0;
    }

    /**
     * Same value seen at a wider width, upper bits zero.
     */
    public KnownBits zeroExtend(int newBits) {
        if (newBits <= bits) {
            return this;
        }
        var extension = BitMath.mask(newBits) & ~BitMath.mask(bits);
        return new KnownBits(one, zero | extension, newBits);
    }

    /**
     * Compute the known bits of an expression tree.
     */
    public static KnownBits of(Expression expression) {
        if (expression instanceof Expression.Constant constant) {
            return constant(constant.value(), constant.bits());
        }
        if (expression instanceof Expression.Operation operation) {
            return operation.knownBits();
        }
        return unknown(expression.bits());
    }

    // Computed once per node by Expression.Operation
    static KnownBits ofOperation(Expression.Operation operation) {
        var op = operation.op();
        var width = operation.bits();
        var rhs = of(operation.rhs());

        if (op.isCast()) {
            return cast(of(operation.lhs()
                                    .orElseThrow()), width, op == OperatorId.CAST);
        }
        if (op.isUnary()) {
            if (rhs.isFullyKnown()) {
                return evaluated(op, 0, 0, rhs, width);
            }
            return op == OperatorId.BITWISE_NOT
                   ? new KnownBits(rhs.zero(), rhs.one(), width)
                   : unknown(width);
        }

        var lhs = of(operation.lhs()
                              .orElseThrow());
        if (lhs.isFullyKnown() && rhs.isFullyKnown()) {
            return evaluated(op, lhs.one(), lhs.bits(), rhs, width);
        }

        var mask = BitMath.mask(width);
        var a = lhs.zeroExtend(width);
        var b = rhs.zeroExtend(width);
        return switch (op) {
            case BITWISE_AND -> new KnownBits(a.one & b.one, (a.zero | b.zero) & mask, width);
            case BITWISE_OR -> new KnownBits(a.one | b.one, a.zero & b.zero, width);
            case BITWISE_XOR -> new KnownBits((a.one & b.zero) | (a.zero & b.one),
                                              (a.one & b.one) | (a.zero & b.zero),
                                              width);
            case SHIFT_LEFT -> rhs.isFullyKnown()
                               ? shiftLeft(lhs, rhs.one(), width)
                               : unknown(width);
            case SHIFT_RIGHT -> rhs.isFullyKnown()
                                ? shiftRight(lhs, rhs.one(), width)
                                : unknown(width);
            default -> unknown(width);
        };
    }

    private static KnownBits evaluated(OperatorId op, long lhs, int lhsBits, KnownBits rhs, int width) {
        return op.evaluate(lhs, lhsBits, rhs.one(), rhs.bits())
                 .map(value -> constant(value, width))
                 .orElseGet(() -> unknown(width));
    }

    private static KnownBits cast(KnownBits value, int width, boolean signExtend) {
        var mask = BitMath.mask(width);
        if (width <= value.bits) {
            return new KnownBits(value.one & mask, value.zero & mask, width);
        }
        var extension = mask & ~BitMath.mask(value.bits);
        var sign = BitMath.signBit(value.bits);
        if (!signExtend || (value.zero & sign) != 0) {
            return new KnownBits(value.one, value.zero | extension, width);
        }
        if ((value.one & sign) != 0) {
            return new KnownBits(value.one | extension, value.zero, width);
        }
        return new KnownBits(value.one, value.zero, width);
    }

    private static KnownBits shiftLeft(KnownBits value, long amount, int width) {
        if (Long.compareUnsigned(amount, width) >= 0) {
            return constant(0, width);
        }
        var mask = BitMath.mask(width);
        var shift = (int) amount;
        return new KnownBits((value.one << shift) & mask,
                             ((value.zero << shift) | BitMath.mask(shift)) & mask,
                             width);
    }

    private static KnownBits shiftRight(KnownBits value, long amount, int width) {
        if (Long.compareUnsigned(amount, width) >= 0) {
            return constant(0, width);
        }
        var mask = BitMath.mask(width);
        var shift = (int) amount;
        var vacated = mask & ~(mask >>> shift);
        return new KnownBits(value.one >>> shift, (value.zero >>> shift) | vacated, width);
    }
}

package org.pragmatica.symex.math;

import java.util.Optional;

/**
 * Operators of the expression algebra. Directive trees and concrete expressions share this set.
 *
 * <p>Operands narrower than the operation are zero-extended before evaluation; signed
 * operators then reinterpret them at the operation width.
 */
public enum OperatorId {
    // === Unary ===
    NEGATE("-", 1, false, Kind.UNARY),
    BITWISE_NOT("~", 1, false, Kind.UNARY),
    POPCNT("__popcnt", 1, false, Kind.UNARY),

    // === Arithmetic ===
    ADD("+", 2, true, Kind.ARITHMETIC),
    SUBTRACT("-", 2, false, Kind.ARITHMETIC),
    MULTIPLY("*", 2, true, Kind.ARITHMETIC),
    DIVIDE("/", 2, false, Kind.ARITHMETIC),
    REMAINDER("%", 2, false, Kind.ARITHMETIC),
    UDIVIDE("u/", 2, false, Kind.ARITHMETIC),
    UREMAINDER("u%", 2, false, Kind.ARITHMETIC),

    // === Bitwise ===
    BITWISE_AND("&", 2, true, Kind.BITWISE),
    BITWISE_OR("|", 2, true, Kind.BITWISE),
    BITWISE_XOR("^", 2, true, Kind.BITWISE),
    SHIFT_LEFT("<<", 2, false, Kind.SHIFT),
    SHIFT_RIGHT(">>", 2, false, Kind.SHIFT),

    // === Comparison ===
    EQUAL("==", 2, true, Kind.COMPARISON),
    NOT_EQUAL("!=", 2, true, Kind.COMPARISON),
    GREATER(">", 2, false, Kind.COMPARISON),
    GREATER_EQ(">=", 2, false, Kind.COMPARISON),
    LESS("<", 2, false, Kind.COMPARISON),
    LESS_EQ("<=", 2, false, Kind.COMPARISON),
    UGREATER("u>", 2, false, Kind.COMPARISON),
    UGREATER_EQ("u>=", 2, false, Kind.COMPARISON),
    ULESS("u<", 2, false, Kind.COMPARISON),
    ULESS_EQ("u<=", 2, false, Kind.COMPARISON),

    // === Casts: lhs is the value, rhs the target width ===
    UCAST("__ucast", 2, false, Kind.CAST),
    CAST("__cast", 2, false, Kind.CAST);

    /**
     * Operator families, used for width rules and rendering.
     */
    public enum Kind {
        UNARY,
        ARITHMETIC,
        BITWISE,
        SHIFT,
        COMPARISON,
        CAST
    }

    private final String symbol;
    private final int arity;
    private final boolean commutative;
    private final Kind kind;

    OperatorId(String symbol, int arity, boolean commutative, Kind kind) {
        this.symbol = symbol;
        this.arity = arity;
        this.commutative = commutative;
        this.kind = kind;
    }

    public String symbol() {
        return symbol;
    }

    public int arity() {
        return arity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    public boolean isCommutative() {
        return commutative;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isCast() {
        return kind == Kind.CAST;
    }

    /**
     * Operators rendered as {@code __name(a, b)} rather than infix.
     */
    public boolean isFunctionStyle() {
        return symbol.startsWith("__");
    }

    /**
     * Width of the result for operands of the given widths. Unary operators ignore {@code lhsBits}.
     */
    public int resultBits(int lhsBits, int rhsBits) {
        return switch (kind) {
            case UNARY -> rhsBits;
            case COMPARISON -> 1;
            case SHIFT -> lhsBits;
            case ARITHMETIC, BITWISE -> Math.max(lhsBits, rhsBits);
            case CAST -> throw new IllegalStateException("Width of " + this + " is carried by its width operand");
        };
    }

    /**
     * Evaluate the operator over known operand values.
     *
     * @return the result within {@link #resultBits(int, int)}, or empty when undefined (division by zero, casts)
     */
    public Optional<Long> evaluate(long lhs, int lhsBits, long rhs, int rhsBits) {
        if (kind == Kind.CAST) {
            return Optional.empty();
        }
        var width = isUnary()
                    ? rhsBits
                    : Math.max(lhsBits, rhsBits);
        var a = BitMath.zeroExtend(lhs, lhsBits);
        var b = BitMath.zeroExtend(rhs, rhsBits);
        var sa = BitMath.signExtend(a, width);
        var sb = BitMath.signExtend(b, width);

        Long result = switch (this) {
            case NEGATE -> -b;
            case BITWISE_NOT -> ~b;
            case POPCNT -> (long) Long.bitCount(b);
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> b == 0 ? null : sa / sb;
            case REMAINDER -> b == 0 ? null : sa % sb;
            case UDIVIDE -> b == 0 ? null : Long.divideUnsigned(a, b);
            case UREMAINDER -> b == 0 ? null : Long.remainderUnsigned(a, b);
            case BITWISE_AND -> a & b;
            case BITWISE_OR -> a | b;
            case BITWISE_XOR -> a ^ b;
            case SHIFT_LEFT -> Long.compareUnsigned(b, lhsBits) >= 0 ? 0L : a << b;
            case SHIFT_RIGHT -> Long.compareUnsigned(b, lhsBits) >= 0 ? 0L : a >>> b;
            case EQUAL -> bool(a == b);
            case NOT_EQUAL -> bool(a != b);
            case GREATER -> bool(sa > sb);
            case GREATER_EQ -> bool(sa >= sb);
            case LESS -> bool(sa < sb);
            case LESS_EQ -> bool(sa <= sb);
            case UGREATER -> bool(Long.compareUnsigned(a, b) > 0);
            case UGREATER_EQ -> bool(Long.compareUnsigned(a, b) >= 0);
            case ULESS -> bool(Long.compareUnsigned(a, b) < 0);
            case ULESS_EQ -> bool(Long.compareUnsigned(a, b) <= 0);
            case UCAST, CAST -> null;
        };
        return Optional.ofNullable(result)
                       .map(value -> BitMath.zeroExtend(value, resultBits(lhsBits, rhsBits)));
    }

    private static long bool(boolean value) {
        return value ? 1L : 0L;
    }
}

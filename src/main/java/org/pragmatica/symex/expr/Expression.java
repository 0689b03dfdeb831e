package org.pragmatica.symex.expr;

import org.pragmatica.symex.math.BitMath;
import org.pragmatica.symex.math.OperatorId;

import java.util.Objects;
import java.util.Optional;

/**
 * Concrete bit-vector expression. Nodes are immutable; operations that "change" a node
 * return a new one, so a node may be shared freely.
 */
public sealed interface Expression {

    /**
     * Width in bits, 1 to 64.
     */
    int bits();

    /**
     * Relative cost of the tree, used to compare rewrite candidates.
     */
    double complexity();

    /**
     * Set on nodes produced by the simplifier: simplifying them again cannot reduce them.
     */
    default boolean simplifyHint() {
        return false;
    }

    default long unknownMask() {
        return KnownBits.of(this)
                        .unknown();
    }

    default long knownOne() {
        return KnownBits.of(this)
                        .one();
    }

    default long knownZero() {
        return KnownBits.of(this)
                        .zero();
    }

    /**
     * The literal value if every bit of this expression is known.
     */
    default Optional<Long> constantValue() {
        var known = KnownBits.of(this);
        return known.isFullyKnown()
               ? Optional.of(known.one())
               : Optional.empty();
    }

    // === Nodes ===

    /**
     * Constant; the value is kept zero-extended to the width.
     */
    record Constant(long value, int bits) implements Expression {
        public Constant {
            requireWidth(bits);
            value = BitMath.zeroExtend(value, bits);
        }

        @Override
        public double complexity() {
            return 0.5;
        }

        @Override
        public String toString() {
            return (value >= 0 && value <= 0x1000
                    ? Long.toString(value)
                    : "0x" + Long.toHexString(value)) + ":" + bits;
        }
    }

    /**
     * Opaque value of unknown content, such as a register or a memory read.
     */
    record Symbol(String name, int bits) implements Expression {
        public Symbol {
            requireWidth(bits);
            Objects.requireNonNull(name, "name");
        }

        @Override
        public double complexity() {
            return 1.0;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Operator applied to one ({@code rhs}) or two operands.
     *
     * <p>Known bits, complexity and hash are computed once at construction from the already
     * computed values of the operands, so shared subtrees are never walked twice.
     */
    final class Operation implements Expression {
        private final OperatorId op;
        private final Optional<Expression> lhs;
        private final Expression rhs;
        private final int bits;
        private final boolean simplifyHint;
        private final double complexity;
        private final int hash;
        private final KnownBits knownBits;

        public Operation(OperatorId op, Optional<Expression> lhs, Expression rhs, int bits, boolean simplifyHint) {
            requireWidth(bits);
            if (rhs == null || lhs.isPresent() == op.isUnary()) {
                throw new IllegalArgumentException("Operator " + op + " expects " + op.arity() + " operand(s)");
            }
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
            this.bits = bits;
            this.simplifyHint = simplifyHint;
            this.complexity = 1.0 + rhs.complexity() + lhs.map(Expression::complexity)
                                                           .orElse(0.0);
            this.hash = Objects.hash(op, lhs, rhs, bits);
            this.knownBits = KnownBits.ofOperation(this);
        }

        public OperatorId op() {
            return op;
        }

        public Optional<Expression> lhs() {
            return lhs;
        }

        public Expression rhs() {
            return rhs;
        }

        @Override
        public int bits() {
            return bits;
        }

        @Override
        public boolean simplifyHint() {
            return simplifyHint;
        }

        @Override
        public double complexity() {
            return complexity;
        }

        KnownBits knownBits() {
            return knownBits;
        }

        public Operation withOperands(Optional<Expression> newLhs, Expression newRhs) {
            return new Operation(op, newLhs, newRhs, bits, false);
        }

        public Operation withHint() {
            return simplifyHint
                   ? this
                   : new Operation(op, lhs, rhs, bits, true);
        }

        // The hint is bookkeeping, not part of the value.
        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Operation other)
                || hash != other.hash
                || op != other.op
                || bits != other.bits
                || !lhs.equals(other.lhs)) {
                return false;
            }
            // Both sides reuse the left operand as the right one: already compared
            return (lhs.isPresent() && lhs.get() == rhs && other.lhs.get() == other.rhs)
                   || rhs.equals(other.rhs);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            if (lhs.isEmpty()) {
                return op.isFunctionStyle()
                       ? op.symbol() + "(" + rhs + ")"
                       : op.symbol() + rhs;
            }
            return op.isFunctionStyle()
                   ? op.symbol() + "(" + lhs.get() + ", " + rhs + ")"
                   : "(" + lhs.get() + op.symbol() + rhs + ")";
        }
    }

    // === Factories ===

    static Expression constant(long value, int bits) {
        return new Constant(value, bits);
    }

    static Expression symbol(String name, int bits) {
        return new Symbol(name, bits);
    }

    private static void requireWidth(int bits) {
        if (!BitMath.isValidWidth(bits)) {
            throw new IllegalArgumentException("Unsupported width: " + bits);
        }
    }
}

package org.pragmatica.symex.directive;

import org.pragmatica.symex.math.OperatorId;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Directive tree - the pattern/rule language. Leaves are pattern variables or constants,
 * interior nodes are either algebra operators or meta-directives.
 *
 * <p>Nodes are immutable and may be shared between any number of parents. The shape of a
 * node (which operands are present) follows from its operator and is checked once at
 * construction.
 */
public sealed interface Directive {

    /**
     * Identifiers of all variables referenced by this tree, in first-seen order.
     */
    default Set<String> variables() {
        var ids = new LinkedHashSet<String>();
        collectVariables(this, ids);
        return Collections.unmodifiableSet(ids);
    }

    private static void collectVariables(Directive directive, Set<String> ids) {
        if (directive instanceof Variable variable) {
            ids.add(variable.id());
        } else if (directive instanceof Operation operation) {
            operation.lhs()
                     .ifPresent(lhs -> collectVariables(lhs, ids));
            collectVariables(operation.rhs(), ids);
        } else if (directive instanceof Meta meta) {
            meta.lhs()
                .ifPresent(lhs -> collectVariables(lhs, ids));
            meta.rhs()
                .ifPresent(rhs -> collectVariables(rhs, ids));
        }
    }

    // === Leaves ===

    /**
     * Literal constant; its width is decided by the context it is translated in.
     */
    record Constant(long value) implements Directive {
        @Override
        public String toString() {
            return value >= -0x1000 && value <= 0x1000
                   ? Long.toString(value)
                   : "0x" + Long.toHexString(value);
        }
    }

    /**
     * Pattern variable, resolved through the symbol table.
     */
    record Variable(String id, LookupType lookup) implements Directive {
        public Variable {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Variable id must not be blank");
            }
        }

        @Override
        public String toString() {
            return id;
        }
    }

    // === Algebra ===

    /**
     * Algebra operator; {@code lhs} is absent for unary operators.
     */
    record Operation(OperatorId op, Optional<Directive> lhs, Directive rhs) implements Directive {
        public Operation {
            if (rhs == null || lhs.isPresent() == op.isUnary()) {
                throw new IllegalArgumentException("Operator " + op + " expects " + op.arity() + " operand(s)");
            }
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

    // === Meta-directives ===

    /**
     * Meta-directive node. Nullary directives carry no operands, unary ones only {@code rhs}.
     */
    record Meta(MetaOp op, Optional<Directive> lhs, Optional<Directive> rhs) implements Directive {
        public Meta {
            var operands = (lhs.isPresent() ? 1 : 0) + (rhs.isPresent() ? 1 : 0);
            if (operands != op.arity() || (op.arity() == 1 && lhs.isPresent())) {
                throw new IllegalArgumentException("Directive " + op + " expects " + op.arity() + " operand(s)");
            }
        }

        /**
         * Left operand; only valid for binary directives.
         */
        public Directive left() {
            return lhs.orElseThrow();
        }

        /**
         * Right operand; valid for unary and binary directives.
         */
        public Directive right() {
            return rhs.orElseThrow();
        }

        @Override
        public String toString() {
            var args = new StringBuilder();
            lhs.ifPresent(l -> args.append(l)
                                   .append(", "));
            rhs.ifPresent(args::append);
            return op.symbol() + "(" + args + ")";
        }
    }

    // === Factories ===

    static Directive constant(long value) {
        return new Constant(value);
    }

    static Directive var(String id) {
        return new Variable(id, LookupType.ANY);
    }

    static Directive var(String id, LookupType lookup) {
        return new Variable(id, lookup);
    }

    static Directive unary(OperatorId op, Directive rhs) {
        return new Operation(op, Optional.empty(), rhs);
    }

    static Directive binary(Directive lhs, OperatorId op, Directive rhs) {
        return new Operation(op, Optional.of(lhs), rhs);
    }

    static Directive add(Directive lhs, Directive rhs) {
        return binary(lhs, OperatorId.ADD, rhs);
    }

    static Directive sub(Directive lhs, Directive rhs) {
        return binary(lhs, OperatorId.SUBTRACT, rhs);
    }

    static Directive and(Directive lhs, Directive rhs) {
        return binary(lhs, OperatorId.BITWISE_AND, rhs);
    }

    static Directive or(Directive lhs, Directive rhs) {
        return binary(lhs, OperatorId.BITWISE_OR, rhs);
    }

    static Directive xor(Directive lhs, Directive rhs) {
        return binary(lhs, OperatorId.BITWISE_XOR, rhs);
    }

    static Directive not(Directive rhs) {
        return unary(OperatorId.BITWISE_NOT, rhs);
    }

    static Directive equal(Directive lhs, Directive rhs) {
        return binary(lhs, OperatorId.EQUAL, rhs);
    }

    static Directive ucast(Directive value, Directive width) {
        return binary(value, OperatorId.UCAST, width);
    }

    static Directive cast(Directive value, Directive width) {
        return binary(value, OperatorId.CAST, width);
    }

    static Directive simplify(Directive rhs) {
        return new Meta(MetaOp.SIMPLIFY, Optional.empty(), Optional.of(rhs));
    }

    static Directive trySimplify(Directive rhs) {
        return new Meta(MetaOp.TRY_SIMPLIFY, Optional.empty(), Optional.of(rhs));
    }

    static Directive orAlso(Directive first, Directive second) {
        return new Meta(MetaOp.OR_ALSO, Optional.of(first), Optional.of(second));
    }

    static Directive iff(Directive condition, Directive result) {
        return new Meta(MetaOp.IFF, Optional.of(condition), Optional.of(result));
    }

    static Directive maskUnknown(Directive rhs) {
        return new Meta(MetaOp.MASK_UNKNOWN, Optional.empty(), Optional.of(rhs));
    }

    static Directive maskOne(Directive rhs) {
        return new Meta(MetaOp.MASK_ONE, Optional.empty(), Optional.of(rhs));
    }

    static Directive maskZero(Directive rhs) {
        return new Meta(MetaOp.MASK_ZERO, Optional.empty(), Optional.of(rhs));
    }

    static Directive unreachable() {
        return new Meta(MetaOp.UNREACHABLE, Optional.empty(), Optional.empty());
    }

    static Directive warning(Directive rhs) {
        return new Meta(MetaOp.WARNING, Optional.empty(), Optional.of(rhs));
    }
}

package org.pragmatica.symex.rewrite;

import org.pragmatica.symex.directive.Directive;
import org.pragmatica.symex.error.DirectiveFault;
import org.pragmatica.symex.error.RewriteError;
import org.pragmatica.symex.expr.Expression;
import org.pragmatica.symex.expr.ExpressionAlgebra;
import org.pragmatica.symex.match.SymbolTable;
import org.pragmatica.symex.math.BitMath;
import org.pragmatica.symex.math.OperatorId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.ToLongFunction;

/**
 * Directive interpreter - evaluates a directive tree against a symbol table.
 *
 * <p>In {@link TranslateMode#CONSTRUCTIVE} mode the result is a {@link TranslateResult.Built}
 * expression; in {@link TranslateMode#SPECULATIVE} mode algebra operators only check their
 * operands and report {@link TranslateResult.Feasible}. Failures are ordinary results;
 * malformed rules raise {@link DirectiveFault}.
 */
public final class DirectiveInterpreter {
    private static final Logger LOG = LoggerFactory.getLogger(DirectiveInterpreter.class);

    // Shared failure results; details go to the trace log
    private static final TranslateResult UNBOUND_VARIABLE = TranslateResult.failed("unbound variable");
    private static final TranslateResult CAST_WIDTH_FAILED = TranslateResult.failed("cast width does not translate");
    private static final TranslateResult CAST_WIDTH_OUT_OF_RANGE = TranslateResult.failed("cast width out of range");
    private static final TranslateResult NOT_APPLICABLE = TranslateResult.failed("operator not applicable");
    private static final TranslateResult NOT_SIMPLIFIED = TranslateResult.failed("does not simplify");
    private static final TranslateResult CONDITION_NOT_MET = TranslateResult.failed("condition not met");

    private final ExpressionAlgebra algebra;
    private final boolean trace;

    private DirectiveInterpreter(ExpressionAlgebra algebra, boolean trace) {
        this.algebra = algebra;
        this.trace = trace;
    }

    public static DirectiveInterpreter create(ExpressionAlgebra algebra, TransformerConfig config) {
        return new DirectiveInterpreter(algebra, config.traceRules());
    }

    /**
     * Translate {@code directive} using {@code symbols}. Constant leaves are built with {@code bits} width.
     */
    public TranslateResult translate(SymbolTable symbols, Directive directive, int bits, TranslateMode mode) {
        if (trace && LOG.isTraceEnabled()) {
            LOG.trace("[{}] {}", mode, directive);
        }
        if (directive instanceof Directive.Constant constant) {
            return mode.isSpeculative()
                   ? TranslateResult.feasible()
                   : TranslateResult.built(algebra.constant(constant.value(), bits));
        }
        if (directive instanceof Directive.Variable variable) {
            return translateVariable(symbols, variable, mode);
        }
        if (directive instanceof Directive.Operation operation) {
            return operation.op()
                            .isCast()
                   ? translateCast(symbols, operation, bits, mode)
                   : translateOperation(symbols, operation, bits, mode);
        }
        if (directive instanceof Directive.Meta meta) {
            return translateMeta(symbols, meta, bits, mode);
        }
        throw new DirectiveFault(new RewriteError.UnknownDirective(String.valueOf(directive)));
    }

    // === Leaves and algebra ===

    private TranslateResult translateVariable(SymbolTable symbols, Directive.Variable variable, TranslateMode mode) {
        var bound = symbols.translate(variable);
        if (bound.isEmpty()) {
            traceRejection("unbound variable", variable);
            return UNBOUND_VARIABLE;
        }
        return mode.isSpeculative()
               ? TranslateResult.feasible()
               : TranslateResult.built(bound.get());
    }

    private TranslateResult translateCast(SymbolTable symbols, Directive.Operation operation, int bits, TranslateMode mode) {
        var value = translate(symbols, operation.lhs()
                                                .orElseThrow(), bits, mode);
        if (value.isFailure()) {
            return value;
        }
        var width = castWidth(symbols, operation);
        if (width.isEmpty()) {
            return CAST_WIDTH_FAILED;
        }
        if (!BitMath.isValidWidth(width.get())) {
            traceRejection("cast width out of range", operation);
            return CAST_WIDTH_OUT_OF_RANGE;
        }
        return mode.isSpeculative()
               ? TranslateResult.feasible()
               : TranslateResult.built(algebra.resize(node(value), width.get()
                                                                        .intValue(), operation.op() == OperatorId.CAST));
    }

    // The width is read in both modes alike, at full width so its literal is never truncated
    private Optional<Long> castWidth(SymbolTable symbols, Directive.Operation operation) {
        var width = operation.rhs();
        if (width instanceof Directive.Constant constant) {
            return Optional.of(constant.value());
        }
        Optional<Expression> node;
        if (width instanceof Directive.Variable variable) {
            node = symbols.translate(variable);
        } else {
            node = translate(symbols, width, BitMath.MAX_BITS, TranslateMode.CONSTRUCTIVE).expression();
        }
        if (node.isEmpty()) {
            return Optional.empty();
        }
        var literal = node.get()
                          .constantValue();
        if (literal.isEmpty()) {
            throw new DirectiveFault(new RewriteError.NonLiteralCastWidth(operation.toString(), node.get()
                                                                                                 .toString()));
        }
        return literal;
    }

    private TranslateResult translateOperation(SymbolTable symbols, Directive.Operation operation, int bits, TranslateMode mode) {
        TranslateResult lhs = null;
        if (operation.lhs()
                     .isPresent()) {
            lhs = translate(symbols, operation.lhs()
                                              .get(), bits, mode);
            if (lhs.isFailure()) {
                return lhs;
            }
        }
        var rhs = translate(symbols, operation.rhs(), bits, mode);
        if (rhs.isFailure()) {
            return rhs;
        }
        if (mode.isSpeculative()) {
            return TranslateResult.feasible();
        }

        var op = operation.op();
        var combined = lhs == null
                       ? algebra.unary(op, node(rhs))
                       : algebra.binary(node(lhs), op, node(rhs));
        if (combined.isEmpty()) {
            traceRejection("operator not applicable", operation);
            return NOT_APPLICABLE;
        }
        return TranslateResult.built(combined.get());
    }

    // === Meta-directives ===

    private TranslateResult translateMeta(SymbolTable symbols, Directive.Meta meta, int bits, TranslateMode mode) {
        return switch (meta.op()) {
            case SIMPLIFY -> simplify(symbols, meta, bits);
            case TRY_SIMPLIFY -> trySimplify(symbols, meta, bits, mode);
            case OR_ALSO -> orAlso(symbols, meta, bits, mode);
            case IFF -> iff(symbols, meta, bits, mode);
            case MASK_UNKNOWN -> mask(symbols, meta, bits, mode, Expression::unknownMask);
            case MASK_ONE -> mask(symbols, meta, bits, mode, Expression::knownOne);
            case MASK_ZERO -> mask(symbols, meta, bits, mode, Expression::knownZero);
            case UNREACHABLE -> throw new DirectiveFault(new RewriteError.UnreachableReached(meta.toString()));
            case WARNING -> {
                LOG.warn("Warning directive reached in {} with bindings {}", meta, symbols);
                yield translate(symbols, meta.right(), bits, mode);
            }
        };
    }

    // Always constructive
    private TranslateResult simplify(SymbolTable symbols, Directive.Meta meta, int bits) {
        var result = translate(symbols, meta.right(), bits, TranslateMode.CONSTRUCTIVE);
        if (result.isSuccess()) {
            var built = node(result);
            if (!built.simplifyHint()) {
                var simplified = algebra.simplify(built);
                if (simplified.isPresent()) {
                    return TranslateResult.built(simplified.get());
                }
            }
        }
        traceRejection("does not simplify", meta);
        return NOT_SIMPLIFIED;
    }

    private TranslateResult trySimplify(SymbolTable symbols, Directive.Meta meta, int bits, TranslateMode mode) {
        var result = translate(symbols, meta.right(), bits, mode);
        if (result.isFailure() || mode.isSpeculative()) {
            return result;
        }
        var built = node(result);
        return TranslateResult.built(algebra.simplify(built)
                                            .orElse(built));
    }

    private TranslateResult orAlso(SymbolTable symbols, Directive.Meta meta, int bits, TranslateMode mode) {
        var first = translate(symbols, meta.left(), bits, mode);
        if (first.isSuccess()) {
            return first;
        }
        if (trace && LOG.isTraceEnabled()) {
            LOG.trace("First alternative failed, trying {}", meta.right());
        }
        var second = translate(symbols, meta.right(), bits, mode);
        if (second.isFailure()) {
            traceRejection("both alternatives failed", meta);
        }
        return second;
    }

    // Condition is always built constructively
    private TranslateResult iff(SymbolTable symbols, Directive.Meta meta, int bits, TranslateMode mode) {
        var condition = translate(symbols, meta.left(), bits, TranslateMode.CONSTRUCTIVE);
        if (condition.isFailure() || !isTrue(node(condition))) {
            traceRejection("condition not met", meta);
            return CONDITION_NOT_MET;
        }
        return translate(symbols, meta.right(), bits, mode);
    }

    private TranslateResult mask(SymbolTable symbols,
                                 Directive.Meta meta,
                                 int bits,
                                 TranslateMode mode,
                                 ToLongFunction<Expression> extractor) {
        var result = translate(symbols, meta.right(), bits, mode);
        if (result.isFailure()) {
            return result;
        }
        if (mode.isSpeculative()) {
            return TranslateResult.feasible();
        }
        var built = node(result);
        return TranslateResult.built(algebra.constant(extractor.applyAsLong(built), built.bits()));
    }

    // === Helpers ===

    private boolean isTrue(Expression condition) {
        return algebra.simplify(condition)
                      .orElse(condition)
                      .constantValue()
                      .map(value -> value != 0)
                      .orElse(false);
    }

    private static Expression node(TranslateResult result) {
        return result.expression()
                     .orElseThrow(() -> new IllegalStateException("Speculative result in constructive translation"));
    }

    private void traceRejection(String reason, Directive directive) {
        if (trace && LOG.isTraceEnabled()) {
            LOG.trace("Rejected {}: {}", directive, reason);
        }
    }
}

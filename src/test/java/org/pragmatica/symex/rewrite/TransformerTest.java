package org.pragmatica.symex.rewrite;

import org.junit.jupiter.api.Test;
import org.pragmatica.symex.error.DirectiveFault;
import org.pragmatica.symex.error.RewriteError;
import org.pragmatica.symex.expr.Expression;
import org.pragmatica.symex.expr.ExpressionAlgebra;
import org.pragmatica.symex.match.Matcher;
import org.pragmatica.symex.match.SymbolTable;
import org.pragmatica.symex.math.OperatorId;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.symex.directive.Directive.add;
import static org.pragmatica.symex.directive.Directive.constant;
import static org.pragmatica.symex.directive.Directive.iff;
import static org.pragmatica.symex.directive.Directive.equal;
import static org.pragmatica.symex.directive.Directive.simplify;
import static org.pragmatica.symex.directive.Directive.sub;
import static org.pragmatica.symex.directive.Directive.ucast;
import static org.pragmatica.symex.directive.Directive.unreachable;
import static org.pragmatica.symex.directive.Directive.var;

class TransformerTest {

    private static final ExpressionAlgebra ALGEBRA = ExpressionAlgebra.standard();
    private static final Expression RAX = Expression.symbol("rax", 64);
    private static final Expression RBX = Expression.symbol("rbx", 64);

    private final Transformer transformer = Transformer.create();

    // === Structural matching ===

    @Test
    void transform_addZero_returnsOperand() {
        var expression = binary(Expression.constant(5, 8), OperatorId.ADD, Expression.constant(0, 8));

        var result = transformer.transform(expression, add(var("X"), constant(0)), var("X"));

        assertEquals(Optional.of(Expression.constant(5, 8)), result);
    }

    @Test
    void transform_subtractSelf_returnsZeroOfExpressionWidth() {
        var eax = Expression.symbol("eax", 32);
        var expression = binary(eax, OperatorId.SUBTRACT, eax);

        var result = transformer.transform(expression, sub(var("X"), var("X")), constant(0));

        assertEquals(Optional.of(Expression.constant(0, 32)), result);
    }

    @Test
    void transform_noMatch_returnsEmpty() {
        var expression = binary(RAX, OperatorId.SUBTRACT, RBX);

        assertTrue(transformer.transform(expression, sub(var("X"), var("X")), constant(0))
                              .isEmpty());
    }

    @Test
    void transform_triesCandidatesInMatcherOrder() {
        var expression = binary(RAX, OperatorId.ADD, Expression.constant(5, 64));
        var from = add(var("A"), var("B"));

        assertEquals(Optional.of(RAX), transformer.transform(expression, from, var("A")));
        assertEquals(Optional.of(Expression.constant(5, 64)),
                     transformer.transform(expression, from, var("A"), result -> result instanceof Expression.Constant));
    }

    @Test
    void transform_conditionalRule_appliesOnlyWhenConditionHolds() {
        var from = add(var("X"), var("Y"));
        var to = iff(equal(var("Y"), constant(0)), var("X"));

        assertEquals(Optional.of(RAX), transformer.transform(binary(RAX, OperatorId.ADD, Expression.constant(0, 64)), from, to));
        assertTrue(transformer.transform(binary(RAX, OperatorId.ADD, RBX), from, to)
                              .isEmpty());
    }

    @Test
    void transform_resultWithSimplify_isReduced() {
        var expression = binary(binary(RAX, OperatorId.ADD, Expression.constant(0, 64)), OperatorId.SUBTRACT, RBX);

        var result = transformer.transform(expression, sub(var("X"), var("Y")), sub(simplify(var("X")), var("Y")));

        assertEquals(Optional.of(binary(RAX, OperatorId.SUBTRACT, RBX)), result);
    }

    @Test
    void transform_unreachableTarget_raisesFault() {
        var expression = binary(RAX, OperatorId.ADD, Expression.constant(0, 64));

        var fault = assertThrows(DirectiveFault.class,
                                 () -> transformer.transform(expression, add(var("X"), constant(0)), unreachable()));

        assertInstanceOf(RewriteError.UnreachableReached.class, fault.error());
    }

    @Test
    void transform_castWidthFoldingOutOfRange_returnsEmptyWithoutFault() {
        assertTrue(transformer.transform(RAX, var("X"), ucast(var("X"), add(constant(0), constant(0))))
                              .isEmpty());
        assertTrue(transformer.transform(RAX, var("X"), ucast(var("X"), sub(constant(0), constant(1))))
                              .isEmpty());
    }

    @Test
    void transform_castWidthFoldingToLiteral_resizes() {
        var result = transformer.transform(RAX, var("X"), ucast(var("X"), add(constant(16), constant(16))));

        assertThat(result).isPresent();
        assertEquals(32, result.get()
                               .bits());
    }

    // === Filters ===

    @Test
    void transform_filterRejectsEverything_returnsEmpty() {
        var expression = binary(RAX, OperatorId.ADD, Expression.constant(0, 64));

        var result = transformer.transform(expression, add(var("X"), constant(0)), var("X"), candidate -> false);

        assertTrue(result.isEmpty());
    }

    @Test
    void transform_complexityFilter_acceptsSimplerResult() {
        var expression = binary(RAX, OperatorId.ADD, Expression.constant(0, 64));

        var result = transformer.transform(expression,
                                           add(var("X"), constant(0)),
                                           var("X"),
                                           ExpressionFilter.notMoreComplexThan(expression));

        assertEquals(Optional.of(RAX), result);
    }

    @Test
    void transform_complexityFilter_rejectsGrowth() {
        var expression = binary(RAX, OperatorId.ADD, RBX);

        var result = transformer.transform(expression,
                                           add(var("X"), var("Y")),
                                           add(add(var("X"), constant(0)), var("Y")),
                                           ExpressionFilter.lessComplexThan(expression));

        assertTrue(result.isEmpty());
    }

    @Test
    void transform_filterRejectsFirst_returnsSecondCandidate() {
        Matcher matcher = (pattern, expression) -> List.of(SymbolTable.of(Map.of("X", RAX)),
                                                           SymbolTable.of(Map.of("X", RBX)));
        var stubbed = Transformer.create(TransformerConfig.DEFAULT, ALGEBRA, matcher);

        var result = stubbed.transform(RAX, var("X"), var("X"), candidate -> !candidate.equals(RAX));

        assertEquals(Optional.of(RBX), result);
    }

    @Test
    void transform_complexityFilter_onSharedSubtrees_completesPromptly() {
        var expression = RAX;
        for (var depth = 0; depth < 40; depth++) {
            expression = binary(expression, OperatorId.ADD, expression);
        }
        var original = binary(expression, OperatorId.ADD, Expression.constant(0, 64));
        var shared = expression;

        var result = assertTimeoutPreemptively(Duration.ofSeconds(5),
                                               () -> transformer.transform(original,
                                                                           add(var("X"), constant(0)),
                                                                           var("X"),
                                                                           ExpressionFilter.notMoreComplexThan(original)));

        assertThat(result).containsSame(shared);
    }

    @Test
    void transform_nullFilter_isRejected() {
        assertThrows(NullPointerException.class, () -> transformer.transform(RAX, var("X"), var("X"), null));
    }

    // === Speculative pre-check ===

    @Test
    void transform_withPrecheck_buildsOnlyTheAcceptedCandidate() {
        var algebra = new CountingAlgebra();
        var stubbed = Transformer.create(TransformerConfig.DEFAULT, algebra, twoCandidates());

        var result = stubbed.transform(RAX, var("X"), add(add(var("X"), constant(1)), var("Y")));

        assertThat(result).isPresent();
        assertEquals("((rax+1:64)+rbx)", result.get()
                                              .toString());
        assertEquals(3, algebra.constructions());
    }

    @Test
    void transform_withoutPrecheck_buildsFailingCandidatesToo() {
        var algebra = new CountingAlgebra();
        var stubbed = Transformer.create(new TransformerConfig(false, false), algebra, twoCandidates());

        var result = stubbed.transform(RAX, var("X"), add(add(var("X"), constant(1)), var("Y")));

        assertThat(result).isPresent();
        assertEquals(5, algebra.constructions());
    }

    @Test
    void transform_allCandidatesInfeasible_buildsNothing() {
        var algebra = new CountingAlgebra();
        var stubbed = Transformer.create(TransformerConfig.DEFAULT, algebra, twoCandidates());

        var result = stubbed.transform(RAX, var("X"), add(add(var("X"), constant(1)), var("Z")));

        assertTrue(result.isEmpty());
        assertEquals(0, algebra.constructions());
    }

    @Test
    void transform_feasibleButUnbuildable_raisesSpeculationMismatch() {
        Matcher matcher = (pattern, expression) -> List.of(SymbolTable.of(Map.of("X", RAX)));
        var stubbed = Transformer.create(TransformerConfig.DEFAULT, new NoBinaryAlgebra(), matcher);

        var fault = assertThrows(DirectiveFault.class, () -> stubbed.transform(RAX, var("X"), add(var("X"), var("X"))));

        assertInstanceOf(RewriteError.SpeculationMismatch.class, fault.error());
    }

    @Test
    void transform_unbuildableWithoutPrecheck_returnsEmpty() {
        Matcher matcher = (pattern, expression) -> List.of(SymbolTable.of(Map.of("X", RAX)));
        var stubbed = Transformer.create(new TransformerConfig(false, false), new NoBinaryAlgebra(), matcher);

        assertTrue(stubbed.transform(RAX, var("X"), add(var("X"), var("X")))
                          .isEmpty());
    }

    // === Translate ===

    @Test
    void translate_buildsWithGivenWidth() {
        var symbols = SymbolTable.of(Map.of("X", RAX));

        var result = transformer.translate(symbols, add(var("X"), constant(1)), 64);

        assertEquals(Optional.of(binary(RAX, OperatorId.ADD, Expression.constant(1, 64))), result);
    }

    @Test
    void isFeasible_reportsWithoutBuilding() {
        var algebra = new CountingAlgebra();
        var counting = Transformer.create(TransformerConfig.DEFAULT, algebra, Matcher.structural());
        var symbols = SymbolTable.of(Map.of("X", RAX));

        assertTrue(counting.isFeasible(symbols, add(var("X"), constant(1)), 64));
        assertFalse(counting.isFeasible(symbols, add(var("Y"), constant(1)), 64));
        assertEquals(0, algebra.constructions());
    }

    @Test
    void create_default_usesDefaultConfig() {
        assertEquals(TransformerConfig.DEFAULT, transformer.config());
        assertTrue(transformer.config()
                              .speculativePrecheck());
        assertFalse(transformer.config()
                               .traceRules());
    }

    private static Matcher twoCandidates() {
        return (pattern, expression) -> List.of(SymbolTable.of(Map.of("X", RAX)),
                                                SymbolTable.of(Map.of("X", RAX, "Y", RBX)));
    }

    private static Expression binary(Expression lhs, OperatorId op, Expression rhs) {
        return ALGEBRA.binary(lhs, op, rhs)
                      .orElseThrow();
    }

    /**
     * Algebra that refuses every binary operator.
     */
    private static final class NoBinaryAlgebra implements ExpressionAlgebra {
        @Override
        public Expression constant(long value, int bits) {
            return ALGEBRA.constant(value, bits);
        }

        @Override
        public Optional<Expression> unary(OperatorId op, Expression rhs) {
            return ALGEBRA.unary(op, rhs);
        }

        @Override
        public Optional<Expression> binary(Expression lhs, OperatorId op, Expression rhs) {
            return Optional.empty();
        }

        @Override
        public Expression resize(Expression expression, int bits, boolean signExtend) {
            return ALGEBRA.resize(expression, bits, signExtend);
        }

        @Override
        public Optional<Expression> simplify(Expression expression) {
            return ALGEBRA.simplify(expression);
        }
    }
}

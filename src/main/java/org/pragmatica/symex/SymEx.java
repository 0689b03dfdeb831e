package org.pragmatica.symex;

import org.pragmatica.symex.directive.Directive;
import org.pragmatica.symex.expr.Expression;
import org.pragmatica.symex.expr.ExpressionAlgebra;
import org.pragmatica.symex.match.Matcher;
import org.pragmatica.symex.match.SymbolTable;
import org.pragmatica.symex.rewrite.ExpressionFilter;
import org.pragmatica.symex.rewrite.TranslateMode;
import org.pragmatica.symex.rewrite.TranslateResult;
import org.pragmatica.symex.rewrite.Transformer;
import org.pragmatica.symex.rewrite.TransformerConfig;

import java.util.Optional;

/**
 * Entry point for applying rewrite rules with the standard algebra and matcher.
 *
 * <p>Example usage:
 * <pre>{@code
 * var algebra = ExpressionAlgebra.standard();
 * var expression = algebra.binary(Expression.symbol("rax", 64), OperatorId.ADD, Expression.constant(0, 64))
 *                         .orElseThrow();
 *
 * // A + 0 => A
 * var result = SymEx.transform(expression, Directive.add(Directive.var("A"), Directive.constant(0)), Directive.var("A"));
 * }</pre>
 */
public final class SymEx {
    private static final Transformer DEFAULT = Transformer.create();

    private SymEx() {}

    /**
     * Build {@code directive} under {@code symbols}; constant leaves get {@code bits} width.
     */
    public static Optional<Expression> translate(SymbolTable symbols, Directive directive, int bits) {
        return DEFAULT.translate(symbols, directive, bits);
    }

    /**
     * Translate in the given mode. A speculative success is reported as
     * {@link TranslateResult.Feasible}, never as an expression.
     */
    public static TranslateResult translate(SymbolTable symbols, Directive directive, int bits, boolean speculative) {
        return DEFAULT.translate(symbols, directive, bits, TranslateMode.of(speculative));
    }

    /**
     * Rewrite {@code expression} from {@code from} to {@code to}.
     */
    public static Optional<Expression> transform(Expression expression, Directive from, Directive to) {
        return DEFAULT.transform(expression, from, to);
    }

    /**
     * Rewrite {@code expression} from {@code from} to {@code to}, accepting only results that pass {@code filter}.
     */
    public static Optional<Expression> transform(Expression expression,
                                                 Directive from,
                                                 Directive to,
                                                 ExpressionFilter filter) {
        return DEFAULT.transform(expression, from, to, filter);
    }

    /**
     * Create a builder for a transformer with custom collaborators or configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ExpressionAlgebra algebra = ExpressionAlgebra.standard();
        private Matcher matcher = Matcher.structural();
        private boolean speculativePrecheck = true;
        private boolean traceRules = false;

        private Builder() {}

        public Builder algebra(ExpressionAlgebra algebra) {
            this.algebra = algebra;
            return this;
        }

        public Builder matcher(Matcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder speculativePrecheck(boolean enabled) {
            this.speculativePrecheck = enabled;
            return this;
        }

        public Builder traceRules(boolean enabled) {
            this.traceRules = enabled;
            return this;
        }

        public Transformer build() {
            var config = new TransformerConfig(speculativePrecheck, traceRules);
            return Transformer.create(config, algebra, matcher);
        }
    }
}

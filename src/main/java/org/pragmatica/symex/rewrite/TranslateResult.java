package org.pragmatica.symex.rewrite;

import org.pragmatica.symex.expr.Expression;

import java.util.Optional;

/**
 * Result of translating a directive - a built expression, a speculative success, or a failure.
 */
public sealed interface TranslateResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The built expression; empty for {@link Feasible} and {@link Failed}.
     */
    default Optional<Expression> expression() {
        return Optional.empty();
    }

    static TranslateResult built(Expression expression) {
        return new Built(expression);
    }

    static TranslateResult feasible() {
        return Feasible.INSTANCE;
    }

    static TranslateResult failed(String reason) {
        return new Failed(reason);
    }

    /**
     * Translation produced an expression.
     */
    record Built(Expression node) implements TranslateResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<Expression> expression() {
            return Optional.of(node);
        }
    }

    /**
     * Speculative translation would succeed; nothing was built.
     */
    record Feasible() implements TranslateResult {
        static final Feasible INSTANCE = new Feasible();

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Translation failed - an ordinary non-match, not an error.
     */
    record Failed(String reason) implements TranslateResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}

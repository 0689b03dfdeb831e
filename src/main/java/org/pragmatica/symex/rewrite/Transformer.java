package org.pragmatica.symex.rewrite;

import org.pragmatica.symex.directive.Directive;
import org.pragmatica.symex.error.DirectiveFault;
import org.pragmatica.symex.error.RewriteError;
import org.pragmatica.symex.expr.Expression;
import org.pragmatica.symex.expr.ExpressionAlgebra;
import org.pragmatica.symex.match.Matcher;
import org.pragmatica.symex.match.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies a {@code from -> to} rule to an expression: matches {@code from}, then translates
 * {@code to} for each candidate binding in matcher order and returns the first accepted result.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class Transformer {
    private static final Logger LOG = LoggerFactory.getLogger(Transformer.class);

    private final TransformerConfig config;
    private final Matcher matcher;
    private final DirectiveInterpreter interpreter;

    private Transformer(TransformerConfig config, Matcher matcher, DirectiveInterpreter interpreter) {
        this.config = config;
        this.matcher = matcher;
        this.interpreter = interpreter;
    }

    public static Transformer create() {
        return create(TransformerConfig.DEFAULT, ExpressionAlgebra.standard(), Matcher.structural());
    }

    public static Transformer create(TransformerConfig config, ExpressionAlgebra algebra, Matcher matcher) {
        return new Transformer(config, matcher, DirectiveInterpreter.create(algebra, config));
    }

    public TransformerConfig config() {
        return config;
    }

    // === Transform ===

    /**
     * Rewrite {@code expression} from {@code from} to {@code to}, taking the first candidate
     * whose translation succeeds.
     *
     * @throws DirectiveFault if the rule is malformed or reaches {@code __unreachable()}
     */
    public Optional<Expression> transform(Expression expression, Directive from, Directive to) {
        var candidates = matcher.match(from, expression);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return config.speculativePrecheck()
               ? firstFeasible(expression, from, to, candidates)
               : firstBuilt(expression, from, to, candidates);
    }

    /**
     * Rewrite {@code expression} from {@code from} to {@code to}, taking the first translated
     * candidate accepted by {@code filter}.
     *
     * @throws DirectiveFault if the rule is malformed or reaches {@code __unreachable()}
     */
    public Optional<Expression> transform(Expression expression, Directive from, Directive to, ExpressionFilter filter) {
        Objects.requireNonNull(filter, "filter");
        var candidates = matcher.match(from, expression);

        for (var candidate : candidates) {
            logTranslation(from, to, candidate);
            var result = build(candidate, to, expression.bits());
            if (result.isEmpty()) {
                LOG.debug("Rejected by directive");
                continue;
            }
            if (filter.accept(result.get())) {
                LOG.debug("Success: {}", result.get());
                return result;
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("Rejected by filter (complexity: {} vs {})", result.get()
                                                                             .complexity(), expression.complexity());
            }
        }
        return Optional.empty();
    }

    private Optional<Expression> firstFeasible(Expression expression, Directive from, Directive to, List<SymbolTable> candidates) {
        for (var candidate : candidates) {
            if (interpreter.translate(candidate, to, expression.bits(), TranslateMode.SPECULATIVE)
                           .isFailure()) {
                LOG.debug("Rejected by directive");
                continue;
            }
            logTranslation(from, to, candidate);

            var result = build(candidate, to, expression.bits());
            if (result.isEmpty()) {
                throw new DirectiveFault(new RewriteError.SpeculationMismatch(to.toString(), candidate.toString()));
            }
            LOG.debug("Success: {}", result.get());
            return result;
        }
        return Optional.empty();
    }

    private Optional<Expression> firstBuilt(Expression expression, Directive from, Directive to, List<SymbolTable> candidates) {
        for (var candidate : candidates) {
            logTranslation(from, to, candidate);
            var result = build(candidate, to, expression.bits());
            if (result.isPresent()) {
                LOG.debug("Success: {}", result.get());
                return result;
            }
            LOG.debug("Rejected by directive");
        }
        return Optional.empty();
    }

    // === Translate ===

    /**
     * Build {@code directive} under {@code symbols}; constant leaves get {@code bits} width.
     */
    public Optional<Expression> translate(SymbolTable symbols, Directive directive, int bits) {
        return build(symbols, directive, bits);
    }

    public TranslateResult translate(SymbolTable symbols, Directive directive, int bits, TranslateMode mode) {
        return interpreter.translate(symbols, directive, bits, mode);
    }

    /**
     * Check whether {@code directive} would translate under {@code symbols}.
     */
    public boolean isFeasible(SymbolTable symbols, Directive directive, int bits) {
        return interpreter.translate(symbols, directive, bits, TranslateMode.SPECULATIVE)
                          .isSuccess();
    }

    private Optional<Expression> build(SymbolTable symbols, Directive directive, int bits) {
        return interpreter.translate(symbols, directive, bits, TranslateMode.CONSTRUCTIVE)
                          .expression();
    }

    private void logTranslation(Directive from, Directive to, SymbolTable candidate) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        LOG.debug("Translating [{}] => [{}]:", from, to);
        for (var id : from.variables()) {
            LOG.debug("    {}: {}", id, candidate.resolve(id)
                                            .map(Expression::toString)
                                            .orElse("<unbound>"));
        }
    }
}

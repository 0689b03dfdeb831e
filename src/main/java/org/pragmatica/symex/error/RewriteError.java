package org.pragmatica.symex.error;

/**
 * Defects found while applying a rule: a malformed rule or a broken internal invariant.
 * Ordinary non-matches are not errors and never produce one of these.
 */
public sealed interface RewriteError {
    String message();

    /**
     * An {@code __unreachable()} directive was evaluated.
     */
    record UnreachableReached(String directive) implements RewriteError {
        @Override
        public String message() {
            return "Directive-time assertion failure in " + directive;
        }
    }

    /**
     * A directive node the interpreter does not know how to evaluate.
     */
    record UnknownDirective(String directive) implements RewriteError {
        @Override
        public String message() {
            return "Unknown directive: " + directive;
        }
    }

    /**
     * The width operand of a cast did not translate to a literal.
     */
    record NonLiteralCastWidth(String directive, String width) implements RewriteError {
        @Override
        public String message() {
            return "Cast width '" + width + "' is not a literal in " + directive;
        }
    }

    /**
     * A candidate passed the speculative check but failed to build.
     */
    record SpeculationMismatch(String directive, String bindings) implements RewriteError {
        @Override
        public String message() {
            return "Speculative translation of " + directive + " succeeded but construction failed for " + bindings;
        }
    }
}

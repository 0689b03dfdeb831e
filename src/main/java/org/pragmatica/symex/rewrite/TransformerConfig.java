package org.pragmatica.symex.rewrite;

/**
 * Transformer configuration options.
 *
 * @param speculativePrecheck check candidates speculatively before building them when no filter is given
 * @param traceRules          log every directive evaluation at TRACE level
 */
public record TransformerConfig(
    boolean speculativePrecheck,
    boolean traceRules
) {
    public static final TransformerConfig DEFAULT = new TransformerConfig(
        true,
        false
    );
}

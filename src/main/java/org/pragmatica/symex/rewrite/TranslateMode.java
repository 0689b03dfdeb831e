package org.pragmatica.symex.rewrite;

/**
 * Evaluation mode of the directive interpreter.
 *
 * <p>Both modes run through the same recursion so that they always agree on success:
 * <ul>
 *   <li>{@link #CONSTRUCTIVE} - build the resulting expression</li>
 *   <li>{@link #SPECULATIVE} - only check that construction would succeed, building nothing
 *       except where a directive needs a concrete value</li>
 * </ul>
 */
public enum TranslateMode {
    CONSTRUCTIVE,
    SPECULATIVE;

    public boolean isSpeculative() {
        return this == SPECULATIVE;
    }

    public static TranslateMode of(boolean speculative) {
        return speculative
               ? SPECULATIVE
               : CONSTRUCTIVE;
    }
}

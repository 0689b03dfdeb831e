package org.pragmatica.symex.directive;

/**
 * Meta-directive operators. These never appear in concrete expressions; the interpreter
 * handles each one explicitly.
 */
public enum MetaOp {
    /**
     * {@code __simplify(x)} - build x and keep it only if simplification reduces it.
     */
    SIMPLIFY("__simplify", 1),

    /**
     * {@code __try_simplify(x)} - build x and simplify it if possible.
     */
    TRY_SIMPLIFY("__try_simplify", 1),

    /**
     * {@code __or(a, b)} - a if it translates, otherwise b.
     */
    OR_ALSO("__or", 2),

    /**
     * {@code __iff(cond, x)} - x only if cond evaluates to a known true value.
     */
    IFF("__iff", 2),

    MASK_UNKNOWN("__mask_unk", 1),
    MASK_ONE("__mask_knw1", 1),
    MASK_ZERO("__mask_knw0", 1),

    /**
     * {@code __unreachable()} - assertion that the rule never gets here.
     */
    UNREACHABLE("__unreachable", 0),

    /**
     * {@code __warning(x)} - log a warning, then continue with x.
     */
    WARNING("__warning", 1);

    private final String symbol;
    private final int arity;

    MetaOp(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    public String symbol() {
        return symbol;
    }

    public int arity() {
        return arity;
    }
}

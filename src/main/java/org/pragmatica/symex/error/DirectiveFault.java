package org.pragmatica.symex.error;

/**
 * Thrown when a {@link RewriteError} halts the current rule application.
 */
public final class DirectiveFault extends RuntimeException {
    private final RewriteError error;

    public DirectiveFault(RewriteError error) {
        super(error.message());
        this.error = error;
    }

    public RewriteError error() {
        return error;
    }
}

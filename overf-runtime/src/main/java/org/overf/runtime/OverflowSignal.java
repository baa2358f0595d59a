package org.overf.runtime;

/**
 * Thrown by propagating arithmetic when an operation overflows. The transformer wraps every
 * propagating region in a handler that catches it and returns the enclosing function's absent
 * value, so it is never meant to escape rewritten code.
 */
public final class OverflowSignal extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public OverflowSignal() {
        super("arithmetic overflow propagated", null, false, false);
    }
}

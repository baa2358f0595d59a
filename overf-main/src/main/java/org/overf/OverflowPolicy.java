package org.overf;

/**
 * The overflow discipline active for a region of code.
 */
public enum OverflowPolicy {

    /** Java's own arithmetic; nothing is rewritten. Sits at the bottom of every scope stack. */
    DEFAULT,

    /** Overflow throws {@link ArithmeticException} naming the operation. */
    CHECKED,

    /** Two's-complement wraparound. */
    OVERFLOWING,

    /** Clamps to the type's minimum or maximum. */
    SATURATING,

    /** Overflow returns the enclosing function's absent value. */
    PROPAGATING;

    public boolean rewrites() {
        return this != DEFAULT;
    }
}

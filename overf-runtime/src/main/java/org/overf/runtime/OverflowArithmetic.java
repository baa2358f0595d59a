package org.overf.runtime;

import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Overflow-aware integer arithmetic used by rewritten code.
 * <p>
 * Every operation comes in three forms:
 * <ul>
 *   <li>{@code checkedX} returns an empty optional on overflow or division by zero,</li>
 *   <li>{@code wrappingX} returns the two's-complement wrapped result,</li>
 *   <li>{@code saturatingX} clamps to the type's minimum or maximum.</li>
 * </ul>
 * There are {@code int} and {@code long} overloads; narrower operands reach the {@code int}
 * overloads by widening. Wrapping and saturating division or remainder by zero throw
 * {@link ArithmeticException}, as the plain operators do.
 */
public final class OverflowArithmetic {

    private OverflowArithmetic() {
    }

    // ── checked ────────────────────────────────────────────────────────────

    public static OptionalInt checkedAdd(int a, int b) {
        int r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(r);
    }

    public static OptionalLong checkedAdd(long a, long b) {
        long r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(r);
    }

    public static OptionalInt checkedSub(int a, int b) {
        int r = a - b;
        if (((a ^ b) & (a ^ r)) < 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(r);
    }

    public static OptionalLong checkedSub(long a, long b) {
        long r = a - b;
        if (((a ^ b) & (a ^ r)) < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(r);
    }

    public static OptionalInt checkedMul(int a, int b) {
        long r = (long) a * (long) b;
        if ((int) r != r) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) r);
    }

    public static OptionalLong checkedMul(long a, long b) {
        if (mulOverflows(a, b)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(a * b);
    }

    public static OptionalInt checkedDiv(int a, int b) {
        if (b == 0 || (a == Integer.MIN_VALUE && b == -1)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(a / b);
    }

    public static OptionalLong checkedDiv(long a, long b) {
        if (b == 0 || (a == Long.MIN_VALUE && b == -1)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(a / b);
    }

    public static OptionalInt checkedRem(int a, int b) {
        if (b == 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(a % b);
    }

    public static OptionalLong checkedRem(long a, long b) {
        if (b == 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(a % b);
    }

    public static OptionalInt checkedNeg(int a) {
        if (a == Integer.MIN_VALUE) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(-a);
    }

    public static OptionalLong checkedNeg(long a) {
        if (a == Long.MIN_VALUE) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(-a);
    }

    // ── wrapping ───────────────────────────────────────────────────────────

    public static int wrappingAdd(int a, int b) {
        return a + b;
    }

    public static long wrappingAdd(long a, long b) {
        return a + b;
    }

    public static int wrappingSub(int a, int b) {
        return a - b;
    }

    public static long wrappingSub(long a, long b) {
        return a - b;
    }

    public static int wrappingMul(int a, int b) {
        return a * b;
    }

    public static long wrappingMul(long a, long b) {
        return a * b;
    }

    /**
     * {@code Integer.MIN_VALUE / -1} wraps to {@code Integer.MIN_VALUE}.
     */
    public static int wrappingDiv(int a, int b) {
        return a / b;
    }

    public static long wrappingDiv(long a, long b) {
        return a / b;
    }

    public static int wrappingRem(int a, int b) {
        return a % b;
    }

    public static long wrappingRem(long a, long b) {
        return a % b;
    }

    public static int wrappingNeg(int a) {
        return -a;
    }

    public static long wrappingNeg(long a) {
        return -a;
    }

    // ── saturating ─────────────────────────────────────────────────────────

    public static int saturatingAdd(int a, int b) {
        int r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) {
            return a < 0 ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
        return r;
    }

    public static long saturatingAdd(long a, long b) {
        long r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) {
            return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return r;
    }

    public static int saturatingSub(int a, int b) {
        int r = a - b;
        if (((a ^ b) & (a ^ r)) < 0) {
            return a < 0 ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
        return r;
    }

    public static long saturatingSub(long a, long b) {
        long r = a - b;
        if (((a ^ b) & (a ^ r)) < 0) {
            return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return r;
    }

    public static int saturatingMul(int a, int b) {
        long r = (long) a * (long) b;
        if (r > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (r < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) r;
    }

    public static long saturatingMul(long a, long b) {
        if (mulOverflows(a, b)) {
            return (a < 0) == (b < 0) ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return a * b;
    }

    public static int saturatingDiv(int a, int b) {
        if (a == Integer.MIN_VALUE && b == -1) {
            return Integer.MAX_VALUE;
        }
        return a / b;
    }

    public static long saturatingDiv(long a, long b) {
        if (a == Long.MIN_VALUE && b == -1) {
            return Long.MAX_VALUE;
        }
        return a / b;
    }

    public static int saturatingRem(int a, int b) {
        return a % b;
    }

    public static long saturatingRem(long a, long b) {
        return a % b;
    }

    public static int saturatingNeg(int a) {
        return a == Integer.MIN_VALUE ? Integer.MAX_VALUE : -a;
    }

    public static long saturatingNeg(long a) {
        return a == Long.MIN_VALUE ? Long.MAX_VALUE : -a;
    }

    private static boolean mulOverflows(long a, long b) {
        long hi = Math.multiplyHigh(a, b);
        long lo = a * b;
        // the full 128-bit product fits in 64 bits only if hi is the sign extension of lo
        return hi != (lo >> 63);
    }
}

package com.sched.core;

import java.math.BigInteger;

/**
 * Saturating arithmetic on virtual-time values.
 * Values are non-negative nanosecond quantities; results never wrap.
 */
public final class VirtualTime {

    /**
     * Smallest key a fairness policy stores. Zero means "uninitialized".
     */
    public static final long MIN_KEY = 1L;

    private VirtualTime() {
    }

    /**
     * {@code a - b}, clamped to 0 when {@code b > a}.
     */
    public static long saturatingSub(long a, long b) {
        return a > b ? a - b : 0L;
    }

    /**
     * {@code a + b}, clamped to {@link Long#MAX_VALUE}.
     */
    public static long saturatingAdd(long a, long b) {
        long sum = a + b;
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return Long.MAX_VALUE;
        }
        return sum;
    }

    /**
     * {@code a * b / divisor} without intermediate overflow, clamped to {@link Long#MAX_VALUE}.
     */
    public static long scale(long a, long b, long divisor) {
        if (a <= 0 || b <= 0) {
            return 0L;
        }
        long d = Math.max(divisor, 1L);
        long product = a * b;
        if (Math.multiplyHigh(a, b) == 0 && product >= 0) {
            return product / d;
        }
        BigInteger exact = BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).divide(BigInteger.valueOf(d));
        return exact.bitLength() < Long.SIZE ? exact.longValue() : Long.MAX_VALUE;
    }

    /**
     * Coerces zero to {@link #MIN_KEY}.
     */
    public static long nonZero(long value) {
        return value == 0L ? MIN_KEY : value;
    }

    /**
     * Clock advance: never moves backwards.
     */
    public static long advance(long clock, long candidate) {
        return Math.max(clock, candidate);
    }
}

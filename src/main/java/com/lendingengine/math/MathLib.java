package com.lendingengine.math;

import java.math.BigInteger;

/**
 * Fixed-point arithmetic on unbounded non-negative integers.
 *
 * Fractions are WAD-scaled (1e18 == 1.0). Every division states its rounding
 * direction in the method name; callers pick the direction that favours the pool.
 */
public final class MathLib {

    public static final BigInteger WAD = BigInteger.TEN.pow(18);

    private MathLib() {}

    /** (x * y) / WAD rounded down. */
    public static BigInteger wMulDown(BigInteger x, BigInteger y) {
        return mulDivDown(x, y, WAD);
    }

    /** (x * WAD) / y rounded down. */
    public static BigInteger wDivDown(BigInteger x, BigInteger y) {
        return mulDivDown(x, WAD, y);
    }

    /** (x * WAD) / y rounded up. */
    public static BigInteger wDivUp(BigInteger x, BigInteger y) {
        return mulDivUp(x, WAD, y);
    }

    public static BigInteger mulDivDown(BigInteger x, BigInteger y, BigInteger d) {
        return x.multiply(y).divide(d);
    }

    public static BigInteger mulDivUp(BigInteger x, BigInteger y, BigInteger d) {
        return x.multiply(y).add(d.subtract(BigInteger.ONE)).divide(d);
    }

    /** max(x - y, 0). */
    public static BigInteger zeroFloorSub(BigInteger x, BigInteger y) {
        return x.compareTo(y) > 0 ? x.subtract(y) : BigInteger.ZERO;
    }

    public static boolean exactlyOneZero(BigInteger x, BigInteger y) {
        return (x.signum() == 0) != (y.signum() == 0);
    }

    public static boolean isZero(BigInteger x) {
        return x.signum() == 0;
    }
}

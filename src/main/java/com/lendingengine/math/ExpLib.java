package com.lendingengine.math;

import java.math.BigInteger;

/**
 * Signed WAD-scaled exponential.
 *
 * x is split as q * ln(2) + r with |r| <= ln(2)/2, exp(r) is approximated by its
 * second-order Taylor expansion and the result is shifted by q.
 */
public final class ExpLib {

    public static final BigInteger LN_2 = new BigInteger("693147180559945309");

    /** ln(1e-18): below this exp(x) rounds to zero. */
    public static final BigInteger LN_WEI = new BigInteger("-41446531673892822312");

    /** Above this the result no longer fits in a signed 256-bit word. */
    public static final BigInteger UPPER_BOUND = new BigInteger("93859467695000404319");

    public static final BigInteger UPPER_VALUE =
        new BigInteger("57716089161558943949701069502944508345128422502756744429568");

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private ExpLib() {}

    public static BigInteger wExp(BigInteger x) {
        if (x.compareTo(LN_WEI) < 0) return BigInteger.ZERO;
        if (x.compareTo(UPPER_BOUND) >= 0) return UPPER_VALUE;

        BigInteger roundingAdjustment = x.signum() < 0 ? LN_2.divide(TWO).negate() : LN_2.divide(TWO);
        // BigInteger division truncates toward zero
        BigInteger q = x.add(roundingAdjustment).divide(LN_2);
        BigInteger r = x.subtract(q.multiply(LN_2));

        BigInteger expR = MathLib.WAD.add(r).add(r.multiply(r).divide(MathLib.WAD).divide(TWO));

        int shift = q.intValueExact();
        return shift >= 0 ? expR.shiftLeft(shift) : expR.shiftRight(-shift);
    }
}

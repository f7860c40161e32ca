package com.lendingengine.irm;

import com.lendingengine.math.ExpLib;
import com.lendingengine.math.MathLib;

import java.math.BigInteger;

/**
 * Pure functions of the adaptive curve.
 *
 * The curve maps utilization to a rate around a "rate at target": linear from zero to
 * the rate at target below the target utilization, then growing with the square of the
 * normalized excess up to {@link #CURVE_STEEPNESS} times the rate at target at 100%.
 * The rate at target itself drifts exponentially with the utilization error over time.
 */
public final class AdaptiveCurve {

    public static final BigInteger SECONDS_PER_YEAR = BigInteger.valueOf(365L * 24 * 60 * 60);

    public static final BigInteger CURVE_STEEPNESS = BigInteger.valueOf(4).multiply(MathLib.WAD);

    public static final BigInteger TARGET_UTILIZATION = new BigInteger("900000000000000000");

    /** 50/year: rate at target doubles in about 5 days at 100% utilization. */
    public static final BigInteger ADJUSTMENT_SPEED =
        BigInteger.valueOf(50).multiply(MathLib.WAD).divide(SECONDS_PER_YEAR);

    /** 4% APR. */
    public static final BigInteger INITIAL_RATE_AT_TARGET =
        new BigInteger("40000000000000000").divide(SECONDS_PER_YEAR);

    /** 0.1% APR. */
    public static final BigInteger MIN_RATE_AT_TARGET =
        new BigInteger("1000000000000000").divide(SECONDS_PER_YEAR);

    /** 200% APR. */
    public static final BigInteger MAX_RATE_AT_TARGET =
        BigInteger.valueOf(2).multiply(MathLib.WAD).divide(SECONDS_PER_YEAR);

    private AdaptiveCurve() {}

    public static BigInteger utilization(BigInteger totalBorrowAssets, BigInteger totalSupplyAssets) {
        if (totalSupplyAssets.signum() == 0) {
            return BigInteger.ZERO;
        }
        return MathLib.wDivDown(totalBorrowAssets, totalSupplyAssets).min(MathLib.WAD);
    }

    /**
     * Distance of utilization from target, normalized to [-1, 1] (WAD-scaled).
     */
    public static BigInteger error(BigInteger utilization) {
        BigInteger u = utilization.min(MathLib.WAD).max(BigInteger.ZERO);
        BigInteger normFactor = u.compareTo(TARGET_UTILIZATION) > 0
            ? MathLib.WAD.subtract(TARGET_UTILIZATION)
            : TARGET_UTILIZATION;
        return u.subtract(TARGET_UTILIZATION).multiply(MathLib.WAD).divide(normFactor);
    }

    /**
     * Rate at target after {@code elapsed} seconds at the given error, clamped to the band.
     */
    public static BigInteger adapt(BigInteger startRateAtTarget, BigInteger err, long elapsed) {
        BigInteger speed = ADJUSTMENT_SPEED.multiply(err).divide(MathLib.WAD);
        BigInteger linearAdaptation = speed.multiply(BigInteger.valueOf(elapsed));
        BigInteger adapted = startRateAtTarget.multiply(ExpLib.wExp(linearAdaptation)).divide(MathLib.WAD);
        return clamp(adapted);
    }

    public static BigInteger curve(BigInteger rateAtTarget, BigInteger err) {
        if (err.signum() <= 0) {
            return rateAtTarget.multiply(MathLib.WAD.add(err)).divide(MathLib.WAD);
        }
        BigInteger errSquared = err.multiply(err).divide(MathLib.WAD);
        BigInteger multiplier = MathLib.WAD.add(
            CURVE_STEEPNESS.subtract(MathLib.WAD).multiply(errSquared).divide(MathLib.WAD));
        return rateAtTarget.multiply(multiplier).divide(MathLib.WAD);
    }

    static BigInteger clamp(BigInteger rateAtTarget) {
        return rateAtTarget.max(MIN_RATE_AT_TARGET).min(MAX_RATE_AT_TARGET);
    }
}

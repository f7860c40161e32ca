package com.lendingengine.math;

import java.math.BigInteger;

/**
 * Conversions between assets and shares of a pooled total.
 *
 * A virtual offset of {@link #VIRTUAL_SHARES} shares and {@link #VIRTUAL_ASSETS} asset is added
 * to both totals, so the first depositor gets 1e6 shares per asset and the exchange rate
 * cannot be inflated by donations to an empty pool.
 *
 * There is no default rounding: every call site chooses the direction explicitly.
 */
public final class SharesMath {

    public static final BigInteger VIRTUAL_SHARES = BigInteger.TEN.pow(6);

    public static final BigInteger VIRTUAL_ASSETS = BigInteger.ONE;

    private SharesMath() {}

    public static BigInteger toSharesRoundingDown(BigInteger assets, BigInteger totalAssets, BigInteger totalShares) {
        return MathLib.mulDivDown(assets, totalShares.add(VIRTUAL_SHARES), totalAssets.add(VIRTUAL_ASSETS));
    }

    public static BigInteger toSharesRoundingUp(BigInteger assets, BigInteger totalAssets, BigInteger totalShares) {
        return MathLib.mulDivUp(assets, totalShares.add(VIRTUAL_SHARES), totalAssets.add(VIRTUAL_ASSETS));
    }

    public static BigInteger toAssetsRoundingDown(BigInteger shares, BigInteger totalAssets, BigInteger totalShares) {
        return MathLib.mulDivDown(shares, totalAssets.add(VIRTUAL_ASSETS), totalShares.add(VIRTUAL_SHARES));
    }

    public static BigInteger toAssetsRoundingUp(BigInteger shares, BigInteger totalAssets, BigInteger totalShares) {
        return MathLib.mulDivUp(shares, totalAssets.add(VIRTUAL_ASSETS), totalShares.add(VIRTUAL_SHARES));
    }
}

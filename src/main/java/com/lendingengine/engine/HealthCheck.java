package com.lendingengine.engine;

import com.lendingengine.math.MathLib;
import com.lendingengine.math.SharesMath;

import java.math.BigInteger;

/**
 * Solvency rule: collateral value times LLTV must cover the borrowed assets.
 * Debt is rounded up and collateral value down, so ties at the boundary count as healthy.
 */
public final class HealthCheck {

    private HealthCheck() {}

    public static boolean isHealthy(BigInteger borrowShares, BigInteger collateral,
                                    BigInteger totalBorrowAssets, BigInteger totalBorrowShares,
                                    BigInteger lltv, BigInteger collateralPrice) {
        if (borrowShares.signum() == 0) {
            return true;
        }
        BigInteger borrowed = SharesMath.toAssetsRoundingUp(borrowShares, totalBorrowAssets, totalBorrowShares);
        return maxBorrow(collateral, lltv, collateralPrice).compareTo(borrowed) >= 0;
    }

    public static BigInteger maxBorrow(BigInteger collateral, BigInteger lltv, BigInteger collateralPrice) {
        BigInteger collateralValue = MathLib.mulDivDown(collateral, collateralPrice, EngineConstants.ORACLE_PRICE_SCALE);
        return MathLib.wMulDown(collateralValue, lltv);
    }

    /**
     * min(1.15, 1 / (1 - 0.3 * (1 - lltv))): the closer LLTV is to 1, the smaller the incentive.
     */
    public static BigInteger liquidationIncentiveFactor(BigInteger lltv) {
        BigInteger discount = MathLib.wMulDown(EngineConstants.LIQUIDATION_CURSOR, MathLib.WAD.subtract(lltv));
        return EngineConstants.MAX_LIQUIDATION_INCENTIVE_FACTOR
            .min(MathLib.wDivDown(MathLib.WAD, MathLib.WAD.subtract(discount)));
    }
}

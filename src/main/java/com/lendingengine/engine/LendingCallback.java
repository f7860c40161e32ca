package com.lendingengine.engine;

import java.math.BigInteger;

/**
 * Hooks into the caller, run after an operation has updated state and before the
 * engine pulls the owed tokens. The caller may use them to source those tokens,
 * including by calling back into the engine.
 */
public interface LendingCallback {

    default void onSupply(BigInteger assets, byte[] data) {
    }

    default void onRepay(BigInteger assets, byte[] data) {
    }

    default void onSupplyCollateral(BigInteger assets, byte[] data) {
    }

    /**
     * @param repaidAssets loan tokens the engine is about to pull from the liquidator
     */
    default void onLiquidate(BigInteger repaidAssets, byte[] data) {
    }

    default void onFlashLoan(BigInteger assets, byte[] data) {
    }
}

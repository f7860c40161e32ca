package com.lendingengine.engine;

import lombok.Value;

import java.math.BigInteger;

@Value
public class LiquidationResult {
    BigInteger seizedAssets;
    BigInteger repaidAssets;
    BigInteger repaidShares;

    /**
     * Debt written off against suppliers because the borrower ran out of collateral.
     */
    BigInteger badDebtAssets;
    BigInteger badDebtShares;
}

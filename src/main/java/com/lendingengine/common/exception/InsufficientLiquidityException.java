package com.lendingengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when an operation would leave more assets borrowed than supplied.
 */
public class InsufficientLiquidityException extends LendingEngineException {

    public InsufficientLiquidityException(String marketId, BigInteger totalBorrowAssets,
                                          BigInteger totalSupplyAssets) {
        super(ErrorCode.INSUFFICIENT_LIQUIDITY,
            String.format("Insufficient liquidity in market %s. Borrowed: %s, Supplied: %s",
                marketId, totalBorrowAssets, totalSupplyAssets));
    }
}

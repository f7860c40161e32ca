package com.lendingengine.common.exception;

/**
 * Thrown when a borrow or collateral withdrawal leaves the position unhealthy.
 */
public class InsufficientCollateralException extends LendingEngineException {

    public InsufficientCollateralException(String marketId, String account) {
        super(ErrorCode.INSUFFICIENT_COLLATERAL,
            String.format("Insufficient collateral for %s in market %s", account, marketId));
    }
}

package com.lendingengine.common.exception;

public class HealthyPositionException extends LendingEngineException {

    public HealthyPositionException(String marketId, String borrower) {
        super(ErrorCode.HEALTHY_POSITION,
            String.format("Position of %s in market %s is healthy and cannot be liquidated", borrower, marketId));
    }
}

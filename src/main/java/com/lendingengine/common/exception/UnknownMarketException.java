package com.lendingengine.common.exception;

/**
 * Thrown when an operation addresses a market that was never created.
 */
public class UnknownMarketException extends LendingEngineException {

    public UnknownMarketException(String marketId) {
        super(ErrorCode.UNKNOWN_MARKET, "Market not created: " + marketId);
    }
}

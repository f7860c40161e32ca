package com.lendingengine.common.exception;

/**
 * Thrown when createMarket is called for an identifier that already has state.
 */
public class MarketAlreadyExistsException extends LendingEngineException {

    public MarketAlreadyExistsException(String marketId) {
        super(ErrorCode.MARKET_ALREADY_EXISTS, "Market already created: " + marketId);
    }
}

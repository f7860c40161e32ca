package com.lendingengine.oracle;

import java.math.BigInteger;

/**
 * Price feed of a market.
 *
 * In production this would wrap an on-chain feed such as a Chainlink aggregator
 * or a TWAP; the engine only depends on this single call.
 */
public interface Oracle {

    /**
     * Scale of {@link #price()}: a price of 1e36 means one raw unit of collateral is
     * worth one raw unit of the loan token.
     */
    BigInteger PRICE_SCALE = BigInteger.TEN.pow(36);

    /**
     * Price of one unit of collateral quoted in the loan token, scaled by {@link #PRICE_SCALE}.
     *
     * @throws RuntimeException if the price cannot be produced; the engine treats this as fatal
     */
    BigInteger price();
}

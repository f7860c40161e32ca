package com.lendingengine.irm;

import com.lendingengine.market.Market;
import com.lendingengine.market.MarketParams;

import java.math.BigInteger;

/**
 * Interest rate model of a market, addressed by {@link #getAddress()}.
 *
 * Rates are per-second and WAD-scaled.
 */
public interface RateModel {

    /**
     * Address under which market params reference this model.
     */
    String getAddress();

    /**
     * Current borrow rate of a market. May update the model's own per-market state.
     *
     * @param params the market's params
     * @param market the market state before pending interest is accrued
     */
    BigInteger borrowRate(MarketParams params, Market market);

    /**
     * Borrow rate the model would return for the given utilization, without mutating state.
     *
     * @param marketId    the market identifier
     * @param utilization borrowed / supplied, WAD-scaled
     */
    BigInteger borrowRateView(String marketId, BigInteger utilization);
}

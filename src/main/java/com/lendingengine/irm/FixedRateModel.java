package com.lendingengine.irm;

import com.lendingengine.common.Addresses;
import com.lendingengine.market.Market;
import com.lendingengine.market.MarketParams;

import java.math.BigInteger;

/**
 * Rate model charging a constant per-second rate regardless of utilization.
 */
public class FixedRateModel implements RateModel {

    private final String address;
    private final BigInteger ratePerSecond;

    public FixedRateModel(String address, BigInteger ratePerSecond) {
        if (ratePerSecond == null || ratePerSecond.signum() < 0) {
            throw new IllegalArgumentException("Rate must be non-negative: " + ratePerSecond);
        }
        this.address = Addresses.requireNonZero(address, "irm");
        this.ratePerSecond = ratePerSecond;
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    public BigInteger borrowRate(MarketParams params, Market market) {
        return ratePerSecond;
    }

    @Override
    public BigInteger borrowRateView(String marketId, BigInteger utilization) {
        return ratePerSecond;
    }
}

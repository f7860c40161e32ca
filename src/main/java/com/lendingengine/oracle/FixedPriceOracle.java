package com.lendingengine.oracle;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Oracle returning a manually maintained price.
 *
 * The price can be updated at runtime or marked unavailable to emulate a feed outage.
 */
@Slf4j
public class FixedPriceOracle implements Oracle {

    private volatile BigInteger price;
    private volatile boolean available = true;

    public FixedPriceOracle(BigInteger price) {
        setPrice(price);
    }

    @Override
    public BigInteger price() {
        if (!available) {
            throw new IllegalStateException("price feed is offline");
        }
        return price;
    }

    public void setPrice(BigInteger price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Price must be non-negative: " + price);
        }
        log.debug("Oracle price set to {}", price);
        this.price = price;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }
}

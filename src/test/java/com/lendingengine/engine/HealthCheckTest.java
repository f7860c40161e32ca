package com.lendingengine.engine;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckTest {

    private static final BigInteger LLTV_80 = new BigInteger("800000000000000000");
    private static final BigInteger PRICE_2000 = BigInteger.valueOf(2000).multiply(BigInteger.TEN.pow(36));
    private static final BigInteger BORROW_SHARES = BigInteger.valueOf(16_000_000_000L);
    private static final BigInteger BORROW_ASSETS = BigInteger.valueOf(16_000);

    @Test
    void testPositionWithoutDebtIsHealthy() {
        assertTrue(HealthCheck.isHealthy(BigInteger.ZERO, BigInteger.ZERO, BORROW_ASSETS, BORROW_SHARES,
            LLTV_80, BigInteger.ZERO));
    }

    @Test
    void testBoundaryIsHealthy() {
        assertEquals(BORROW_ASSETS, HealthCheck.maxBorrow(BigInteger.TEN, LLTV_80, PRICE_2000));
        assertTrue(HealthCheck.isHealthy(BORROW_SHARES, BigInteger.TEN, BORROW_ASSETS, BORROW_SHARES,
            LLTV_80, PRICE_2000));
    }

    @Test
    void testSmallestPriceDropMakesBoundaryUnhealthy() {
        assertFalse(HealthCheck.isHealthy(BORROW_SHARES, BigInteger.TEN, BORROW_ASSETS, BORROW_SHARES,
            LLTV_80, PRICE_2000.subtract(BigInteger.ONE)));
    }

    @Test
    void testLiquidationIncentiveFactor() {
        assertEquals(new BigInteger("1063829787234042553"),
            HealthCheck.liquidationIncentiveFactor(LLTV_80));
        assertEquals(new BigInteger("1016776817488561260"),
            HealthCheck.liquidationIncentiveFactor(new BigInteger("945000000000000000")));
    }

    @Test
    void testLiquidationIncentiveFactorIsCapped() {
        assertEquals(EngineConstants.MAX_LIQUIDATION_INCENTIVE_FACTOR,
            HealthCheck.liquidationIncentiveFactor(new BigInteger("500000000000000000")));
        assertEquals(EngineConstants.MAX_LIQUIDATION_INCENTIVE_FACTOR,
            HealthCheck.liquidationIncentiveFactor(BigInteger.ZERO));
    }
}

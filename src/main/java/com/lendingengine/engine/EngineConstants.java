package com.lendingengine.engine;

import com.lendingengine.oracle.Oracle;

import java.math.BigInteger;

public final class EngineConstants {

    /** 25% of accrued interest. */
    public static final BigInteger MAX_FEE = new BigInteger("250000000000000000");

    public static final BigInteger ORACLE_PRICE_SCALE = Oracle.PRICE_SCALE;

    /** Share of the distance to 1.0 LLTV turned into liquidation incentive. */
    public static final BigInteger LIQUIDATION_CURSOR = new BigInteger("300000000000000000");

    /** 1.15x. */
    public static final BigInteger MAX_LIQUIDATION_INCENTIVE_FACTOR = new BigInteger("1150000000000000000");

    private EngineConstants() {}
}

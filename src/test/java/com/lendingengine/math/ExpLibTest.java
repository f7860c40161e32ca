package com.lendingengine.math;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExpLibTest {

    private static final BigInteger WAD = MathLib.WAD;

    @Test
    void testExpOfZeroIsOne() {
        assertEquals(WAD, ExpLib.wExp(BigInteger.ZERO));
    }

    @Test
    void testExpOfLn2IsTwo() {
        assertEquals(WAD.multiply(BigInteger.TWO), ExpLib.wExp(ExpLib.LN_2));
        assertEquals(WAD.divide(BigInteger.TWO), ExpLib.wExp(ExpLib.LN_2.negate()));
    }

    @Test
    void testExpOfOneIsCloseToE() {
        BigInteger e = new BigInteger("2718281828459045235");
        BigInteger result = ExpLib.wExp(WAD);

        BigInteger diff = result.subtract(e).abs();
        // second-order approximation: well under 1%
        assertTrue(diff.compareTo(e.divide(BigInteger.valueOf(100))) < 0, "exp(1) = " + result);
    }

    @Test
    void testBounds() {
        assertEquals(BigInteger.ZERO, ExpLib.wExp(ExpLib.LN_WEI.subtract(BigInteger.ONE)));
        assertEquals(ExpLib.UPPER_VALUE, ExpLib.wExp(ExpLib.UPPER_BOUND));
        assertEquals(ExpLib.UPPER_VALUE, ExpLib.wExp(ExpLib.UPPER_BOUND.multiply(BigInteger.TEN)));
    }

    @Test
    void testMonotonic() {
        BigInteger previous = BigInteger.ZERO;
        for (int i = -20; i <= 20; i++) {
            BigInteger value = ExpLib.wExp(WAD.multiply(BigInteger.valueOf(i)).divide(BigInteger.valueOf(4)));
            assertTrue(value.compareTo(previous) >= 0, "exp not monotonic at " + i);
            previous = value;
        }
    }
}

package com.lendingengine.engine;

import lombok.Value;

import java.math.BigInteger;

/**
 * Amounts moved by a supply, withdraw, borrow or repay: the driving quantity and the derived one.
 */
@Value
public class AssetsShares {
    BigInteger assets;
    BigInteger shares;
}

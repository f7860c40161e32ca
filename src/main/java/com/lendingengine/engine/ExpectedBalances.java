package com.lendingengine.engine;

import lombok.Value;

import java.math.BigInteger;

/**
 * Market totals as they would be after accruing pending interest now.
 */
@Value
public class ExpectedBalances {
    BigInteger totalSupplyAssets;
    BigInteger totalSupplyShares;
    BigInteger totalBorrowAssets;
    BigInteger totalBorrowShares;
}

package com.lendingengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a position or token holder does not hold enough of something to cover a decrement.
 */
public class InsufficientBalanceException extends LendingEngineException {

    public InsufficientBalanceException(String what, String holder, BigInteger required, BigInteger available) {
        super(ErrorCode.INSUFFICIENT_BALANCE,
            String.format("Insufficient %s for %s. Required: %s, Available: %s",
                what, holder, required, available));
    }
}

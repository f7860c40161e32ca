package com.lendingengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when call arguments are malformed: both or neither of assets/shares given,
 * zero amounts, zero addresses, values that are already set, or values out of bounds.
 */
public class InvalidInputException extends LendingEngineException {

    public InvalidInputException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static InvalidInputException inconsistentInput() {
        return new InvalidInputException(ErrorCode.INCONSISTENT_INPUT,
            "Exactly one of assets or shares must be non-zero");
    }

    public static InvalidInputException negativeAmount(String field, BigInteger value) {
        return new InvalidInputException(ErrorCode.INVALID_AMOUNT,
            String.format("%s must not be negative: %s", field, value));
    }

    public static InvalidInputException zeroAmount(String field) {
        return new InvalidInputException(ErrorCode.ZERO_AMOUNT, field + " must not be zero");
    }

    public static InvalidInputException zeroAddress(String field) {
        return new InvalidInputException(ErrorCode.ZERO_ADDRESS, field + " must not be the zero address");
    }

    public static InvalidInputException alreadySet(String field) {
        return new InvalidInputException(ErrorCode.ALREADY_SET, field + " is already set to this value");
    }

    public static InvalidInputException feeTooHigh(BigInteger fee, BigInteger maxFee) {
        return new InvalidInputException(ErrorCode.MAX_FEE_EXCEEDED,
            String.format("Fee %s exceeds maximum %s", fee, maxFee));
    }

    public static InvalidInputException lltvTooHigh(BigInteger lltv) {
        return new InvalidInputException(ErrorCode.MAX_LLTV_EXCEEDED,
            "LLTV must be below 1e18: " + lltv);
    }
}

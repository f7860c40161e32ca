package com.lendingengine.common.exception;

/**
 * Stable error identifiers reported to callers.
 */
public enum ErrorCode {
    // configuration
    UNKNOWN_MARKET,
    MARKET_ALREADY_EXISTS,
    UNSUPPORTED_RATE_MODEL,
    UNSUPPORTED_LLTV,
    UNKNOWN_ORACLE,
    INCONSISTENT_INPUT,
    INVALID_AMOUNT,
    ZERO_AMOUNT,
    ZERO_ADDRESS,
    ALREADY_SET,
    MAX_FEE_EXCEEDED,
    MAX_LLTV_EXCEEDED,

    // authorization
    UNAUTHORIZED,
    SIGNATURE_EXPIRED,
    INVALID_NONCE,
    INVALID_SIGNATURE,

    // invariants
    INSUFFICIENT_LIQUIDITY,
    INSUFFICIENT_COLLATERAL,
    HEALTHY_POSITION,
    INSUFFICIENT_BALANCE,

    // collaborators
    TRANSFER_FAILED,
    UNREPAID_FLASH_LOAN,
    ORACLE_UNAVAILABLE,

    REENTRANT_CALL
}

package com.lendingengine.common.exception;

/**
 * Thrown when the price feed of a market cannot produce a price. No fallback price is used.
 */
public class OracleUnavailableException extends LendingEngineException {

    public OracleUnavailableException(String oracle, String reason) {
        super(ErrorCode.ORACLE_UNAVAILABLE, "Oracle " + oracle + " unavailable: " + reason);
    }

    public OracleUnavailableException(String oracle, Throwable cause) {
        super(ErrorCode.ORACLE_UNAVAILABLE, "Oracle " + oracle + " unavailable: " + cause.getMessage(), cause);
    }
}

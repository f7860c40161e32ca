package com.lendingengine.common.exception;

/**
 * Thrown when a market references an oracle address that resolves to nothing.
 */
public class UnknownOracleException extends LendingEngineException {

    public UnknownOracleException(String oracle) {
        super(ErrorCode.UNKNOWN_ORACLE, "No oracle registered at " + oracle);
    }
}

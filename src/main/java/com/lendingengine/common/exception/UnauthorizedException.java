package com.lendingengine.common.exception;

/**
 * Thrown when the caller is neither the account owner nor one of its authorized delegates,
 * or is not the engine owner for governance operations.
 */
public class UnauthorizedException extends LendingEngineException {

    public UnauthorizedException(String caller, String action) {
        super(ErrorCode.UNAUTHORIZED, String.format("Caller %s is not authorized to %s", caller, action));
    }
}

package com.lendingengine.common.exception;

/**
 * Base exception for all lending engine exceptions.
 *
 * Every failure is fatal for the operation that raised it: the surrounding
 * transaction is rolled back and nothing is persisted.
 */
public class LendingEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    public LendingEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LendingEngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

package com.lendingengine.common.exception;

/**
 * Thrown when a signed authorization is expired, replayed, or signed by someone else.
 */
public class InvalidSignatureException extends LendingEngineException {

    public InvalidSignatureException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(ErrorCode.INVALID_SIGNATURE, message, cause);
    }
}

package com.lendingengine.common.exception;

public class ReentrantCallException extends LendingEngineException {

    public ReentrantCallException(String operation, String activeOperation) {
        super(ErrorCode.REENTRANT_CALL,
            String.format("Cannot enter %s while %s is executing", operation, activeOperation));
    }
}

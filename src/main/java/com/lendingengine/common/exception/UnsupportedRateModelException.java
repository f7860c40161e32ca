package com.lendingengine.common.exception;

public class UnsupportedRateModelException extends LendingEngineException {

    public UnsupportedRateModelException(String irm) {
        super(ErrorCode.UNSUPPORTED_RATE_MODEL, "Rate model not enabled: " + irm);
    }
}

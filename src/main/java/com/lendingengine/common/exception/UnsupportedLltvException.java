package com.lendingengine.common.exception;

import java.math.BigInteger;

public class UnsupportedLltvException extends LendingEngineException {

    public UnsupportedLltvException(BigInteger lltv) {
        super(ErrorCode.UNSUPPORTED_LLTV, "LLTV not enabled: " + lltv);
    }
}

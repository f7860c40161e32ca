package com.lendingengine.common.exception;

import java.math.BigInteger;

public class TransferFailedException extends LendingEngineException {

    public TransferFailedException(String token, String from, String to, BigInteger amount, String reason) {
        super(ErrorCode.TRANSFER_FAILED,
            String.format("Transfer of %s %s from %s to %s failed: %s", amount, token, from, to, reason));
    }
}

package com.lendingengine.common.exception;

import java.math.BigInteger;

public class UnrepaidFlashLoanException extends LendingEngineException {

    public UnrepaidFlashLoanException(String token, BigInteger assets, Throwable cause) {
        super(ErrorCode.UNREPAID_FLASH_LOAN,
            String.format("Flash loan of %s %s was not repaid", assets, token), cause);
    }
}

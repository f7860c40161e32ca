package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for supply, withdraw, borrow and repay. Exactly one of assets or shares must be non-zero.
 * The receiver is only used by withdraw and borrow.
 */
@Data
public class AmountRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    private BigInteger assets = BigInteger.ZERO;

    private BigInteger shares = BigInteger.ZERO;

    @NotBlank(message = "onBehalf is required")
    private String onBehalf;

    private String receiver;
}

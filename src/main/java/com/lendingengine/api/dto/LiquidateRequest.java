package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigInteger;

@Data
public class LiquidateRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    @NotBlank(message = "Borrower is required")
    private String borrower;

    private BigInteger seizedAssets = BigInteger.ZERO;

    private BigInteger repaidShares = BigInteger.ZERO;
}

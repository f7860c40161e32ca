package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for creating a new market.
 */
@Data
public class CreateMarketRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    @NotBlank(message = "Loan token is required")
    private String loanToken;

    @NotBlank(message = "Collateral token is required")
    private String collateralToken;

    @NotBlank(message = "Oracle is required")
    private String oracle;

    @NotBlank(message = "Rate model is required")
    private String irm;

    @NotNull(message = "LLTV is required")
    private BigInteger lltv;
}

package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

@Data
public class CollateralRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    @NotNull(message = "Assets are required")
    @Positive(message = "Assets must be positive")
    private BigInteger assets;

    @NotBlank(message = "onBehalf is required")
    private String onBehalf;

    private String receiver;
}

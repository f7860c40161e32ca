package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for owner-only settings. Address settings use {@code address}, LLTV and fee settings use {@code value}.
 */
@Data
public class OwnerActionRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    private String address;

    private BigInteger value;
}

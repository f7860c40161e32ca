package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * DTO for submitting an authorization signed by the authorizer.
 */
@Data
public class SignedAuthorizationRequest {

    @NotBlank(message = "Authorizer is required")
    private String authorizer;

    @NotBlank(message = "Authorized is required")
    private String authorized;

    private boolean enabled;

    private long nonce;

    private long deadline;

    /**
     * 65-byte r || s || v signature, hex encoded.
     */
    @NotBlank(message = "Signature is required")
    @Pattern(regexp = "^0x[0-9a-fA-F]{130}$", message = "Signature must be 65 bytes of hex")
    private String signature;
}

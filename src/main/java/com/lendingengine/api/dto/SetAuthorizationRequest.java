package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SetAuthorizationRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    @NotBlank(message = "Delegate is required")
    private String delegate;

    private boolean enabled;
}

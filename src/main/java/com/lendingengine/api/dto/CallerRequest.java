package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CallerRequest {

    @NotBlank(message = "Caller is required")
    private String caller;
}

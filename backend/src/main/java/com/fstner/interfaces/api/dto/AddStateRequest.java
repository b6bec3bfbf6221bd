package com.fstner.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AddStateRequest(
        @NotBlank(message = "State id is required")
        @Size(max = 100, message = "State id must not exceed 100 characters")
        String id
) {}

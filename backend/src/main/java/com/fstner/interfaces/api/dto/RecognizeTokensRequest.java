package com.fstner.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record RecognizeTokensRequest(
        @NotNull(message = "Tokens are required")
        @Size(max = 2000, message = "At most 2000 tokens are accepted")
        List<@NotNull(message = "Tokens must not be null") String> tokens
) {}

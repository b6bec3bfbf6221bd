package com.fstner.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RecognizeTextRequest(
        @NotBlank(message = "Text is required")
        @Size(max = 10000, message = "Text must not exceed 10000 characters")
        String text
) {}

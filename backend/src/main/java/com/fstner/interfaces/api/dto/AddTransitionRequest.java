package com.fstner.interfaces.api.dto;

import com.fstner.infrastructure.transducer.MatchMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * @param label optional category; omit for a continuation transition
 * @param match optional, defaults to FULL
 */
public record AddTransitionRequest(
        @NotBlank(message = "Source state is required")
        String from,

        @NotNull(message = "Pattern is required")
        @Size(max = 1000, message = "Pattern must not exceed 1000 characters")
        String pattern,

        @NotBlank(message = "Destination state is required")
        String to,

        @Size(max = 100, message = "Label must not exceed 100 characters")
        String label,

        MatchMode match
) {}

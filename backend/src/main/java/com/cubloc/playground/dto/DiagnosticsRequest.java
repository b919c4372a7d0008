package com.cubloc.playground.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record DiagnosticsRequest(
        @NotNull(message = "Source code cannot be null")
        @Size(max = 200_000, message = "Source code cannot exceed 200,000 characters")
        String sourceCode) {
}

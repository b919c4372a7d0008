package com.cubloc.playground.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Full text of an opened or edited document.
 */
public record DocumentChangeRequest(
        @NotBlank(message = "Document uri cannot be blank")
        String uri,
        Integer version,
        @NotNull(message = "Document text cannot be null")
        @Size(max = 200_000, message = "Document text cannot exceed 200,000 characters")
        String text) {
}

package com.cubloc.playground.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record HoverRequest(
        @NotBlank(message = "Document uri cannot be blank")
        String uri,
        @PositiveOrZero
        int line,
        @PositiveOrZero
        int character) {
}

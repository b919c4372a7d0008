package com.cubloc.playground.dto;

import jakarta.validation.constraints.NotBlank;

public record DocumentCloseRequest(
        @NotBlank(message = "Document uri cannot be blank")
        String uri) {
}

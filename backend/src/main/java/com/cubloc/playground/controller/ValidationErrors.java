package com.cubloc.playground.controller;

import org.springframework.web.bind.MethodArgumentNotValidException;

final class ValidationErrors {

    private ValidationErrors() {
    }

    static String describe(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        return errorMessage.toString();
    }
}

package com.cubloc.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "cubloc.lint")
@Validated
public record CublocLintProperties(
    @Positive
    @DefaultValue("120")
    Integer maxLineLength,

    @NotBlank
    @DefaultValue("cubloc-basic")
    String diagnosticSource,

    @Positive
    @DefaultValue("200000")
    Integer maxSourceCodeLength
) {

    @ConstructorBinding
    public CublocLintProperties {
    }

    public CublocLintProperties() {
        this(120, "cubloc-basic", 200_000);
    }
}

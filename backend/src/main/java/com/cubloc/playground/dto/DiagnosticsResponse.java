package com.cubloc.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagnosticsResponse(
        boolean success,
        String uri,
        Integer version,
        List<Diagnostic> diagnostics,
        String error,
        long analysisTimeMs) {

    public static DiagnosticsResponse success(List<Diagnostic> diagnostics, long analysisTimeMs) {
        return new DiagnosticsResponse(true, null, null, diagnostics, null, analysisTimeMs);
    }

    public static DiagnosticsResponse error(String error, long analysisTimeMs) {
        return new DiagnosticsResponse(false, null, null, List.of(), error, analysisTimeMs);
    }

    public DiagnosticsResponse forDocument(String uri, Integer version) {
        return new DiagnosticsResponse(success, uri, version, diagnostics, error, analysisTimeMs);
    }
}

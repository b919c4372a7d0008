package com.cubloc.playground.dto;

public record Diagnostic(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    Severity severity,
    String message,
    String source
) {
    public enum Severity {
        ERROR(1),
        WARNING(2),
        INFORMATION(3);

        private final int code;

        Severity(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }
    }
}
